package classifier.store;

import java.util.Locale;

/**
 * What the orchestrator knows at the end of an inference attempt.
 *
 * <p>Use the factories; they enforce the {@code error}/zero-probability rule for failures and
 * drop the filename when consent was not given.
 */
public record PredictionAttempt(
    boolean success,
    String predictionResult,
    double probaCat,
    double probaDog,
    long inferenceTimeMs,
    boolean rgpdConsent,
    String filename,
    String userComment
) {

  static final int MAX_FILENAME_LENGTH = 255;
  static final int MAX_COMMENT_LENGTH = 2000;

  public PredictionAttempt {
    if (inferenceTimeMs < 0) {
      throw new IllegalArgumentException("inferenceTimeMs must not be negative");
    }
    if (success == PredictionRecord.RESULT_ERROR.equals(predictionResult)) {
      throw new IllegalArgumentException("predictionResult '" + predictionResult + "' does not match success=" + success);
    }
  }

  public static PredictionAttempt success(
      String label, double probaCatPct, double probaDogPct, long inferenceTimeMs, boolean rgpdConsent, String filename) {
    return new PredictionAttempt(
        true,
        label.toLowerCase(Locale.ROOT),
        probaCatPct,
        probaDogPct,
        inferenceTimeMs,
        rgpdConsent,
        rgpdConsent ? truncate(filename, MAX_FILENAME_LENGTH) : null,
        null);
  }

  /**
   * Failure rows never carry consent or a filename, whatever the request said.
   */
  public static PredictionAttempt failure(long inferenceTimeMs, String errorMessage) {
    return new PredictionAttempt(
        false,
        PredictionRecord.RESULT_ERROR,
        0.0,
        0.0,
        inferenceTimeMs,
        false,
        null,
        truncate(errorMessage, MAX_COMMENT_LENGTH));
  }

  private static String truncate(String value, int maxLength) {
    if (value == null || value.length() <= maxLength) {
      return value;
    }
    return value.substring(0, maxLength - 3) + "...";
  }
}
