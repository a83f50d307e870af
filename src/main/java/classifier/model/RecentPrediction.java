package classifier.model;

import classifier.store.PredictionRecord;
import com.fasterxml.jackson.annotation.JsonInclude;
import java.time.Instant;

public record RecentPrediction(
    long id,
    Instant timestamp,
    String predictionResult,
    double probaCat,
    double probaDog,
    long inferenceTimeMs,
    boolean success,
    boolean rgpdConsent,
    Integer userFeedback,
    @JsonInclude(JsonInclude.Include.NON_NULL) String filename
) {

  public static RecentPrediction from(PredictionRecord r) {
    return new RecentPrediction(
        r.getId(),
        r.getTimestamp(),
        r.getPredictionResult(),
        r.getProbaCat(),
        r.getProbaDog(),
        r.getInferenceTimeMs(),
        r.isSuccess(),
        r.isRgpdConsent(),
        r.getUserFeedback().orElse(null),
        // never disclosed without consent, even if a value were somehow stored
        r.isRgpdConsent() ? r.getFilename().orElse(null) : null);
  }
}
