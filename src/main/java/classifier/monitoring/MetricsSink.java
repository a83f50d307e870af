package classifier.monitoring;

/**
 * Counters, histogram and gauge exported to the metrics scraper.
 *
 * <p>
 * Implementations must tolerate concurrent calls without losing updates. Callers treat every
 * method as fire-and-forget.
 * </p>
 */
public interface MetricsSink {

  /**
   * Counts one successful prediction for the class label ({@code cat} or {@code dog}).
   */
  void recordPrediction(String predictionClass);

  void recordInferenceTime(long inferenceTimeMs);

  void recordFeedback(FeedbackPolarity polarity);

  /**
   * Counts one call of a public endpoint with its outcome ({@code success}, {@code error}, ...).
   */
  void recordUsage(String endpoint, String outcome);

  void updateDatabaseStatus(boolean connected);
}
