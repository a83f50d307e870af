package classifier.monitoring;

/**
 * Wired when metrics export is disabled.
 */
public class NoopMetricsSink implements MetricsSink {

  @Override
  public void recordPrediction(String predictionClass) {}

  @Override
  public void recordInferenceTime(long inferenceTimeMs) {}

  @Override
  public void recordFeedback(FeedbackPolarity polarity) {}

  @Override
  public void recordUsage(String endpoint, String outcome) {}

  @Override
  public void updateDatabaseStatus(boolean connected) {}
}
