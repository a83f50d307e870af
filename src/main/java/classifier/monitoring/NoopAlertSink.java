package classifier.monitoring;

/**
 * Wired when no alert webhook is configured.
 */
public class NoopAlertSink implements AlertSink {

  @Override
  public void alertHighLatency(long inferenceTimeMs, long thresholdMs) {}

  @Override
  public void alertDatabaseDisconnected(String errorDetail) {}
}
