package classifier.monitoring;

/**
 * Outbound notifications for threshold and state-change events.
 *
 * <p>
 * Delivery is asynchronous and best-effort: implementations return immediately and never
 * throw because an alert could not be sent.
 * </p>
 */
public interface AlertSink {

  /**
   * The caller has already decided that {@code inferenceTimeMs} exceeds {@code thresholdMs}.
   */
  void alertHighLatency(long inferenceTimeMs, long thresholdMs);

  /**
   * Fired once per transition into the disconnected state.
   */
  void alertDatabaseDisconnected(String errorDetail);
}
