package classifier.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs an observability side effect so that its failure can never reach the caller.
 */
final class SinkGuard {
  private static final Logger log = LoggerFactory.getLogger(SinkGuard.class);

  private SinkGuard() {}

  static void run(String operation, Runnable action) {
    try {
      action.run();
    } catch (RuntimeException e) {
      log.warn("event=sink.failed operation={} exceptionType={} reason={}",
          operation, e.getClass().getName(), e.getMessage());
    }
  }
}
