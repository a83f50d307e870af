package classifier.monitoring;

import java.time.Instant;
import java.util.Map;

/**
 * Structured alert content, rendered by the sink into the channel's payload format.
 */
public record AlertEvent(
    String type,
    Severity severity,
    Instant timestamp,
    String title,
    String description,
    Map<String, String> fields
) {

  public enum Severity {
    INFO(0x3498db),
    WARNING(0xf39c12),
    CRITICAL(0xe74c3c);

    private final int color;

    Severity(int color) {
      this.color = color;
    }

    public int color() {
      return color;
    }
  }
}
