package classifier.monitoring;

import classifier.monitoring.AlertEvent.Severity;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.RejectedExecutionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.task.TaskExecutor;
import org.springframework.http.MediaType;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

/**
 * Posts alerts to a chat webhook (Discord embed format) from a background executor.
 *
 * <p>
 * The request thread only enqueues. A full queue, an unreachable channel or a non-2xx answer
 * is logged and forgotten.
 * </p>
 */
public class WebhookAlertSink implements AlertSink {
  private static final Logger log = LoggerFactory.getLogger(WebhookAlertSink.class);

  static final String EVENT_HIGH_LATENCY = "high_latency";
  static final String EVENT_DATABASE_DISCONNECTED = "database_disconnected";

  private final RestClient restClient;
  private final String webhookUrl;
  private final TaskExecutor executor;
  private final Clock clock;

  public WebhookAlertSink(RestClient restClient, String webhookUrl, TaskExecutor executor, Clock clock) {
    this.restClient = restClient;
    this.webhookUrl = webhookUrl;
    this.executor = executor;
    this.clock = clock;
  }

  @Override
  public void alertHighLatency(long inferenceTimeMs, long thresholdMs) {
    Map<String, String> fields = new LinkedHashMap<>();
    fields.put("Inference time", inferenceTimeMs + " ms");
    fields.put("Threshold", thresholdMs + " ms");
    send(new AlertEvent(
        EVENT_HIGH_LATENCY,
        Severity.WARNING,
        Instant.now(clock),
        "High inference latency",
        "Inference took " + inferenceTimeMs + " ms, above the " + thresholdMs + " ms threshold.",
        fields));
  }

  @Override
  public void alertDatabaseDisconnected(String errorDetail) {
    Map<String, String> fields = new LinkedHashMap<>();
    fields.put("Error", errorDetail == null ? "unknown" : errorDetail);
    fields.put("Impact", "Predictions cannot be recorded; feedback is unavailable");
    send(new AlertEvent(
        EVENT_DATABASE_DISCONNECTED,
        Severity.CRITICAL,
        Instant.now(clock),
        "Database disconnected",
        "The health probe could not reach the database.",
        fields));
  }

  void send(AlertEvent event) {
    try {
      executor.execute(() -> deliver(event));
    } catch (RejectedExecutionException ree) {
      log.warn("event=alert.dropped type={} severity={} reason=queue_full", event.type(), event.severity());
    }
  }

  private void deliver(AlertEvent event) {
    try {
      restClient.post()
          .uri(webhookUrl)
          .contentType(MediaType.APPLICATION_JSON)
          .body(toPayload(event))
          .retrieve()
          .toBodilessEntity();
      log.info("event=alert.sent type={} severity={}", event.type(), event.severity());
    } catch (RestClientException e) {
      log.warn("event=alert.failed type={} severity={} reason={}", event.type(), event.severity(), e.getMessage());
    } catch (RuntimeException e) {
      log.warn("event=alert.failed type={} severity={} exceptionType={}",
          event.type(), event.severity(), e.getClass().getName(), e);
    }
  }

  static Map<String, Object> toPayload(AlertEvent event) {
    List<Map<String, Object>> fields = new ArrayList<>();
    fields.add(field("Event", event.type()));
    fields.add(field("Severity", event.severity().name()));
    event.fields().forEach((name, value) -> fields.add(field(name, value)));

    Map<String, Object> embed = new LinkedHashMap<>();
    embed.put("title", event.title());
    embed.put("description", event.description());
    embed.put("color", event.severity().color());
    embed.put("timestamp", event.timestamp().toString());
    embed.put("fields", fields);

    Map<String, Object> payload = new LinkedHashMap<>();
    payload.put("username", "Classifier Monitoring");
    payload.put("embeds", List.of(embed));
    return payload;
  }

  private static Map<String, Object> field(String name, String value) {
    Map<String, Object> f = new LinkedHashMap<>();
    f.put("name", name);
    f.put("value", value);
    f.put("inline", true);
    return f;
  }
}
