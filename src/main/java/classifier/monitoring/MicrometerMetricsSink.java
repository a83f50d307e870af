package classifier.monitoring;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import java.time.Duration;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Micrometer-backed sink. With a Prometheus registry the meters scrape as:
 * <ul>
 *   <li>{@code cv_predictions_total{prediction_class}}</li>
 *   <li>{@code cv_inference_time_seconds} (histogram)</li>
 *   <li>{@code cv_user_feedback_total{feedback_type}}</li>
 *   <li>{@code cv_api_requests_total{endpoint,outcome}}</li>
 *   <li>{@code cv_database_connected} (1 connected, 0 disconnected)</li>
 * </ul>
 */
public class MicrometerMetricsSink implements MetricsSink {

  static final String PREDICTIONS = "cv.predictions";
  static final String INFERENCE_TIME = "cv.inference.time";
  static final String USER_FEEDBACK = "cv.user.feedback";
  static final String API_REQUESTS = "cv.api.requests";
  static final String DATABASE_CONNECTED = "cv.database.connected";

  private final MeterRegistry registry;
  private final Timer inferenceTime;
  private final AtomicInteger databaseConnected = new AtomicInteger(1);

  public MicrometerMetricsSink(MeterRegistry registry) {
    this.registry = registry;
    this.inferenceTime = Timer.builder(INFERENCE_TIME)
        .description("Model inference time")
        .publishPercentileHistogram()
        .minimumExpectedValue(Duration.ofMillis(5))
        .maximumExpectedValue(Duration.ofSeconds(30))
        .register(registry);
    Gauge.builder(DATABASE_CONNECTED, databaseConnected, AtomicInteger::get)
        .description("Database connection status (1=connected, 0=disconnected)")
        .register(registry);
  }

  @Override
  public void recordPrediction(String predictionClass) {
    Counter.builder(PREDICTIONS)
        .description("Successful predictions by class")
        .tag("prediction_class", predictionClass)
        .register(registry)
        .increment();
  }

  @Override
  public void recordInferenceTime(long inferenceTimeMs) {
    inferenceTime.record(inferenceTimeMs, TimeUnit.MILLISECONDS);
  }

  @Override
  public void recordFeedback(FeedbackPolarity polarity) {
    Counter.builder(USER_FEEDBACK)
        .description("User feedback by polarity")
        .tag("feedback_type", polarity.tag())
        .register(registry)
        .increment();
  }

  @Override
  public void recordUsage(String endpoint, String outcome) {
    Counter.builder(API_REQUESTS)
        .description("Gateway usage by endpoint and outcome")
        .tag("endpoint", endpoint)
        .tag("outcome", outcome)
        .register(registry)
        .increment();
  }

  @Override
  public void updateDatabaseStatus(boolean connected) {
    databaseConnected.set(connected ? 1 : 0);
  }
}
