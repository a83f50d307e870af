package classifier.service;

import classifier.config.MonitoringConfig.MonitoringProperties;
import classifier.error.InferenceFailedException;
import classifier.error.InvalidInputException;
import classifier.error.ModelUnavailableException;
import classifier.model.FeedbackAck;
import classifier.model.PredictionResponse;
import classifier.model.PredictionUpload;
import classifier.monitoring.AlertSink;
import classifier.monitoring.FeedbackPolarity;
import classifier.monitoring.MetricsSink;
import classifier.predictor.ClassificationResult;
import classifier.predictor.Predictor;
import classifier.store.FeedbackStore;
import classifier.store.PredictionAttempt;
import classifier.store.PredictionRecord;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.TimeUnit;
import java.util.function.LongSupplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

/**
 * Sequences one inference request: preflight, timed model call, metrics, persistence, alerting.
 *
 * <p>
 * Only predictor and feedback store errors reach the caller. Metrics and alert calls go through
 * {@link SinkGuard} and cannot fail or reorder the response.
 * </p>
 */
@Service
public class PredictionService {
  private static final Logger log = LoggerFactory.getLogger(PredictionService.class);

  private final Predictor predictor;
  private final FeedbackStore store;
  private final MetricsSink metrics;
  private final AlertSink alerts;
  private final MonitoringProperties monitoring;
  private final LongSupplier nanoTime;

  @Autowired
  public PredictionService(
      Predictor predictor,
      FeedbackStore store,
      MetricsSink metrics,
      AlertSink alerts,
      MonitoringProperties monitoring
  ) {
    this(predictor, store, metrics, alerts, monitoring, System::nanoTime);
  }

  PredictionService(
      Predictor predictor,
      FeedbackStore store,
      MetricsSink metrics,
      AlertSink alerts,
      MonitoringProperties monitoring,
      LongSupplier nanoTime
  ) {
    this.predictor = predictor;
    this.store = store;
    this.metrics = metrics;
    this.alerts = alerts;
    this.monitoring = monitoring;
    this.nanoTime = nanoTime;
  }

  public PredictionResponse predict(PredictionUpload upload) {
    if (!predictor.isLoaded()) {
      SinkGuard.run("recordUsage", () -> metrics.recordUsage("predict", "unavailable"));
      log.warn("event=predict.rejected reason=model_unavailable");
      throw new ModelUnavailableException();
    }
    String contentType = upload.contentType();
    if (contentType == null || !contentType.toLowerCase(Locale.ROOT).startsWith("image/")) {
      SinkGuard.run("recordUsage", () -> metrics.recordUsage("predict", "invalid_input"));
      log.info("event=predict.rejected reason=invalid_content_type contentType={}", contentType);
      throw new InvalidInputException("Invalid image format: expected an image/* upload, got " + contentType);
    }
    if (upload.content() == null || upload.content().length == 0) {
      SinkGuard.run("recordUsage", () -> metrics.recordUsage("predict", "invalid_input"));
      log.info("event=predict.rejected reason=empty_upload");
      throw new InvalidInputException("Uploaded image is empty");
    }

    long startNs = nanoTime.getAsLong();
    ClassificationResult result;
    try {
      result = checked(predictor.predict(upload.content()));
    } catch (Exception e) {
      if (e instanceof InterruptedException) {
        Thread.currentThread().interrupt();
      }
      long inferenceTimeMs = elapsedMs(startNs);
      String errorText = errorText(e);
      recordFailure(inferenceTimeMs, errorText);
      SinkGuard.run("recordUsage", () -> metrics.recordUsage("predict", "error"));
      log.error("event=predict.completed result=FAILED inferenceTimeMs={} exceptionType={}",
          inferenceTimeMs, e.getClass().getName(), e);
      throw new InferenceFailedException(errorText, e);
    }
    long inferenceTimeMs = elapsedMs(startNs);

    String label = result.prediction().toLowerCase(Locale.ROOT);
    SinkGuard.run("recordPrediction", () -> metrics.recordPrediction(label));
    SinkGuard.run("recordInferenceTime", () -> metrics.recordInferenceTime(inferenceTimeMs));

    // the store is the record of truth: a failure here propagates
    PredictionRecord record = store.save(PredictionAttempt.success(
        label,
        result.probabilityCat() * 100,
        result.probabilityDog() * 100,
        inferenceTimeMs,
        upload.rgpdConsent(),
        upload.filename()));

    SinkGuard.run("recordUsage", () -> metrics.recordUsage("predict", "success"));
    if (inferenceTimeMs > monitoring.latencyThresholdMs()) {
      log.warn("event=predict.slow feedbackId={} inferenceTimeMs={} thresholdMs={}",
          record.getId(), inferenceTimeMs, monitoring.latencyThresholdMs());
      SinkGuard.run("alertHighLatency",
          () -> alerts.alertHighLatency(inferenceTimeMs, monitoring.latencyThresholdMs()));
    }

    log.info("event=predict.completed result=SUCCESS feedbackId={} prediction={} confidence={} inferenceTimeMs={}",
        record.getId(), result.prediction(), percent(result.confidence()), inferenceTimeMs);
    return toResponse(upload, result, inferenceTimeMs, record.getId());
  }

  /**
   * Attaches user feedback to an existing record and counts its polarity. The store checks
   * existence, consent and then the payload, in that order.
   */
  public FeedbackAck amendFeedback(long feedbackId, Integer userFeedback, String userComment) {
    store.updateFeedback(feedbackId, userFeedback, userComment);

    if (userFeedback != null) {
      FeedbackPolarity polarity = FeedbackPolarity.fromUserFeedback(userFeedback);
      SinkGuard.run("recordFeedback", () -> metrics.recordFeedback(polarity));
    }
    SinkGuard.run("recordUsage", () -> metrics.recordUsage("feedback", "success"));
    log.info("event=feedback.updated feedbackId={} userFeedback={} hasComment={}",
        feedbackId, userFeedback, userComment != null && !userComment.isBlank());
    return new FeedbackAck(true, "Feedback recorded", feedbackId);
  }

  // one attempt only: a failure while recording the failure is logged and dropped
  private void recordFailure(long inferenceTimeMs, String errorText) {
    try {
      PredictionRecord failed = store.save(PredictionAttempt.failure(inferenceTimeMs, errorText));
      log.info("event=predict.failure_recorded feedbackId={}", failed.getId());
    } catch (RuntimeException secondary) {
      log.warn("event=predict.failure_not_recorded exceptionType={} reason={}",
          secondary.getClass().getName(), secondary.getMessage());
    }
  }

  private static ClassificationResult checked(ClassificationResult result) {
    if (result == null) {
      throw new IllegalStateException("predictor returned no result");
    }
    if (!ClassificationResult.CAT.equalsIgnoreCase(result.prediction())
        && !ClassificationResult.DOG.equalsIgnoreCase(result.prediction())) {
      throw new IllegalStateException("predictor returned unknown label: " + result.prediction());
    }
    return result;
  }

  private long elapsedMs(long startNs) {
    return Math.max(0L, TimeUnit.NANOSECONDS.toMillis(nanoTime.getAsLong() - startNs));
  }

  private static String errorText(Exception e) {
    String message = e.getMessage();
    return message == null || message.isBlank() ? e.getClass().getSimpleName() : message;
  }

  private static PredictionResponse toResponse(
      PredictionUpload upload, ClassificationResult result, long inferenceTimeMs, Long feedbackId) {
    Map<String, String> probabilities = new LinkedHashMap<>();
    probabilities.put("cat", percent(result.probabilityCat()));
    probabilities.put("dog", percent(result.probabilityDog()));

    PredictionResponse r = new PredictionResponse();
    r.setFilename(upload.filename());
    r.setPrediction(capitalize(result.prediction()));
    r.setConfidence(percent(result.confidence()));
    r.setProbabilities(probabilities);
    r.setInferenceTimeMs(inferenceTimeMs);
    r.setFeedbackId(feedbackId);
    return r;
  }

  static String percent(double fraction) {
    return String.format(Locale.ROOT, "%.2f%%", fraction * 100);
  }

  private static String capitalize(String label) {
    String lower = label.toLowerCase(Locale.ROOT);
    return Character.toUpperCase(lower.charAt(0)) + lower.substring(1);
  }
}
