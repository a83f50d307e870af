package classifier.service;

import classifier.config.MonitoringConfig.MonitoringProperties;
import classifier.model.GatewayInfo;
import classifier.model.HealthStatus;
import classifier.monitoring.AlertSink;
import classifier.monitoring.MetricsSink;
import classifier.predictor.ModelInfo;
import classifier.predictor.Predictor;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Health probe and service metadata.
 *
 * <p>
 * The probe tracks the last observed database state so the disconnect alert fires on the
 * connected to disconnected transition only, not on every failing probe.
 * </p>
 */
@Service
public class HealthService {
  private static final Logger log = LoggerFactory.getLogger(HealthService.class);

  private final DatabaseProbe databaseProbe;
  private final Predictor predictor;
  private final MetricsSink metrics;
  private final AlertSink alerts;
  private final MonitoringProperties monitoring;
  private final AtomicBoolean databaseConnected = new AtomicBoolean(true);

  public HealthService(
      DatabaseProbe databaseProbe,
      Predictor predictor,
      MetricsSink metrics,
      AlertSink alerts,
      MonitoringProperties monitoring
  ) {
    this.databaseProbe = databaseProbe;
    this.predictor = predictor;
    this.metrics = metrics;
    this.alerts = alerts;
    this.monitoring = monitoring;
  }

  public HealthStatus check() {
    String database;
    boolean connected;
    try {
      databaseProbe.ping();
      connected = true;
      database = "connected";
    } catch (RuntimeException e) {
      connected = false;
      database = "error: " + (e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage());
    }

    if (connected) {
      if (databaseConnected.compareAndSet(false, true)) {
        log.info("event=health.database_reconnected");
      }
    } else if (databaseConnected.compareAndSet(true, false)) {
      log.error("event=health.database_disconnected detail=\"{}\"", database);
      String detail = database;
      SinkGuard.run("alertDatabaseDisconnected", () -> alerts.alertDatabaseDisconnected(detail));
    } else {
      log.warn("event=health.database_still_disconnected detail=\"{}\"", database);
    }
    boolean status = connected;
    SinkGuard.run("updateDatabaseStatus", () -> metrics.updateDatabaseStatus(status));

    return new HealthStatus(
        connected ? HealthStatus.HEALTHY : HealthStatus.DEGRADED,
        predictor.isLoaded(),
        database,
        new HealthStatus.Monitoring(monitoring.prometheusEnabled(), monitoring.alertingEnabled()));
  }

  public GatewayInfo info() {
    ModelInfo model = predictor.info();
    List<String> features = new ArrayList<>(List.of(
        "Image classification (cats/dogs)",
        "RGPD compliance",
        "User feedback collection",
        "Prediction history and statistics"));
    if (monitoring.prometheusEnabled()) {
      features.add("Prometheus metrics");
    }
    if (monitoring.alertingEnabled()) {
      features.add("Webhook alerting");
    }
    return new GatewayInfo(
        model.name(),
        model.version(),
        model.classes(),
        model.inputSize(),
        predictor.isLoaded(),
        features,
        new GatewayInfo.Monitoring(
            monitoring.prometheusEnabled(),
            monitoring.alertingEnabled(),
            monitoring.prometheusEnabled() ? "/metrics" : null));
  }
}
