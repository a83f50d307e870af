package classifier.config;

import classifier.monitoring.AlertSink;
import classifier.monitoring.MetricsSink;
import classifier.monitoring.MicrometerMetricsSink;
import classifier.monitoring.NoopAlertSink;
import classifier.monitoring.NoopMetricsSink;
import classifier.monitoring.WebhookAlertSink;
import io.micrometer.prometheus.PrometheusConfig;
import io.micrometer.prometheus.PrometheusMeterRegistry;
import java.time.Clock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.task.TaskDecorator;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.web.client.RestClient;

/**
 * Resolves the monitoring feature flags once at startup and wires either the real or the no-op
 * sinks. Nothing downstream branches on the flags again.
 */
@Configuration
public class MonitoringConfig {
  private static final Logger log = LoggerFactory.getLogger(MonitoringConfig.class);

  @Bean
  public Clock clock() {
    return Clock.systemUTC();
  }

  @Bean
  public MonitoringProperties monitoringProperties(
      @Value("${classifier.monitoring.prometheus-enabled:false}") boolean prometheusEnabled,
      @Value("${classifier.monitoring.alert-webhook-url:}") String alertWebhookUrl,
      @Value("${classifier.monitoring.latency-threshold-ms:2000}") long latencyThresholdMs,
      @Value("${classifier.monitoring.alert-timeout-ms:2000}") long alertTimeoutMs,
      @Value("${classifier.monitoring.alert-queue-capacity:100}") int alertQueueCapacity
  ) {
    MonitoringProperties props = new MonitoringProperties(
        prometheusEnabled,
        alertWebhookUrl == null || alertWebhookUrl.isBlank() ? null : alertWebhookUrl.trim(),
        latencyThresholdMs,
        alertTimeoutMs,
        alertQueueCapacity
    );
    log.info("event=monitoring.configured prometheusEnabled={} alertingEnabled={} latencyThresholdMs={}",
        props.prometheusEnabled(), props.alertingEnabled(), props.latencyThresholdMs());
    return props;
  }

  @Bean
  @ConditionalOnProperty(name = "classifier.monitoring.prometheus-enabled", havingValue = "true")
  public PrometheusMeterRegistry prometheusMeterRegistry() {
    return new PrometheusMeterRegistry(PrometheusConfig.DEFAULT);
  }

  @Bean
  public MetricsSink metricsSink(ObjectProvider<PrometheusMeterRegistry> registry) {
    PrometheusMeterRegistry r = registry.getIfAvailable();
    if (r == null) {
      return new NoopMetricsSink();
    }
    return new MicrometerMetricsSink(r);
  }

  @Bean
  public AlertSink alertSink(
      MonitoringProperties props,
      Clock clock,
      @Qualifier("alertExecutor") ThreadPoolTaskExecutor alertExecutor
  ) {
    if (!props.alertingEnabled()) {
      return new NoopAlertSink();
    }
    SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
    requestFactory.setConnectTimeout((int) props.alertTimeoutMs());
    requestFactory.setReadTimeout((int) props.alertTimeoutMs());
    RestClient restClient = RestClient.builder().requestFactory(requestFactory).build();
    return new WebhookAlertSink(restClient, props.alertWebhookUrl(), alertExecutor, clock);
  }

  @Bean(name = "alertExecutor")
  public ThreadPoolTaskExecutor alertExecutor(MonitoringProperties props) {
    ThreadPoolTaskExecutor exec = new ThreadPoolTaskExecutor();
    exec.setThreadNamePrefix("alert-");
    exec.setCorePoolSize(1);
    exec.setMaxPoolSize(2);
    exec.setQueueCapacity(props.alertQueueCapacity());
    exec.setTaskDecorator(mdcTaskDecorator());
    // a saturated queue drops the alert instead of blocking the request thread
    exec.setRejectedExecutionHandler(new java.util.concurrent.ThreadPoolExecutor.AbortPolicy());
    exec.initialize();
    return exec;
  }

  @Bean
  public TaskDecorator mdcTaskDecorator() {
    return runnable -> {
      var captured = MDC.getCopyOfContextMap();
      return () -> {
        var previous = MDC.getCopyOfContextMap();
        try {
          if (captured != null) {
            MDC.setContextMap(captured);
          } else {
            MDC.clear();
          }
          runnable.run();
        } finally {
          if (previous != null) {
            MDC.setContextMap(previous);
          } else {
            MDC.clear();
          }
        }
      };
    };
  }

  public record MonitoringProperties(
      boolean prometheusEnabled,
      String alertWebhookUrl,
      long latencyThresholdMs,
      long alertTimeoutMs,
      int alertQueueCapacity
  ) {
    public boolean alertingEnabled() {
      return alertWebhookUrl != null;
    }
  }
}
