package classifier.controller;

import classifier.model.GatewayInfo;
import classifier.model.HealthStatus;
import classifier.model.RecentPredictions;
import classifier.model.Statistics;
import classifier.service.HealthService;
import classifier.store.StatisticsService;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * Read-only views for dashboards and external health checks.
 */
@RestController
public class MonitoringController {
  private static final Logger log = LoggerFactory.getLogger(MonitoringController.class);

  private final StatisticsService statisticsService;
  private final HealthService healthService;

  public MonitoringController(StatisticsService statisticsService, HealthService healthService) {
    this.statisticsService = statisticsService;
    this.healthService = healthService;
  }

  @GetMapping("/statistics")
  public Statistics statistics() {
    Statistics stats = statisticsService.statistics();
    log.info("event=statistics.get totalPredictions={}", stats.totalPredictions());
    return stats;
  }

  @GetMapping("/recent-predictions")
  public RecentPredictions recentPredictions(
      @RequestParam(value = "limit", defaultValue = "10") @Min(1) @Max(1000) int limit
  ) {
    RecentPredictions recent = statisticsService.recentPredictions(limit);
    log.info("event=recent_predictions.get limit={} count={}", limit, recent.count());
    return recent;
  }

  /**
   * Always 200: a database outage is reported as {@code degraded}, not as an error.
   */
  @GetMapping("/health")
  public HealthStatus health() {
    return healthService.check();
  }

  @GetMapping("/info")
  public GatewayInfo info() {
    return healthService.info();
  }
}
