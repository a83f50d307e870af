package classifier.model;

public record HealthStatus(String status, boolean modelLoaded, String database, Monitoring monitoring) {

  public static final String HEALTHY = "healthy";
  public static final String DEGRADED = "degraded";

  public record Monitoring(boolean prometheus, boolean alerting) {}
}
