package classifier.model;

import java.util.List;

public record GatewayInfo(
    String name,
    String version,
    List<String> classes,
    String inputSize,
    boolean modelLoaded,
    List<String> features,
    Monitoring monitoring
) {

  public record Monitoring(boolean prometheusEnabled, boolean alertingEnabled, String metricsEndpoint) {}
}
