package classifier.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class PredictorConfig {

  @Bean
  public PredictorProperties predictorProperties(
      @Value("${classifier.predictor.loaded:true}") boolean loaded,
      @Value("${classifier.predictor.name:Cats vs Dogs Classifier}") String name,
      @Value("${classifier.predictor.version:3.0.0}") String version,
      @Value("${classifier.predictor.image-size:224}") int imageSize,
      @Value("${classifier.predictor.simulated-min-ms:5}") int simulatedMinMs,
      @Value("${classifier.predictor.simulated-max-ms:40}") int simulatedMaxMs
  ) {
    return new PredictorProperties(loaded, name, version, imageSize, simulatedMinMs, simulatedMaxMs);
  }

  @Bean
  public AuthProperties authProperties(@Value("${classifier.auth.api-token:}") String apiToken) {
    return new AuthProperties(apiToken);
  }

  public record PredictorProperties(
      boolean loaded,
      String name,
      String version,
      int imageSize,
      int simulatedMinMs,
      int simulatedMaxMs
  ) {}

  public record AuthProperties(String apiToken) {}
}
