package classifier.service;

import classifier.config.PredictorConfig.AuthProperties;
import classifier.error.UnauthorizedException;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import org.springframework.stereotype.Component;

/**
 * Pass/fail gate for the bearer token in front of the prediction endpoint.
 */
@Component
public class ApiTokenVerifier {
  private static final String BEARER_PREFIX = "Bearer ";

  private final byte[] expected;

  public ApiTokenVerifier(AuthProperties props) {
    String token = props.apiToken();
    this.expected = token == null || token.isBlank() ? null : token.trim().getBytes(StandardCharsets.UTF_8);
  }

  public void verify(String authorizationHeader) {
    if (expected == null) {
      throw new UnauthorizedException("No API token is configured on the server");
    }
    if (authorizationHeader == null || !authorizationHeader.startsWith(BEARER_PREFIX)) {
      throw new UnauthorizedException("Missing bearer token");
    }
    byte[] presented = authorizationHeader.substring(BEARER_PREFIX.length()).trim().getBytes(StandardCharsets.UTF_8);
    if (!MessageDigest.isEqual(expected, presented)) {
      throw new UnauthorizedException("Invalid bearer token");
    }
  }
}
