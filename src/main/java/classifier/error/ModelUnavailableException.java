package classifier.error;

import org.springframework.http.HttpStatus;

public class ModelUnavailableException extends GatewayException {

  public ModelUnavailableException() {
    super(HttpStatus.SERVICE_UNAVAILABLE, "model_unavailable", "Model is not available", null);
  }
}
