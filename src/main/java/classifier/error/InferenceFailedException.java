package classifier.error;

import org.springframework.http.HttpStatus;

/**
 * The predictor raised. The detail carries the original error text.
 */
public class InferenceFailedException extends GatewayException {

  public InferenceFailedException(String errorText, Throwable cause) {
    super(HttpStatus.INTERNAL_SERVER_ERROR, "inference_failed", "Prediction failed: " + errorText, cause);
  }
}
