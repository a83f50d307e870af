package classifier.error;

import org.springframework.http.HttpStatus;

public class InvalidInputException extends GatewayException {

  public InvalidInputException(String detail) {
    super(HttpStatus.BAD_REQUEST, "invalid_input", detail, null);
  }
}
