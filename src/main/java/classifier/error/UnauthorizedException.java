package classifier.error;

import org.springframework.http.HttpStatus;

public class UnauthorizedException extends GatewayException {

  public UnauthorizedException(String detail) {
    super(HttpStatus.UNAUTHORIZED, "unauthorized", detail, null);
  }
}
