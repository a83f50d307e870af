package classifier.error;

import org.springframework.http.HttpStatus;

public class ConsentDeniedException extends GatewayException {

  public ConsentDeniedException(long id) {
    super(HttpStatus.FORBIDDEN, "consent_denied",
        "RGPD consent was not given for prediction " + id + "; feedback cannot be stored", null);
  }
}
