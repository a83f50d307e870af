package classifier.error;

import org.springframework.http.HttpStatus;

public class RecordNotFoundException extends GatewayException {

  public RecordNotFoundException(long id) {
    super(HttpStatus.NOT_FOUND, "not_found", "Prediction record " + id + " not found", null);
  }
}
