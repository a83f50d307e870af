package classifier.error;

import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.ErrorResponseException;

/**
 * Base of the gateway's own failures. Each subclass fixes its HTTP status and problem title so the
 * controller advice can render any of them the same way.
 */
public abstract class GatewayException extends ErrorResponseException {

  protected GatewayException(HttpStatus status, String title, String detail, Throwable cause) {
    super(status, problem(status, title, detail), cause);
  }

  public String getTitle() {
    return getBody().getTitle();
  }

  public String getDetail() {
    return getBody().getDetail();
  }

  @Override
  public String getMessage() {
    return getTitle() + ": " + getDetail();
  }

  private static ProblemDetail problem(HttpStatus status, String title, String detail) {
    ProblemDetail pd = ProblemDetail.forStatusAndDetail(status, detail);
    pd.setTitle(title);
    return pd;
  }
}
