package classifier.controller;

import java.util.LinkedHashMap;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.core.NestedRuntimeException;
import org.springframework.dao.DataAccessException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.transaction.TransactionException;
import org.springframework.web.ErrorResponse;
import org.springframework.web.ErrorResponseException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.HandlerMethodValidationException;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;
import org.springframework.web.multipart.support.MissingServletRequestPartException;

/**
 * Every failure leaves as an RFC 7807 Problem Details body carrying the request id, so a
 * client report can be matched to the server log line.
 */
@RestControllerAdvice
public class ApiExceptionHandler {
  private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

  @ExceptionHandler(HandlerMethodValidationException.class)
  public ProblemDetail handleValidation(HandlerMethodValidationException e) {
    ProblemDetail pd = ProblemDetail.forStatus(HttpStatus.BAD_REQUEST);
    pd.setTitle("validation_failed");
    pd.setDetail("Request validation failed");
    pd.setProperty("requestId", MDC.get(RequestIdFilter.MDC_KEY));

    Map<String, String> fields = new LinkedHashMap<>();
    e.getAllValidationResults().forEach(result -> {
      String name = result.getMethodParameter().getParameterName();
      String message = result.getResolvableErrors().isEmpty()
          ? "invalid"
          : result.getResolvableErrors().get(0).getDefaultMessage();
      fields.put(name == null ? "arg" + result.getMethodParameter().getParameterIndex() : name, message);
    });
    pd.setProperty("fields", fields);

    log.info("event=api.bad_request type=validation_failed fields={}", fields.keySet());
    return pd;
  }

  @ExceptionHandler({
      MissingServletRequestParameterException.class,
      MissingServletRequestPartException.class,
      MethodArgumentTypeMismatchException.class
  })
  public ProblemDetail handleBadParameter(Exception e) {
    ProblemDetail pd = ProblemDetail.forStatus(HttpStatus.BAD_REQUEST);
    pd.setTitle("bad_request");
    pd.setDetail(e.getMessage());
    pd.setProperty("requestId", MDC.get(RequestIdFilter.MDC_KEY));

    log.info("event=api.bad_request type={}", e.getClass().getSimpleName());
    return pd;
  }

  @ExceptionHandler(ErrorResponseException.class)
  public ProblemDetail handleSpringErrorResponse(ErrorResponseException e) {
    // domain exceptions arrive here with their title and detail already set
    ProblemDetail pd = e.getBody();
    pd.setProperty("requestId", MDC.get(RequestIdFilter.MDC_KEY));

    HttpStatus status = HttpStatus.resolve(pd.getStatus());
    int code = status == null ? pd.getStatus() : status.value();
    if (code >= 500) {
      log.error("event=api.error status={} title={} detail=\"{}\"", code, pd.getTitle(), pd.getDetail(), e);
    } else {
      log.info("event=api.client_error status={} title={}", code, pd.getTitle());
    }
    return pd;
  }

  /**
   * Store errors raised by the data access layer and by the transaction infrastructure, such as an
   * unreachable database when a transaction begins or a failed commit. The driver message stays in
   * the log.
   */
  @ExceptionHandler({DataAccessException.class, TransactionException.class})
  public ProblemDetail handleStoreFailure(NestedRuntimeException e) {
    ProblemDetail pd = ProblemDetail.forStatus(HttpStatus.INTERNAL_SERVER_ERROR);
    pd.setTitle("store_failure");
    pd.setDetail("Feedback store operation failed");
    pd.setProperty("requestId", MDC.get(RequestIdFilter.MDC_KEY));

    log.error("event=api.error status=500 title=store_failure exceptionType={} reason=\"{}\"",
        e.getClass().getName(), e.getMostSpecificCause().getMessage(), e);
    return pd;
  }

  @ExceptionHandler(Exception.class)
  public ProblemDetail handleUnexpected(Exception e) {
    if (e instanceof ErrorResponse er) {
      // framework errors such as 405 or 415 keep their own status
      ProblemDetail pd = er.getBody();
      pd.setProperty("requestId", MDC.get(RequestIdFilter.MDC_KEY));
      log.info("event=api.client_error status={} type={}", pd.getStatus(), e.getClass().getSimpleName());
      return pd;
    }
    ProblemDetail pd = ProblemDetail.forStatus(HttpStatus.INTERNAL_SERVER_ERROR);
    pd.setTitle("internal_error");
    pd.setDetail("Unexpected server error");
    pd.setProperty("requestId", MDC.get(RequestIdFilter.MDC_KEY));

    log.error("event=api.error status=500 title=internal_error", e);
    return pd;
  }
}
