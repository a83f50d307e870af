package classifier.controller;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.util.UUID;
import org.slf4j.MDC;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

/**
 * Puts the caller's {@code X-Request-Id} (or a generated one) in the MDC for the whole request,
 * error handling included, and echoes it back.
 */
@Component
@Order(Ordered.HIGHEST_PRECEDENCE)
public class RequestIdFilter extends OncePerRequestFilter {
  static final String REQUEST_ID_HEADER = "X-Request-Id";
  static final String MDC_KEY = "requestId";

  @Override
  protected void doFilterInternal(HttpServletRequest request, HttpServletResponse response, FilterChain chain)
      throws ServletException, IOException {
    String rid = normalizeOrGenerate(request.getHeader(REQUEST_ID_HEADER));
    response.setHeader(REQUEST_ID_HEADER, rid);
    try (var ignored = MDC.putCloseable(MDC_KEY, rid)) {
      chain.doFilter(request, response);
    }
  }

  private static String normalizeOrGenerate(String headerRequestId) {
    if (headerRequestId != null && !headerRequestId.isBlank()) {
      String candidate = headerRequestId.trim();
      return candidate.length() <= 128 ? candidate : candidate.substring(0, 128);
    }
    return UUID.randomUUID().toString();
  }
}
