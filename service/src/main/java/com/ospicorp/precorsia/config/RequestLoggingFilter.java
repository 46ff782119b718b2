package com.ospicorp.precorsia.config;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.lang.NonNull;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

/**
 * Logs every HTTP exchange and tags the log lines of a request with a short request id, so
 * the pipeline steps of one correlation run can be followed in the log.
 */
@Component
public class RequestLoggingFilter extends OncePerRequestFilter {

  private static final Logger log = LoggerFactory.getLogger(RequestLoggingFilter.class);
  static final String REQUEST_ID = "requestId";

  @Override
  protected void doFilterInternal(@NonNull HttpServletRequest request,
      @NonNull HttpServletResponse response, @NonNull FilterChain filterChain)
      throws ServletException, IOException {
    long startTime = System.currentTimeMillis();
    MDC.put(REQUEST_ID, UUID.randomUUID().toString().substring(0, 8));
    try {
      filterChain.doFilter(request, response);
    } catch (ServletException | IOException | RuntimeException ex) {
      log.error("Request {} {} failed: {}", request.getMethod(), uriWithQuery(request),
          ex.getMessage(), ex);
      throw ex;
    } finally {
      long duration = System.currentTimeMillis() - startTime;
      if (request.getRequestURI().startsWith("/actuator")) {
        log.debug("HTTP {} {} -> {} ({} ms)", request.getMethod(), uriWithQuery(request),
            response.getStatus(), duration);
      } else {
        log.info("HTTP {} {} -> {} ({} ms)", request.getMethod(), uriWithQuery(request),
            response.getStatus(), duration);
      }
      MDC.remove(REQUEST_ID);
    }
  }

  private String uriWithQuery(HttpServletRequest request) {
    String queryString = request.getQueryString();
    if (queryString == null || queryString.isBlank()) {
      return request.getRequestURI();
    }
    return request.getRequestURI() + "?" + queryString;
  }
}
