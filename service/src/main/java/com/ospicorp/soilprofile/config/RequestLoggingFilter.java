package com.ospicorp.soilprofile.config;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.util.UUID;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.lang.NonNull;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

/**
 * Tags each request with an id (taken from {@code X-Request-Id} when it looks sane, generated
 * otherwise), exposes it through the MDC and the response header, and logs one access line.
 */
@Component
@Order(Ordered.HIGHEST_PRECEDENCE)
public class RequestLoggingFilter extends OncePerRequestFilter {

  public static final String REQUEST_ID_HEADER = "X-Request-Id";
  public static final String REQUEST_ID_MDC_KEY = "requestId";

  private static final Logger log = LoggerFactory.getLogger(RequestLoggingFilter.class);
  private static final Pattern REQUEST_ID_PATTERN = Pattern.compile("^[A-Za-z0-9._-]{1,64}$");

  @Override
  protected void doFilterInternal(@NonNull HttpServletRequest request,
      @NonNull HttpServletResponse response, @NonNull FilterChain filterChain)
      throws ServletException, IOException {
    long startTime = System.nanoTime();
    String requestId = resolveRequestId(request);
    MDC.put(REQUEST_ID_MDC_KEY, requestId);
    response.setHeader(REQUEST_ID_HEADER, requestId);
    try {
      filterChain.doFilter(request, response);
    } catch (ServletException | IOException | RuntimeException ex) {
      log.error("Request {} {} from {} failed: {}",
          request.getMethod(),
          RequestDescriptions.uriWithQuery(request),
          RequestDescriptions.clientIp(request),
          ex.getMessage(),
          ex);
      throw ex;
    } finally {
      long durationMs = (System.nanoTime() - startTime) / 1_000_000;
      log.info("HTTP {} {} from {} -> {} ({} ms)",
          request.getMethod(),
          RequestDescriptions.uriWithQuery(request),
          RequestDescriptions.clientIp(request),
          response.getStatus(),
          durationMs);
      MDC.remove(REQUEST_ID_MDC_KEY);
    }
  }

  static String resolveRequestId(HttpServletRequest request) {
    String supplied = request.getHeader(REQUEST_ID_HEADER);
    if (supplied != null && REQUEST_ID_PATTERN.matcher(supplied).matches()) {
      return supplied;
    }
    return UUID.randomUUID().toString();
  }
}
