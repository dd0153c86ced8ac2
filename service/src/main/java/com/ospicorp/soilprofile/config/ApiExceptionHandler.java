package com.ospicorp.soilprofile.config;

import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.ConstraintViolationException;
import java.net.URI;
import java.util.Locale;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.security.access.AccessDeniedException;
import org.springframework.security.core.AuthenticationException;
import org.springframework.web.ErrorResponse;
import org.springframework.web.HttpMediaTypeNotSupportedException;
import org.springframework.web.HttpRequestMethodNotSupportedException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;
import org.springframework.web.server.ResponseStatusException;
import org.springframework.web.servlet.resource.NoResourceFoundException;

/**
 * Renders framework-level failures as RFC 7807 problem documents. Analysis outcomes, including
 * rejected coordinates, are not exceptions and never reach this class.
 */
@RestControllerAdvice
public class ApiExceptionHandler {

  private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

  static final String PROBLEM_TYPE_BASE = "https://docs.soil-profile-api.dev/problems/";

  @ExceptionHandler({MethodArgumentTypeMismatchException.class,
      MissingServletRequestParameterException.class, MethodArgumentNotValidException.class,
      ConstraintViolationException.class, HttpMessageNotReadableException.class,
      IllegalArgumentException.class})
  public ResponseEntity<ProblemDetail> handleBadInput(Exception ex, HttpServletRequest request) {
    return problem(HttpStatus.BAD_REQUEST, describeBadInput(ex), ex, request);
  }

  /** Routing and negotiation failures already carry their status. */
  @ExceptionHandler({NoResourceFoundException.class, HttpRequestMethodNotSupportedException.class,
      HttpMediaTypeNotSupportedException.class, ResponseStatusException.class})
  public ResponseEntity<ProblemDetail> handleFrameworkStatus(Exception ex,
      HttpServletRequest request) {
    ErrorResponse response = (ErrorResponse) ex;
    HttpStatus status = HttpStatus.resolve(response.getStatusCode().value());
    return problem(status != null ? status : HttpStatus.INTERNAL_SERVER_ERROR,
        response.getBody().getDetail(), ex, request);
  }

  @ExceptionHandler(AuthenticationException.class)
  public ResponseEntity<ProblemDetail> handleUnauthenticated(AuthenticationException ex,
      HttpServletRequest request) {
    return problem(HttpStatus.UNAUTHORIZED, "A valid bearer token is required", ex, request);
  }

  @ExceptionHandler(AccessDeniedException.class)
  public ResponseEntity<ProblemDetail> handleDenied(AccessDeniedException ex,
      HttpServletRequest request) {
    return problem(HttpStatus.FORBIDDEN, ex.getMessage(), ex, request);
  }

  @ExceptionHandler(Exception.class)
  public ResponseEntity<ProblemDetail> handleUnexpected(Exception ex, HttpServletRequest request) {
    return problem(HttpStatus.INTERNAL_SERVER_ERROR, "Unexpected server error", ex, request);
  }

  private static String describeBadInput(Exception ex) {
    if (ex instanceof MethodArgumentTypeMismatchException mismatch) {
      return "Parameter '" + mismatch.getName() + "' must be a number";
    }
    if (ex instanceof MissingServletRequestParameterException missing) {
      return "Parameter '" + missing.getParameterName() + "' is required";
    }
    if (ex instanceof MethodArgumentNotValidException invalid) {
      String fields = invalid.getBindingResult().getFieldErrors().stream()
          .map(error -> error.getField() + " " + error.getDefaultMessage())
          .sorted()
          .collect(Collectors.joining("; "));
      return fields.isEmpty() ? "Request body is invalid" : fields;
    }
    if (ex instanceof HttpMessageNotReadableException) {
      return "Request body is not valid JSON";
    }
    return ex.getMessage();
  }

  private static ResponseEntity<ProblemDetail> problem(HttpStatus status, String detail,
      Exception ex, HttpServletRequest request) {
    String described = request.getMethod() + " " + RequestDescriptions.uriWithQuery(request)
        + " from " + RequestDescriptions.clientIp(request);
    if (status.is5xxServerError()) {
      log.error("{} failed with {}: {}", described, status.value(), reason(ex), ex);
    } else {
      log.warn("{} rejected with {}: {}", described, status.value(), reason(ex));
    }

    ProblemDetail body = ProblemDetail.forStatusAndDetail(status, detail);
    body.setType(URI.create(PROBLEM_TYPE_BASE
        + status.name().toLowerCase(Locale.ROOT).replace('_', '-')));
    body.setTitle(status.getReasonPhrase());
    body.setInstance(URI.create(request.getRequestURI()));
    body.setProperty("path", request.getRequestURI());
    return ResponseEntity.status(status).body(body);
  }

  private static String reason(Exception ex) {
    String message = ex.getMessage();
    return message == null || message.isBlank() ? ex.getClass().getName() : message;
  }
}
