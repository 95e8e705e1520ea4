package io.intellixity.vigil.server.web;

import io.intellixity.vigil.source.UpstreamException;
import jakarta.servlet.http.HttpServletRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/** Maps exceptions to the {@code {success:false, error}} envelope. */
@RestControllerAdvice
public class ApiExceptionHandler {
  private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

  @ExceptionHandler(UpstreamException.class)
  public ResponseEntity<ApiResponse<Void>> handleUpstream(UpstreamException ex, HttpServletRequest request) {
    HttpStatus status = HttpStatus.resolve(ex.status());
    if (status == null || !status.isError()) status = HttpStatus.INTERNAL_SERVER_ERROR;
    log.warn("Upstream call failed: {} (status={}, path={})", ex.getMessage(), status.value(), path(request));
    return ResponseEntity.status(status).body(ApiResponse.error(ex.getMessage()));
  }

  @ExceptionHandler(IllegalArgumentException.class)
  public ResponseEntity<ApiResponse<Void>> handleBadRequest(IllegalArgumentException ex, HttpServletRequest request) {
    String detail = (ex.getMessage() == null || ex.getMessage().isBlank())
        ? "Request could not be processed"
        : ex.getMessage();
    log.debug("Request validation failed: {} (path={})", detail, path(request));
    return ResponseEntity.badRequest().body(ApiResponse.error(detail));
  }

  @ExceptionHandler(MissingServletRequestParameterException.class)
  public ResponseEntity<ApiResponse<Void>> handleMissingParameter(MissingServletRequestParameterException ex) {
    return ResponseEntity.badRequest().body(ApiResponse.error(ex.getParameterName() + " parameter is required"));
  }

  @ExceptionHandler(HttpMessageNotReadableException.class)
  public ResponseEntity<ApiResponse<Void>> handleUnreadable(HttpMessageNotReadableException ex, HttpServletRequest request) {
    log.debug("Unreadable request body (path={})", path(request), ex);
    return ResponseEntity.badRequest().body(ApiResponse.error("Malformed JSON request body"));
  }

  @ExceptionHandler(Exception.class)
  public ResponseEntity<ApiResponse<Void>> handleUnexpected(Exception ex, HttpServletRequest request) {
    log.error("Unhandled error (path={})", path(request), ex);
    return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(ApiResponse.error("Internal server error"));
  }

  private static String path(HttpServletRequest request) {
    return request != null ? request.getRequestURI() : "<unknown>";
  }
}
