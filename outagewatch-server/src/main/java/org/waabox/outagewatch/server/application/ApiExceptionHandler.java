package org.waabox.outagewatch.server.application;

import java.util.LinkedHashMap;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import org.waabox.outagewatch.BuildException;
import org.waabox.outagewatch.ExtractionException;
import org.waabox.outagewatch.ModeledDataNotFoundException;
import org.waabox.outagewatch.OutageWatchException;
import org.waabox.outagewatch.QueryException;
import org.waabox.outagewatch.RefreshInProgressException;
import org.waabox.outagewatch.SwapException;

/** Maps failures to HTTP answers with an {@code error} and a
 * {@code detail} field.
 *
 * <ul>
 *   <li>bad query or refresh parameters: 400</li>
 *   <li>missing token: 401, wrong token: 403</li>
 *   <li>no modeled tables yet: 404</li>
 *   <li>a refresh is already running: 409</li>
 *   <li>upstream extraction failed: 502</li>
 *   <li>build or swap failed: 500</li>
 * </ul>
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
@RestControllerAdvice
public class ApiExceptionHandler {

  /** The class logger. */
  private static final Logger log =
      LoggerFactory.getLogger(ApiExceptionHandler.class);

  @ExceptionHandler(QueryException.class)
  public ResponseEntity<Map<String, Object>> handleQuery(
      final QueryException e) {
    return error(HttpStatus.BAD_REQUEST, "invalid_request", e.getMessage());
  }

  @ExceptionHandler(MethodArgumentTypeMismatchException.class)
  public ResponseEntity<Map<String, Object>> handleTypeMismatch(
      final MethodArgumentTypeMismatchException e) {
    return error(HttpStatus.BAD_REQUEST, "invalid_request",
        e.getName() + " has an invalid value: " + e.getValue());
  }

  @ExceptionHandler(AuthenticationException.class)
  public ResponseEntity<Map<String, Object>> handleAuthentication(
      final AuthenticationException e) {
    if (e.missing()) {
      return error(HttpStatus.UNAUTHORIZED, "unauthorized", e.getMessage());
    }
    return error(HttpStatus.FORBIDDEN, "forbidden", e.getMessage());
  }

  @ExceptionHandler(ModeledDataNotFoundException.class)
  public ResponseEntity<Map<String, Object>> handleNotFound(
      final ModeledDataNotFoundException e) {
    return error(HttpStatus.NOT_FOUND, "not_found",
        "Modeled data not found. Run POST /refresh first.");
  }

  @ExceptionHandler(RefreshInProgressException.class)
  public ResponseEntity<Map<String, Object>> handleInProgress(
      final RefreshInProgressException e) {
    return error(HttpStatus.CONFLICT, "refresh_in_progress", e.getMessage());
  }

  @ExceptionHandler(ExtractionException.class)
  public ResponseEntity<Map<String, Object>> handleExtraction(
      final ExtractionException e) {
    return error(HttpStatus.BAD_GATEWAY, "extraction_failed",
        e.getMessage());
  }

  @ExceptionHandler({BuildException.class, SwapException.class})
  public ResponseEntity<Map<String, Object>> handleRefreshFailure(
      final OutageWatchException e) {
    return error(HttpStatus.INTERNAL_SERVER_ERROR, "refresh_failed",
        e.getMessage());
  }

  @ExceptionHandler(OutageWatchException.class)
  public ResponseEntity<Map<String, Object>> handleOther(
      final OutageWatchException e) {
    log.error("Unhandled service failure", e);
    return error(HttpStatus.INTERNAL_SERVER_ERROR, "internal_error",
        e.getMessage());
  }

  private static ResponseEntity<Map<String, Object>> error(
      final HttpStatus status, final String error, final String detail) {
    final Map<String, Object> body = new LinkedHashMap<>();
    body.put("error", error);
    body.put("detail", detail);
    return ResponseEntity.status(status).body(body);
  }
}
