package io.intellixity.datastore.server.web;

import io.intellixity.datastore.actions.UnknownActionException;
import io.intellixity.datastore.error.AccessDeniedException;
import io.intellixity.datastore.error.DatastoreValidationException;
import io.intellixity.datastore.error.InvalidDataException;
import io.intellixity.datastore.error.ResourceNotFoundException;
import jakarta.servlet.http.HttpServletRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Renders action failures in the action API envelope:\n
 * {@code {"help": ..., "success": false, "error": {"__type": ..., ...}}}\n
 */
@RestControllerAdvice
public final class ActionExceptionHandler {
  private static final Logger log = LoggerFactory.getLogger(ActionExceptionHandler.class);

  static final String VALIDATION_ERROR = "Validation Error";
  static final String NOT_FOUND_ERROR = "Not Found Error";
  static final String AUTHORIZATION_ERROR = "Authorization Error";
  static final String BAD_REQUEST = "Bad Request";

  @ExceptionHandler(DatastoreValidationException.class)
  public ResponseEntity<Map<String, Object>> validation(DatastoreValidationException e, HttpServletRequest req) {
    Map<String, Object> error = new LinkedHashMap<>();
    error.put("__type", VALIDATION_ERROR);
    error.putAll(e.errors());
    return respond(HttpStatus.CONFLICT, error, req);
  }

  @ExceptionHandler(InvalidDataException.class)
  public ResponseEntity<Map<String, Object>> invalidData(InvalidDataException e, HttpServletRequest req) {
    return validation(e.toValidation("message"), req);
  }

  @ExceptionHandler(ResourceNotFoundException.class)
  public ResponseEntity<Map<String, Object>> notFound(ResourceNotFoundException e, HttpServletRequest req) {
    return respond(HttpStatus.NOT_FOUND, message(NOT_FOUND_ERROR, e.getMessage()), req);
  }

  @ExceptionHandler(AccessDeniedException.class)
  public ResponseEntity<Map<String, Object>> denied(AccessDeniedException e, HttpServletRequest req) {
    log.debug("datastore.http denied path={} message={}", req.getRequestURI(), e.getMessage());
    return respond(HttpStatus.FORBIDDEN, message(AUTHORIZATION_ERROR, e.getMessage()), req);
  }

  @ExceptionHandler(UnknownActionException.class)
  public ResponseEntity<Map<String, Object>> unknownAction(UnknownActionException e, HttpServletRequest req) {
    return respond(HttpStatus.BAD_REQUEST, message(BAD_REQUEST, "Action name not known: " + e.action()), req);
  }

  @ExceptionHandler(HttpMessageNotReadableException.class)
  public ResponseEntity<Map<String, Object>> unreadable(HttpMessageNotReadableException e, HttpServletRequest req) {
    return respond(HttpStatus.BAD_REQUEST, message(BAD_REQUEST, "JSON Error: request body is not valid JSON"), req);
  }

  private static Map<String, Object> message(String type, String message) {
    Map<String, Object> error = new LinkedHashMap<>();
    error.put("__type", type);
    error.put("message", message);
    return error;
  }

  private static ResponseEntity<Map<String, Object>> respond(HttpStatus status, Map<String, Object> error,
                                                            HttpServletRequest req) {
    Map<String, Object> body = new LinkedHashMap<>();
    body.put("help", ActionController.help(actionOf(req.getRequestURI())));
    body.put("success", false);
    body.put("error", error);
    return ResponseEntity.status(status).body(body);
  }

  private static String actionOf(String uri) {
    if (uri == null) return "";
    int slash = uri.lastIndexOf('/');
    return slash < 0 ? uri : uri.substring(slash + 1);
  }
}
