package io.intellixity.datastore.error;

import java.util.List;
import java.util.Map;

/**
 * Raised by table engines when caller-supplied data cannot be applied (unknown columns, type mismatch,
 * duplicate or missing keys).
 * <p>
 * The action layer reports it as a {@link DatastoreValidationException}.
 */
public final class InvalidDataException extends RuntimeException {
  private final Map<String, List<String>> errors;

  public InvalidDataException(String message) {
    super(message);
    this.errors = Map.of();
  }

  public InvalidDataException(String message, Throwable cause) {
    super(message, cause);
    this.errors = Map.of();
  }

  public InvalidDataException(String field, String message) {
    super(message);
    this.errors = Map.of(field, List.of(message));
  }

  /** Field-keyed messages; empty when the engine only supplied a message. */
  public Map<String, List<String>> errors() {
    return errors;
  }

  public DatastoreValidationException toValidation(String defaultField) {
    if (!errors.isEmpty()) return new DatastoreValidationException(errors, this);
    return new DatastoreValidationException(Map.of(defaultField, List.of(String.valueOf(getMessage()))), this);
  }
}
