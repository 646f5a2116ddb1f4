package io.intellixity.datastore.error;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Raised when a request is malformed or conflicts with the target table.
 * <p>
 * Carries field-keyed messages (e.g. {@code resource_id -> ["Missing value"]}) that are reported to the caller
 * verbatim. Never retried.
 */
public final class DatastoreValidationException extends RuntimeException {
  private final Map<String, List<String>> errors;

  public DatastoreValidationException(Map<String, List<String>> errors) {
    super(render(errors));
    this.errors = copy(errors);
  }

  public DatastoreValidationException(Map<String, List<String>> errors, Throwable cause) {
    super(render(errors), cause);
    this.errors = copy(errors);
  }

  public static DatastoreValidationException of(String field, String message) {
    return new DatastoreValidationException(Map.of(field, List.of(message)));
  }

  /** Field-keyed messages in insertion order. */
  public Map<String, List<String>> errors() {
    return errors;
  }

  private static Map<String, List<String>> copy(Map<String, List<String>> in) {
    if (in == null || in.isEmpty()) return Map.of();
    Map<String, List<String>> out = new LinkedHashMap<>();
    for (var e : in.entrySet()) {
      out.put(e.getKey(), e.getValue() == null ? List.of() : List.copyOf(new ArrayList<>(e.getValue())));
    }
    return Collections.unmodifiableMap(out);
  }

  private static String render(Map<String, List<String>> errors) {
    if (errors == null || errors.isEmpty()) return "Validation error";
    StringBuilder sb = new StringBuilder("Validation error: ");
    boolean first = true;
    for (var e : errors.entrySet()) {
      if (!first) sb.append("; ");
      first = false;
      sb.append(e.getKey()).append('=').append(e.getValue());
    }
    return sb.toString();
  }
}
