package io.intellixity.datastore.request;

import java.util.Map;
import java.util.Objects;

/**
 * Delete rows or a whole table.\n
 *
 * A null {@code filters} drops the table with its aliases; a non-null map (even an empty one) deletes matching
 * rows and keeps the table.\n
 */
public record DeleteRequest(String resourceId, Map<String, Object> filters, boolean force) {
  public DeleteRequest {
    Objects.requireNonNull(resourceId, "resourceId");
    filters = Copies.map(filters);
  }

  public boolean dropsTable() {
    return filters == null;
  }

  public DeleteRequest withForce(boolean f) {
    return new DeleteRequest(resourceId, filters, f);
  }
}
