package io.intellixity.datastore.actions;

import io.intellixity.datastore.error.DatastoreValidationException;
import io.intellixity.datastore.model.Resource;
import io.intellixity.datastore.spi.ResourceRegistry;

import java.util.Objects;

/** Refuses mutation of tables that are not datastore-managed unless the caller forces it. */
public final class ReadOnlyGate {
  static final String FIELD = "read-only";
  static final String MESSAGE =
      "Cannot edit read-only resource. Either pass \"force=True\" or change url-type to \"datastore\"";

  private final ResourceRegistry registry;

  public ReadOnlyGate(ResourceRegistry registry) {
    this.registry = Objects.requireNonNull(registry, "registry");
  }

  public void check(String resourceId, boolean force) {
    if (force) return;
    Resource r = registry.get(resourceId);
    if (!r.datastoreManaged()) throw DatastoreValidationException.of(FIELD, MESSAGE);
  }
}
