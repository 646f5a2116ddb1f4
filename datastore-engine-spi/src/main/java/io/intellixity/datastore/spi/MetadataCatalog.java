package io.intellixity.datastore.spi;

import io.intellixity.datastore.model.CatalogEntry;

import java.util.Optional;

/**
 * Lookups against the reserved catalog of tables and aliases.\n
 *
 * This is the only source the action layer uses to test table existence and resolve aliases.\n
 */
public interface MetadataCatalog {
  /** Catalog row for a table or alias name. */
  Optional<CatalogEntry> lookup(String connectionUrl, String name);

  /** True if {@code name} is a real (non-alias) table. */
  default boolean tableExists(String connectionUrl, String name) {
    return lookup(connectionUrl, name).map(e -> !e.isAlias()).orElse(false);
  }
}
