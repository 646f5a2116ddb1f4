package io.intellixity.datastore.actions;

import io.intellixity.datastore.error.ResourceNotFoundException;
import io.intellixity.datastore.model.CatalogEntry;
import io.intellixity.datastore.model.TableRef;
import io.intellixity.datastore.spi.MetadataCatalog;

import java.util.Objects;
import java.util.Optional;

/** Resolves table or alias names through the metadata catalog. */
public final class AliasResolver {
  private final MetadataCatalog catalog;

  public AliasResolver(MetadataCatalog catalog) {
    this.catalog = Objects.requireNonNull(catalog, "catalog");
  }

  public Optional<TableRef> resolve(String connectionUrl, String name) {
    Objects.requireNonNull(name, "name");
    return catalog.lookup(connectionUrl, name).map(CatalogEntry::toTableRef);
  }

  /** Resolve or raise {@link ResourceNotFoundException}. */
  public TableRef require(String connectionUrl, String name) {
    return resolve(connectionUrl, name).orElseThrow(() -> ResourceNotFoundException.resource(name));
  }

  /** True only for real tables; alias names answer false. */
  public boolean isRealTable(String connectionUrl, String name) {
    return resolve(connectionUrl, name).map(r -> !r.isAlias()).orElse(false);
  }
}
