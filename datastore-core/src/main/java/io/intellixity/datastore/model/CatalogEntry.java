package io.intellixity.datastore.model;

import java.util.Objects;

/**
 * One row of the metadata catalog.\n
 *
 * @param name table or alias name\n
 * @param aliasOf null for real tables, the real table name for aliases\n
 */
public record CatalogEntry(String name, String aliasOf) {
  public CatalogEntry {
    Objects.requireNonNull(name, "name");
  }

  public boolean isAlias() {
    return aliasOf != null;
  }

  public TableRef toTableRef() {
    return isAlias() ? new TableRef.Alias(name, aliasOf) : new TableRef.Real(name);
  }
}
