package io.intellixity.datastore.request;

import java.util.Objects;

/** A single SQL select statement. */
public record SearchSqlRequest(String sql) {
  public SearchSqlRequest {
    Objects.requireNonNull(sql, "sql");
  }
}
