package io.intellixity.datastore.model;

import java.util.Locale;
import java.util.Optional;

/** Write method for {@code upsert}. */
public enum UpsertMethod {
  /** Update rows whose key exists, insert the rest. Requires a primary key. */
  UPSERT,
  /** Insert only; fails on any key collision. */
  INSERT,
  /** Update only; fails if a key does not exist. Requires a primary key. */
  UPDATE;

  public String wireName() {
    return name().toLowerCase(Locale.ROOT);
  }

  public static Optional<UpsertMethod> parse(String raw) {
    if (raw == null) return Optional.empty();
    for (UpsertMethod m : values()) {
      if (m.wireName().equalsIgnoreCase(raw.trim())) return Optional.of(m);
    }
    return Optional.empty();
  }
}
