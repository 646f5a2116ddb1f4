package io.intellixity.datastore.model;

import java.util.Objects;

/**
 * Result of resolving a caller-supplied table identifier against the metadata catalog.
 * <p>
 * Access checks and engine calls must use {@link #physicalId()}, never {@link #name()}.
 */
public sealed interface TableRef permits TableRef.Real, TableRef.Alias {
  /** Identifier as supplied by the caller. */
  String name();

  /** Name of the physical table backing this reference. */
  String physicalId();

  default boolean isAlias() {
    return this instanceof Alias;
  }

  record Real(String name) implements TableRef {
    public Real {
      Objects.requireNonNull(name, "name");
    }

    @Override public String physicalId() { return name; }
  }

  record Alias(String name, String target) implements TableRef {
    public Alias {
      Objects.requireNonNull(name, "name");
      Objects.requireNonNull(target, "target");
    }

    @Override public String physicalId() { return target; }
  }
}
