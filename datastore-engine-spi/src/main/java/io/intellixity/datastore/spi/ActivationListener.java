package io.intellixity.datastore.spi;

import java.util.Objects;

/** Consumer of committed activation-flag changes. */
@FunctionalInterface
public interface ActivationListener {
  void activationChanged(ActivationChanged event);

  /** The {@code datastore_active} flag of a resource was committed as {@code active}. */
  record ActivationChanged(String resourceId, String packageId, boolean active) {
    public ActivationChanged {
      Objects.requireNonNull(resourceId, "resourceId");
    }
  }
}
