package io.intellixity.datastore.actions;

import io.intellixity.datastore.model.Resource;
import io.intellixity.datastore.spi.ActivationListener;
import io.intellixity.datastore.spi.ActivationListener.ActivationChanged;
import io.intellixity.datastore.spi.ResourceRegistry;
import io.intellixity.datastore.spi.ResourceRegistry.ActivationRow;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;

/**
 * Records whether a physical table backs a resource and publishes the change.\n
 *
 * The registry patch is committed before listeners run; there is no transaction spanning the table, the registry
 * and the listeners. A registry failure propagates; what listeners do with a failure is up to them.\n
 */
public final class ActiveFlagSynchronizer {
  private static final Logger log = LoggerFactory.getLogger(ActiveFlagSynchronizer.class);

  private final ResourceRegistry registry;
  private final List<ActivationListener> listeners;

  public ActiveFlagSynchronizer(ResourceRegistry registry, List<ActivationListener> listeners) {
    this.registry = Objects.requireNonNull(registry, "registry");
    this.listeners = List.copyOf(Objects.requireNonNull(listeners, "listeners"));
  }

  public void setActive(String resourceId, boolean active) {
    Objects.requireNonNull(resourceId, "resourceId");
    ActivationRow row = registry.readActivation(resourceId);
    registry.patchExtra(resourceId, Resource.DATASTORE_ACTIVE, active);
    log.debug("datastore.action flag resourceId={} packageId={} {}={}",
        resourceId, row.packageId(), Resource.DATASTORE_ACTIVE, active);

    ActivationChanged event = new ActivationChanged(resourceId, row.packageId(), active);
    for (ActivationListener l : listeners) l.activationChanged(event);
  }
}
