package io.intellixity.datastore.spi;

import io.intellixity.datastore.context.ActionContext;
import io.intellixity.datastore.error.AccessDeniedException;

import java.util.Map;

/** Authorization of datastore actions. */
@FunctionalInterface
public interface AccessPolicy {
  /**
   * Raise {@link AccessDeniedException} if the caller may not run {@code action}.\n
   *
   * @param action one of {@link ActionNames}\n
   * @param payload action inputs; {@code resource_id} is always the physical table id\n
   */
  void checkAccess(String action, ActionContext ctx, Map<String, Object> payload);

  /** Allows everything; for trusted embedded use. */
  static AccessPolicy permitAll() {
    return (action, ctx, payload) -> { };
  }
}
