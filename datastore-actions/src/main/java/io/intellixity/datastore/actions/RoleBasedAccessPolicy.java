package io.intellixity.datastore.actions;

import io.intellixity.datastore.context.ActionContext;
import io.intellixity.datastore.error.AccessDeniedException;
import io.intellixity.datastore.model.Resource;
import io.intellixity.datastore.spi.AccessPolicy;
import io.intellixity.datastore.spi.ActionNames;
import io.intellixity.datastore.spi.ResourceRegistry;

import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Role-based {@link AccessPolicy}.\n
 *
 * - {@code sysadmin} and trusted internal callers may do anything\n
 * - mutations and permission changes need {@code editor}\n
 * - reading a table of a private package needs {@code editor} or {@code member}\n
 * - raw SQL search is open to everyone; private tables are closed by the backend role\n
 */
public final class RoleBasedAccessPolicy implements AccessPolicy {
  public static final String SYSADMIN = "sysadmin";
  public static final String EDITOR = "editor";
  public static final String MEMBER = "member";

  private static final Set<String> WRITE_ACTIONS =
      Set.of(ActionNames.CREATE, ActionNames.UPSERT, ActionNames.DELETE, ActionNames.CHANGE_PERMISSIONS);
  private static final Set<String> READ_ACTIONS = Set.of(ActionNames.SEARCH, ActionNames.INFO);

  private final ResourceRegistry registry;

  public RoleBasedAccessPolicy(ResourceRegistry registry) {
    this.registry = Objects.requireNonNull(registry, "registry");
  }

  @Override
  public void checkAccess(String action, ActionContext ctx, Map<String, Object> payload) {
    Objects.requireNonNull(action, "action");
    if (ctx != null && ctx.ignoreAuth()) return;
    Set<String> roles = (ctx == null) ? Set.of() : ctx.roles();
    if (roles.contains(SYSADMIN)) return;

    if (WRITE_ACTIONS.contains(action)) {
      if (!roles.contains(EDITOR)) throw denied(action, ctx);
      return;
    }
    if (READ_ACTIONS.contains(action)) {
      Object id = (payload == null) ? null : payload.get("resource_id");
      // unknown resources are reported as not-found by the action itself
      Optional<Resource> r = (id == null) ? Optional.empty() : registry.find(String.valueOf(id));
      if (r.isPresent() && r.get().packagePrivate() && !roles.contains(EDITOR) && !roles.contains(MEMBER)) {
        throw denied(action, ctx);
      }
      return;
    }
    if (ActionNames.SEARCH_SQL.equals(action)) return;
    throw denied(action, ctx);
  }

  private static AccessDeniedException denied(String action, ActionContext ctx) {
    String user = (ctx == null || ctx.user() == null) ? "Anonymous" : ctx.user();
    return new AccessDeniedException("User " + user + " not authorized to call " + action);
  }
}
