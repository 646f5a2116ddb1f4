package io.intellixity.datastore.actions;

import com.fasterxml.jackson.databind.JsonNode;
import io.intellixity.datastore.context.ActionContext;
import io.intellixity.datastore.context.ActionScope;
import io.intellixity.datastore.request.ActionRequests;
import io.intellixity.datastore.spi.ActionNames;

import java.util.List;
import java.util.Objects;

/**
 * Maps action names and raw JSON payloads onto {@link DatastoreActions}.\n
 *
 * The caller context is bound to {@link ActionScope} for the duration of the call.\n
 */
public final class ActionDispatcher {
  public static final String CREATE = ActionNames.CREATE;
  public static final String UPSERT = ActionNames.UPSERT;
  public static final String DELETE = ActionNames.DELETE;
  public static final String SEARCH = ActionNames.SEARCH;
  public static final String SEARCH_SQL = ActionNames.SEARCH_SQL;
  public static final String MAKE_PRIVATE = "datastore_make_private";
  public static final String MAKE_PUBLIC = "datastore_make_public";
  public static final String INFO = ActionNames.INFO;

  public static final List<String> ACTIONS =
      List.of(CREATE, UPSERT, DELETE, SEARCH, SEARCH_SQL, MAKE_PRIVATE, MAKE_PUBLIC, INFO);

  private final ActionRequests requests;
  private final DatastoreActions actions;

  public ActionDispatcher(ActionRequests requests, DatastoreActions actions) {
    this.requests = Objects.requireNonNull(requests, "requests");
    this.actions = Objects.requireNonNull(actions, "actions");
  }

  /** Returns the action result; null for actions that return nothing. */
  public Object dispatch(String action, ActionContext ctx, JsonNode data) {
    Objects.requireNonNull(action, "action");
    ActionContext c = (ctx == null) ? ActionContext.of(null, "anonymous") : ctx;
    return ActionScope.inContext(c, () -> run(action, c, data));
  }

  private Object run(String action, ActionContext ctx, JsonNode data) {
    switch (action) {
      case CREATE:
        return actions.create(ctx, requests.create(data)).orElse(null);
      case UPSERT:
        return actions.upsert(ctx, requests.upsert(data));
      case DELETE:
        return actions.delete(ctx, requests.delete(data));
      case SEARCH:
        return actions.search(ctx, requests.search(data));
      case SEARCH_SQL:
        return actions.searchSql(ctx, requests.searchSql(data));
      case MAKE_PRIVATE:
        actions.makePrivate(ctx, requests.permission(data));
        return null;
      case MAKE_PUBLIC:
        actions.makePublic(ctx, requests.permission(data));
        return null;
      case INFO:
        return actions.info(ctx, requests.info(data));
      default:
        throw new UnknownActionException(action);
    }
  }
}
