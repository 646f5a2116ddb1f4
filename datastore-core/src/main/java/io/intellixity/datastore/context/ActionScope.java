package io.intellixity.datastore.context;

import java.util.Objects;
import java.util.function.Supplier;

/** Thread-scoped {@link ActionContext} binding for the duration of one action call. */
public final class ActionScope {
  private ActionScope() {}

  private static final ThreadLocal<ActionContext> CTX = new ThreadLocal<>();

  /** Execute work within an action context boundary; the previous binding is restored afterwards. */
  public static <T> T inContext(ActionContext ctx, Supplier<T> work) {
    Objects.requireNonNull(ctx, "ctx");
    Objects.requireNonNull(work, "work");
    ActionContext previous = CTX.get();
    CTX.set(ctx);
    try {
      return work.get();
    } finally {
      if (previous == null) CTX.remove();
      else CTX.set(previous);
    }
  }

  public static ActionContext currentOrNull() {
    return CTX.get();
  }

  public static ActionContext currentOrThrow() {
    ActionContext c = currentOrNull();
    if (c == null) throw new IllegalStateException("No ActionContext bound in current scope");
    return c;
  }
}
