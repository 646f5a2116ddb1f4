package io.intellixity.datastore.context;

import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * Per-request caller context handed to the access policy.\n
 *
 * Typical keys: {@code user}, {@code roles}, {@code ignoreAuth}.\n
 */
public interface ActionContext {
  String USER = "user";
  String ROLES = "roles";
  String IGNORE_AUTH = "ignoreAuth";

  /** Return a context value or null if absent. */
  Object get(String key);

  /** Stable identity for this context (used in log lines). */
  String cacheKey();

  /** Calling user name, or null for anonymous callers. */
  default String user() {
    Object v = get(USER);
    return (v == null) ? null : String.valueOf(v);
  }

  /** Roles granted to the caller; empty for anonymous callers. */
  default Set<String> roles() {
    Object v = get(ROLES);
    if (v instanceof Collection<?> c) {
      Set<String> out = new LinkedHashSet<>();
      for (Object o : c) if (o != null) out.add(String.valueOf(o));
      return Set.copyOf(out);
    }
    if (v instanceof String s && !s.isBlank()) {
      Set<String> out = new LinkedHashSet<>();
      for (String part : s.split(",")) if (!part.isBlank()) out.add(part.trim());
      return Set.copyOf(out);
    }
    return Set.of();
  }

  /** True when the caller is trusted code that skips access checks (e.g. internal jobs). */
  default boolean ignoreAuth() {
    return Boolean.TRUE.equals(get(IGNORE_AUTH));
  }

  /** Simple map-backed context. */
  static ActionContext of(Map<String, ?> values) {
    Map<String, ?> m = values == null ? Map.of() : Map.copyOf(values);
    return of(m, "map:" + m.hashCode());
  }

  /** Simple map-backed context with an explicit cache key. */
  static ActionContext of(Map<String, ?> values, String cacheKey) {
    Map<String, ?> m = values == null ? Map.of() : Map.copyOf(values);
    String ck = (cacheKey == null || cacheKey.isBlank()) ? ("map:" + m.hashCode()) : cacheKey;
    return new ActionContext() {
      @Override public Object get(String key) { return m.get(key); }
      @Override public String cacheKey() { return ck; }
    };
  }

  /** Context for trusted internal callers. */
  static ActionContext internal() {
    return of(Map.of(IGNORE_AUTH, true), "internal");
  }
}
