package io.intellixity.datastore.jdbc;

/**
 * One positional bind value.\n
 *
 * @param value encoded value (text, or null)\n
 * @param sqlType backend type the placeholder is cast to; null binds untyped\n
 */
public record Bind(Object value, String sqlType) {
  public static Bind text(Object value) {
    return new Bind(value, null);
  }
}
