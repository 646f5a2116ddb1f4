package io.intellixity.datastore.jdbc;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Compiles SQL containing named parameters (e.g. {@code :name}) into JDBC SQL with '?' binds.\n
 *
 * Rules:\n
 * - Params are recognized as ':' followed by [A-Za-z_][A-Za-z0-9_]*\n
 * - '::' is treated as a SQL cast and not a param.\n
 * - Params inside single-quoted literals and double-quoted identifiers are ignored.\n
 */
public final class SqlParamCompiler {
  private SqlParamCompiler() {}

  /**
   * Resolve binds for named params in a SQL string without rewriting the SQL.\n
   * Bind order matches appearance order of named params; a {@link Bind} value is used as-is.\n
   */
  public static List<Bind> bindsFor(String sql, Map<String, Object> params) {
    if (sql == null) return List.of();
    Map<String, Object> effective = (params == null) ? Map.of() : params;
    List<Bind> binds = new ArrayList<>();
    scan(sql, null, name -> {
      Object raw = getRequired(effective, name);
      binds.add((raw instanceof Bind b) ? b : Bind.text(raw));
    });
    return binds;
  }

  /** Rewrite named params into '?' placeholders. Purely lexical. */
  public static String toJdbcSql(String sql) {
    if (sql == null) return "";
    StringBuilder out = new StringBuilder(sql.length() + 16);
    scan(sql, out, name -> out.append('?'));
    return out.toString();
  }

  /** Compile SQL with named params into JDBC SQL plus ordered binds. */
  public static SqlStatement compile(String sql, Map<String, Object> params) {
    return new SqlStatement(sql, bindsFor(sql, params));
  }

  private interface ParamSink {
    void param(String name);
  }

  private static void scan(String sql, StringBuilder out, ParamSink sink) {
    char quote = 0;
    for (int i = 0; i < sql.length(); i++) {
      char ch = sql.charAt(i);

      if (quote != 0) {
        if (out != null) out.append(ch);
        if (ch == quote) {
          // doubled quote is an escaped quote
          if (i + 1 < sql.length() && sql.charAt(i + 1) == quote) {
            if (out != null) out.append(quote);
            i++;
          } else {
            quote = 0;
          }
        }
        continue;
      }

      if (ch == '\'' || ch == '"') {
        quote = ch;
        if (out != null) out.append(ch);
        continue;
      }

      if (ch == ':') {
        // Skip :: casts
        if (i + 1 < sql.length() && sql.charAt(i + 1) == ':') {
          if (out != null) out.append("::");
          i++;
          continue;
        }
        int start = i + 1;
        if (start < sql.length() && isIdentStart(sql.charAt(start))) {
          int end = start + 1;
          while (end < sql.length() && isIdentPart(sql.charAt(end))) end++;
          sink.param(sql.substring(start, end));
          i = end - 1;
          continue;
        }
      }

      if (out != null) out.append(ch);
    }
  }

  private static Object getRequired(Map<String, Object> params, String name) {
    if (params.containsKey(name)) return params.get(name);
    throw new IllegalArgumentException("Missing query param: " + name);
  }

  private static boolean isIdentStart(char c) {
    return (c >= 'A' && c <= 'Z') || (c >= 'a' && c <= 'z') || c == '_';
  }

  private static boolean isIdentPart(char c) {
    return isIdentStart(c) || (c >= '0' && c <= '9');
  }
}
