package io.intellixity.datastore.sql;

import java.util.ArrayList;
import java.util.List;

/**
 * Lexical statement splitting for raw SQL.\n
 *
 * Semicolons inside single-quoted literals, escape strings ({@code E'...'}), double-quoted identifiers,
 * dollar-quoted bodies ({@code $$...$$}, {@code $tag$...$tag$}) and comments ({@code --}, nested block comments)
 * do not split. A {@code $} inside an identifier ({@code a$b}) does not open a dollar quote.\n
 */
public final class SqlStatements {
  private SqlStatements() {}

  /** True if the input holds exactly one non-empty statement (trailing semicolons allowed). */
  public static boolean isSingleStatement(String sql) {
    return split(sql).size() == 1;
  }

  /** Split into statements; blank statements and comment-only statements are dropped. */
  public static List<String> split(String sql) {
    if (sql == null) return List.of();
    List<String> out = new ArrayList<>();
    StringBuilder cur = new StringBuilder();
    boolean hasContent = false;
    int n = sql.length();
    int i = 0;

    while (i < n) {
      char ch = sql.charAt(i);

      if (ch == '\'' || ch == '"') {
        int end = (ch == '\'' && isEscapePrefix(sql, i)) ? skipEscapeString(sql, i) : skipQuoted(sql, i, ch);
        cur.append(sql, i, end);
        hasContent = true;
        i = end;
        continue;
      }

      if (ch == '-' && i + 1 < n && sql.charAt(i + 1) == '-') {
        int end = sql.indexOf('\n', i);
        i = (end < 0) ? n : end;
        cur.append(' ');
        continue;
      }

      if (ch == '/' && i + 1 < n && sql.charAt(i + 1) == '*') {
        i = skipBlockComment(sql, i);
        cur.append(' ');
        continue;
      }

      if (ch == '$' && (i == 0 || !isIdentChar(sql.charAt(i - 1)))) {
        String tag = dollarTag(sql, i);
        if (tag != null) {
          int close = sql.indexOf(tag, i + tag.length());
          int end = (close < 0) ? n : close + tag.length();
          cur.append(sql, i, end);
          hasContent = true;
          i = end;
          continue;
        }
      }

      if (ch == ';') {
        if (hasContent) out.add(cur.toString().trim());
        cur.setLength(0);
        hasContent = false;
        i++;
        continue;
      }

      if (!Character.isWhitespace(ch)) hasContent = true;
      cur.append(ch);
      i++;
    }

    if (hasContent) out.add(cur.toString().trim());
    return out;
  }

  private static int skipQuoted(String sql, int start, char quote) {
    int i = start + 1;
    while (i < sql.length()) {
      char c = sql.charAt(i);
      if (c == quote) {
        // doubled quote is an escaped quote
        if (i + 1 < sql.length() && sql.charAt(i + 1) == quote) {
          i += 2;
          continue;
        }
        return i + 1;
      }
      i++;
    }
    return sql.length();
  }

  /** True when the quote at {@code quotePos} is preceded by a standalone {@code E} / {@code e} prefix. */
  private static boolean isEscapePrefix(String sql, int quotePos) {
    if (quotePos < 1) return false;
    char p = sql.charAt(quotePos - 1);
    if (p != 'E' && p != 'e') return false;
    return quotePos < 2 || !isIdentChar(sql.charAt(quotePos - 2));
  }

  // backslash escapes the next character; a doubled quote is still an escaped quote
  private static int skipEscapeString(String sql, int start) {
    int i = start + 1;
    while (i < sql.length()) {
      char c = sql.charAt(i);
      if (c == '\\') {
        i += 2;
        continue;
      }
      if (c == '\'') {
        if (i + 1 < sql.length() && sql.charAt(i + 1) == '\'') {
          i += 2;
          continue;
        }
        return i + 1;
      }
      i++;
    }
    return sql.length();
  }

  private static boolean isIdentChar(char c) {
    return Character.isLetterOrDigit(c) || c == '_' || c == '$' || c >= 0x80;
  }

  private static int skipBlockComment(String sql, int start) {
    int depth = 0;
    int i = start;
    while (i < sql.length()) {
      if (sql.startsWith("/*", i)) {
        depth++;
        i += 2;
      } else if (sql.startsWith("*/", i)) {
        depth--;
        i += 2;
        if (depth == 0) return i;
      } else {
        i++;
      }
    }
    return sql.length();
  }

  /** Returns the opening dollar-quote tag at {@code start} (e.g. {@code $$} or {@code $fn$}), or null. */
  private static String dollarTag(String sql, int start) {
    int i = start + 1;
    while (i < sql.length()) {
      char c = sql.charAt(i);
      if (c == '$') return sql.substring(start, i + 1);
      boolean identChar = Character.isLetter(c) || c == '_' || (i > start + 1 && Character.isDigit(c));
      if (!identChar) return null;
      i++;
    }
    return null;
  }
}
