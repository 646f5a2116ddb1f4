package io.intellixity.datastore.jdbc;

import io.intellixity.datastore.error.AccessDeniedException;
import io.intellixity.datastore.error.InvalidDataException;

import java.sql.SQLException;

/**
 * Classifies {@link SQLException}s by SQLState.\n
 *
 * - 57014 (statement timeout) and classes 22, 23, 42 are caller-data problems: {@link InvalidDataException}\n
 * - 42501 (insufficient privilege): {@link AccessDeniedException}\n
 * - anything else is an infrastructure failure wrapped in {@link RuntimeException}\n
 */
public final class SqlErrors {
  public static final String QUERY_CANCELED = "57014";
  public static final String INSUFFICIENT_PRIVILEGE = "42501";

  private SqlErrors() {}

  public static RuntimeException translate(SQLException e) {
    String state = e.getSQLState();
    if (QUERY_CANCELED.equals(state)) return new InvalidDataException("Query took too long", e);
    if (INSUFFICIENT_PRIVILEGE.equals(state)) return new AccessDeniedException(firstLine(e.getMessage()), e);
    if (state != null && (state.startsWith("22") || state.startsWith("23") || state.startsWith("42"))) {
      return new InvalidDataException(firstLine(e.getMessage()), e);
    }
    return new RuntimeException(e);
  }

  private static String firstLine(String msg) {
    if (msg == null) return "Database error";
    int nl = msg.indexOf('\n');
    return (nl < 0 ? msg : msg.substring(0, nl)).trim();
  }
}
