package io.intellixity.datastore.sql;

import java.nio.charset.StandardCharsets;

/**
 * Identifier rules for table, alias and column names.\n
 *
 * Names that pass these checks are safe to embed as quoted SQL identifiers.\n
 */
public final class TableNames {
  /** Reserved catalog view listing every table and alias. */
  public static final String TABLE_METADATA = "_table_metadata";

  /** PostgreSQL truncates identifiers longer than this many bytes. */
  public static final int MAX_IDENTIFIER_BYTES = 63;

  private TableNames() {}

  /** Column names: not blank, no double quote, no leading underscore. */
  public static boolean isValidFieldName(String name) {
    if (name == null || name.isBlank()) return false;
    if (name.startsWith("_")) return false;
    if (name.indexOf('"') >= 0) return false;
    return name.getBytes(StandardCharsets.UTF_8).length <= MAX_IDENTIFIER_BYTES;
  }

  /** Table and alias names: field-name rules plus no {@code %}. */
  public static boolean isValidTableName(String name) {
    if (name == null || name.indexOf('%') >= 0) return false;
    return isValidFieldName(name);
  }
}
