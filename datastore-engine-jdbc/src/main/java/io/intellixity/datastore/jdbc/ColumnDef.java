package io.intellixity.datastore.jdbc;

import java.util.Objects;

/**
 * Column as reported by the backend.\n
 *
 * @param name column name\n
 * @param type backend type name usable in casts (e.g. {@code int4}, {@code _text})\n
 * @param dataType descriptive type name (e.g. {@code integer}, {@code timestamp without time zone})\n
 */
public record ColumnDef(String name, String type, String dataType) {
  public static final String ID = "_id";
  public static final String FULL_TEXT = "_full_text";

  public ColumnDef {
    Objects.requireNonNull(name, "name");
    Objects.requireNonNull(type, "type");
    dataType = (dataType == null) ? type : dataType;
  }

  public ColumnDef(String name, String type) {
    this(name, type, type);
  }

  /** Columns managed by the engine itself ({@code _id}, {@code _full_text}). */
  public boolean internal() {
    return name.startsWith("_");
  }
}
