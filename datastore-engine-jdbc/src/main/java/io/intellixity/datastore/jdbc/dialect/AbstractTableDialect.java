package io.intellixity.datastore.jdbc.dialect;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.intellixity.datastore.error.InvalidDataException;
import io.intellixity.datastore.jdbc.Bind;
import io.intellixity.datastore.jdbc.ColumnDef;
import io.intellixity.datastore.jdbc.SqlStatement;
import io.intellixity.datastore.jdbc.SqlStatement.ExecKind;
import io.intellixity.datastore.query.SortField;
import io.intellixity.datastore.request.SearchRequest;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.sql.Array;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.HexFormat;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * JDBC-generic table dialect base.\n
 *
 * Provides common rendering for:\n
 * - DDL: create table, add column, aliases as views, indexes\n
 * - DML: insert/update/delete with typed casts\n
 * - search: projection + filters + full text + sort + paging\n
 *
 * DB-specific dialects override hooks for quoting, introspection, full text, upsert and privileges.\n
 */
public abstract class AbstractTableDialect implements TableDialect {
  private static final Pattern TYPE_NAME = Pattern.compile("_?[a-z][a-z0-9_]*");

  protected final ObjectMapper mapper;

  protected AbstractTableDialect(ObjectMapper mapper) {
    this.mapper = (mapper == null) ? new ObjectMapper() : mapper;
  }

  protected static final class RenderCtx {
    private int n = 1;
    private final List<Bind> binds = new ArrayList<>();
    public String add(Bind b) {
      binds.add(b);
      return ":b" + (n++);
    }
    public List<Bind> binds() {
      return binds;
    }
  }

  // ---- DDL ----

  @Override
  public List<SqlStatement> createTable(String table, List<ColumnDef> columns) {
    StringBuilder sb = new StringBuilder("CREATE TABLE ").append(quoteIdent(table)).append(" (")
        .append(quoteIdent(ColumnDef.ID)).append(" ").append(idColumnType()).append(" PRIMARY KEY, ")
        .append(quoteIdent(ColumnDef.FULL_TEXT)).append(" ").append(fullTextColumnType());
    for (ColumnDef c : columns) {
      sb.append(", ").append(quoteIdent(c.name())).append(" ").append(columnTypeSql(c.type()));
    }
    sb.append(")");
    List<SqlStatement> out = new ArrayList<>();
    out.add(SqlStatement.ddl(sb.toString()));
    out.add(SqlStatement.ddl(fullTextIndexSql(table)));
    return out;
  }

  @Override
  public SqlStatement addColumn(String table, ColumnDef column) {
    return SqlStatement.ddl("ALTER TABLE " + quoteIdent(table) + " ADD COLUMN "
        + quoteIdent(column.name()) + " " + columnTypeSql(column.type()));
  }

  @Override
  public SqlStatement createAlias(String alias, String table) {
    return SqlStatement.ddl("CREATE VIEW " + quoteIdent(alias) + " AS SELECT * FROM " + quoteIdent(table));
  }

  @Override
  public SqlStatement dropAlias(String alias) {
    return SqlStatement.ddl("DROP VIEW IF EXISTS " + quoteIdent(alias));
  }

  @Override
  public SqlStatement dropTable(String table) {
    return SqlStatement.ddl("DROP TABLE " + quoteIdent(table) + " CASCADE");
  }

  @Override
  public List<SqlStatement> replacePrimaryKey(String table, List<String> columns) {
    String name = primaryKeyIndexName(table);
    List<SqlStatement> out = new ArrayList<>();
    out.add(SqlStatement.ddl("DROP INDEX IF EXISTS " + quoteIdent(name)));
    if (!columns.isEmpty()) {
      out.add(SqlStatement.ddl("CREATE UNIQUE INDEX " + quoteIdent(name) + " ON " + quoteIdent(table)
          + " (" + joinIdents(columns) + ")"));
    }
    return out;
  }

  @Override
  public SqlStatement createIndex(String table, String column) {
    return SqlStatement.ddl("CREATE INDEX " + quoteIdent(indexName(INDEX_PREFIX, table, List.of(column)))
        + " ON " + quoteIdent(table) + " (" + quoteIdent(column) + ")");
  }

  @Override
  public SqlStatement dropIndex(String indexName) {
    return SqlStatement.ddl("DROP INDEX IF EXISTS " + quoteIdent(indexName));
  }

  @Override
  public SqlStatement rowCount(String table) {
    return new SqlStatement("SELECT COUNT(*) FROM " + quoteIdent(table), List.of());
  }

  // ---- DML ----

  @Override
  public SqlStatement insert(String table, Map<String, Object> row, Map<String, ColumnDef> columns) {
    RenderCtx ctx = new RenderCtx();
    List<String> names = new ArrayList<>(row.keySet());
    StringBuilder sb = new StringBuilder("INSERT INTO ").append(quoteIdent(table)).append(" (");
    StringBuilder values = new StringBuilder();
    for (int i = 0; i < names.size(); i++) {
      if (i > 0) {
        sb.append(", ");
        values.append(", ");
      }
      String n = names.get(i);
      sb.append(quoteIdent(n));
      values.append(placeholder(ctx, row.get(n), columns.get(n)));
    }
    if (names.isEmpty()) {
      sb.setLength(sb.length() - 2);
      sb.append(" DEFAULT VALUES");
    } else {
      sb.append(") VALUES (").append(values).append(")");
    }
    return new SqlStatement(sb.toString(), ctx.binds(), ExecKind.UPDATE);
  }

  @Override
  public SqlStatement update(String table, Map<String, Object> row, List<String> key, Map<String, ColumnDef> columns) {
    RenderCtx ctx = new RenderCtx();
    StringBuilder sb = new StringBuilder("UPDATE ").append(quoteIdent(table)).append(" SET ")
        .append(quoteIdent(ColumnDef.FULL_TEXT)).append(" = NULL");
    for (var e : row.entrySet()) {
      if (key.contains(e.getKey())) continue;
      sb.append(", ").append(quoteIdent(e.getKey())).append(" = ").append(placeholder(ctx, e.getValue(), columns.get(e.getKey())));
    }
    sb.append(" WHERE ");
    appendKey(sb, ctx, row, key, columns);
    return new SqlStatement(sb.toString(), ctx.binds(), ExecKind.UPDATE);
  }

  @Override
  public SqlStatement delete(String table, Map<String, Object> filters, Map<String, ColumnDef> columns) {
    RenderCtx ctx = new RenderCtx();
    StringBuilder sb = new StringBuilder("DELETE FROM ").append(quoteIdent(table));
    appendFilters(sb, ctx, filters, columns, false);
    return new SqlStatement(sb.toString(), ctx.binds(), ExecKind.UPDATE);
  }

  @Override
  public SqlStatement refreshFullText(String table, List<ColumnDef> columns) {
    StringBuilder text = new StringBuilder();
    for (ColumnDef c : columns) {
      if (c.internal()) continue;
      if (text.length() > 0) text.append(", ");
      text.append("CAST(").append(quoteIdent(c.name())).append(" AS text)");
    }
    String expr = text.length() == 0 ? "''" : "concat_ws(' ', " + text + ")";
    return SqlStatement.ddl("UPDATE " + quoteIdent(table) + " SET " + quoteIdent(ColumnDef.FULL_TEXT) + " = "
        + fullTextVector(expr) + " WHERE " + quoteIdent(ColumnDef.FULL_TEXT) + " IS NULL");
  }

  // ---- queries ----

  @Override
  public SqlStatement select(SearchRequest req, List<String> projection, Map<String, ColumnDef> columns) {
    RenderCtx ctx = new RenderCtx();
    StringBuilder sb = new StringBuilder("SELECT ");
    if (req.distinct()) sb.append("DISTINCT ");
    sb.append(joinIdents(projection)).append(" FROM ").append(quoteIdent(req.resourceId()));
    Rank rank = appendWhere(sb, ctx, req, columns);
    if (!req.sort().isEmpty()) {
      sb.append(" ORDER BY ");
      for (int i = 0; i < req.sort().size(); i++) {
        SortField s = req.sort().get(i);
        if (i > 0) sb.append(", ");
        sb.append(quoteIdent(s.field())).append(s.direction() == SortField.Direction.DESC ? " DESC" : " ASC");
      }
    } else if (rank != null && !req.distinct()) {
      // rank binds are added after the WHERE binds, matching their position in the SQL
      String vector = rank.column() == null ? quoteIdent(ColumnDef.FULL_TEXT) : fieldVector(quoteIdent(rank.column()), ctx, req.language());
      sb.append(" ORDER BY ").append(fullTextRank(vector, tsQuery(ctx, rank.query(), req.plain(), req.language()))).append(" DESC");
    }
    sb.append(" LIMIT ").append(req.limit()).append(" OFFSET ").append(req.offset());
    return new SqlStatement(sb.toString(), ctx.binds());
  }

  @Override
  public SqlStatement count(SearchRequest req, Map<String, ColumnDef> columns) {
    RenderCtx ctx = new RenderCtx();
    StringBuilder inner = new StringBuilder("SELECT ");
    if (req.distinct()) {
      List<String> all = new ArrayList<>();
      for (ColumnDef c : columns.values()) {
        if (!ColumnDef.FULL_TEXT.equals(c.name())) all.add(c.name());
      }
      inner.append("DISTINCT ").append(joinIdents(req.fields().isEmpty() ? all : req.fields()));
    } else {
      inner.append("1");
    }
    inner.append(" FROM ").append(quoteIdent(req.resourceId()));
    appendWhere(inner, ctx, req, columns);
    return new SqlStatement("SELECT COUNT(*) FROM (" + inner + ") datastore_count", ctx.binds());
  }

  /** Text query used for ranking; {@code column} is null for the whole-row full-text column. */
  private record Rank(String column, String query) {}

  /** Appends filters and full-text conditions; returns the ranking source when a text query is present. */
  private Rank appendWhere(StringBuilder sb, RenderCtx ctx, SearchRequest req, Map<String, ColumnDef> columns) {
    boolean where = appendFilters(sb, ctx, req.filters(), columns, false);
    Rank rank = null;
    if (req.q() != null && !req.q().isBlank()) {
      String query = tsQuery(ctx, req.q(), req.plain(), req.language());
      sb.append(where ? " AND " : " WHERE ").append(quoteIdent(ColumnDef.FULL_TEXT)).append(" @@ ").append(query);
      where = true;
      rank = new Rank(null, req.q());
    }
    for (var e : req.qFields().entrySet()) {
      String vector = fieldVector(quoteIdent(e.getKey()), ctx, req.language());
      String query = tsQuery(ctx, e.getValue(), req.plain(), req.language());
      sb.append(where ? " AND " : " WHERE ").append(vector).append(" @@ ").append(query);
      where = true;
      if (rank == null) rank = new Rank(e.getKey(), e.getValue());
    }
    return rank;
  }

  private boolean appendFilters(StringBuilder sb, RenderCtx ctx, Map<String, Object> filters,
                                Map<String, ColumnDef> columns, boolean whereOpen) {
    boolean where = whereOpen;
    for (var e : filters.entrySet()) {
      ColumnDef col = columns.get(e.getKey());
      sb.append(where ? " AND " : " WHERE ");
      where = true;
      String lhs = quoteIdent(e.getKey());
      Object v = e.getValue();
      if (v == null) {
        sb.append(lhs).append(" IS NULL");
      } else if (v instanceof Collection<?> list && !isArrayType(col)) {
        if (list.isEmpty()) {
          sb.append("1=0");
          continue;
        }
        sb.append(lhs).append(" IN (");
        int i = 0;
        for (Object item : list) {
          if (i++ > 0) sb.append(", ");
          sb.append(placeholder(ctx, item, col));
        }
        sb.append(")");
      } else {
        sb.append(lhs).append(" = ").append(placeholder(ctx, v, col));
      }
    }
    return where;
  }

  private void appendKey(StringBuilder sb, RenderCtx ctx, Map<String, Object> row, List<String> key,
                         Map<String, ColumnDef> columns) {
    for (int i = 0; i < key.size(); i++) {
      String k = key.get(i);
      if (i > 0) sb.append(" AND ");
      sb.append(quoteIdent(k)).append(" = ").append(placeholder(ctx, row.get(k), columns.get(k)));
    }
  }

  /** Typed placeholder: {@code CAST(:bN AS type)}; values are bound as text. */
  protected String placeholder(RenderCtx ctx, Object value, ColumnDef column) {
    String type = (column == null) ? null : column.type();
    String p = ctx.add(new Bind(encodeValue(value, column), type));
    return (type == null) ? p : "CAST(" + p + " AS " + type + ")";
  }

  /** Text form of a value for a column. */
  protected Object encodeValue(Object value, ColumnDef column) {
    if (value == null) return null;
    if (isArrayType(column)) {
      if (value instanceof Collection<?> list) return arrayLiteral(list);
      if (value instanceof Object[] arr) return arrayLiteral(Arrays.asList(arr));
    }
    if (value instanceof Map<?, ?> || value instanceof Collection<?>) {
      try {
        return mapper.writeValueAsString(value);
      } catch (JsonProcessingException e) {
        throw new InvalidDataException("records", "Value of column \"" + (column == null ? "?" : column.name())
            + "\" is not serializable as JSON");
      }
    }
    if (value instanceof BigDecimal bd) return bd.toPlainString();
    return String.valueOf(value);
  }

  /** Array literal in {@code {"a","b"}} form. */
  protected String arrayLiteral(Collection<?> items) {
    StringBuilder sb = new StringBuilder("{");
    int i = 0;
    for (Object item : items) {
      if (i++ > 0) sb.append(',');
      if (item == null) {
        sb.append("NULL");
        continue;
      }
      String s = String.valueOf(item instanceof Map<?, ?> || item instanceof Collection<?> ? encodeValue(item, null) : item);
      sb.append('"').append(s.replace("\\", "\\\\").replace("\"", "\\\"")).append('"');
    }
    return sb.append('}').toString();
  }

  protected static boolean isArrayType(ColumnDef column) {
    return column != null && column.type().startsWith("_");
  }

  protected String joinIdents(List<String> names) {
    StringBuilder sb = new StringBuilder();
    for (int i = 0; i < names.size(); i++) {
      if (i > 0) sb.append(", ");
      sb.append(quoteIdent(names.get(i)));
    }
    return sb.toString();
  }

  // ---- index naming ----

  public static final String PRIMARY_KEY_PREFIX = "pk_";
  public static final String INDEX_PREFIX = "idx_";
  public static final String FULL_TEXT_PREFIX = "ft_";

  /** Stable index name that stays under identifier limits whatever the table name length. */
  public static String indexName(String prefix, String table, List<String> columns) {
    try {
      MessageDigest md = MessageDigest.getInstance("SHA-1");
      md.update(table.getBytes(StandardCharsets.UTF_8));
      for (String c : columns) {
        md.update((byte) 0);
        md.update(c.getBytes(StandardCharsets.UTF_8));
      }
      return prefix + HexFormat.of().formatHex(md.digest()).substring(0, 24);
    } catch (NoSuchAlgorithmException e) {
      throw new IllegalStateException(e);
    }
  }

  public static String primaryKeyIndexName(String table) {
    return indexName(PRIMARY_KEY_PREFIX, table, List.of());
  }

  protected String fullTextIndexSql(String table) {
    return "CREATE INDEX " + quoteIdent(indexName(FULL_TEXT_PREFIX, table, List.of())) + " ON " + quoteIdent(table)
        + " (" + quoteIdent(ColumnDef.FULL_TEXT) + ")";
  }

  // ---- types ----

  @Override
  public boolean isValidTypeName(String type) {
    return type != null && TYPE_NAME.matcher(type).matches();
  }

  @Override
  public String columnTypeSql(String type) {
    if (!isValidTypeName(type)) throw new InvalidDataException("fields", "\"" + type + "\" is not a valid field type");
    return type.startsWith("_") ? type.substring(1) + "[]" : type;
  }

  @Override
  public String guessType(Object value) {
    if (value == null) return "text";
    if (value instanceof Integer || value instanceof Long || value instanceof Short || value instanceof BigInteger) return "int";
    if (value instanceof Number) return "float";
    if (value instanceof Boolean) return "bool";
    if (value instanceof Map<?, ?>) return "json";
    if (value instanceof Collection<?> list) {
      Object first = null;
      for (Object o : list) {
        if (o != null) {
          first = o;
          break;
        }
      }
      String inner = guessType(first);
      return inner.startsWith("_") || "json".equals(inner) ? "json" : "_" + inner;
    }
    if (value instanceof String s && looksLikeTimestamp(s)) return "timestamp";
    return "text";
  }

  private static boolean looksLikeTimestamp(String s) {
    try {
      LocalDateTime.parse(s);
      return true;
    } catch (DateTimeParseException e) {
      try {
        LocalDate.parse(s);
        return true;
      } catch (DateTimeParseException e2) {
        return false;
      }
    }
  }

  @Override
  public String infoType(String dataType) {
    if (dataType == null) return "text";
    String t = dataType.toLowerCase();
    if (t.equals("numeric") || t.equals("integer")) return "number";
    if (t.startsWith("timestamp")) return "date";
    return "text";
  }

  @Override
  public Object readValue(Object raw) {
    if (raw == null) return null;
    if (raw instanceof Timestamp ts) return ts.toLocalDateTime().toString();
    if (raw instanceof java.sql.Date d) return d.toLocalDate().toString();
    if (raw instanceof java.sql.Time t) return t.toLocalTime().toString();
    if (raw instanceof Array arr) {
      try {
        Object[] items = (Object[]) arr.getArray();
        List<Object> out = new ArrayList<>(items.length);
        for (Object o : items) out.add(readValue(o));
        return out;
      } catch (SQLException e) {
        throw new RuntimeException(e);
      }
    }
    return raw;
  }

  // ---- hooks ----

  protected abstract String idColumnType();

  protected abstract String fullTextColumnType();

  /** Vector expression for a text expression. */
  protected abstract String fullTextVector(String textExpr);

  /** Query expression for a caller-supplied text query. */
  protected abstract String tsQuery(RenderCtx ctx, String query, boolean plain, String language);

  /** Vector expression for a single column. */
  protected abstract String fieldVector(String quotedColumn, RenderCtx ctx, String language);

  protected abstract String fullTextRank(String vector, String query);
}
