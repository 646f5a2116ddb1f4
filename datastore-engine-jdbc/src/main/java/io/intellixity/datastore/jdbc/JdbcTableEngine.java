package io.intellixity.datastore.jdbc;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.intellixity.datastore.config.DatastoreSettings;
import io.intellixity.datastore.error.InvalidDataException;
import io.intellixity.datastore.error.ResourceNotFoundException;
import io.intellixity.datastore.jdbc.dialect.TableDialect;
import io.intellixity.datastore.model.FieldSpec;
import io.intellixity.datastore.model.UpsertMethod;
import io.intellixity.datastore.query.SortField;
import io.intellixity.datastore.request.CreateRequest;
import io.intellixity.datastore.request.DeleteRequest;
import io.intellixity.datastore.request.SearchRequest;
import io.intellixity.datastore.request.SearchSqlRequest;
import io.intellixity.datastore.request.UpsertRequest;
import io.intellixity.datastore.spi.TableEngine;
import io.intellixity.datastore.spi.handle.EngineHandleResolver;
import io.intellixity.datastore.sql.TableNames;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.sql.Statement;
import java.sql.Types;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * {@link TableEngine} over JDBC.\n
 *
 * Every operation runs in its own transaction on a connection obtained from the handle resolved for the
 * connection url chosen by the action layer. SQL is rendered by a {@link TableDialect}.\n
 */
public final class JdbcTableEngine implements TableEngine {
  private static final Logger log = LoggerFactory.getLogger(JdbcTableEngine.class);

  private final EngineHandleResolver<JdbcHandle> handles;
  private final TableDialect dialect;
  private final DatastoreSettings settings;
  private final ObjectMapper mapper;

  public JdbcTableEngine(EngineHandleResolver<JdbcHandle> handles, TableDialect dialect,
                         DatastoreSettings settings, ObjectMapper mapper) {
    this.handles = Objects.requireNonNull(handles, "handles");
    this.dialect = Objects.requireNonNull(dialect, "dialect");
    this.settings = Objects.requireNonNull(settings, "settings");
    this.mapper = (mapper == null) ? new ObjectMapper() : mapper;
  }

  public JdbcTableEngine(EngineHandleResolver<JdbcHandle> handles, TableDialect dialect, DatastoreSettings settings) {
    this(handles, dialect, settings, null);
  }

  /** Create the reserved catalog view (idempotent). */
  public void bootstrap(String connectionUrl) {
    inTx(connectionUrl, false, s -> {
      for (SqlStatement ss : dialect.catalogBootstrap()) s.update("BOOTSTRAP", ss);
      return null;
    });
  }

  // ---- create ----

  @Override
  public Map<String, Object> create(String connectionUrl, CreateRequest req, boolean privateTable) {
    String table = Objects.requireNonNull(req.resourceId(), "resourceId");
    List<FieldSpec> supplied = (req.fields() == null) ? List.of() : req.fields();
    List<Map<String, Object>> records = (req.records() == null) ? List.of() : req.records();
    validateFields(supplied);

    return inTx(connectionUrl, false, s -> {
      Map<String, ColumnDef> existing = s.describe(table);
      boolean created = existing.isEmpty();

      List<ColumnDef> added = newColumns(supplied, records, existing);
      String role = settings.readOnlyRole();
      if (created) {
        for (SqlStatement ss : dialect.createTable(table, added)) s.update("CREATE_TABLE", ss);
        if (role != null) s.update("PRIVILEGE", dialect.changePrivilege(table, role, !privateTable));
      } else {
        for (ColumnDef c : added) s.update("ADD_COLUMN", dialect.addColumn(table, c));
      }
      for (FieldSpec f : supplied) {
        if (!f.info().isEmpty()) s.update("COMMENT", dialect.columnComment(table, f.id(), toJson(f.info())));
      }

      Map<String, ColumnDef> columns = created || !added.isEmpty() ? s.describe(table) : existing;
      if (req.aliases() != null) replaceAliases(s, table, req.aliases(), role, privateTable);
      if (req.primaryKey() != null) {
        requireColumns("primary_key", req.primaryKey(), columns);
        for (SqlStatement ss : dialect.replacePrimaryKey(table, req.primaryKey())) s.update("PRIMARY_KEY", ss);
      }
      if (req.indexes() != null) {
        requireColumns("indexes", req.indexes(), columns);
        for (Map<String, Object> row : s.query("LIST_INDEXES", dialect.listIndexes(table))) {
          s.update("DROP_INDEX", dialect.dropIndex(String.valueOf(row.get("index_name"))));
        }
        for (String col : new LinkedHashSet<>(req.indexes())) s.update("CREATE_INDEX", dialect.createIndex(table, col));
      }
      if (!records.isEmpty()) {
        writeRecords(s, table, records, UpsertMethod.INSERT, columns);
      }

      Map<String, Object> out = new LinkedHashMap<>();
      out.put("resource_id", table);
      out.put("fields", fieldList(columns, null));
      if (req.primaryKey() != null) out.put("primary_key", req.primaryKey());
      if (req.aliases() != null) out.put("aliases", req.aliases());
      if (req.indexes() != null) out.put("indexes", req.indexes());
      if (!records.isEmpty()) out.put("records", records);
      out.put("private", privateTable);
      internalKeys(out, connectionUrl, table);
      return out;
    });
  }

  private void validateFields(List<FieldSpec> fields) {
    Set<String> seen = new LinkedHashSet<>();
    for (FieldSpec f : fields) {
      if (!TableNames.isValidFieldName(f.id())) {
        throw new InvalidDataException("fields", "\"" + f.id() + "\" is not a valid field name");
      }
      if (!seen.add(f.id())) throw new InvalidDataException("fields", "Duplicate column: " + f.id());
      if (f.type() != null && !dialect.isValidTypeName(f.type())) {
        throw new InvalidDataException("fields", "\"" + f.type() + "\" is not a valid field type");
      }
    }
  }

  /** Supplied and record-only columns not yet in the table; missing types are inferred from records. */
  private List<ColumnDef> newColumns(List<FieldSpec> supplied, List<Map<String, Object>> records,
                                     Map<String, ColumnDef> existing) {
    Map<String, String> wanted = new LinkedHashMap<>();
    for (FieldSpec f : supplied) {
      if (!existing.containsKey(f.id())) wanted.put(f.id(), f.type());
    }
    for (Map<String, Object> r : records) {
      for (String k : r.keySet()) {
        if (existing.containsKey(k) || wanted.containsKey(k)) continue;
        if (!TableNames.isValidFieldName(k)) {
          throw new InvalidDataException("records", "\"" + k + "\" is not a valid field name");
        }
        wanted.put(k, null);
      }
    }
    List<ColumnDef> out = new ArrayList<>();
    for (var e : wanted.entrySet()) {
      String type = (e.getValue() != null) ? e.getValue() : dialect.guessType(sample(records, e.getKey()));
      out.add(new ColumnDef(e.getKey(), type));
    }
    return out;
  }

  private static Object sample(List<Map<String, Object>> records, String column) {
    for (Map<String, Object> r : records) {
      Object v = r.get(column);
      if (v != null) return v;
    }
    return null;
  }

  private void replaceAliases(Session s, String table, List<String> aliases, String role, boolean privateTable)
      throws SQLException {
    Set<String> current = s.aliasesOf(table);
    for (String a : current) {
      if (!aliases.contains(a)) s.update("DROP_ALIAS", dialect.dropAlias(a));
    }
    for (String a : new LinkedHashSet<>(aliases)) {
      if (current.contains(a)) continue;
      if (!s.query("LOOKUP", dialect.lookupCatalog(a)).isEmpty()) {
        throw new InvalidDataException("alias", "The alias \"" + a + "\" already exists.");
      }
      s.update("CREATE_ALIAS", dialect.createAlias(a, table));
      if (role != null) s.update("PRIVILEGE", dialect.changePrivilege(a, role, !privateTable));
    }
  }

  // ---- upsert ----

  @Override
  public Map<String, Object> upsert(String connectionUrl, UpsertRequest req) {
    String table = req.resourceId();
    return inTx(connectionUrl, false, s -> {
      Map<String, ColumnDef> columns = s.requireTable(table);
      writeRecords(s, table, req.records(), req.method(), columns);

      Map<String, Object> out = new LinkedHashMap<>();
      out.put("resource_id", table);
      out.put("method", req.method().wireName());
      out.put("records", req.records());
      internalKeys(out, connectionUrl, table);
      return out;
    });
  }

  private void writeRecords(Session s, String table, List<Map<String, Object>> records, UpsertMethod method,
                            Map<String, ColumnDef> columns) throws SQLException {
    for (int i = 0; i < records.size(); i++) {
      List<String> extra = new ArrayList<>();
      for (String k : records.get(i).keySet()) {
        ColumnDef c = columns.get(k);
        if (c == null || c.internal()) extra.add(k);
      }
      if (!extra.isEmpty()) {
        throw new InvalidDataException("records", "row \"" + (i + 1) + "\" has extra keys \"" + String.join(", ", extra) + "\"");
      }
    }

    List<String> key = List.of();
    if (method != UpsertMethod.INSERT) {
      key = s.primaryKey(table);
      if (key.isEmpty()) throw new InvalidDataException("key", "table does not have a unique key defined");
    }

    for (Map<String, Object> row : records) {
      switch (method) {
        case INSERT -> s.update("INSERT", dialect.insert(table, row, columns));
        case UPDATE -> {
          requireKeyValues(row, key);
          int n = s.update("UPDATE", dialect.update(table, row, key, columns));
          if (n == 0) throw new InvalidDataException("key", "key \"" + keyValues(row, key) + "\" not found");
        }
        case UPSERT -> {
          requireKeyValues(row, key);
          s.update("UPSERT", dialect.upsert(table, row, key, columns));
        }
        default -> throw new IllegalStateException("Unknown method: " + method);
      }
    }
    if (!records.isEmpty()) s.update("FULL_TEXT", dialect.refreshFullText(table, new ArrayList<>(columns.values())));
  }

  private static void requireKeyValues(Map<String, Object> row, List<String> key) {
    List<String> missing = new ArrayList<>();
    for (String k : key) {
      if (row.get(k) == null) missing.add(k);
    }
    if (!missing.isEmpty()) {
      throw new InvalidDataException("key", "fields \"" + String.join(", ", missing) + "\" are missing but needed as key");
    }
  }

  private static List<Object> keyValues(Map<String, Object> row, List<String> key) {
    List<Object> out = new ArrayList<>();
    for (String k : key) out.add(row.get(k));
    return out;
  }

  // ---- delete ----

  @Override
  public Map<String, Object> delete(String connectionUrl, DeleteRequest req) {
    String table = req.resourceId();
    return inTx(connectionUrl, false, s -> {
      Map<String, Object> out = new LinkedHashMap<>();
      out.put("resource_id", table);
      if (req.dropsTable()) {
        s.requireTable(table);
        s.update("DROP_TABLE", dialect.dropTable(table));
      } else {
        Map<String, ColumnDef> columns = s.requireTable(table);
        requireColumns("filters", new ArrayList<>(req.filters().keySet()), columns);
        s.update("DELETE", dialect.delete(table, req.filters(), columns));
      }
      internalKeys(out, connectionUrl, table);
      return out;
    });
  }

  // ---- search ----

  @Override
  public Map<String, Object> search(String connectionUrl, SearchRequest req) {
    String table = req.resourceId();
    return inTx(connectionUrl, true, s -> {
      Map<String, ColumnDef> columns = s.requireTable(table);
      requireColumns("fields", req.fields(), columns);
      requireColumns("filters", new ArrayList<>(req.filters().keySet()), columns);
      requireColumns("q", new ArrayList<>(req.qFields().keySet()), columns);
      List<String> sortFields = new ArrayList<>();
      for (SortField f : req.sort()) sortFields.add(f.field());
      requireColumns("sort", sortFields, columns);
      if (req.q() != null && !req.q().isBlank() && !columns.containsKey(ColumnDef.FULL_TEXT)) {
        throw new InvalidDataException("q", "Full-text search is not available for \"" + table + "\"");
      }

      List<String> projection = new ArrayList<>();
      if (req.fields().isEmpty()) {
        for (ColumnDef c : columns.values()) {
          if (!ColumnDef.FULL_TEXT.equals(c.name())) projection.add(c.name());
        }
      } else {
        projection.addAll(req.fields());
      }

      long total = s.count("COUNT", dialect.count(req, columns));
      List<Map<String, Object>> records = s.query("SELECT", dialect.select(req, projection, columns));

      Map<String, Object> out = new LinkedHashMap<>();
      out.put("resource_id", table);
      out.put("fields", fieldList(columns, projection));
      out.put("filters", req.filters());
      if (req.q() != null) out.put("q", req.q());
      if (!req.sort().isEmpty()) out.put("sort", sortString(req.sort()));
      out.put("limit", req.limit());
      out.put("offset", req.offset());
      out.put("total", total);
      out.put("records", records);
      internalKeys(out, connectionUrl, table);
      return out;
    });
  }

  private static String sortString(List<SortField> sort) {
    StringBuilder sb = new StringBuilder();
    for (SortField f : sort) {
      if (sb.length() > 0) sb.append(", ");
      sb.append('"').append(f.field()).append("\" ").append(f.direction() == SortField.Direction.DESC ? "desc" : "asc");
    }
    return sb.toString();
  }

  // ---- search_sql ----

  @Override
  public Map<String, Object> searchSql(String connectionUrl, SearchSqlRequest req) {
    return inTx(connectionUrl, true, s -> {
      if (settings.sqlSearchTimeoutMillis() > 0) {
        s.update("TIMEOUT", dialect.statementTimeout(settings.sqlSearchTimeoutMillis()));
      }
      long start = System.nanoTime();
      if (log.isDebugEnabled()) {
        log.debug("datastore.jdbc op={} execKind={} handleId={} sqlLen={}",
            "SEARCH_SQL", SqlStatement.ExecKind.QUERY, s.handle.id(), req.sql().length());
      }
      try (Statement st = s.conn.createStatement()) {
        st.setMaxRows(settings.searchRowsMax());
        try (ResultSet rs = st.executeQuery(req.sql())) {
          ResultSetMetaData md = rs.getMetaData();
          List<Map<String, Object>> fields = new ArrayList<>();
          for (int i = 1; i <= md.getColumnCount(); i++) {
            Map<String, Object> f = new LinkedHashMap<>();
            f.put("id", md.getColumnLabel(i));
            f.put("type", md.getColumnTypeName(i));
            fields.add(f);
          }
          List<Map<String, Object>> records = readRows(rs);
          debugDone("SEARCH_SQL", SqlStatement.ExecKind.QUERY, records.size(), System.nanoTime() - start);
          Map<String, Object> out = new LinkedHashMap<>();
          out.put("fields", fields);
          out.put("records", records);
          return out;
        }
      }
    });
  }

  // ---- privileges ----

  @Override
  public void makePrivate(String connectionUrl, String resourceId) {
    changePrivilege(connectionUrl, resourceId, false);
  }

  @Override
  public void makePublic(String connectionUrl, String resourceId) {
    changePrivilege(connectionUrl, resourceId, true);
  }

  private void changePrivilege(String connectionUrl, String table, boolean grant) {
    String role = settings.readOnlyRole();
    if (role == null) {
      log.debug("datastore.jdbc op=PRIVILEGE skipped: no read-only role configured table={}", table);
      return;
    }
    inTx(connectionUrl, false, s -> {
      s.requireTable(table);
      s.update("PRIVILEGE", dialect.changePrivilege(table, role, grant));
      for (String alias : s.aliasesOf(table)) s.update("PRIVILEGE", dialect.changePrivilege(alias, role, grant));
      return null;
    });
  }

  // ---- info ----

  @Override
  public Map<String, Object> info(String connectionUrl, String resourceId) {
    return inTx(connectionUrl, true, s -> {
      Map<String, ColumnDef> columns = s.requireTable(resourceId);
      Map<String, Object> schema = new LinkedHashMap<>();
      for (ColumnDef c : columns.values()) {
        if (!c.internal()) schema.put(c.name(), dialect.infoType(c.dataType()));
      }
      Map<String, Object> meta = new LinkedHashMap<>();
      meta.put("count", s.count("COUNT", dialect.rowCount(resourceId)));
      meta.put("aliases", new ArrayList<>(s.aliasesOf(resourceId)));

      Map<String, Object> out = new LinkedHashMap<>();
      out.put("schema", schema);
      out.put("meta", meta);
      internalKeys(out, connectionUrl, resourceId);
      return out;
    });
  }

  // ---- helpers ----

  private static void requireColumns(String field, List<String> names, Map<String, ColumnDef> columns) {
    for (String n : names) {
      if (!columns.containsKey(n)) throw new InvalidDataException(field, "field \"" + n + "\" not in table");
    }
  }

  private static List<Map<String, Object>> fieldList(Map<String, ColumnDef> columns, List<String> projection) {
    List<Map<String, Object>> out = new ArrayList<>();
    for (ColumnDef c : columns.values()) {
      if (projection == null ? c.internal() : !projection.contains(c.name())) continue;
      Map<String, Object> f = new LinkedHashMap<>();
      f.put("id", c.name());
      f.put("type", c.type());
      out.add(f);
    }
    return out;
  }

  private static void internalKeys(Map<String, Object> out, String connectionUrl, String id) {
    out.put("id", id);
    out.put("connection_url", connectionUrl);
  }

  private String toJson(Object value) {
    try {
      return mapper.writeValueAsString(value);
    } catch (JsonProcessingException e) {
      throw new InvalidDataException("fields", "Field info is not serializable as JSON");
    }
  }

  @FunctionalInterface
  private interface Work<T> {
    T run(Session s) throws SQLException;
  }

  private <T> T inTx(String connectionUrl, boolean readOnly, Work<T> work) {
    JdbcHandle h = handles.resolve(connectionUrl);
    try {
      Connection c = h.client().getConnection();
      try {
        c.setAutoCommit(false);
        if (readOnly) c.setReadOnly(true);
        if (h.schema() != null) c.setSchema(h.schema());
        T out = work.run(new Session(h, c));
        c.commit();
        return out;
      } catch (SQLException | RuntimeException e) {
        rollback(c, e);
        throw e;
      } finally {
        c.close();
      }
    } catch (SQLException e) {
      throw SqlErrors.translate(e);
    }
  }

  private static void rollback(Connection c, Exception cause) {
    try {
      c.rollback();
    } catch (SQLException e) {
      cause.addSuppressed(e);
    }
  }

  private List<Map<String, Object>> readRows(ResultSet rs) throws SQLException {
    ResultSetMetaData md = rs.getMetaData();
    int n = md.getColumnCount();
    List<Map<String, Object>> out = new ArrayList<>();
    while (rs.next()) {
      Map<String, Object> row = new LinkedHashMap<>();
      for (int i = 1; i <= n; i++) row.put(md.getColumnLabel(i), dialect.readValue(rs.getObject(i)));
      out.add(row);
    }
    return out;
  }

  /** One connection inside a transaction. */
  private final class Session {
    private final JdbcHandle handle;
    private final Connection conn;

    private Session(JdbcHandle handle, Connection conn) {
      this.handle = handle;
      this.conn = conn;
    }

    int update(String op, SqlStatement ss) throws SQLException {
      String jdbcSql = SqlParamCompiler.toJdbcSql(ss.sql());
      long start = System.nanoTime();
      debugSql(op, ss, jdbcSql);
      try (PreparedStatement ps = conn.prepareStatement(jdbcSql)) {
        bindAll(ps, ss);
        int n = ps.executeUpdate();
        debugDone(op, ss.execKind(), n, System.nanoTime() - start);
        return n;
      }
    }

    List<Map<String, Object>> query(String op, SqlStatement ss) throws SQLException {
      String jdbcSql = SqlParamCompiler.toJdbcSql(ss.sql());
      long start = System.nanoTime();
      debugSql(op, ss, jdbcSql);
      try (PreparedStatement ps = conn.prepareStatement(jdbcSql)) {
        bindAll(ps, ss);
        try (ResultSet rs = ps.executeQuery()) {
          List<Map<String, Object>> out = readRows(rs);
          debugDone(op, ss.execKind(), out.size(), System.nanoTime() - start);
          return out;
        }
      }
    }

    long count(String op, SqlStatement ss) throws SQLException {
      List<Map<String, Object>> rows = query(op, ss);
      if (rows.isEmpty()) return 0;
      Object v = rows.get(0).values().iterator().next();
      return (v instanceof Number n) ? n.longValue() : 0;
    }

    Map<String, ColumnDef> describe(String table) throws SQLException {
      Map<String, ColumnDef> out = new LinkedHashMap<>();
      for (Map<String, Object> row : query("DESCRIBE", dialect.describeColumns(table))) {
        String name = String.valueOf(row.get("column_name"));
        out.put(name, new ColumnDef(name, String.valueOf(row.get("udt_name")), (String) row.get("data_type")));
      }
      return out;
    }

    Map<String, ColumnDef> requireTable(String table) throws SQLException {
      Map<String, ColumnDef> columns = describe(table);
      if (columns.isEmpty()) throw ResourceNotFoundException.resource(table);
      return columns;
    }

    List<String> primaryKey(String table) throws SQLException {
      List<String> out = new ArrayList<>();
      for (Map<String, Object> row : query("PRIMARY_KEY", dialect.primaryKeyColumns(table))) {
        out.add(String.valueOf(row.get("column_name")));
      }
      return out;
    }

    Set<String> aliasesOf(String table) throws SQLException {
      Set<String> out = new LinkedHashSet<>();
      for (Map<String, Object> row : query("LIST_ALIASES", dialect.listAliases(table))) {
        out.add(String.valueOf(row.get("name")));
      }
      return out;
    }

    private void bindAll(PreparedStatement ps, SqlStatement ss) throws SQLException {
      for (int i = 0; i < ss.binds().size(); i++) {
        Object v = ss.binds().get(i).value();
        if (v == null) ps.setNull(i + 1, Types.VARCHAR);
        else if (v instanceof String str) ps.setString(i + 1, str);
        else ps.setObject(i + 1, v);
      }
    }

    private void debugSql(String op, SqlStatement ss, String jdbcSql) {
      if (!log.isDebugEnabled()) return;
      log.debug("datastore.jdbc op={} execKind={} bindCount={} handleId={} schema={} sql={}",
          op, ss.execKind(), ss.binds().size(), handle.id(), handle.schema(), jdbcSql);

      // TRACE: bind summary only (no raw values)
      if (log.isTraceEnabled() && !ss.binds().isEmpty()) {
        int idx = 1;
        for (Bind b : ss.binds()) {
          Object v = b.value();
          String vType = (v == null) ? "null" : v.getClass().getName();
          int vLen = (v instanceof CharSequence cs) ? cs.length() : -1;
          log.trace("datastore.jdbc bind index={} sqlType={} valueType={} valueLen={}", idx++, b.sqlType(), vType, vLen);
        }
      }
    }
  }

  private static void debugDone(String op, SqlStatement.ExecKind execKind, Object result, long durationNanos) {
    if (!log.isDebugEnabled()) return;
    log.debug("datastore.jdbc_done op={} execKind={} durationMs={} result={}",
        op, execKind, durationNanos / 1_000_000.0, result);
  }
}
