package io.intellixity.datastore.jdbc.postgres;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.intellixity.datastore.jdbc.Bind;
import io.intellixity.datastore.jdbc.ColumnDef;
import io.intellixity.datastore.jdbc.SqlParamCompiler;
import io.intellixity.datastore.jdbc.SqlStatement;
import io.intellixity.datastore.jdbc.SqlStatement.ExecKind;
import io.intellixity.datastore.jdbc.dialect.AbstractTableDialect;
import io.intellixity.datastore.sql.TableNames;
import org.postgresql.util.PGobject;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Postgres dialect implementation for datastore tables.\n
 *
 * Keeps only Postgres-specific overrides: quoting, catalog queries, tsvector full text, ON CONFLICT upserts,
 * GRANT/REVOKE and json values.\n
 * Generic SQL rendering lives in {@link AbstractTableDialect}.
 */
public final class PostgresTableDialect extends AbstractTableDialect {
  public PostgresTableDialect(ObjectMapper mapper) {
    super(mapper);
  }

  public PostgresTableDialect() {
    this(null);
  }

  @Override public String id() { return "postgres"; }

  @Override
  public String quoteIdent(String ident) {
    if (ident == null) return null;
    return "\"" + ident.replace("\"", "\"\"") + "\"";
  }

  // ---- catalog and introspection ----

  @Override
  public SqlStatement describeColumns(String table) {
    return SqlParamCompiler.compile(
        "SELECT column_name, data_type, udt_name FROM information_schema.columns"
            + " WHERE table_schema = current_schema() AND table_name = :table ORDER BY ordinal_position",
        Map.of("table", table));
  }

  @Override
  public SqlStatement lookupCatalog(String name) {
    return SqlParamCompiler.compile(
        "SELECT name, alias_of FROM " + quoteIdent(TableNames.TABLE_METADATA)
            + " WHERE name = :name ORDER BY alias_of NULLS FIRST LIMIT 1",
        Map.of("name", name));
  }

  @Override
  public SqlStatement listAliases(String table) {
    return SqlParamCompiler.compile(
        "SELECT name FROM " + quoteIdent(TableNames.TABLE_METADATA) + " WHERE alias_of = :table ORDER BY name",
        Map.of("table", table));
  }

  @Override
  public SqlStatement primaryKeyColumns(String table) {
    return SqlParamCompiler.compile(
        "SELECT a.attname AS column_name FROM pg_index i"
            + " JOIN pg_class ic ON ic.oid = i.indexrelid"
            + " JOIN pg_attribute a ON a.attrelid = i.indrelid AND a.attnum = ANY(i.indkey)"
            + " WHERE ic.relname = :index AND ic.relnamespace = current_schema()::regnamespace"
            + " ORDER BY array_position(i.indkey::int2[], a.attnum)",
        Map.of("index", primaryKeyIndexName(table)));
  }

  @Override
  public SqlStatement listIndexes(String table) {
    return SqlParamCompiler.compile(
        "SELECT indexname AS index_name FROM pg_indexes"
            + " WHERE schemaname = current_schema() AND tablename = :table AND left(indexname, "
            + INDEX_PREFIX.length() + ") = '" + INDEX_PREFIX + "'",
        Map.of("table", table));
  }

  /**
   * One row per table or view of the current schema. A view also gets one row per relation it depends on,
   * with {@code alias_of} naming that relation. The catalog view itself reads as an alias of {@code pg_class}.\n
   */
  @Override
  public List<SqlStatement> catalogBootstrap() {
    return List.of(SqlStatement.ddl(
        "CREATE OR REPLACE VIEW " + quoteIdent(TableNames.TABLE_METADATA) + " AS"
            + " SELECT DISTINCT substr(md5(dependee.relname || COALESCE(dependent.relname, '')), 0, 17) AS \"_id\","
            + " dependee.relname AS name, dependee.oid AS oid, dependent.relname AS alias_of"
            + " FROM pg_class AS dependee"
            + " LEFT OUTER JOIN pg_rewrite AS r ON r.ev_class = dependee.oid"
            + " LEFT OUTER JOIN pg_depend AS d ON d.objid = r.oid"
            + " LEFT OUTER JOIN pg_class AS dependent ON d.refobjid = dependent.oid"
            + " WHERE (dependee.oid != dependent.oid OR dependent.oid IS NULL)"
            + " AND (dependee.relname IN (SELECT tablename FROM pg_catalog.pg_tables)"
            + " OR dependee.relname IN (SELECT viewname FROM pg_catalog.pg_views))"
            + " AND dependee.relnamespace = current_schema()::regnamespace"
            + " ORDER BY dependee.oid DESC"));
  }

  // ---- DDL ----

  @Override
  public SqlStatement columnComment(String table, String column, String comment) {
    String literal = (comment == null) ? "NULL" : "'" + comment.replace("'", "''") + "'";
    return SqlStatement.ddl("COMMENT ON COLUMN " + quoteIdent(table) + "." + quoteIdent(column) + " IS " + literal);
  }

  @Override
  public SqlStatement changePrivilege(String relation, String role, boolean grant) {
    return SqlStatement.ddl(grant
        ? "GRANT SELECT ON " + quoteIdent(relation) + " TO " + quoteIdent(role)
        : "REVOKE SELECT ON " + quoteIdent(relation) + " FROM " + quoteIdent(role));
  }

  @Override
  protected String fullTextIndexSql(String table) {
    return "CREATE INDEX " + quoteIdent(indexName(FULL_TEXT_PREFIX, table, List.of())) + " ON " + quoteIdent(table)
        + " USING gin (" + quoteIdent(ColumnDef.FULL_TEXT) + ")";
  }

  @Override protected String idColumnType() { return "serial"; }
  @Override protected String fullTextColumnType() { return "tsvector"; }

  // ---- DML ----

  @Override
  public SqlStatement upsert(String table, Map<String, Object> row, List<String> key, Map<String, ColumnDef> columns) {
    if (key.isEmpty()) throw new IllegalArgumentException("Upsert has no conflict columns");
    SqlStatement insertBase = insert(table, row, columns);

    StringBuilder sql = new StringBuilder(insertBase.sql());
    sql.append(" ON CONFLICT (").append(joinIdents(key)).append(") DO UPDATE SET ")
        .append(quoteIdent(ColumnDef.FULL_TEXT)).append(" = NULL");
    List<String> updateCols = new ArrayList<>();
    for (String c : row.keySet()) {
      if (!key.contains(c)) updateCols.add(c);
    }
    for (String c : updateCols) sql.append(", ").append(quoteIdent(c)).append(" = EXCLUDED.").append(quoteIdent(c));
    return new SqlStatement(sql.toString(), insertBase.binds(), ExecKind.UPDATE);
  }

  @Override
  public SqlStatement statementTimeout(long millis) {
    return SqlStatement.ddl("SET LOCAL statement_timeout = " + millis);
  }

  // ---- full text ----

  @Override
  protected String fullTextVector(String textExpr) {
    return "to_tsvector(" + textExpr + ")";
  }

  @Override
  protected String tsQuery(RenderCtx ctx, String query, boolean plain, String language) {
    String lang = ctx.add(Bind.text(language));
    String q = ctx.add(Bind.text(query));
    return (plain ? "plainto_tsquery" : "to_tsquery") + "(CAST(" + lang + " AS regconfig), " + q + ")";
  }

  @Override
  protected String fieldVector(String quotedColumn, RenderCtx ctx, String language) {
    return "to_tsvector(CAST(" + ctx.add(Bind.text(language)) + " AS regconfig), CAST(" + quotedColumn + " AS text))";
  }

  @Override
  protected String fullTextRank(String vector, String query) {
    return "ts_rank(" + vector + ", " + query + ")";
  }

  // ---- types ----

  @Override
  public Object readValue(Object raw) {
    if (raw instanceof PGobject pg) {
      String type = pg.getType();
      if (pg.getValue() != null && ("json".equals(type) || "jsonb".equals(type))) {
        try {
          return mapper.readValue(pg.getValue(), Object.class);
        } catch (JsonProcessingException e) {
          throw new IllegalStateException("Invalid json value from backend", e);
        }
      }
      return pg.getValue();
    }
    return super.readValue(raw);
  }
}
