package io.intellixity.datastore.jdbc.dialect;

import io.intellixity.datastore.jdbc.ColumnDef;
import io.intellixity.datastore.jdbc.SqlStatement;
import io.intellixity.datastore.request.SearchRequest;

import java.util.List;
import java.util.Map;

/**
 * SQL rendering for datastore tables.\n
 *
 * Statements use named placeholders compiled by {@link io.intellixity.datastore.jdbc.SqlParamCompiler}.
 * Row maps passed in are already validated against {@code columns} (keyed by column name).\n
 */
public interface TableDialect {
  String id();

  String quoteIdent(String ident);

  // ---- catalog and introspection ----

  /** Columns of a table or view in ordinal order: rows of {@code column_name, data_type, udt_name}. */
  SqlStatement describeColumns(String table);

  /** Catalog row for a name: {@code name, alias_of}, real tables first. */
  SqlStatement lookupCatalog(String name);

  /** Names of aliases pointing at a table: rows of {@code name}. */
  SqlStatement listAliases(String table);

  /** Primary key columns of a table in key order: rows of {@code column_name}. */
  SqlStatement primaryKeyColumns(String table);

  /** Secondary indexes created by {@link #createIndex}: rows of {@code index_name}. */
  SqlStatement listIndexes(String table);

  /** Statements creating the reserved catalog view. */
  List<SqlStatement> catalogBootstrap();

  // ---- DDL ----

  List<SqlStatement> createTable(String table, List<ColumnDef> columns);

  SqlStatement addColumn(String table, ColumnDef column);

  SqlStatement columnComment(String table, String column, String comment);

  SqlStatement createAlias(String alias, String table);

  SqlStatement dropAlias(String alias);

  SqlStatement dropTable(String table);

  /** Replace the primary key; an empty list only drops it. */
  List<SqlStatement> replacePrimaryKey(String table, List<String> columns);

  SqlStatement createIndex(String table, String column);

  SqlStatement dropIndex(String indexName);

  SqlStatement changePrivilege(String relation, String role, boolean grant);

  // ---- DML ----

  SqlStatement insert(String table, Map<String, Object> row, Map<String, ColumnDef> columns);

  SqlStatement update(String table, Map<String, Object> row, List<String> key, Map<String, ColumnDef> columns);

  SqlStatement upsert(String table, Map<String, Object> row, List<String> key, Map<String, ColumnDef> columns);

  SqlStatement delete(String table, Map<String, Object> filters, Map<String, ColumnDef> columns);

  /** Recompute the full-text column of rows whose full-text value was reset by a write. */
  SqlStatement refreshFullText(String table, List<ColumnDef> columns);

  // ---- queries ----

  SqlStatement select(SearchRequest req, List<String> projection, Map<String, ColumnDef> columns);

  SqlStatement count(SearchRequest req, Map<String, ColumnDef> columns);

  SqlStatement rowCount(String table);

  /** Per-transaction statement timeout. */
  SqlStatement statementTimeout(long millis);

  // ---- types ----

  /** True if {@code type} is a syntactically acceptable type name for {@link #columnTypeSql}. */
  boolean isValidTypeName(String type);

  /** DDL type for a user-facing type name (e.g. {@code _text} renders as {@code text[]}). */
  String columnTypeSql(String type);

  /** Type inferred from a sample record value. */
  String guessType(Object value);

  /** Simplified type reported by info: {@code number}, {@code date} or {@code text}. */
  String infoType(String dataType);

  /** Convert a driver value into a plain JSON-friendly value. */
  Object readValue(Object raw);
}
