package io.intellixity.datastore.jdbc;

import io.intellixity.datastore.config.DatastoreSettings;
import io.intellixity.datastore.error.InvalidDataException;
import io.intellixity.datastore.error.ResourceNotFoundException;
import io.intellixity.datastore.jdbc.postgres.PostgresTableDialect;
import io.intellixity.datastore.model.FieldSpec;
import io.intellixity.datastore.model.UpsertMethod;
import io.intellixity.datastore.query.SortField;
import io.intellixity.datastore.request.CreateRequest;
import io.intellixity.datastore.request.DeleteRequest;
import io.intellixity.datastore.request.SearchRequest;
import io.intellixity.datastore.request.SearchSqlRequest;
import io.intellixity.datastore.request.UpsertRequest;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.sql.SQLException;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

final class JdbcTableEngineTest {
  private static final String URL = "postgresql://writer@db/datastore";
  private static final String DESCRIBE = "information_schema.columns";
  private static final String PRIMARY_KEY = "FROM pg_index";
  private static final String CATALOG_NAME = "WHERE name = ?";
  private static final String CATALOG_ALIASES = "WHERE alias_of = ?";

  private ScriptedJdbc db;
  private JdbcTableEngine engine;

  @BeforeEach
  void setUp() {
    db = new ScriptedJdbc();
    engine = newEngine(DatastoreSettings.of(URL, null));
  }

  private JdbcTableEngine newEngine(DatastoreSettings settings) {
    JdbcHandle handle = new JdbcHandle("test", db.dataSource(), null);
    return new JdbcTableEngine(url -> handle, new PostgresTableDialect(), settings);
  }

  private static Map<String, Object> column(String name, String udt, String dataType) {
    Map<String, Object> c = new LinkedHashMap<>();
    c.put("column_name", name);
    c.put("data_type", dataType);
    c.put("udt_name", udt);
    return c;
  }

  /** Table {@code t} with columns {@code id int4, name text} plus the managed ones. */
  private static List<Map<String, Object>> tableT() {
    return List.of(
        column("_id", "int4", "integer"),
        column("_full_text", "tsvector", "tsvector"),
        column("id", "int4", "integer"),
        column("name", "text", "text"));
  }

  private static Map<String, Object> row(Object id, String name) {
    Map<String, Object> r = new LinkedHashMap<>();
    if (id != null) r.put("id", id);
    if (name != null) r.put("name", name);
    return r;
  }

  private void keyedOnId() {
    db.answer(DESCRIBE, tableT()).answer(PRIMARY_KEY, List.of(Map.of("column_name", "id")));
  }

  private boolean wroteRows() {
    return db.statements().stream().anyMatch(s -> s.startsWith("INSERT INTO") || s.contains("= NULL,"));
  }

  // ---------------------------------------------------------------- upsert

  @Test
  void upsertWritesEachRowThenRefreshesFullTextOnce() {
    keyedOnId();

    Map<String, Object> out = engine.upsert(URL,
        new UpsertRequest("t", List.of(row(1, "a"), row(2, "b")), UpsertMethod.UPSERT, false));

    assertEquals(2, db.count("ON CONFLICT (\"id\") DO UPDATE SET \"_full_text\" = NULL"));
    assertEquals(1, db.count("SET \"_full_text\" = to_tsvector("));
    assertTrue(db.statements().get(db.statements().size() - 1).endsWith("WHERE \"_full_text\" IS NULL"));
    assertEquals(List.of("resource_id", "method", "records", "id", "connection_url"), List.copyOf(out.keySet()));
    assertEquals(1, db.commits);
    assertEquals(0, db.rollbacks);
  }

  @Test
  void updateOfUnknownKeyIsKeyErrorAndRollsBack() {
    keyedOnId();
    db.updateCount("SET \"_full_text\" = NULL,", 0);

    InvalidDataException e = assertThrows(InvalidDataException.class, () -> engine.upsert(URL,
        new UpsertRequest("t", List.of(row(7, "ghost")), UpsertMethod.UPDATE, false)));

    assertEquals(List.of("key \"[7]\" not found"), e.errors().get("key"));
    assertEquals(0, db.commits);
    assertEquals(1, db.rollbacks);
  }

  @Test
  void updateAndUpsertNeedAUniqueKey() {
    db.answer(DESCRIBE, tableT());

    for (UpsertMethod method : List.of(UpsertMethod.UPDATE, UpsertMethod.UPSERT)) {
      InvalidDataException e = assertThrows(InvalidDataException.class, () -> engine.upsert(URL,
          new UpsertRequest("t", List.of(row(1, "a")), method, false)));
      assertEquals(List.of("table does not have a unique key defined"), e.errors().get("key"));
    }
    assertFalse(wroteRows());
  }

  @Test
  void rowWithoutKeyValueIsRejected() {
    keyedOnId();

    InvalidDataException e = assertThrows(InvalidDataException.class, () -> engine.upsert(URL,
        new UpsertRequest("t", List.of(row(null, "a")), UpsertMethod.UPSERT, false)));

    assertEquals(List.of("fields \"id\" are missing but needed as key"), e.errors().get("key"));
    assertFalse(wroteRows());
  }

  @Test
  void unknownAndManagedKeysAreExtraKeys() {
    db.answer(DESCRIBE, tableT());

    Map<String, Object> bogus = row(2, null);
    bogus.put("bogus", "x");
    InvalidDataException unknown = assertThrows(InvalidDataException.class, () -> engine.upsert(URL,
        new UpsertRequest("t", List.of(row(1, "a"), bogus), UpsertMethod.INSERT, false)));
    assertEquals(List.of("row \"2\" has extra keys \"bogus\""), unknown.errors().get("records"));

    InvalidDataException managed = assertThrows(InvalidDataException.class, () -> engine.upsert(URL,
        new UpsertRequest("t", List.of(Map.of("_id", 5)), UpsertMethod.INSERT, false)));
    assertEquals(List.of("row \"1\" has extra keys \"_id\""), managed.errors().get("records"));

    assertFalse(wroteRows());
  }

  @Test
  void upsertOnMissingTableIsNotFound() {
    assertThrows(ResourceNotFoundException.class, () -> engine.upsert(URL,
        new UpsertRequest("t", List.of(row(1, "a")), UpsertMethod.INSERT, false)));
  }

  @Test
  void constraintViolationBecomesInvalidData() {
    db.answer(DESCRIBE, tableT())
        .fail("INSERT INTO", new SQLException("duplicate key value violates unique constraint\nDETAIL: x", "23505"));

    InvalidDataException e = assertThrows(InvalidDataException.class, () -> engine.upsert(URL,
        new UpsertRequest("t", List.of(row(1, "a")), UpsertMethod.INSERT, false)));

    assertEquals("duplicate key value violates unique constraint", e.getMessage());
    assertEquals(1, db.rollbacks);
  }

  // ---------------------------------------------------------------- create

  @Test
  void newPrivateTableIsCreatedAndRevokedFromReadOnlyRole() {
    engine = newEngine(DatastoreSettings.of(URL, "postgresql://reader@db/datastore").withReadOnlyRole("reader"));
    db.answer(DESCRIBE, List.of(), tableT());

    Map<String, Object> out = engine.create(URL,
        CreateRequest.forResource("t", List.of(new FieldSpec("id", "int4"), new FieldSpec("name", "text"))), true);

    List<String> sql = db.statements();
    assertTrue(sql.stream().anyMatch(s -> s.startsWith("CREATE TABLE \"t\" (\"_id\" serial PRIMARY KEY")), sql.toString());
    assertTrue(sql.contains("REVOKE SELECT ON \"t\" FROM \"reader\""), sql.toString());
    assertEquals(true, out.get("private"));
    assertEquals(1, db.commits);
  }

  @Test
  void aliasTakenByAnotherRelationIsRejected() {
    db.answer(DESCRIBE, tableT())
        .answer(CATALOG_ALIASES, List.of())
        .answer(CATALOG_NAME, List.of(Map.of("name", "taken")));

    InvalidDataException e = assertThrows(InvalidDataException.class, () -> engine.create(URL,
        CreateRequest.forResource("t", List.of()).withAliases(List.of("taken")), false));

    assertEquals(List.of("The alias \"taken\" already exists."), e.errors().get("alias"));
    assertEquals(0, db.count("CREATE VIEW"));
    assertEquals(1, db.rollbacks);
  }

  @Test
  void replacingAliasesDropsStaleViewsOnly() {
    db.answer(DESCRIBE, tableT())
        .answer(CATALOG_ALIASES, List.of(Map.of("name", "old"), Map.of("name", "kept")));

    engine.create(URL, CreateRequest.forResource("t", List.of()).withAliases(List.of("kept", "fresh")), false);

    List<String> sql = db.statements();
    assertTrue(sql.contains("DROP VIEW IF EXISTS \"old\""), sql.toString());
    assertFalse(sql.contains("DROP VIEW IF EXISTS \"kept\""), sql.toString());
    assertTrue(sql.contains("CREATE VIEW \"fresh\" AS SELECT * FROM \"t\""), sql.toString());
  }

  @Test
  void primaryKeyOnUnknownColumnIsRejected() {
    db.answer(DESCRIBE, tableT());

    InvalidDataException e = assertThrows(InvalidDataException.class, () -> engine.create(URL,
        CreateRequest.forResource("t", List.of()).withPrimaryKey(List.of("nope")), false));

    assertEquals(List.of("field \"nope\" not in table"), e.errors().get("primary_key"));
  }

  // ---------------------------------------------------------------- delete

  @Test
  void nullFiltersDropTheTable() {
    db.answer(DESCRIBE, tableT());

    engine.delete(URL, new DeleteRequest("t", null, false));

    assertTrue(db.statements().contains("DROP TABLE \"t\" CASCADE"));
    assertEquals(0, db.count("DELETE FROM"));
  }

  @Test
  void filteredDeleteKeepsTableAndReportsNoRowCount() {
    db.answer(DESCRIBE, tableT()).updateCount("DELETE FROM", 3);

    Map<String, Object> out = engine.delete(URL, new DeleteRequest("t", Map.of("name", "zz"), false));

    assertEquals(1, db.count("DELETE FROM \"t\" WHERE"));
    assertEquals(0, db.count("DROP TABLE"));
    assertEquals(List.of("resource_id", "id", "connection_url"), List.copyOf(out.keySet()));
  }

  @Test
  void emptyFiltersDeleteAllRowsButKeepTable() {
    db.answer(DESCRIBE, tableT());

    engine.delete(URL, new DeleteRequest("t", Map.of(), false));

    assertTrue(db.statements().contains("DELETE FROM \"t\""), db.statements().toString());
    assertEquals(0, db.count("DROP TABLE"));
  }

  @Test
  void deleteFilterOnUnknownColumnIsRejected() {
    db.answer(DESCRIBE, tableT());

    InvalidDataException e = assertThrows(InvalidDataException.class,
        () -> engine.delete(URL, new DeleteRequest("t", Map.of("zz", 1), false)));

    assertEquals(List.of("field \"zz\" not in table"), e.errors().get("filters"));
    assertEquals(0, db.count("DELETE FROM"));
  }

  // ---------------------------------------------------------------- search

  private static SearchRequest search(Map<String, Object> filters, String q, Map<String, String> qFields,
                                      List<SortField> sort) {
    return new SearchRequest("t", filters, q, qFields, true, null, null, sort, 10, 0, false);
  }

  @Test
  void searchChecksEveryReferencedColumn() {
    db.answer(DESCRIBE, tableT());

    InvalidDataException filters = assertThrows(InvalidDataException.class,
        () -> engine.search(URL, search(Map.of("zz", 1), null, null, null)));
    assertEquals(List.of("field \"zz\" not in table"), filters.errors().get("filters"));

    InvalidDataException sort = assertThrows(InvalidDataException.class,
        () -> engine.search(URL, search(null, null, null, List.of(new SortField("zz", SortField.Direction.ASC)))));
    assertEquals(List.of("field \"zz\" not in table"), sort.errors().get("sort"));

    InvalidDataException q = assertThrows(InvalidDataException.class,
        () -> engine.search(URL, search(null, null, Map.of("zz", "x"), null)));
    assertEquals(List.of("field \"zz\" not in table"), q.errors().get("q"));

    assertEquals(0, db.count("SELECT COUNT(*)"));
  }

  @Test
  void textQueryNeedsFullTextColumn() {
    db.answer(DESCRIBE, List.of(column("id", "int4", "integer")));

    InvalidDataException e = assertThrows(InvalidDataException.class,
        () -> engine.search(URL, search(null, "hello", null, null)));

    assertTrue(e.errors().containsKey("q"));
  }

  @Test
  void searchCountsAndReadsInReadOnlyTransaction() {
    db.answer(DESCRIBE, tableT())
        .answer("SELECT COUNT(*)", List.of(Map.of("count", 2L)))
        .answer("FROM \"t\"", List.of(Map.of("id", 1), Map.of("id", 2)));

    Map<String, Object> out = engine.search(URL, search(Map.of("name", "a"), null, null, null));

    assertEquals(2L, out.get("total"));
    assertEquals(List.of(Map.of("id", 1), Map.of("id", 2)), out.get("records"));
    assertEquals(Map.of("name", "a"), out.get("filters"));
    assertTrue(db.readOnly);
  }

  // ---------------------------------------------------------------- search_sql

  @Test
  void searchSqlRunsUnderTimeoutAndRowCap() {
    engine = newEngine(DatastoreSettings.of(URL, null).withSearchLimits(100, 500).withSqlSearchTimeoutMillis(1500));
    db.answer("SELECT 1 AS one", List.of(Map.of("one", 1)));

    Map<String, Object> out = engine.searchSql(URL, new SearchSqlRequest("SELECT 1 AS one"));

    assertEquals(List.of("SET LOCAL statement_timeout = 1500", "SELECT 1 AS one"), db.statements());
    assertEquals(500, db.maxRows);
    assertTrue(db.readOnly);
    assertEquals(List.of(Map.of("id", "one", "type", "text")), out.get("fields"));
    assertEquals(List.of(Map.of("one", 1)), out.get("records"));
  }

  @Test
  void cancelledStatementIsReportedAsTooLong() {
    db.fail("pg_sleep", new SQLException("canceling statement due to statement timeout", "57014"));

    InvalidDataException e = assertThrows(InvalidDataException.class,
        () -> engine.searchSql(URL, new SearchSqlRequest("SELECT pg_sleep(10)")));

    assertEquals("Query took too long", e.getMessage());
  }
}
