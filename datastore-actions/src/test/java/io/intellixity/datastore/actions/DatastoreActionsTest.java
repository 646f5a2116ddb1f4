package io.intellixity.datastore.actions;

import io.intellixity.datastore.config.DatastoreSettings;
import io.intellixity.datastore.context.ActionContext;
import io.intellixity.datastore.error.AccessDeniedException;
import io.intellixity.datastore.error.DatastoreValidationException;
import io.intellixity.datastore.error.ResourceNotFoundException;
import io.intellixity.datastore.model.FieldSpec;
import io.intellixity.datastore.model.Resource;
import io.intellixity.datastore.model.ResourceSpec;
import io.intellixity.datastore.model.UpsertMethod;
import io.intellixity.datastore.request.CreateRequest;
import io.intellixity.datastore.request.DeleteRequest;
import io.intellixity.datastore.request.InfoRequest;
import io.intellixity.datastore.request.PermissionRequest;
import io.intellixity.datastore.request.SearchRequest;
import io.intellixity.datastore.request.SearchSqlRequest;
import io.intellixity.datastore.request.UpsertRequest;
import io.intellixity.datastore.spi.ActionNames;
import io.intellixity.datastore.sql.TableNames;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

final class DatastoreActionsTest {
  private static final String WRITE = "postgresql://writer@db/datastore";
  private static final String READ = "postgresql://reader@db/datastore";
  private static final ActionContext CTX = ActionContext.of(Map.of(ActionContext.USER, "tester"), "tester");

  private InMemoryDatastore datastore;
  private InMemoryResourceRegistry registry;
  private InMemorySearchIndex index;
  private RecordingAccessPolicy policy;
  private List<String> submitted;
  private DatastoreActions actions;

  @BeforeEach
  void setUp() {
    datastore = new InMemoryDatastore();
    registry = new InMemoryResourceRegistry();
    index = new InMemorySearchIndex();
    policy = new RecordingAccessPolicy();
    submitted = new ArrayList<>();
    actions = newActions(DatastoreSettings.of(WRITE, READ));
  }

  private DatastoreActions newActions(DatastoreSettings settings) {
    ActiveFlagSynchronizer sync = new ActiveFlagSynchronizer(registry, List.of(new SearchIndexActivationListener(index)));
    return new DatastoreActions(settings, datastore, datastore, registry, policy, sync, submitted::add);
  }

  private static List<FieldSpec> idAndName() {
    return List.of(new FieldSpec("id", "int"), new FieldSpec("name", "text"));
  }

  private static Map<String, Object> row(int id, String name) {
    return Map.of("id", id, "name", name);
  }

  /** Datastore-managed resource with a table keyed on {@code id}. */
  private void createTable(String id, List<Map<String, Object>> records) {
    registry.add(id, "pkg", Resource.DATASTORE_URL_TYPE);
    actions.create(CTX, CreateRequest.forResource(id, idAndName()).withPrimaryKey(List.of("id")).withRecords(records));
  }

  @SuppressWarnings("unchecked")
  private static List<Map<String, Object>> records(Map<String, Object> result) {
    return (List<Map<String, Object>>) result.get("records");
  }

  // ---------------------------------------------------------------- create

  @Test
  void createWithResourceIdBuildsTableAndStripsInternalKeys() {
    registry.add("r1", "pkg", Resource.DATASTORE_URL_TYPE);

    Map<String, Object> out = actions.create(CTX, CreateRequest.forResource("r1", idAndName())).orElseThrow();

    assertEquals("r1", out.get("resource_id"));
    assertFalse(out.containsKey("id"));
    assertFalse(out.containsKey("private"));
    assertFalse(out.containsKey("connection_url"));
    assertTrue(datastore.calls.contains("create " + WRITE + " r1 private=false"));
    assertEquals(ActionNames.CREATE, policy.checks.get(0).action());
  }

  @Test
  void createRequiresExactlyOneOfResourceAndResourceId() {
    ResourceSpec spec = new ResourceSpec("pkg", "n", null, null, null);
    DatastoreValidationException both = assertThrows(DatastoreValidationException.class,
        () -> actions.create(CTX, CreateRequest.forResource("r1", null).withResource(spec)));
    assertEquals(List.of("resource cannot be used with resource_id"), both.errors().get("resource"));

    DatastoreValidationException none = assertThrows(DatastoreValidationException.class,
        () -> actions.create(CTX, CreateRequest.forResource(null, idAndName())));
    assertEquals(List.of("resource_id or resource required"), none.errors().get("resource_id"));
    assertTrue(datastore.tables.isEmpty());
  }

  @Test
  void createFromSpecWithoutUrlMakesDatastoreOnlyResource() {
    CreateRequest req = CreateRequest.forResource(null, idAndName())
        .withResource(new ResourceSpec("pkg", "inline", null, "csv", Map.of()));

    Map<String, Object> out = actions.create(CTX, req).orElseThrow();

    String id = (String) out.get("resource_id");
    Resource r = registry.resources.get(id);
    assertEquals(Resource.DATASTORE_URL_TYPE, r.urlType());
    assertEquals(Resource.DATASTORE_ONLY_URL, r.url());
    assertTrue(r.datastoreActive());
    assertTrue(datastore.tables.containsKey(id));
    assertTrue(submitted.isEmpty());
  }

  @Test
  void createFromSpecWithUrlHandsOffToImportPipeline() {
    CreateRequest req = CreateRequest.forResource(null, idAndName())
        .withResource(new ResourceSpec("pkg", "remote", "https://example.org/data.csv", "csv", Map.of()));

    Optional<Map<String, Object>> out = actions.create(CTX, req);

    assertTrue(out.isEmpty());
    assertEquals(1, submitted.size());
    assertTrue(registry.resources.containsKey(submitted.get(0)));
    assertTrue(datastore.tables.isEmpty());
    assertTrue(registry.patches.isEmpty());
  }

  @Test
  void createFromUrlWithoutImportPipelineIsRejected() {
    ActiveFlagSynchronizer sync = new ActiveFlagSynchronizer(registry, List.of());
    DatastoreActions noImport = new DatastoreActions(DatastoreSettings.of(WRITE, READ),
        datastore, datastore, registry, policy, sync, null);
    CreateRequest req = CreateRequest.forResource(null, null)
        .withResource(new ResourceSpec("pkg", "remote", "https://example.org/data.csv", null, Map.of()));

    DatastoreValidationException e = assertThrows(DatastoreValidationException.class, () -> noImport.create(CTX, req));
    assertEquals(List.of("The import pipeline has to be enabled."), e.errors().get("resource"));
    assertTrue(registry.resources.isEmpty());
  }

  @Test
  void createOnReadOnlyResourceNeedsForce() {
    registry.add("up", "pkg", "upload");

    DatastoreValidationException e = assertThrows(DatastoreValidationException.class,
        () -> actions.create(CTX, CreateRequest.forResource("up", idAndName())));
    assertEquals(List.of(ReadOnlyGate.MESSAGE), e.errors().get("read-only"));

    assertTrue(actions.create(CTX, CreateRequest.forResource("up", idAndName()).withForce(true)).isPresent());
  }

  @Test
  void createRejectsInvalidAliasNames() {
    registry.add("r1", "pkg", Resource.DATASTORE_URL_TYPE);
    for (String bad : List.of("_hidden", "has\"quote", "100%")) {
      DatastoreValidationException e = assertThrows(DatastoreValidationException.class,
          () -> actions.create(CTX, CreateRequest.forResource("r1", idAndName()).withAliases(List.of(bad))));
      assertEquals(List.of("\"" + bad + "\" is not a valid alias name"), e.errors().get("alias"));
    }
    assertTrue(datastore.tables.isEmpty());
  }

  @Test
  void invalidAliasInResourceCreateLeavesNoResourceBehind() {
    CreateRequest req = CreateRequest.forResource(null, idAndName())
        .withResource(new ResourceSpec("pkg", "inline", null, "csv", Map.of()))
        .withAliases(List.of("_hidden"));

    DatastoreValidationException e = assertThrows(DatastoreValidationException.class, () -> actions.create(CTX, req));
    assertEquals(List.of("\"_hidden\" is not a valid alias name"), e.errors().get("alias"));
    assertTrue(registry.resources.isEmpty());
    assertTrue(datastore.tables.isEmpty());
  }

  @Test
  void createMarksTablePrivateOnlyWithReadWriteSplit() {
    registry.privatePackages.add("secret");
    registry.add("p1", "secret", Resource.DATASTORE_URL_TYPE);
    actions.create(CTX, CreateRequest.forResource("p1", idAndName()));
    assertTrue(datastore.tables.get("p1").privateTable);

    registry.add("p2", "secret", Resource.DATASTORE_URL_TYPE);
    newActions(DatastoreSettings.of(WRITE, null)).create(CTX, CreateRequest.forResource("p2", idAndName()));
    assertFalse(datastore.tables.get("p2").privateTable);
  }

  @Test
  void engineDataErrorsBecomeValidationErrors() {
    registry.add("r1", "pkg", Resource.DATASTORE_URL_TYPE);
    DatastoreValidationException e = assertThrows(DatastoreValidationException.class,
        () -> actions.create(CTX, CreateRequest.forResource("r1", idAndName()).withPrimaryKey(List.of("nope"))));
    assertEquals(List.of("field \"nope\" does not exist"), e.errors().get("primary_key"));
  }

  @Test
  void createDoesNotRewriteFlagThatIsAlreadySet() {
    createTable("r1", List.of());
    assertEquals(1, registry.patches.size());

    actions.create(CTX, CreateRequest.forResource("r1", List.of(new FieldSpec("extra", "text"))));
    assertEquals(1, registry.patches.size());
  }

  // ---------------------------------------------------------------- properties

  @Test
  void aliasSearchReturnsSameRecordsAsRealId() {
    registry.add("r1", "pkg", Resource.DATASTORE_URL_TYPE);
    actions.create(CTX, CreateRequest.forResource("r1", idAndName())
        .withAliases(List.of("my_alias", "other name"))
        .withRecords(List.of(row(1, "a"), row(2, "b"))));

    Map<String, Object> byId = actions.search(CTX, SearchRequest.of("r1", 100));
    for (String alias : List.of("my_alias", "other name")) {
      Map<String, Object> byAlias = actions.search(CTX, SearchRequest.of(alias, 100));
      assertEquals(records(byId), records(byAlias));
      assertEquals("r1", byAlias.get("resource_id"));
    }
    // access is always evaluated on the physical table
    policy.checks.stream().filter(c -> c.action().equals(ActionNames.SEARCH))
        .forEach(c -> assertEquals("r1", c.payload().get("resource_id")));
  }

  @Test
  void readOnlyTableCannotBeMutatedWithoutForce() {
    registry.add("up", "pkg", "upload");
    datastore.seed("up", new FieldSpec("id", "int")).primaryKey = List.of("id");

    UpsertRequest up = new UpsertRequest("up", List.of(Map.of("id", 1)), UpsertMethod.INSERT, false);
    DatastoreValidationException e1 = assertThrows(DatastoreValidationException.class, () -> actions.upsert(CTX, up));
    assertTrue(e1.errors().containsKey("read-only"));

    ActionContext admin = ActionContext.of(Map.of(ActionContext.ROLES, List.of("sysadmin")), "admin");
    DatastoreValidationException e2 = assertThrows(DatastoreValidationException.class,
        () -> actions.delete(admin, new DeleteRequest("up", null, false)));
    assertTrue(e2.errors().containsKey("read-only"));
    assertTrue(datastore.tables.containsKey("up"));

    actions.upsert(CTX, up.withForce(true));
    assertEquals(1, datastore.tables.get("up").rows.size());
    actions.delete(CTX, new DeleteRequest("up", null, true));
    assertFalse(datastore.tables.containsKey("up"));
  }

  @Test
  void searchSqlRejectsStackedStatementsBeforeAccessCheck() {
    DatastoreValidationException e = assertThrows(DatastoreValidationException.class,
        () -> actions.searchSql(CTX, new SearchSqlRequest("SELECT 1; DROP TABLE x")));
    assertEquals(Map.of("query", List.of("Query is not a single statement.")), e.errors());
    assertTrue(policy.checks.isEmpty());
    assertTrue(datastore.calls.isEmpty());
  }

  @Test
  void searchSqlSeesStatementsHiddenBehindEscapeStringsAndIdentifierDollars() {
    for (String sql : List.of(
        "SELECT E'\\''; SET statement_timeout = 0; SELECT pg_sleep(100000); --'",
        "SELECT 1 AS a$b$; DROP TABLE x; SELECT 1 AS c$b$")) {
      DatastoreValidationException e = assertThrows(DatastoreValidationException.class,
          () -> actions.searchSql(CTX, new SearchSqlRequest(sql)));
      assertEquals(List.of("Query is not a single statement."), e.errors().get("query"));
    }
    assertTrue(datastore.calls.isEmpty());
  }

  @Test
  void searchSqlRunsSingleSelectOnReadOnlyConnection() {
    Map<String, Object> out = actions.searchSql(CTX, new SearchSqlRequest("SELECT * FROM \"abc123\""));

    assertEquals(List.of("fields", "records"), List.copyOf(out.keySet()));
    assertEquals(List.of("search_sql " + READ), datastore.calls);
    assertEquals(ActionNames.SEARCH_SQL, policy.checks.get(0).action());
  }

  @Test
  void searchSqlIsRefusedInLegacyMode() {
    DatastoreActions legacy = newActions(DatastoreSettings.of(WRITE, null));
    assertThrows(DatastoreValidationException.class, () -> legacy.searchSql(CTX, new SearchSqlRequest("SELECT 1")));
    assertTrue(datastore.calls.isEmpty());
  }

  @Test
  void searchSqlAccessDenialStopsExecution() {
    policy.deny.add(ActionNames.SEARCH_SQL);
    assertThrows(AccessDeniedException.class, () -> actions.searchSql(CTX, new SearchSqlRequest("SELECT 1")));
    assertTrue(datastore.calls.isEmpty());
  }

  @Test
  void activationFlagFollowsTableLifecycle() {
    index.putPackage("pkg", "other", "r1");

    createTable("r1", List.of(row(1, "a"), row(2, "b")));
    assertTrue(registry.active("r1"));
    assertEquals(true, index.resourceFlag("pkg", "r1"));
    assertNull(index.resourceFlag("pkg", "other"));

    actions.delete(CTX, new DeleteRequest("r1", Map.of("id", 1), false));
    assertTrue(registry.active("r1"));
    assertEquals(1, datastore.tables.get("r1").rows.size());
    assertEquals(1, index.indexed.size());

    actions.delete(CTX, new DeleteRequest("r1", null, false));
    assertFalse(registry.active("r1"));
    assertEquals(false, index.resourceFlag("pkg", "r1"));
    assertFalse(datastore.tables.containsKey("r1"));
  }

  @Test
  void emptyFiltersDeleteRowsButKeepTableAndFlag() {
    createTable("r1", List.of(row(1, "a")));

    Map<String, Object> out = actions.delete(CTX, new DeleteRequest("r1", Map.of(), false));

    assertEquals(Map.of(), out.get("filters"));
    assertTrue(datastore.tables.get("r1").rows.isEmpty());
    assertTrue(registry.active("r1"));
  }

  @Test
  void deleteEchoesFilters() {
    createTable("r1", List.of(row(1, "a")));
    Map<String, Object> out = actions.delete(CTX, new DeleteRequest("r1", Map.of("name", "zzz"), false));
    assertEquals(List.of("resource_id", "filters"), List.copyOf(out.keySet()));
    assertEquals(Map.of("name", "zzz"), out.get("filters"));
    assertFalse(out.containsKey("connection_url"));
  }

  @Test
  void upsertMethodsEnforceKeySemantics() {
    createTable("r1", List.of(row(1, "a")));

    DatastoreValidationException dup = assertThrows(DatastoreValidationException.class, () -> actions.upsert(CTX,
        new UpsertRequest("r1", List.of(row(1, "again")), UpsertMethod.INSERT, false)));
    assertFalse(dup.errors().isEmpty());

    DatastoreValidationException missing = assertThrows(DatastoreValidationException.class, () -> actions.upsert(CTX,
        new UpsertRequest("r1", List.of(row(7, "ghost")), UpsertMethod.UPDATE, false)));
    assertTrue(missing.errors().containsKey("key"));

    actions.upsert(CTX, new UpsertRequest("r1", List.of(row(1, "renamed"), row(7, "new")), UpsertMethod.UPSERT, false));
    List<Map<String, Object>> rows = datastore.tables.get("r1").rows;
    assertEquals(2, rows.size());
    assertEquals("renamed", rows.get(0).get("name"));
  }

  @Test
  void mutationsOnUnknownTableAreNotFound() {
    registry.add("ghost", "pkg", Resource.DATASTORE_URL_TYPE);
    registry.add("up", "pkg", "upload");

    for (String id : List.of("ghost", "up", "never-registered")) {
      ResourceNotFoundException e1 = assertThrows(ResourceNotFoundException.class,
          () -> actions.upsert(CTX, new UpsertRequest(id, List.of(), UpsertMethod.UPSERT, false)));
      assertEquals("Resource \"" + id + "\" was not found.", e1.getMessage());
      assertThrows(ResourceNotFoundException.class, () -> actions.delete(CTX, new DeleteRequest(id, null, false)));
    }
    assertTrue(registry.patches.isEmpty());
  }

  @Test
  void mutationsThroughAliasAreNotFound() {
    registry.add("r1", "pkg", Resource.DATASTORE_URL_TYPE);
    actions.create(CTX, CreateRequest.forResource("r1", idAndName()).withAliases(List.of("nick")));

    assertThrows(ResourceNotFoundException.class,
        () -> actions.upsert(CTX, new UpsertRequest("nick", List.of(), UpsertMethod.INSERT, false)));
    assertThrows(ResourceNotFoundException.class, () -> actions.delete(CTX, new DeleteRequest("nick", null, false)));
  }

  @Test
  void roundTripSingleRecord() {
    createTable("r1", List.of(row(1, "a")));

    Map<String, Object> out = actions.search(CTX, SearchRequest.of("r1", 100));

    assertEquals(1, out.get("total"));
    assertEquals(List.of(row(1, "a")), records(out));
  }

  // ---------------------------------------------------------------- search

  @Test
  void searchOfUnknownNameIsNotFound() {
    assertThrows(ResourceNotFoundException.class, () -> actions.search(CTX, SearchRequest.of("nope", 10)));
    assertTrue(policy.checks.isEmpty());
  }

  @Test
  void searchDenialUsesPhysicalTable() {
    createTable("r1", List.of());
    actions.create(CTX, CreateRequest.forResource("r1", null).withAliases(List.of("public_name")));
    policy.deny.add(ActionNames.SEARCH);

    assertThrows(AccessDeniedException.class, () -> actions.search(CTX, SearchRequest.of("public_name", 10)));
    RecordingAccessPolicy.Check last = policy.checks.get(policy.checks.size() - 1);
    assertEquals(Map.of("resource_id", "r1"), last.payload());
  }

  @Test
  void tableMetadataIsExemptFromAccessControl() {
    datastore.seed(TableNames.TABLE_METADATA, new FieldSpec("name", "text"), new FieldSpec("alias_of", "text"));
    policy.deny.add(ActionNames.SEARCH);

    Map<String, Object> out = actions.search(CTX, SearchRequest.of(TableNames.TABLE_METADATA, 10));

    assertEquals(TableNames.TABLE_METADATA, out.get("resource_id"));
    assertTrue(policy.checks.isEmpty());
  }

  @Test
  void searchFilterErrorsAreValidationErrors() {
    createTable("r1", List.of(row(1, "a")));
    DatastoreValidationException e = assertThrows(DatastoreValidationException.class,
        () -> actions.search(CTX, SearchRequest.of("r1", 10).withFilters(Map.of("missing", 1))));
    assertTrue(e.errors().containsKey("filters"));
  }

  // ---------------------------------------------------------------- privacy toggles and info

  @Test
  void privacyTogglesRequireRegistryAndCatalog() {
    registry.add("only-registry", "pkg", Resource.DATASTORE_URL_TYPE);
    datastore.seed("only-catalog");

    for (String id : List.of("only-registry", "only-catalog")) {
      assertThrows(ResourceNotFoundException.class, () -> actions.makePrivate(CTX, new PermissionRequest(id)));
      assertThrows(ResourceNotFoundException.class, () -> actions.makePublic(CTX, new PermissionRequest(id)));
    }
    assertTrue(policy.checks.isEmpty());
  }

  @Test
  void privacyTogglesAreIdempotentAndChecked() {
    createTable("r1", List.of());

    actions.makePrivate(CTX, new PermissionRequest("r1"));
    actions.makePrivate(CTX, new PermissionRequest("r1"));
    assertTrue(datastore.tables.get("r1").privateTable);
    actions.makePublic(CTX, new PermissionRequest("r1"));
    assertFalse(datastore.tables.get("r1").privateTable);

    assertEquals(3, policy.checks.stream().filter(c -> c.action().equals(ActionNames.CHANGE_PERMISSIONS)).count());

    policy.deny.add(ActionNames.CHANGE_PERMISSIONS);
    assertThrows(AccessDeniedException.class, () -> actions.makePrivate(CTX, new PermissionRequest("r1")));
    assertFalse(datastore.tables.get("r1").privateTable);
  }

  @Test
  void infoReportsSchemaAndCountOnReadConnection() {
    createTable("r1", List.of(row(1, "a"), row(2, "b")));

    Map<String, Object> out = actions.info(CTX, new InfoRequest("r1"));

    assertEquals(Map.of("id", "number", "name", "text"), out.get("schema"));
    assertEquals(Map.of("count", 2), out.get("meta"));
    assertTrue(datastore.calls.contains("info " + READ + " r1"));
    assertThrows(ResourceNotFoundException.class, () -> actions.info(CTX, new InfoRequest("missing")));
  }
}
