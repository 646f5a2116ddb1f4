package io.intellixity.datastore.request;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.intellixity.datastore.config.DatastoreSettings;
import io.intellixity.datastore.error.DatastoreValidationException;
import io.intellixity.datastore.model.UpsertMethod;
import io.intellixity.datastore.query.SortField;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

final class ActionRequestsTest {
  private static final ObjectMapper JSON = new ObjectMapper();
  private final ActionRequests requests = new ActionRequests(
      DatastoreSettings.of("jdbc:postgresql://db/datastore", null).withSearchLimits(100, 500));

  private static JsonNode json(String s) throws Exception {
    return JSON.readTree(s);
  }

  @Test
  void createParsesFieldsRecordsAndCommaLists() throws Exception {
    CreateRequest r = requests.create(json("""
        {
          "resource_id": "r1",
          "fields": [ {"id": "id", "type": "int"}, {"id": "name", "info": {"label": "Name"}} ],
          "records": [ {"id": 1, "name": "a"}, {"id": 2, "name": null} ],
          "aliases": "first, second",
          "primary_key": ["id"],
          "force": "true"
        }
        """));
    assertEquals("r1", r.resourceId());
    assertNull(r.resource());
    assertEquals(2, r.fields().size());
    assertEquals("int", r.fields().get(0).type());
    assertNull(r.fields().get(1).type());
    assertEquals("Name", r.fields().get(1).info().get("label"));
    assertEquals(2, r.records().size());
    assertTrue(r.records().get(1).containsKey("name"));
    assertNull(r.records().get(1).get("name"));
    assertEquals(List.of("first", "second"), r.aliases());
    assertEquals(List.of("id"), r.primaryKey());
    assertNull(r.indexes());
    assertTrue(r.force());
  }

  @Test
  void createKeepsResourceAttributes() throws Exception {
    CreateRequest r = requests.create(json("""
        {"resource": {"package_id": "p1", "name": "n", "description": "d"}}
        """));
    assertNull(r.resourceId());
    assertEquals("p1", r.resource().packageId());
    assertFalse(r.resource().hasUrl());
    assertEquals(Map.of("description", "d"), r.resource().attributes());
  }

  @Test
  void createCollectsAllErrorsInOnePass() throws Exception {
    DatastoreValidationException e = assertThrows(DatastoreValidationException.class, () -> requests.create(json("""
        {"resource_id": 5, "fields": "nope", "records": [1], "aliases": 3, "force": "maybe"}
        """)));
    assertEquals(List.of("resource_id", "fields", "records", "aliases", "force"), List.copyOf(e.errors().keySet()));
  }

  @Test
  void upsertDefaultsAndMethod() throws Exception {
    assertEquals(UpsertMethod.UPSERT, requests.upsert(json("{\"resource_id\": \"r\"}")).method());
    assertEquals(UpsertMethod.INSERT, requests.upsert(json("{\"resource_id\": \"r\", \"method\": \"Insert\"}")).method());

    DatastoreValidationException e = assertThrows(DatastoreValidationException.class,
        () -> requests.upsert(json("{\"method\": \"merge\"}")));
    assertEquals(List.of("Missing value"), e.errors().get("resource_id"));
    assertTrue(e.errors().containsKey("method"));
  }

  @Test
  void deleteDistinguishesAbsentAndEmptyFilters() throws Exception {
    assertTrue(requests.delete(json("{\"resource_id\": \"r\"}")).dropsTable());
    assertTrue(requests.delete(json("{\"resource_id\": \"r\", \"filters\": null}")).dropsTable());
    DeleteRequest d = requests.delete(json("{\"resource_id\": \"r\", \"filters\": {}}"));
    assertFalse(d.dropsTable());
    assertEquals(Map.of(), d.filters());
  }

  @Test
  void deleteRejectsNonMappingFilters() throws Exception {
    DatastoreValidationException e = assertThrows(DatastoreValidationException.class,
        () -> requests.delete(json("{\"resource_id\": \"r\", \"filters\": [1, 2]}")));
    assertEquals(Map.of("filters", List.of("filters must be either a dict or null.")), e.errors());
  }

  @Test
  void searchAppliesDefaultsAndClampsLimit() throws Exception {
    SearchRequest s = requests.search(json("{\"resource_id\": \"r\"}"));
    assertEquals(100, s.limit());
    assertEquals(0, s.offset());
    assertTrue(s.plain());
    assertEquals("english", s.language());
    assertFalse(s.distinct());
    assertFalse(s.hasTextQuery());

    assertEquals(500, requests.search(json("{\"resource_id\": \"r\", \"limit\": 100000}")).limit());
  }

  @Test
  void searchParsesQueryForms() throws Exception {
    SearchRequest s = requests.search(json("""
        {"resource_id": "r", "q": {"name": "bob"}, "sort": "name desc", "fields": "id,name", "offset": "5"}
        """));
    assertNull(s.q());
    assertEquals(Map.of("name", "bob"), s.qFields());
    assertTrue(s.hasTextQuery());
    assertEquals(List.of(new SortField("name", SortField.Direction.DESC)), s.sort());
    assertEquals(List.of("id", "name"), s.fields());
    assertEquals(5, s.offset());
  }

  @Test
  void searchRejectsNegativePagingAndBadSort() throws Exception {
    DatastoreValidationException e = assertThrows(DatastoreValidationException.class,
        () -> requests.search(json("{\"resource_id\": \"r\", \"limit\": -1, \"offset\": \"x\", \"sort\": \"a up\"}")));
    assertTrue(e.errors().containsKey("limit"));
    assertTrue(e.errors().containsKey("offset"));
    assertTrue(e.errors().containsKey("sort"));
  }

  @Test
  void permissionAcceptsIdAsResourceId() throws Exception {
    assertEquals("r9", requests.permission(json("{\"id\": \"r9\"}")).resourceId());
    assertEquals("r1", requests.permission(json("{\"resource_id\": \"r1\", \"id\": \"r9\"}")).resourceId());
    assertThrows(DatastoreValidationException.class, () -> requests.permission(json("{}")));
  }

  @Test
  void searchSqlRequiresSql() throws Exception {
    assertEquals("SELECT 1", requests.searchSql(json("{\"sql\": \"SELECT 1\"}")).sql());
    DatastoreValidationException e = assertThrows(DatastoreValidationException.class,
        () -> requests.searchSql(json("{\"sql\": \"  \"}")));
    assertEquals(List.of("Missing value"), e.errors().get("sql"));
  }
}
