package io.intellixity.datastore.request;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.intellixity.datastore.config.DatastoreSettings;
import io.intellixity.datastore.error.DatastoreValidationException;
import io.intellixity.datastore.model.FieldSpec;
import io.intellixity.datastore.model.ResourceSpec;
import io.intellixity.datastore.model.UpsertMethod;
import io.intellixity.datastore.query.SortField;
import io.intellixity.datastore.query.SortSpecs;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Turns raw action payloads (JSON objects) into typed requests.\n
 *
 * Each method validates the whole payload in one pass and raises a single
 * {@link DatastoreValidationException} listing every problem found.\n
 */
public final class ActionRequests {
  static final String MISSING = "Missing value";
  static final String NOT_A_STRING = "Must be a string";
  static final String NOT_A_BOOLEAN = "Must be a boolean";
  static final String NOT_A_LIST = "Must be a list or a comma-separated string";
  static final String BAD_FILTERS = "filters must be either a dict or null.";

  private final DatastoreSettings settings;
  private final ObjectMapper json;

  public ActionRequests(DatastoreSettings settings) {
    this(settings, new ObjectMapper());
  }

  public ActionRequests(DatastoreSettings settings, ObjectMapper json) {
    this.settings = Objects.requireNonNull(settings, "settings");
    this.json = Objects.requireNonNull(json, "json");
  }

  public CreateRequest create(JsonNode data) {
    Errors err = new Errors();
    JsonNode root = object(data, err);

    String resourceId = optionalString(root, "resource_id", err);
    ResourceSpec resource = null;
    JsonNode r = root.get("resource");
    if (r != null && !r.isNull()) {
      if (!r.isObject()) {
        err.add("resource", "Must be a dict");
      } else {
        resource = resourceSpec(r, err);
      }
    }

    List<FieldSpec> fields = null;
    JsonNode f = root.get("fields");
    if (f != null && !f.isNull()) fields = fieldSpecs(f, err);

    List<Map<String, Object>> records = records(root, err);
    List<String> aliases = stringList(root, "aliases", err);
    List<String> primaryKey = stringList(root, "primary_key", err);
    List<String> indexes = stringList(root, "indexes", err);
    boolean force = bool(root, "force", false, err);

    err.throwIfAny();
    return new CreateRequest(resourceId, resource, fields, records, aliases, primaryKey, indexes, force);
  }

  public UpsertRequest upsert(JsonNode data) {
    Errors err = new Errors();
    JsonNode root = object(data, err);

    String resourceId = requiredString(root, "resource_id", err);
    List<Map<String, Object>> records = records(root, err);
    UpsertMethod method = UpsertMethod.UPSERT;
    String m = optionalString(root, "method", err);
    if (m != null) {
      method = UpsertMethod.parse(m).orElse(null);
      if (method == null) err.add("method", "Must be one of upsert, insert, update");
    }
    boolean force = bool(root, "force", false, err);

    err.throwIfAny();
    return new UpsertRequest(resourceId, records, method, force);
  }

  public DeleteRequest delete(JsonNode data) {
    Errors err = new Errors();
    JsonNode root = object(data, err);

    String resourceId = requiredString(root, "resource_id", err);
    Map<String, Object> filters = filters(root, err);
    boolean force = bool(root, "force", false, err);

    err.throwIfAny();
    return new DeleteRequest(resourceId, filters, force);
  }

  public SearchRequest search(JsonNode data) {
    Errors err = new Errors();
    JsonNode root = object(data, err);

    String resourceId = requiredString(root, "resource_id", err);
    Map<String, Object> filters = filters(root, err);

    String q = null;
    Map<String, String> qFields = new LinkedHashMap<>();
    JsonNode qn = root.get("q");
    if (qn != null && !qn.isNull()) {
      if (qn.isTextual()) {
        q = qn.asText();
      } else if (qn.isObject()) {
        Iterator<Map.Entry<String, JsonNode>> it = qn.fields();
        while (it.hasNext()) {
          var e = it.next();
          if (!e.getValue().isTextual()) {
            err.add("q", "Values of q must be strings");
          } else {
            qFields.put(e.getKey(), e.getValue().asText());
          }
        }
      } else {
        err.add("q", "Must be a string or a dict");
      }
    }

    boolean plain = bool(root, "plain", true, err);
    String language = optionalString(root, "language", err);
    List<String> fields = stringList(root, "fields", err);

    List<SortField> sort = List.of();
    List<String> sortParts = stringList(root, "sort", err);
    if (sortParts != null) {
      try {
        sort = SortSpecs.parse(sortParts);
      } catch (IllegalArgumentException e) {
        err.add("sort", e.getMessage());
      }
    }

    int limit = nonNegativeInt(root, "limit", settings.searchDefaultLimit(), err);
    int offset = nonNegativeInt(root, "offset", 0, err);
    boolean distinct = bool(root, "distinct", false, err);

    err.throwIfAny();
    return new SearchRequest(resourceId, filters, q, qFields, plain, language, fields, sort,
        Math.min(limit, settings.searchRowsMax()), offset, distinct);
  }

  public SearchSqlRequest searchSql(JsonNode data) {
    Errors err = new Errors();
    JsonNode root = object(data, err);
    String sql = requiredString(root, "sql", err);
    if (sql != null && sql.isBlank()) err.add("sql", MISSING);
    err.throwIfAny();
    return new SearchSqlRequest(sql);
  }

  /** {@code id} is accepted as an alias of {@code resource_id}. */
  public PermissionRequest permission(JsonNode data) {
    Errors err = new Errors();
    JsonNode root = object(data, err);
    String id = optionalString(root, "resource_id", err);
    if (id == null) id = optionalString(root, "id", err);
    if (id == null || id.isBlank()) err.add("resource_id", MISSING);
    err.throwIfAny();
    return new PermissionRequest(id);
  }

  public InfoRequest info(JsonNode data) {
    Errors err = new Errors();
    JsonNode root = object(data, err);
    String id = optionalString(root, "id", err);
    if (id == null) id = optionalString(root, "resource_id", err);
    if (id == null || id.isBlank()) err.add("id", MISSING);
    err.throwIfAny();
    return new InfoRequest(id);
  }

  // ---------------------------------------------------------------- helpers

  private JsonNode object(JsonNode data, Errors err) {
    if (data == null || data.isNull()) return json.createObjectNode();
    if (!data.isObject()) {
      err.add("data", "Must be a dict");
      return json.createObjectNode();
    }
    return data;
  }

  private ResourceSpec resourceSpec(JsonNode r, Errors err) {
    String packageId = textOrNull(r.get("package_id"));
    if (packageId == null || packageId.isBlank()) err.add("resource", "package_id: " + MISSING);
    Map<String, Object> attributes = new LinkedHashMap<>();
    Iterator<Map.Entry<String, JsonNode>> it = r.fields();
    while (it.hasNext()) {
      var e = it.next();
      switch (e.getKey()) {
        case "package_id", "name", "url", "format" -> { }
        default -> attributes.put(e.getKey(), toJava(e.getValue()));
      }
    }
    return new ResourceSpec(packageId, textOrNull(r.get("name")), textOrNull(r.get("url")),
        textOrNull(r.get("format")), attributes);
  }

  private List<FieldSpec> fieldSpecs(JsonNode f, Errors err) {
    if (!f.isArray()) {
      err.add("fields", "Must be a list of dicts");
      return null;
    }
    List<FieldSpec> out = new ArrayList<>();
    for (JsonNode x : f) {
      if (!x.isObject()) {
        err.add("fields", "Must be a list of dicts");
        continue;
      }
      String id = textOrNull(x.get("id"));
      if (id == null) {
        err.add("fields", "id: " + MISSING);
        continue;
      }
      JsonNode t = x.get("type");
      String type = null;
      if (t != null && !t.isNull()) {
        if (!t.isTextual()) err.add("fields", "type of \"" + id + "\": " + NOT_A_STRING);
        else type = t.asText();
      }
      Map<String, Object> info = null;
      JsonNode i = x.get("info");
      if (i != null && !i.isNull()) {
        if (!i.isObject()) err.add("fields", "info of \"" + id + "\": Must be a dict");
        else info = toMap(i);
      }
      out.add(new FieldSpec(id, type, info));
    }
    return out;
  }

  private List<Map<String, Object>> records(JsonNode root, Errors err) {
    JsonNode n = root.get("records");
    if (n == null || n.isNull()) return null;
    if (!n.isArray()) {
      err.add("records", "Must be a list of dicts");
      return null;
    }
    List<Map<String, Object>> out = new ArrayList<>(n.size());
    for (JsonNode x : n) {
      if (!x.isObject()) {
        err.add("records", "Must be a list of dicts");
        return null;
      }
      out.add(toMap(x));
    }
    return out;
  }

  private Map<String, Object> filters(JsonNode root, Errors err) {
    JsonNode n = root.get("filters");
    if (n == null || n.isNull()) return null;
    if (!n.isObject()) {
      err.add("filters", BAD_FILTERS);
      return null;
    }
    return toMap(n);
  }

  private Map<String, Object> toMap(JsonNode n) {
    Map<String, Object> out = new LinkedHashMap<>();
    Iterator<Map.Entry<String, JsonNode>> it = n.fields();
    while (it.hasNext()) {
      var e = it.next();
      out.put(e.getKey(), toJava(e.getValue()));
    }
    return out;
  }

  private Object toJava(JsonNode n) {
    if (n == null || n.isNull()) return null;
    return json.convertValue(n, Object.class);
  }

  private static String requiredString(JsonNode root, String key, Errors err) {
    JsonNode n = root.get(key);
    if (n == null || n.isNull()) {
      err.add(key, MISSING);
      return null;
    }
    if (!n.isTextual()) {
      err.add(key, NOT_A_STRING);
      return null;
    }
    if (n.asText().isBlank()) {
      err.add(key, MISSING);
      return null;
    }
    return n.asText();
  }

  private static String optionalString(JsonNode root, String key, Errors err) {
    JsonNode n = root.get(key);
    if (n == null || n.isNull()) return null;
    if (!n.isTextual()) {
      err.add(key, NOT_A_STRING);
      return null;
    }
    return n.asText();
  }

  /** JSON array of strings or a comma-separated string; null when absent. */
  private static List<String> stringList(JsonNode root, String key, Errors err) {
    JsonNode n = root.get(key);
    if (n == null || n.isNull()) return null;
    List<String> out = new ArrayList<>();
    if (n.isTextual()) {
      for (String part : n.asText().split(",")) {
        String p = part.trim();
        if (!p.isEmpty()) out.add(p);
      }
      return out;
    }
    if (n.isArray()) {
      for (JsonNode x : n) {
        if (!x.isTextual()) {
          err.add(key, NOT_A_LIST);
          return null;
        }
        out.add(x.asText());
      }
      return out;
    }
    err.add(key, NOT_A_LIST);
    return null;
  }

  private static boolean bool(JsonNode root, String key, boolean dflt, Errors err) {
    JsonNode n = root.get(key);
    if (n == null || n.isNull()) return dflt;
    if (n.isBoolean()) return n.asBoolean();
    if (n.isTextual()) {
      String s = n.asText().trim();
      if (s.equalsIgnoreCase("true")) return true;
      if (s.equalsIgnoreCase("false")) return false;
    }
    err.add(key, NOT_A_BOOLEAN);
    return dflt;
  }

  private static int nonNegativeInt(JsonNode root, String key, int dflt, Errors err) {
    JsonNode n = root.get(key);
    if (n == null || n.isNull()) return dflt;
    Integer v = null;
    if (n.isIntegralNumber() && n.canConvertToInt()) {
      v = n.asInt();
    } else if (n.isTextual()) {
      try {
        v = Integer.parseInt(n.asText().trim());
      } catch (NumberFormatException ignored) {
        v = null;
      }
    }
    if (v == null) {
      err.add(key, "Invalid integer");
      return dflt;
    }
    if (v < 0) {
      err.add(key, "Must be a positive integer");
      return dflt;
    }
    return v;
  }

  private static String textOrNull(JsonNode n) {
    return (n == null || n.isNull()) ? null : n.asText();
  }

  private static final class Errors {
    private final Map<String, List<String>> byField = new LinkedHashMap<>();

    void add(String field, String message) {
      byField.computeIfAbsent(field, k -> new ArrayList<>()).add(message);
    }

    void throwIfAny() {
      if (!byField.isEmpty()) throw new DatastoreValidationException(byField);
    }
  }
}
