package io.intellixity.datastore.jdbc.postgres;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.intellixity.datastore.error.DatastoreValidationException;
import io.intellixity.datastore.error.ResourceNotFoundException;
import io.intellixity.datastore.jdbc.JdbcHandle;
import io.intellixity.datastore.jdbc.SqlErrors;
import io.intellixity.datastore.jdbc.SqlParamCompiler;
import io.intellixity.datastore.jdbc.SqlStatement;
import io.intellixity.datastore.model.Resource;
import io.intellixity.datastore.model.ResourceSpec;
import io.intellixity.datastore.spi.ResourceRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Types;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;

/**
 * {@link ResourceRegistry} stored in two Postgres tables: {@code package(id, private)} and
 * {@code resource(id, package_id, name, url, url_type, format, extras jsonb)}.\n
 *
 * Each call runs in its own auto-committed statement.\n
 */
public final class PostgresResourceRegistry implements ResourceRegistry {
  private static final Logger log = LoggerFactory.getLogger(PostgresResourceRegistry.class);
  private static final TypeReference<Map<String, Object>> MAP = new TypeReference<>() {};

  static final String SELECT_RESOURCE =
      "SELECT r.id, r.package_id, r.url, r.url_type, r.extras, p.private FROM resource r"
          + " JOIN package p ON p.id = r.package_id WHERE r.id = :id";

  static final String PATCH_EXTRA =
      "UPDATE resource SET extras = COALESCE(extras, '{}'::jsonb) || jsonb_build_object(:key, CAST(:value AS jsonb))"
          + " WHERE id = :id";

  private final JdbcHandle handle;
  private final ObjectMapper mapper;

  public PostgresResourceRegistry(JdbcHandle handle, ObjectMapper mapper) {
    this.handle = Objects.requireNonNull(handle, "handle");
    this.mapper = (mapper == null) ? new ObjectMapper() : mapper;
  }

  /** Create the registry tables if missing. */
  public void bootstrap() {
    update("BOOTSTRAP", SqlStatement.ddl(
        "CREATE TABLE IF NOT EXISTS package (id text PRIMARY KEY, private boolean NOT NULL DEFAULT false)"));
    update("BOOTSTRAP", SqlStatement.ddl(
        "CREATE TABLE IF NOT EXISTS resource (id text PRIMARY KEY, package_id text NOT NULL REFERENCES package(id),"
            + " name text, url text, url_type text, format text, extras jsonb NOT NULL DEFAULT '{}'::jsonb)"));
  }

  @Override
  public Optional<Resource> find(String resourceId) {
    if (resourceId == null) return Optional.empty();
    List<Resource> rows = query("FIND", SqlParamCompiler.compile(SELECT_RESOURCE, Map.of("id", resourceId)), rs ->
        new Resource(rs.getString("id"), rs.getString("package_id"), rs.getString("url"), rs.getString("url_type"),
            rs.getBoolean("private"), readExtras(rs.getString("extras"))));
    return rows.isEmpty() ? Optional.empty() : Optional.of(rows.get(0));
  }

  @Override
  public Resource create(ResourceSpec spec) {
    Objects.requireNonNull(spec, "spec");
    boolean packageExists = !query("PACKAGE", SqlParamCompiler.compile(
        "SELECT id FROM package WHERE id = :id", params("id", spec.packageId())), rs -> rs.getString(1)).isEmpty();
    if (!packageExists) throw DatastoreValidationException.of("resource", "package_id: Not found: " + spec.packageId());

    String id = UUID.randomUUID().toString();
    Map<String, Object> p = new HashMap<>();
    p.put("id", id);
    p.put("package", spec.packageId());
    p.put("name", spec.name());
    p.put("url", spec.url());
    p.put("format", spec.format());
    p.put("extras", writeJson(spec.attributes()));
    update("CREATE", SqlParamCompiler.compile(
        "INSERT INTO resource (id, package_id, name, url, format, extras)"
            + " VALUES (:id, :package, :name, :url, :format, CAST(:extras AS jsonb))", p));
    log.debug("datastore.registry resource created id={} packageId={}", id, spec.packageId());
    return get(id);
  }

  @Override
  public Resource update(Resource resource) {
    Map<String, Object> p = new HashMap<>();
    p.put("id", resource.id());
    p.put("url", resource.url());
    p.put("urlType", resource.urlType());
    p.put("extras", writeJson(resource.extras()));
    int n = update("UPDATE", SqlParamCompiler.compile(
        "UPDATE resource SET url = :url, url_type = :urlType, extras = CAST(:extras AS jsonb) WHERE id = :id", p));
    if (n == 0) throw ResourceNotFoundException.resource(resource.id());
    return get(resource.id());
  }

  @Override
  public ActivationRow readActivation(String resourceId) {
    List<ActivationRow> rows = query("READ_ACTIVATION", SqlParamCompiler.compile(
        "SELECT id, package_id, extras FROM resource WHERE id = :id", params("id", resourceId)), rs ->
        new ActivationRow(rs.getString("id"), rs.getString("package_id"), readExtras(rs.getString("extras"))));
    if (rows.isEmpty()) throw ResourceNotFoundException.resource(resourceId);
    return rows.get(0);
  }

  @Override
  public void patchExtra(String resourceId, String key, Object value) {
    Map<String, Object> p = new HashMap<>();
    p.put("id", resourceId);
    p.put("key", key);
    p.put("value", writeJson(value));
    int n = update("PATCH_EXTRA", SqlParamCompiler.compile(PATCH_EXTRA, p));
    if (n == 0) throw ResourceNotFoundException.resource(resourceId);
  }

  // ---- helpers ----

  @FunctionalInterface
  private interface RowMapper<T> {
    T map(ResultSet rs) throws SQLException;
  }

  private static Map<String, Object> params(String k, Object v) {
    Map<String, Object> p = new HashMap<>();
    p.put(k, v);
    return p;
  }

  private <T> List<T> query(String op, SqlStatement ss, RowMapper<T> mapper) {
    String jdbcSql = SqlParamCompiler.toJdbcSql(ss.sql());
    debugSql(op, ss, jdbcSql);
    try (Connection c = handle.client().getConnection();
         PreparedStatement ps = c.prepareStatement(jdbcSql)) {
      bindAll(ps, ss);
      try (ResultSet rs = ps.executeQuery()) {
        List<T> out = new ArrayList<>();
        while (rs.next()) out.add(mapper.map(rs));
        return out;
      }
    } catch (SQLException e) {
      throw SqlErrors.translate(e);
    }
  }

  private int update(String op, SqlStatement ss) {
    String jdbcSql = SqlParamCompiler.toJdbcSql(ss.sql());
    debugSql(op, ss, jdbcSql);
    try (Connection c = handle.client().getConnection();
         PreparedStatement ps = c.prepareStatement(jdbcSql)) {
      bindAll(ps, ss);
      return ps.executeUpdate();
    } catch (SQLException e) {
      throw SqlErrors.translate(e);
    }
  }

  private static void bindAll(PreparedStatement ps, SqlStatement ss) throws SQLException {
    for (int i = 0; i < ss.binds().size(); i++) {
      Object v = ss.binds().get(i).value();
      if (v == null) ps.setNull(i + 1, Types.VARCHAR);
      else ps.setObject(i + 1, v);
    }
  }

  private void debugSql(String op, SqlStatement ss, String jdbcSql) {
    if (!log.isDebugEnabled()) return;
    log.debug("datastore.registry op={} bindCount={} handleId={} sql={}", op, ss.binds().size(), handle.id(), jdbcSql);
  }

  private Map<String, Object> readExtras(String json) {
    if (json == null || json.isBlank()) return new LinkedHashMap<>();
    try {
      return mapper.readValue(json, MAP);
    } catch (JsonProcessingException e) {
      throw new IllegalStateException("Invalid resource extras", e);
    }
  }

  private String writeJson(Object value) {
    try {
      return mapper.writeValueAsString(value);
    } catch (JsonProcessingException e) {
      throw new IllegalArgumentException("Value is not serializable as JSON", e);
    }
  }
}
