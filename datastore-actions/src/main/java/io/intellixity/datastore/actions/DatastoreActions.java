package io.intellixity.datastore.actions;

import io.intellixity.datastore.actions.ConnectionRouter.ConnectionRole;
import io.intellixity.datastore.config.DatastoreSettings;
import io.intellixity.datastore.context.ActionContext;
import io.intellixity.datastore.error.DatastoreValidationException;
import io.intellixity.datastore.error.InvalidDataException;
import io.intellixity.datastore.error.ResourceNotFoundException;
import io.intellixity.datastore.model.Resource;
import io.intellixity.datastore.model.ResourceSpec;
import io.intellixity.datastore.model.TableRef;
import io.intellixity.datastore.request.CreateRequest;
import io.intellixity.datastore.request.DeleteRequest;
import io.intellixity.datastore.request.InfoRequest;
import io.intellixity.datastore.request.PermissionRequest;
import io.intellixity.datastore.request.SearchRequest;
import io.intellixity.datastore.request.SearchSqlRequest;
import io.intellixity.datastore.request.UpsertRequest;
import io.intellixity.datastore.spi.AccessPolicy;
import io.intellixity.datastore.spi.ActionNames;
import io.intellixity.datastore.spi.ImportTrigger;
import io.intellixity.datastore.spi.MetadataCatalog;
import io.intellixity.datastore.spi.ResourceRegistry;
import io.intellixity.datastore.spi.TableEngine;
import io.intellixity.datastore.sql.SqlStatements;
import io.intellixity.datastore.sql.TableNames;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Datastore actions: validation order, access control, alias resolution, read-only enforcement and
 * activation-flag upkeep around the {@link TableEngine}.\n
 *
 * Stateless between calls; safe for concurrent use if its collaborators are.\n
 */
public final class DatastoreActions {
  private static final Logger log = LoggerFactory.getLogger(DatastoreActions.class);

  /** Catalog views readable without an access check. */
  static final Set<String> WHITELISTED_TABLES = Set.of(TableNames.TABLE_METADATA);

  private static final String[] INTERNAL_KEYS = {"id", "private", "connection_url"};

  private final DatastoreSettings settings;
  private final ConnectionRouter router;
  private final AliasResolver aliases;
  private final ReadOnlyGate readOnlyGate;
  private final ActiveFlagSynchronizer activeFlag;
  private final TableEngine engine;
  private final MetadataCatalog catalog;
  private final ResourceRegistry registry;
  private final AccessPolicy accessPolicy;
  private final ImportTrigger importTrigger;

  /**
   * @param importTrigger null when no import pipeline is available; url-sourced creates are then rejected\n
   */
  public DatastoreActions(DatastoreSettings settings,
                          TableEngine engine,
                          MetadataCatalog catalog,
                          ResourceRegistry registry,
                          AccessPolicy accessPolicy,
                          ActiveFlagSynchronizer activeFlag,
                          ImportTrigger importTrigger) {
    this.settings = Objects.requireNonNull(settings, "settings");
    this.engine = Objects.requireNonNull(engine, "engine");
    this.catalog = Objects.requireNonNull(catalog, "catalog");
    this.registry = Objects.requireNonNull(registry, "registry");
    this.accessPolicy = Objects.requireNonNull(accessPolicy, "accessPolicy");
    this.activeFlag = Objects.requireNonNull(activeFlag, "activeFlag");
    this.importTrigger = importTrigger;
    this.router = new ConnectionRouter(settings);
    this.aliases = new AliasResolver(catalog);
    this.readOnlyGate = new ReadOnlyGate(registry);
  }

  /**
   * Create or alter a table, creating its resource first when a resource spec is given.\n
   *
   * @return the table description, or empty when population was handed to the import pipeline\n
   */
  public Optional<Map<String, Object>> create(ActionContext ctx, CreateRequest req) {
    Objects.requireNonNull(req, "req");
    accessPolicy.checkAccess(ActionNames.CREATE, ctx, createPayload(req));

    if (req.resource() != null && req.resourceId() != null) {
      throw DatastoreValidationException.of("resource", "resource cannot be used with resource_id");
    }
    if (req.resource() == null && req.resourceId() == null) {
      throw DatastoreValidationException.of("resource_id", "resource_id or resource required");
    }
    for (String alias : req.aliasesOrEmpty()) {
      if (!TableNames.isValidTableName(alias)) {
        throw DatastoreValidationException.of("alias", "\"" + alias + "\" is not a valid alias name");
      }
    }

    CreateRequest work = req;
    Resource resource;
    if (req.resource() != null) {
      ResourceSpec spec = req.resource();
      if (spec.hasUrl() && importTrigger == null) {
        throw DatastoreValidationException.of("resource", "The import pipeline has to be enabled.");
      }
      resource = registry.create(spec.withDefaultUrl());
      if (spec.hasUrl()) {
        importTrigger.submit(resource.id());
        log.debug("datastore.action action=create resourceId={} import=submitted", resource.id());
        return Optional.empty();
      }
      resource = registry.update(resource.withUrlType(Resource.DATASTORE_URL_TYPE));
      work = req.withResourceId(resource.id()).withResource(null);
    } else {
      readOnlyGate.check(req.resourceId(), req.force());
      resource = registry.get(req.resourceId());
    }

    String url = router.urlFor(ConnectionRole.WRITE);

    boolean privateTable = settings.readWriteSplit() && resource.packagePrivate();
    log.debug("datastore.action action=create resourceId={} private={} user={}",
        resource.id(), privateTable, userOf(ctx));

    Map<String, Object> result;
    try {
      result = engine.create(url, work, privateTable);
    } catch (InvalidDataException e) {
      throw e.toValidation("message");
    }

    if (!resource.datastoreActive()) {
      activeFlag.setActive(resource.id(), true);
    }
    return Optional.of(stripInternal(result));
  }

  public Map<String, Object> upsert(ActionContext ctx, UpsertRequest req) {
    Objects.requireNonNull(req, "req");
    accessPolicy.checkAccess(ActionNames.UPSERT, ctx,
        payload("resource_id", req.resourceId(), "method", req.method().wireName()));
    String url = router.urlFor(ConnectionRole.WRITE);
    requireRealTable(url, req.resourceId());
    readOnlyGate.check(req.resourceId(), req.force());

    log.debug("datastore.action action=upsert resourceId={} method={} records={} user={}",
        req.resourceId(), req.method().wireName(), req.records().size(), userOf(ctx));
    try {
      return stripInternal(engine.upsert(url, req));
    } catch (InvalidDataException e) {
      throw e.toValidation("message");
    }
  }

  /** Drop the table (no filters) or delete matching rows. The result echoes the filters, not a row count. */
  public Map<String, Object> delete(ActionContext ctx, DeleteRequest req) {
    Objects.requireNonNull(req, "req");
    accessPolicy.checkAccess(ActionNames.DELETE, ctx, payload("resource_id", req.resourceId(), "filters", req.filters()));
    String url = router.urlFor(ConnectionRole.WRITE);
    requireRealTable(url, req.resourceId());
    readOnlyGate.check(req.resourceId(), req.force());

    log.debug("datastore.action action=delete resourceId={} dropTable={} user={}",
        req.resourceId(), req.dropsTable(), userOf(ctx));
    try {
      engine.delete(url, req);
    } catch (InvalidDataException e) {
      throw e.toValidation("message");
    }

    if (req.dropsTable()) {
      Optional<Resource> resource = registry.find(req.resourceId());
      if (resource.isEmpty()) {
        log.warn("datastore.action action=delete resourceId={} flag=skipped reason=resource-missing", req.resourceId());
      } else if (resource.get().datastoreActive()) {
        activeFlag.setActive(req.resourceId(), false);
      }
    }

    Map<String, Object> out = new LinkedHashMap<>();
    out.put("resource_id", req.resourceId());
    if (req.filters() != null) out.put("filters", req.filters());
    return out;
  }

  /** Search a table or alias; access is always checked against the physical table. */
  public Map<String, Object> search(ActionContext ctx, SearchRequest req) {
    Objects.requireNonNull(req, "req");
    String url = router.urlFor(ConnectionRole.WRITE);
    TableRef ref = aliases.require(url, req.resourceId());

    SearchRequest work = req;
    if (!WHITELISTED_TABLES.contains(req.resourceId())) {
      work = req.withResourceId(ref.physicalId());
      accessPolicy.checkAccess(ActionNames.SEARCH, ctx, payload("resource_id", ref.physicalId()));
    }

    log.debug("datastore.action action=search name={} resourceId={} alias={} user={}",
        req.resourceId(), work.resourceId(), ref.isAlias(), userOf(ctx));
    try {
      return stripInternal(engine.search(url, work));
    } catch (InvalidDataException e) {
      throw e.toValidation("message");
    }
  }

  /**
   * Run one raw select on the read-only role.\n
   * Private tables are protected by the backend role's revoked privileges, not by inspecting the statement.\n
   */
  public Map<String, Object> searchSql(ActionContext ctx, SearchSqlRequest req) {
    Objects.requireNonNull(req, "req");
    if (!SqlStatements.isSingleStatement(req.sql())) {
      throw DatastoreValidationException.of("query", "Query is not a single statement.");
    }
    accessPolicy.checkAccess(ActionNames.SEARCH_SQL, ctx, payload("sql", req.sql()));

    String url = router.urlFor(ConnectionRole.READ_ONLY);
    log.debug("datastore.action action=search_sql user={}", userOf(ctx));

    Map<String, Object> result;
    try {
      result = engine.searchSql(url, req);
    } catch (InvalidDataException e) {
      throw e.toValidation("query");
    }
    Map<String, Object> out = new LinkedHashMap<>();
    out.put("fields", result.get("fields"));
    out.put("records", result.get("records"));
    return out;
  }

  public void makePrivate(ActionContext ctx, PermissionRequest req) {
    String url = checkPermissionChange(ctx, req);
    log.debug("datastore.action action=make_private resourceId={} user={}", req.resourceId(), userOf(ctx));
    engine.makePrivate(url, req.resourceId());
  }

  public void makePublic(ActionContext ctx, PermissionRequest req) {
    String url = checkPermissionChange(ctx, req);
    log.debug("datastore.action action=make_public resourceId={} user={}", req.resourceId(), userOf(ctx));
    engine.makePublic(url, req.resourceId());
  }

  /** Column types (number, date or text) and row count of a table. */
  public Map<String, Object> info(ActionContext ctx, InfoRequest req) {
    Objects.requireNonNull(req, "req");
    accessPolicy.checkAccess(ActionNames.INFO, ctx, payload("id", req.resourceId(), "resource_id", req.resourceId()));
    registry.get(req.resourceId());

    String url = router.urlFor(ConnectionRole.READ_PREFERRED);
    requireRealTable(url, req.resourceId());
    return stripInternal(engine.info(url, req.resourceId()));
  }

  private String checkPermissionChange(ActionContext ctx, PermissionRequest req) {
    Objects.requireNonNull(req, "req");
    String url = router.urlFor(ConnectionRole.WRITE);
    if (registry.find(req.resourceId()).isEmpty() || !catalog.tableExists(url, req.resourceId())) {
      throw ResourceNotFoundException.resource(req.resourceId());
    }
    accessPolicy.checkAccess(ActionNames.CHANGE_PERMISSIONS, ctx, payload("resource_id", req.resourceId()));
    return url;
  }

  private void requireRealTable(String url, String resourceId) {
    if (!aliases.isRealTable(url, resourceId)) throw ResourceNotFoundException.resource(resourceId);
  }

  private static Map<String, Object> createPayload(CreateRequest req) {
    Map<String, Object> p = payload("resource_id", req.resourceId());
    if (req.resource() != null) p.put("package_id", req.resource().packageId());
    return p;
  }

  private static Map<String, Object> payload(Object... kv) {
    Map<String, Object> p = new LinkedHashMap<>();
    for (int i = 0; i + 1 < kv.length; i += 2) {
      if (kv[i + 1] != null) p.put((String) kv[i], kv[i + 1]);
    }
    return p;
  }

  private static Map<String, Object> stripInternal(Map<String, Object> result) {
    Map<String, Object> out = (result == null) ? new LinkedHashMap<>() : new LinkedHashMap<>(result);
    for (String k : INTERNAL_KEYS) out.remove(k);
    return out;
  }

  private static String userOf(ActionContext ctx) {
    return (ctx == null) ? null : ctx.user();
  }
}
