package io.intellixity.datastore.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Resource record as held by the resource registry.\n
 *
 * @param id stable resource id (also the physical table name)\n
 * @param packageId owning package\n
 * @param url resource url ({@link #DATASTORE_ONLY_URL} for datastore-only resources)\n
 * @param urlType provenance marker; {@link #DATASTORE_URL_TYPE} for datastore-managed tables\n
 * @param packagePrivate privacy inherited from the owning package\n
 * @param extras free-form extras (holds {@link #DATASTORE_ACTIVE})\n
 */
public record Resource(String id,
                       String packageId,
                       String url,
                       String urlType,
                       boolean packagePrivate,
                       Map<String, Object> extras) {
  public static final String DATASTORE_URL_TYPE = "datastore";
  public static final String DATASTORE_ONLY_URL = "_datastore_only_resource";
  public static final String DATASTORE_ACTIVE = "datastore_active";

  public Resource {
    Objects.requireNonNull(id, "id");
    extras = (extras == null) ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(extras));
  }

  /** True if a physical table is recorded as backing this resource. */
  public boolean datastoreActive() {
    return Boolean.TRUE.equals(extras.get(DATASTORE_ACTIVE));
  }

  public boolean datastoreManaged() {
    return DATASTORE_URL_TYPE.equals(urlType);
  }

  public Resource withUrlType(String urlType) {
    return new Resource(id, packageId, url, urlType, packagePrivate, extras);
  }
}
