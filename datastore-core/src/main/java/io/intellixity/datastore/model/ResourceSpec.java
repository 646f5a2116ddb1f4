package io.intellixity.datastore.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Specification of a resource to create together with its table.\n
 *
 * @param packageId owning package (required by the registry)\n
 * @param name display name (optional)\n
 * @param url source url; when present the table is populated by the import pipeline\n
 * @param format format label (optional)\n
 * @param attributes remaining attributes passed through to the registry\n
 */
public record ResourceSpec(String packageId,
                           String name,
                           String url,
                           String format,
                           Map<String, Object> attributes) {
  public ResourceSpec {
    attributes = (attributes == null) ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(attributes));
  }

  public boolean hasUrl() {
    return url != null;
  }

  /** Datastore-only resources carry a placeholder url in the registry. */
  public ResourceSpec withDefaultUrl() {
    return hasUrl() ? this : new ResourceSpec(packageId, name, Resource.DATASTORE_ONLY_URL, format, attributes);
  }
}
