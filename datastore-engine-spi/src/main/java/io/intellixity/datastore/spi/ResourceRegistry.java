package io.intellixity.datastore.spi;

import io.intellixity.datastore.error.ResourceNotFoundException;
import io.intellixity.datastore.model.Resource;
import io.intellixity.datastore.model.ResourceSpec;

import java.util.Map;
import java.util.Optional;

/** Resource metadata store. */
public interface ResourceRegistry {
  Optional<Resource> find(String resourceId);

  /** Like {@link #find} but raises {@link ResourceNotFoundException}. */
  default Resource get(String resourceId) {
    return find(resourceId).orElseThrow(() -> ResourceNotFoundException.resource(resourceId));
  }

  /** Create a resource in its package; the returned record carries the generated id. */
  Resource create(ResourceSpec spec);

  /** Full update of a resource record. */
  Resource update(Resource resource);

  /** Extras and owning package of a resource, read in one query. Raises {@link ResourceNotFoundException}. */
  ActivationRow readActivation(String resourceId);

  /**
   * Set one key of the resource extras without rewriting the rest, and commit.\n
   * Concurrent writers of the same key may still lose updates.\n
   */
  void patchExtra(String resourceId, String key, Object value);

  record ActivationRow(String resourceId, String packageId, Map<String, Object> extras) {
    public ActivationRow {
      extras = (extras == null) ? Map.of() : extras;
    }
  }
}
