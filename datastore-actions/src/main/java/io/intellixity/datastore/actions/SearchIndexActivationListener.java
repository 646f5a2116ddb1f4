package io.intellixity.datastore.actions;

import io.intellixity.datastore.model.Resource;
import io.intellixity.datastore.spi.ActivationListener;
import io.intellixity.datastore.spi.SearchIndex;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Patches the activation flag into the indexed package document and re-indexes it.\n
 *
 * A missing package document (or resource sub-document) leaves the index stale until the next full reindex;
 * that is logged, not raised. Index failures propagate.\n
 */
public final class SearchIndexActivationListener implements ActivationListener {
  private static final Logger log = LoggerFactory.getLogger(SearchIndexActivationListener.class);

  static final String RESOURCES = "resources";

  private final SearchIndex index;

  public SearchIndexActivationListener(SearchIndex index) {
    this.index = Objects.requireNonNull(index, "index");
  }

  @Override
  public void activationChanged(ActivationChanged event) {
    if (event.packageId() == null) {
      log.warn("datastore.index skip resourceId={} reason=no-package", event.resourceId());
      return;
    }
    Optional<Map<String, Object>> found = index.findPackage(event.packageId());
    if (found.isEmpty()) {
      log.warn("datastore.index skip resourceId={} packageId={} reason=package-not-indexed",
          event.resourceId(), event.packageId());
      return;
    }

    Map<String, Object> doc = new LinkedHashMap<>(found.get());
    Object raw = doc.get(RESOURCES);
    List<Object> resources = new ArrayList<>();
    boolean patched = false;
    if (raw instanceof List<?> list) {
      for (Object o : list) {
        if (!patched && o instanceof Map<?, ?> m && event.resourceId().equals(m.get("id"))) {
          Map<String, Object> copy = new LinkedHashMap<>();
          for (var e : m.entrySet()) copy.put(String.valueOf(e.getKey()), e.getValue());
          copy.put(Resource.DATASTORE_ACTIVE, event.active());
          resources.add(copy);
          patched = true;
        } else {
          resources.add(o);
        }
      }
    }
    if (!patched) {
      log.warn("datastore.index skip resourceId={} packageId={} reason=resource-not-in-document",
          event.resourceId(), event.packageId());
      return;
    }

    doc.put(RESOURCES, resources);
    index.index(doc);
    log.debug("datastore.index reindexed packageId={} resourceId={} {}={}",
        event.packageId(), event.resourceId(), Resource.DATASTORE_ACTIVE, event.active());
  }
}
