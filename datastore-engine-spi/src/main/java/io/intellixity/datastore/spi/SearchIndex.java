package io.intellixity.datastore.spi;

import java.util.Map;
import java.util.Optional;

/** Read-optimized package documents; each holds a {@code resources} list of resource sub-documents. */
public interface SearchIndex {
  /** Currently indexed document of a package, looked up by exact id. */
  Optional<Map<String, Object>> findPackage(String packageId);

  /** Submit a whole package document for (re)indexing. */
  void index(Map<String, Object> packageDocument);
}
