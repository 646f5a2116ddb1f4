package io.intellixity.datastore.spi.handle;

/**
 * Resolved runtime handle for a backend store.\n
 *
 * Example:\n
 * - JDBC: client() is javax.sql.DataSource, namespace() is schema\n
 * - Mongo: client() is MongoDatabase, namespace() is database\n
 */
public interface EngineHandle<TClient> {
  /** Unique identifier for this handle (useful for logging/caching). */
  String id();

  /** Native client/handle used by an engine (DataSource, MongoDatabase, etc.). */
  TClient client();

  /** Namespace (schema/database) for this handle. */
  String namespace();
}
