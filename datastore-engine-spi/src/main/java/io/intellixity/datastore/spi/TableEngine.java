package io.intellixity.datastore.spi;

import io.intellixity.datastore.error.InvalidDataException;
import io.intellixity.datastore.request.CreateRequest;
import io.intellixity.datastore.request.DeleteRequest;
import io.intellixity.datastore.request.SearchRequest;
import io.intellixity.datastore.request.SearchSqlRequest;
import io.intellixity.datastore.request.UpsertRequest;

import java.util.Map;

/**
 * Physical table operations (DDL, row I/O, search) against one backend.\n
 *
 * Every call receives the connection url selected by the action layer; implementations must not pick a
 * different role. Caller-data problems raise {@link InvalidDataException}; infrastructure failures raise
 * other runtime exceptions.\n
 *
 * Results are mutable maps. They may carry internal keys ({@code id}, {@code private},
 * {@code connection_url}) that the action layer strips before returning them to callers.\n
 */
public interface TableEngine {
  /**
   * Create the table named {@code req.resourceId()} or alter it additively.\n
   * Supplied aliases, primary key and indexes replace existing ones; records are appended.\n
   */
  Map<String, Object> create(String connectionUrl, CreateRequest req, boolean privateTable);

  /** Insert, update or upsert records; {@code update}/{@code upsert} require a primary key. */
  Map<String, Object> upsert(String connectionUrl, UpsertRequest req);

  /** Drop the table with its aliases ({@link DeleteRequest#dropsTable()}) or delete matching rows. */
  Map<String, Object> delete(String connectionUrl, DeleteRequest req);

  /** Search the physical table {@code req.resourceId()}. */
  Map<String, Object> search(String connectionUrl, SearchRequest req);

  /** Run a single pre-validated select statement; result holds {@code fields} and {@code records}. */
  Map<String, Object> searchSql(String connectionUrl, SearchSqlRequest req);

  /** Revoke read access of the read-only role on the table and its aliases. Idempotent. */
  void makePrivate(String connectionUrl, String resourceId);

  /** Grant read access of the read-only role on the table and its aliases. Idempotent. */
  void makePublic(String connectionUrl, String resourceId);

  /** Column types and row count: {@code {schema: {col: number|date|text}, meta: {count: n}}}. */
  Map<String, Object> info(String connectionUrl, String resourceId);
}
