package io.intellixity.datastore.index.mongo;

import com.mongodb.client.MongoCollection;
import com.mongodb.client.model.ReplaceOptions;
import io.intellixity.datastore.spi.SearchIndex;
import org.bson.Document;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * {@link SearchIndex} holding one document per package in a Mongo collection.\n
 *
 * Documents are keyed by package id ({@code _id}) and scoped by {@code site_id}, so several sites can share one
 * collection.\n
 */
public final class MongoSearchIndex implements SearchIndex {
  private static final Logger log = LoggerFactory.getLogger(MongoSearchIndex.class);

  static final String SITE_ID = "site_id";

  private final MongoHandle handle;
  private final String collection;
  private final String siteId;

  public MongoSearchIndex(MongoHandle handle, String collection, String siteId) {
    this.handle = Objects.requireNonNull(handle, "handle");
    this.collection = Objects.requireNonNull(collection, "collection");
    this.siteId = Objects.requireNonNull(siteId, "siteId");
  }

  @Override
  public Optional<Map<String, Object>> findPackage(String packageId) {
    Document filter = packageFilter(packageId, siteId);
    if (log.isDebugEnabled()) {
      log.debug("datastore.mongo op=FIND handleId={} db={} collection={} filter={}",
          handle.id(), handle.database(), collection, filter.toJson());
    }
    Document d = collection().find(filter).first();
    if (d == null) return Optional.empty();
    Map<String, Object> out = new LinkedHashMap<>(d);
    out.remove("_id");
    return Optional.of(out);
  }

  @Override
  public void index(Map<String, Object> packageDocument) {
    Object id = packageDocument.get("id");
    if (id == null) throw new IllegalArgumentException("Package document has no id");
    Document d = toDocument(packageDocument, String.valueOf(id), siteId);
    Document filter = packageFilter(String.valueOf(id), siteId);
    if (log.isDebugEnabled()) {
      log.debug("datastore.mongo op=REPLACE handleId={} db={} collection={} filter={}",
          handle.id(), handle.database(), collection, filter.toJson());
    }
    collection().replaceOne(filter, d, new ReplaceOptions().upsert(true));
  }

  /** Exact-match filter on package id within one site. */
  static Document packageFilter(String packageId, String siteId) {
    return new Document("_id", packageId).append(SITE_ID, siteId);
  }

  static Document toDocument(Map<String, Object> packageDocument, String id, String siteId) {
    Document d = new Document("_id", id);
    for (var e : packageDocument.entrySet()) {
      if (!"_id".equals(e.getKey())) d.append(e.getKey(), e.getValue());
    }
    d.put(SITE_ID, siteId);
    return d;
  }

  private MongoCollection<Document> collection() {
    return handle.client().getDatabase(handle.database()).getCollection(collection);
  }
}
