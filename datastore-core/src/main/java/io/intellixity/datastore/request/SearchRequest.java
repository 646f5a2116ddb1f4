package io.intellixity.datastore.request;

import io.intellixity.datastore.query.SortField;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Search a table or alias.\n
 *
 * @param resourceId table or alias name\n
 * @param filters column equality filters; a list value matches any of its elements\n
 * @param q full-text query over all columns (null if absent)\n
 * @param qFields per-column full-text queries (empty if absent)\n
 * @param plain true treats queries as plain text, false enables the full query language\n
 * @param language text search configuration used for ranking and parsing\n
 * @param fields projection; empty returns all columns in table order\n
 * @param sort sort order; empty sorts by rank when {@code q} is set\n
 * @param limit maximum rows returned\n
 * @param offset rows skipped\n
 * @param distinct return distinct rows only\n
 */
public record SearchRequest(String resourceId,
                            Map<String, Object> filters,
                            String q,
                            Map<String, String> qFields,
                            boolean plain,
                            String language,
                            List<String> fields,
                            List<SortField> sort,
                            int limit,
                            int offset,
                            boolean distinct) {
  public static final String DEFAULT_LANGUAGE = "english";

  public SearchRequest {
    Objects.requireNonNull(resourceId, "resourceId");
    filters = (filters == null) ? Map.of() : Copies.map(filters);
    qFields = (qFields == null) ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(qFields));
    language = (language == null || language.isBlank()) ? DEFAULT_LANGUAGE : language;
    fields = (fields == null) ? List.of() : List.copyOf(fields);
    sort = (sort == null) ? List.of() : List.copyOf(sort);
    if (limit < 0) throw new IllegalArgumentException("limit must be >= 0");
    if (offset < 0) throw new IllegalArgumentException("offset must be >= 0");
  }

  public static SearchRequest of(String resourceId, int limit) {
    return new SearchRequest(resourceId, Map.of(), null, Map.of(), true, DEFAULT_LANGUAGE, List.of(), List.of(), limit, 0, false);
  }

  public boolean hasTextQuery() {
    return (q != null && !q.isBlank()) || !qFields.isEmpty();
  }

  public SearchRequest withResourceId(String id) {
    return new SearchRequest(id, filters, q, qFields, plain, language, fields, sort, limit, offset, distinct);
  }

  public SearchRequest withFilters(Map<String, Object> f) {
    return new SearchRequest(resourceId, f, q, qFields, plain, language, fields, sort, limit, offset, distinct);
  }

  public SearchRequest withSort(List<SortField> s) {
    return new SearchRequest(resourceId, filters, q, qFields, plain, language, fields, s, limit, offset, distinct);
  }

  public SearchRequest withFields(List<String> f) {
    return new SearchRequest(resourceId, filters, q, qFields, plain, language, f, sort, limit, offset, distinct);
  }
}
