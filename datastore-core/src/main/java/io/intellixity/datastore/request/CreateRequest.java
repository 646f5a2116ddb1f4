package io.intellixity.datastore.request;

import io.intellixity.datastore.model.FieldSpec;
import io.intellixity.datastore.model.ResourceSpec;

import java.util.List;
import java.util.Map;

/**
 * Create or alter a table.\n
 *
 * Exactly one of {@code resourceId} and {@code resource} must be set. Null collections mean "not supplied":
 * supplied aliases, primary key and indexes replace the existing ones, supplied records are appended.\n
 */
public record CreateRequest(String resourceId,
                            ResourceSpec resource,
                            List<FieldSpec> fields,
                            List<Map<String, Object>> records,
                            List<String> aliases,
                            List<String> primaryKey,
                            List<String> indexes,
                            boolean force) {
  public CreateRequest {
    fields = (fields == null) ? null : List.copyOf(fields);
    records = Copies.records(records);
    aliases = Copies.strings(aliases);
    primaryKey = Copies.strings(primaryKey);
    indexes = Copies.strings(indexes);
  }

  public static CreateRequest forResource(String resourceId, List<FieldSpec> fields) {
    return new CreateRequest(resourceId, null, fields, null, null, null, null, false);
  }

  public CreateRequest withResourceId(String id) {
    return new CreateRequest(id, resource, fields, records, aliases, primaryKey, indexes, force);
  }

  public CreateRequest withResource(ResourceSpec spec) {
    return new CreateRequest(resourceId, spec, fields, records, aliases, primaryKey, indexes, force);
  }

  public CreateRequest withRecords(List<Map<String, Object>> rows) {
    return new CreateRequest(resourceId, resource, fields, rows, aliases, primaryKey, indexes, force);
  }

  public CreateRequest withAliases(List<String> names) {
    return new CreateRequest(resourceId, resource, fields, records, names, primaryKey, indexes, force);
  }

  public CreateRequest withPrimaryKey(List<String> key) {
    return new CreateRequest(resourceId, resource, fields, records, aliases, key, indexes, force);
  }

  public CreateRequest withIndexes(List<String> idx) {
    return new CreateRequest(resourceId, resource, fields, records, aliases, primaryKey, idx, force);
  }

  public CreateRequest withForce(boolean f) {
    return new CreateRequest(resourceId, resource, fields, records, aliases, primaryKey, indexes, f);
  }

  public List<String> aliasesOrEmpty() {
    return aliases == null ? List.of() : aliases;
  }
}
