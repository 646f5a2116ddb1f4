package io.intellixity.datastore.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Column definition submitted with a create request.\n
 *
 * @param id column name\n
 * @param type column type (e.g. {@code text}, {@code int}, {@code _text}); null lets the engine infer it\n
 * @param info free-form column metadata stored alongside the column\n
 */
public record FieldSpec(String id, String type, Map<String, Object> info) {
  public FieldSpec {
    Objects.requireNonNull(id, "id");
    info = (info == null) ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(info));
  }

  public FieldSpec(String id, String type) {
    this(id, type, Map.of());
  }

  public FieldSpec withType(String type) {
    return new FieldSpec(id, type, info);
  }
}
