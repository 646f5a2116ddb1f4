package io.intellixity.datastore.request;

import io.intellixity.datastore.model.UpsertMethod;

import java.util.List;
import java.util.Map;
import java.util.Objects;

public record UpsertRequest(String resourceId,
                            List<Map<String, Object>> records,
                            UpsertMethod method,
                            boolean force) {
  public UpsertRequest {
    Objects.requireNonNull(resourceId, "resourceId");
    records = (records == null) ? List.of() : Copies.records(records);
    method = (method == null) ? UpsertMethod.UPSERT : method;
  }

  public UpsertRequest withForce(boolean f) {
    return new UpsertRequest(resourceId, records, method, f);
  }
}
