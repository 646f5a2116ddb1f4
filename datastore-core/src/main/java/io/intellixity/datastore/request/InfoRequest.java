package io.intellixity.datastore.request;

import java.util.Objects;

public record InfoRequest(String resourceId) {
  public InfoRequest {
    Objects.requireNonNull(resourceId, "resourceId");
  }
}
