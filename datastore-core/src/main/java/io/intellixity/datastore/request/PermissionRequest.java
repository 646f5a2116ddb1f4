package io.intellixity.datastore.request;

import java.util.Objects;

/** Target of {@code make_private} / {@code make_public}. */
public record PermissionRequest(String resourceId) {
  public PermissionRequest {
    Objects.requireNonNull(resourceId, "resourceId");
  }
}
