package io.intellixity.datastore.error;

/** Raised when a resource or table is absent from one of the backing stores. */
public final class ResourceNotFoundException extends RuntimeException {
  public ResourceNotFoundException(String message) {
    super(message);
  }

  public static ResourceNotFoundException resource(String resourceId) {
    return new ResourceNotFoundException("Resource \"" + resourceId + "\" was not found.");
  }
}
