package io.intellixity.datastore.error;

/**
 * Raised by the access policy (or the read-only backend role) when the caller may not perform an action.
 * <p>
 * Kept distinct from {@link ResourceNotFoundException}.
 */
public final class AccessDeniedException extends RuntimeException {
  public AccessDeniedException(String message) {
    super(message);
  }

  public AccessDeniedException(String message, Throwable cause) {
    super(message, cause);
  }
}
