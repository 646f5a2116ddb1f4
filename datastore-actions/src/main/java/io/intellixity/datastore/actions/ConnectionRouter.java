package io.intellixity.datastore.actions;

import io.intellixity.datastore.config.DatastoreSettings;
import io.intellixity.datastore.error.DatastoreValidationException;

import java.util.Objects;

/**
 * Selects the backend connection url for an operation.\n
 *
 * Write paths always get the write url. {@link ConnectionRole#READ_ONLY} is never downgraded to the write url:
 * without a configured read url (legacy mode) it is refused.\n
 */
public final class ConnectionRouter {
  public enum ConnectionRole {
    /** Write-capable role. */
    WRITE,
    /** Read-only role; refused in legacy mode. */
    READ_ONLY,
    /** Read-only role when configured, otherwise the write role. */
    READ_PREFERRED
  }

  private final DatastoreSettings settings;

  public ConnectionRouter(DatastoreSettings settings) {
    this.settings = Objects.requireNonNull(settings, "settings");
  }

  public String urlFor(ConnectionRole role) {
    Objects.requireNonNull(role, "role");
    return switch (role) {
      case WRITE -> settings.writeUrl();
      case READ_ONLY -> {
        if (settings.readUrl() == null) {
          throw DatastoreValidationException.of("connection",
              "This action requires a read-only connection, which is not configured (legacy mode).");
        }
        yield settings.readUrl();
      }
      case READ_PREFERRED -> (settings.readUrl() == null) ? settings.writeUrl() : settings.readUrl();
    };
  }
}
