package io.intellixity.datastore.config;

import java.util.Objects;

/**
 * Runtime settings shared by the action layer and the engines.\n
 *
 * @param writeUrl connection string of the write-capable role\n
 * @param readUrl connection string of the read-only role; null runs in legacy mode (no read/write split)\n
 * @param readOnlyRole database role used by {@code readUrl}; private tables revoke SELECT from it\n
 * @param searchDefaultLimit limit applied to searches that do not specify one\n
 * @param searchRowsMax upper bound for any search limit\n
 * @param sqlSearchTimeoutMillis statement timeout enforced by the backend for raw SQL searches\n
 * @param siteId scope of package documents in the search index\n
 */
public record DatastoreSettings(String writeUrl,
                                String readUrl,
                                String readOnlyRole,
                                int searchDefaultLimit,
                                int searchRowsMax,
                                long sqlSearchTimeoutMillis,
                                String siteId) {
  public static final int DEFAULT_SEARCH_LIMIT = 100;
  public static final int DEFAULT_ROWS_MAX = 32000;
  public static final long DEFAULT_SQL_TIMEOUT_MILLIS = 60_000L;
  public static final String DEFAULT_SITE_ID = "default";

  public DatastoreSettings {
    Objects.requireNonNull(writeUrl, "writeUrl");
    if (writeUrl.isBlank()) throw new IllegalArgumentException("writeUrl is blank");
    readUrl = (readUrl == null || readUrl.isBlank()) ? null : readUrl;
    readOnlyRole = (readOnlyRole == null || readOnlyRole.isBlank()) ? null : readOnlyRole;
    if (searchDefaultLimit <= 0) throw new IllegalArgumentException("searchDefaultLimit must be > 0");
    if (searchRowsMax <= 0) throw new IllegalArgumentException("searchRowsMax must be > 0");
    if (sqlSearchTimeoutMillis < 0) throw new IllegalArgumentException("sqlSearchTimeoutMillis must be >= 0");
    siteId = (siteId == null || siteId.isBlank()) ? DEFAULT_SITE_ID : siteId;
  }

  public static DatastoreSettings of(String writeUrl, String readUrl) {
    return new DatastoreSettings(writeUrl, readUrl, null,
        DEFAULT_SEARCH_LIMIT, DEFAULT_ROWS_MAX, DEFAULT_SQL_TIMEOUT_MILLIS, DEFAULT_SITE_ID);
  }

  /** Read/write split is enabled when a read url distinct from the write url is configured. */
  public boolean readWriteSplit() {
    return readUrl != null && !readUrl.equals(writeUrl);
  }

  public DatastoreSettings withReadOnlyRole(String role) {
    return new DatastoreSettings(writeUrl, readUrl, role, searchDefaultLimit, searchRowsMax, sqlSearchTimeoutMillis, siteId);
  }

  public DatastoreSettings withSearchLimits(int defaultLimit, int rowsMax) {
    return new DatastoreSettings(writeUrl, readUrl, readOnlyRole, defaultLimit, rowsMax, sqlSearchTimeoutMillis, siteId);
  }

  public DatastoreSettings withSqlSearchTimeoutMillis(long millis) {
    return new DatastoreSettings(writeUrl, readUrl, readOnlyRole, searchDefaultLimit, searchRowsMax, millis, siteId);
  }

  public DatastoreSettings withSiteId(String siteId) {
    return new DatastoreSettings(writeUrl, readUrl, readOnlyRole, searchDefaultLimit, searchRowsMax, sqlSearchTimeoutMillis, siteId);
  }
}
