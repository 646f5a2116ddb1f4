package io.intellixity.datastore.server.config;

import io.intellixity.datastore.config.DatastoreSettings;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

@ConfigurationProperties(prefix = "datastore")
public class DatastoreProperties {
  /** JDBC url of the write-capable role. */
  private String writeUrl;
  /** Optional JDBC url of the read-only role; if absent the server runs without a read/write split. */
  private String readUrl;
  /** Database role behind readUrl; private tables revoke SELECT from it. */
  private String readOnlyRole;
  /** Optional JDBC url of the resource registry; defaults to writeUrl. */
  private String registryUrl;
  private String schema = "public";
  private int maximumPoolSize = 10;

  private int searchDefaultLimit = DatastoreSettings.DEFAULT_SEARCH_LIMIT;
  private int searchRowsMax = DatastoreSettings.DEFAULT_ROWS_MAX;
  private long sqlSearchTimeoutMillis = DatastoreSettings.DEFAULT_SQL_TIMEOUT_MILLIS;
  private String siteId = DatastoreSettings.DEFAULT_SITE_ID;

  /** Create the registry tables and the catalog view on startup. */
  private boolean bootstrap;

  private final Mongo mongo = new Mongo();
  private final Map<String, ApiKey> apiKeys = new HashMap<>();

  public String getWriteUrl() { return writeUrl; }
  public void setWriteUrl(String writeUrl) { this.writeUrl = writeUrl; }
  public String getReadUrl() { return readUrl; }
  public void setReadUrl(String readUrl) { this.readUrl = readUrl; }
  public String getReadOnlyRole() { return readOnlyRole; }
  public void setReadOnlyRole(String readOnlyRole) { this.readOnlyRole = readOnlyRole; }
  public String getRegistryUrl() { return registryUrl; }
  public void setRegistryUrl(String registryUrl) { this.registryUrl = registryUrl; }
  public String getSchema() { return schema; }
  public void setSchema(String schema) { this.schema = schema; }
  public int getMaximumPoolSize() { return maximumPoolSize; }
  public void setMaximumPoolSize(int maximumPoolSize) { this.maximumPoolSize = maximumPoolSize; }
  public int getSearchDefaultLimit() { return searchDefaultLimit; }
  public void setSearchDefaultLimit(int searchDefaultLimit) { this.searchDefaultLimit = searchDefaultLimit; }
  public int getSearchRowsMax() { return searchRowsMax; }
  public void setSearchRowsMax(int searchRowsMax) { this.searchRowsMax = searchRowsMax; }
  public long getSqlSearchTimeoutMillis() { return sqlSearchTimeoutMillis; }
  public void setSqlSearchTimeoutMillis(long sqlSearchTimeoutMillis) { this.sqlSearchTimeoutMillis = sqlSearchTimeoutMillis; }
  public String getSiteId() { return siteId; }
  public void setSiteId(String siteId) { this.siteId = siteId; }
  public boolean isBootstrap() { return bootstrap; }
  public void setBootstrap(boolean bootstrap) { this.bootstrap = bootstrap; }
  public Mongo getMongo() { return mongo; }
  public Map<String, ApiKey> getApiKeys() { return apiKeys; }

  public DatastoreSettings toSettings() {
    return new DatastoreSettings(writeUrl, readUrl, readOnlyRole,
        searchDefaultLimit, searchRowsMax, sqlSearchTimeoutMillis, siteId);
  }

  public static class Mongo {
    /** Connection string; the search index is disabled when absent. */
    private String uri;
    private String database = "datastore";
    private String collection = "packages";

    public String getUri() { return uri; }
    public void setUri(String uri) { this.uri = uri; }
    public String getDatabase() { return database; }
    public void setDatabase(String database) { this.database = database; }
    public String getCollection() { return collection; }
    public void setCollection(String collection) { this.collection = collection; }
  }

  public static class ApiKey {
    private String user;
    private List<String> roles = new ArrayList<>();

    public String getUser() { return user; }
    public void setUser(String user) { this.user = user; }
    public List<String> getRoles() { return roles; }
    public void setRoles(List<String> roles) { this.roles = roles; }
  }
}
