package io.intellixity.datastore.server.config;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import io.intellixity.datastore.jdbc.JdbcHandle;
import io.intellixity.datastore.spi.handle.EngineHandleResolver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/** One HikariCP pool per connection url, created on first use. */
public final class JdbcHandlePools implements EngineHandleResolver<JdbcHandle>, AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(JdbcHandlePools.class);

  private final Map<String, JdbcHandle> handles = new ConcurrentHashMap<>();
  private final Map<String, HikariDataSource> pools = new ConcurrentHashMap<>();
  private final String schema;
  private final int maximumPoolSize;

  public JdbcHandlePools(String schema, int maximumPoolSize) {
    this.schema = schema;
    this.maximumPoolSize = maximumPoolSize;
  }

  @Override
  public JdbcHandle resolve(String connectionUrl) {
    if (connectionUrl == null || connectionUrl.isBlank()) throw new IllegalArgumentException("Missing connection url");
    return handles.computeIfAbsent(connectionUrl, url -> {
      HikariConfig hc = new HikariConfig();
      hc.setJdbcUrl(url);
      hc.setMaximumPoolSize(maximumPoolSize);
      hc.setPoolName("datastore-" + (pools.size() + 1));
      HikariDataSource ds = new HikariDataSource(hc);
      pools.put(url, ds);
      log.info("datastore.jdbc pool created pool={} maximumPoolSize={}", hc.getPoolName(), maximumPoolSize);
      return new JdbcHandle(hc.getPoolName(), ds, schema);
    });
  }

  @Override
  public void close() {
    pools.values().forEach(HikariDataSource::close);
    pools.clear();
    handles.clear();
  }
}
