package io.intellixity.datastore.jdbc;

import io.intellixity.datastore.jdbc.dialect.TableDialect;
import io.intellixity.datastore.model.CatalogEntry;
import io.intellixity.datastore.spi.MetadataCatalog;
import io.intellixity.datastore.spi.handle.EngineHandleResolver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.Objects;
import java.util.Optional;

/** {@link MetadataCatalog} backed by the reserved catalog view. */
public final class JdbcMetadataCatalog implements MetadataCatalog {
  private static final Logger log = LoggerFactory.getLogger(JdbcMetadataCatalog.class);

  private final EngineHandleResolver<JdbcHandle> handles;
  private final TableDialect dialect;

  public JdbcMetadataCatalog(EngineHandleResolver<JdbcHandle> handles, TableDialect dialect) {
    this.handles = Objects.requireNonNull(handles, "handles");
    this.dialect = Objects.requireNonNull(dialect, "dialect");
  }

  @Override
  public Optional<CatalogEntry> lookup(String connectionUrl, String name) {
    if (name == null || name.isBlank()) return Optional.empty();
    JdbcHandle h = handles.resolve(connectionUrl);
    SqlStatement ss = dialect.lookupCatalog(name);
    String jdbcSql = SqlParamCompiler.toJdbcSql(ss.sql());
    if (log.isDebugEnabled()) {
      log.debug("datastore.jdbc op={} execKind={} handleId={} sql={}", "LOOKUP", ss.execKind(), h.id(), jdbcSql);
    }
    try (Connection c = h.client().getConnection()) {
      if (h.schema() != null) c.setSchema(h.schema());
      try (PreparedStatement ps = c.prepareStatement(jdbcSql)) {
        for (int i = 0; i < ss.binds().size(); i++) ps.setObject(i + 1, ss.binds().get(i).value());
        try (ResultSet rs = ps.executeQuery()) {
          if (!rs.next()) return Optional.empty();
          return Optional.of(new CatalogEntry(rs.getString("name"), rs.getString("alias_of")));
        }
      }
    } catch (SQLException e) {
      throw SqlErrors.translate(e);
    }
  }
}
