package io.intellixity.datastore.server.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.mongodb.client.MongoClient;
import com.mongodb.client.MongoClients;
import io.intellixity.datastore.actions.ActionDispatcher;
import io.intellixity.datastore.actions.ActiveFlagSynchronizer;
import io.intellixity.datastore.actions.DatastoreActions;
import io.intellixity.datastore.actions.RoleBasedAccessPolicy;
import io.intellixity.datastore.actions.SearchIndexActivationListener;
import io.intellixity.datastore.config.DatastoreSettings;
import io.intellixity.datastore.index.mongo.MongoHandle;
import io.intellixity.datastore.index.mongo.MongoSearchIndex;
import io.intellixity.datastore.jdbc.JdbcMetadataCatalog;
import io.intellixity.datastore.jdbc.JdbcTableEngine;
import io.intellixity.datastore.jdbc.dialect.TableDialect;
import io.intellixity.datastore.jdbc.postgres.PostgresResourceRegistry;
import io.intellixity.datastore.jdbc.postgres.PostgresTableDialect;
import io.intellixity.datastore.request.ActionRequests;
import io.intellixity.datastore.spi.AccessPolicy;
import io.intellixity.datastore.spi.ActivationListener;
import io.intellixity.datastore.sql.TableNames;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.ArrayList;
import java.util.List;

@Configuration
@EnableConfigurationProperties(DatastoreProperties.class)
public class DatastoreServerConfig {
  private static final Logger log = LoggerFactory.getLogger(DatastoreServerConfig.class);

  @Bean
  public DatastoreSettings datastoreSettings(DatastoreProperties props) {
    return props.toSettings();
  }

  @Bean
  public JdbcHandlePools jdbcHandlePools(DatastoreProperties props) {
    return new JdbcHandlePools(props.getSchema(), props.getMaximumPoolSize());
  }

  @Bean
  public TableDialect tableDialect(ObjectMapper mapper) {
    return new PostgresTableDialect(mapper);
  }

  @Bean
  public JdbcTableEngine tableEngine(JdbcHandlePools pools, TableDialect dialect, DatastoreSettings settings,
                                     ObjectMapper mapper) {
    return new JdbcTableEngine(pools, dialect, settings, mapper);
  }

  @Bean
  public JdbcMetadataCatalog metadataCatalog(JdbcHandlePools pools, TableDialect dialect) {
    return new JdbcMetadataCatalog(pools, dialect);
  }

  @Bean
  public PostgresResourceRegistry resourceRegistry(JdbcHandlePools pools, DatastoreProperties props, ObjectMapper mapper) {
    String url = (props.getRegistryUrl() == null || props.getRegistryUrl().isBlank())
        ? props.getWriteUrl()
        : props.getRegistryUrl();
    return new PostgresResourceRegistry(pools.resolve(url), mapper);
  }

  @Bean
  @ConditionalOnProperty(prefix = "datastore.mongo", name = "uri")
  public MongoClient mongoClient(DatastoreProperties props) {
    return MongoClients.create(props.getMongo().getUri());
  }

  @Bean
  public ActiveFlagSynchronizer activeFlagSynchronizer(PostgresResourceRegistry registry,
                                                       ObjectProvider<MongoClient> mongoClient,
                                                       DatastoreProperties props,
                                                       DatastoreSettings settings) {
    List<ActivationListener> listeners = new ArrayList<>();
    MongoClient client = mongoClient.getIfAvailable();
    if (client != null) {
      DatastoreProperties.Mongo m = props.getMongo();
      MongoHandle handle = new MongoHandle("mongo:" + m.getDatabase(), client, m.getDatabase());
      listeners.add(new SearchIndexActivationListener(new MongoSearchIndex(handle, m.getCollection(), settings.siteId())));
    } else {
      log.info("datastore.index disabled: no datastore.mongo.uri configured");
    }
    return new ActiveFlagSynchronizer(registry, listeners);
  }

  @Bean
  public AccessPolicy accessPolicy(PostgresResourceRegistry registry) {
    return new RoleBasedAccessPolicy(registry);
  }

  @Bean
  public DatastoreActions datastoreActions(DatastoreSettings settings,
                                           JdbcTableEngine engine,
                                           JdbcMetadataCatalog catalog,
                                           PostgresResourceRegistry registry,
                                           AccessPolicy accessPolicy,
                                           ActiveFlagSynchronizer activeFlag) {
    // No import pipeline in this server: url-sourced creates are rejected.
    return new DatastoreActions(settings, engine, catalog, registry, accessPolicy, activeFlag, null);
  }

  @Bean
  public ActionDispatcher actionDispatcher(DatastoreSettings settings, ObjectMapper mapper, DatastoreActions actions) {
    return new ActionDispatcher(new ActionRequests(settings, mapper), actions);
  }

  @Bean
  public ApplicationRunner datastoreBootstrap(DatastoreProperties props,
                                              PostgresResourceRegistry registry,
                                              JdbcTableEngine engine) {
    return args -> {
      if (!props.isBootstrap()) return;
      registry.bootstrap();
      engine.bootstrap(props.getWriteUrl());
      log.info("datastore.bootstrap done catalog={}", TableNames.TABLE_METADATA);
    };
  }
}
