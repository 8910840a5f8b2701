package com.sessionradar.ingester.durable;

import com.sessionradar.ingester.backfill.AtcHistoryBackfill;
import com.sessionradar.ingester.backfill.AtcHistoryClient;
import com.sessionradar.ingester.classify.ParticipantClassifier;
import com.sessionradar.ingester.config.IngesterProperties;
import com.sessionradar.ingester.store.HistoryStore;
import com.sessionradar.ingester.store.SessionStore;
import com.sessionradar.ingester.sync.StoreSynchronizer;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDate;
import java.util.Properties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.datasource.DriverManagerDataSource;

/** Wires the SQLite durable store when {@code ingester.durable.enabled=true}. */
@Configuration
@ConditionalOnProperty(prefix = "ingester.durable", name = "enabled", havingValue = "true")
public class DurableStoreConfig {
  private static final Logger log = LoggerFactory.getLogger(DurableStoreConfig.class);

  @Bean
  public DurableSessionStore durableSessionStore(IngesterProperties properties) {
    Path path = Path.of(properties.durable().path()).toAbsolutePath();
    try {
      if (path.getParent() != null) {
        Files.createDirectories(path.getParent());
      }
    } catch (IOException ex) {
      throw new UncheckedIOException("Unable to create durable store directory for " + path, ex);
    }

    DriverManagerDataSource dataSource = new DriverManagerDataSource("jdbc:sqlite:" + path);
    dataSource.setDriverClassName("org.sqlite.JDBC");
    Properties connectionProperties = new Properties();
    // Live loop and one-shot jobs may share the file.
    connectionProperties.setProperty("busy_timeout", "5000");
    dataSource.setConnectionProperties(connectionProperties);

    JdbcDurableSessionStore store = new JdbcDurableSessionStore(new JdbcTemplate(dataSource));
    store.initSchema();
    log.info("Durable session store enabled at {}", path);
    return store;
  }

  @Bean
  public AtcHistoryBackfill atcHistoryBackfill(
      AtcHistoryClient client,
      ParticipantClassifier classifier,
      DurableSessionStore durableSessionStore,
      IngesterProperties properties) {
    IngesterProperties.Backfill backfill = properties.backfill();
    return new AtcHistoryBackfill(
        client, classifier, durableSessionStore, LocalDate.parse(backfill.since()), backfill.pageSize());
  }

  @Bean
  public StoreSynchronizer storeSynchronizer(
      DurableSessionStore durableSessionStore, HistoryStore historyStore, SessionStore sessionStore) {
    return new StoreSynchronizer(durableSessionStore, historyStore, sessionStore);
  }
}
