package com.sessionradar.ingester;

import com.sessionradar.ingester.backfill.AtcHistoryBackfill;
import com.sessionradar.ingester.config.IngesterProperties;
import com.sessionradar.ingester.sync.StoreSynchronizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.stereotype.Component;

/** Runs the {@code sync} or {@code backfill} mode once at startup; idle in {@code live} mode. */
@Component
public class OneShotJobRunner implements ApplicationRunner, ExitCodeGenerator {
  private static final Logger log = LoggerFactory.getLogger(OneShotJobRunner.class);

  private final IngesterProperties properties;
  private final ObjectProvider<StoreSynchronizer> synchronizer;
  private final ObjectProvider<AtcHistoryBackfill> backfill;
  private volatile int exitCode;

  public OneShotJobRunner(
      IngesterProperties properties,
      ObjectProvider<StoreSynchronizer> synchronizer,
      ObjectProvider<AtcHistoryBackfill> backfill) {
    this.properties = properties;
    this.synchronizer = synchronizer;
    this.backfill = backfill;
  }

  @Override
  public void run(ApplicationArguments args) {
    IngesterProperties.Mode mode = properties.mode();
    if (mode == null || mode == IngesterProperties.Mode.LIVE) {
      return;
    }
    try {
      switch (mode) {
        case SYNC -> required(synchronizer.getIfAvailable(), "sync").synchronize();
        case BACKFILL -> required(backfill.getIfAvailable(), "backfill").run();
        default -> throw new IllegalStateException("Unsupported mode " + mode);
      }
      exitCode = 0;
    } catch (RuntimeException ex) {
      exitCode = 1;
      log.error("{} run failed", mode, ex);
    }
  }

  @Override
  public int getExitCode() {
    return exitCode;
  }

  private static <T> T required(T job, String mode) {
    if (job == null) {
      throw new IllegalStateException(
          "Mode " + mode + " needs the durable store, set ingester.durable.enabled=true");
    }
    return job;
  }
}
