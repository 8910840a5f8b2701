package com.sessionradar.ingester;

import com.sessionradar.ingester.classify.ClassificationResult;
import com.sessionradar.ingester.classify.ParticipantClassifier;
import com.sessionradar.ingester.engine.ReconcileResult;
import com.sessionradar.ingester.engine.SessionTracker;
import com.sessionradar.ingester.feed.FeedSnapshot;
import com.sessionradar.ingester.feed.FeedUnavailableException;
import com.sessionradar.ingester.feed.SnapshotFetcher;
import com.sessionradar.ingester.session.ClosedSession;
import com.sessionradar.ingester.session.OpenSession;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.Clock;
import java.time.Instant;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/** Live loop: fetch, classify and reconcile one snapshot per tick. */
@Component
@ConditionalOnProperty(prefix = "ingester", name = "mode", havingValue = "live", matchIfMissing = true)
public class SessionTrackingJob {
  private static final Logger log = LoggerFactory.getLogger(SessionTrackingJob.class);

  private final SnapshotFetcher fetcher;
  private final ParticipantClassifier classifier;
  private final SessionTracker tracker;
  private final Clock clock;
  private final Counter cycleCounter;
  private final Counter failedCounter;
  private final Counter skippedRowsCounter;

  public SessionTrackingJob(
      SnapshotFetcher fetcher,
      ParticipantClassifier classifier,
      SessionTracker tracker,
      Clock clock,
      MeterRegistry meterRegistry) {
    this.fetcher = fetcher;
    this.classifier = classifier;
    this.tracker = tracker;
    this.clock = clock;
    this.cycleCounter = meterRegistry.counter("ingester.cycles.total");
    this.failedCounter = meterRegistry.counter("ingester.cycles.failed");
    this.skippedRowsCounter = meterRegistry.counter("ingester.feed.rows.skipped");
  }

  @Scheduled(fixedDelayString = "${ingester.refresh-ms}")
  public void runCycle() {
    cycleCounter.increment();
    try {
      FeedSnapshot snapshot = fetcher.fetch();
      Instant now = clock.instant();
      ClassificationResult classified = classifier.classify(snapshot);
      skippedRowsCounter.increment(classified.skipped());

      ReconcileResult result = tracker.track(classified.entries(), now);
      if (result.hasLifecycleChanges()) {
        log.info("Sessions updated: started=[{}] closed=[{}] open={}",
            result.started().stream().map(OpenSession::callsign).collect(Collectors.joining(", ")),
            result.closed().stream()
                .map(c -> c.callsign() + " " + c.durationMinutes() + "m")
                .collect(Collectors.joining(", ")),
            result.updatedOpen().size());
      } else {
        log.info("No changes ({} tracked participants online, {} rows skipped)",
            classified.entries().size(), classified.skipped());
      }
    } catch (FeedUnavailableException ex) {
      // No information this tick; open sessions are left as they are.
      failedCounter.increment();
      log.error("Tracking cycle aborted, feed unavailable: {}", ex.getMessage());
    } catch (Exception ex) {
      failedCounter.increment();
      log.error("Tracking cycle failed", ex);
    }
  }
}
