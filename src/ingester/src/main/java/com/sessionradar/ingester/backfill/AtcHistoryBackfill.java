package com.sessionradar.ingester.backfill;

import com.sessionradar.ingester.classify.ParticipantClassifier;
import com.sessionradar.ingester.durable.DurableSessionStore;
import com.sessionradar.ingester.feed.FeedController;
import com.sessionradar.ingester.session.ClassifiedEntry;
import com.sessionradar.ingester.session.ClosedSession;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Imports historical controller connections into the durable store.
 *
 * <p>Rows go through the same controller classification as live rows and receive the same
 * deterministic ids, so the backfill can be re-run and overlaps with live tracking collapse.
 */
public class AtcHistoryBackfill {
  private static final Logger log = LoggerFactory.getLogger(AtcHistoryBackfill.class);

  private final AtcHistoryClient client;
  private final ParticipantClassifier classifier;
  private final DurableSessionStore durableStore;
  private final Instant since;
  private final int pageSize;

  public AtcHistoryBackfill(
      AtcHistoryClient client,
      ParticipantClassifier classifier,
      DurableSessionStore durableStore,
      LocalDate since,
      int pageSize) {
    this.client = client;
    this.classifier = classifier;
    this.durableStore = durableStore;
    this.since = since.atStartOfDay(ZoneOffset.UTC).toInstant();
    this.pageSize = Math.max(1, pageSize);
  }

  public BackfillReport run() {
    log.info("Starting controller history backfill from {}", since);
    int offset = 0;
    int pages = 0;
    int imported = 0;
    int duplicates = 0;
    int filtered = 0;
    int malformed = 0;

    while (true) {
      AtcHistoryPage page = client.fetchPage(pageSize, offset);
      if (page.items().isEmpty()) {
        break;
      }
      pages++;
      int importedOnPage = 0;
      for (AtcHistoryItem item : page.items()) {
        Optional<ClosedSession> session;
        try {
          session = toSession(item);
        } catch (IllegalArgumentException | DateTimeParseException ex) {
          malformed++;
          log.debug("Skipping malformed history row {}: {}", item, ex.getMessage());
          continue;
        }
        if (session.isEmpty()) {
          filtered++;
        } else if (durableStore.insertClosedSession(session.get())) {
          imported++;
          importedOnPage++;
        } else {
          duplicates++;
        }
      }
      log.info("Processed offset {}, imported {} sessions", offset, importedOnPage);
      offset += pageSize;
      if (page.count() != null && offset >= page.count()) {
        break;
      }
    }

    BackfillReport report = new BackfillReport(pages, imported, duplicates, filtered, malformed);
    log.info("Backfill complete: {}", report);
    return report;
  }

  Optional<ClosedSession> toSession(AtcHistoryItem item) {
    if (item.start() == null || item.end() == null) {
      throw new IllegalArgumentException("row has no start or end");
    }
    Optional<ClassifiedEntry> entry = classifier.classifyController(
        new FeedController(item.callsign(), item.cid(), null, null, null));
    Instant start = parseTime(item.start());
    if (entry.isEmpty() || start.isBefore(since)) {
      return Optional.empty();
    }
    ClassifiedEntry controller = entry.get();
    return Optional.of(ClosedSession.of(
        controller.key(),
        controller.cid(),
        controller.name(),
        controller.frequency(),
        controller.facility(),
        null,
        null,
        null,
        controller.region(),
        start,
        parseTime(item.end())));
  }

  /** Accepts timestamps with or without an offset; the latter are read as UTC. */
  static Instant parseTime(String value) {
    try {
      return OffsetDateTime.parse(value).toInstant();
    } catch (DateTimeParseException ex) {
      return LocalDateTime.parse(value).toInstant(ZoneOffset.UTC);
    }
  }
}
