package com.sessionradar.ingester.sync;

import com.sessionradar.ingester.session.ParticipantCategory;
import java.util.EnumMap;
import java.util.Map;

/**
 * Outcome of one synchronizer run.
 *
 * @param imported closed sessions copied from the durable store into history, per category
 * @param openCreated open sessions recreated from durable checkpoints
 * @param openRefreshed open sessions whose last sighting moved forward
 * @param exported history records that were missing from the durable store
 */
public record SyncReport(
    Map<ParticipantCategory, Counts> imported,
    int openCreated,
    int openRefreshed,
    int exported,
    int historySize,
    int openSize) {

  public SyncReport {
    Map<ParticipantCategory, Counts> copy = new EnumMap<>(ParticipantCategory.class);
    for (ParticipantCategory category : ParticipantCategory.values()) {
      copy.put(category, imported == null ? Counts.ZERO : imported.getOrDefault(category, Counts.ZERO));
    }
    imported = Map.copyOf(copy);
  }

  public Counts importedFor(ParticipantCategory category) {
    return imported.get(category);
  }

  public record Counts(int inserted, int skipped) {
    public static final Counts ZERO = new Counts(0, 0);

    Counts plusInserted() {
      return new Counts(inserted + 1, skipped);
    }

    Counts plusSkipped() {
      return new Counts(inserted, skipped + 1);
    }
  }
}
