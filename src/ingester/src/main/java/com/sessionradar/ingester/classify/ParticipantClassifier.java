package com.sessionradar.ingester.classify;

import com.sessionradar.ingester.config.IngesterProperties;
import com.sessionradar.ingester.feed.FeedController;
import com.sessionradar.ingester.feed.FeedPilot;
import com.sessionradar.ingester.feed.FeedSnapshot;
import com.sessionradar.ingester.session.ClassifiedEntry;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Selects the snapshot rows that belong to the tracked area.
 *
 * <p>Controllers are kept when their callsign matches the position pattern. Pilots are kept when
 * they are inside the geofence or file a route starting with one of the route prefixes. Absent
 * attributes are replaced with sentinels here so that nothing downstream sees nulls.
 */
@Component
public class ParticipantClassifier {
  private static final Logger log = LoggerFactory.getLogger(ParticipantClassifier.class);
  static final String UNKNOWN_FACILITY = "UNK";

  private final Pattern controllerPattern;
  private final List<String> facilityNames;
  private final List<String> regionIds;
  private final List<String> routePrefixes;
  private final Geofence geofence;

  @Autowired
  public ParticipantClassifier(IngesterProperties properties, Geofence geofence) {
    this(properties.classifier(), geofence);
  }

  public ParticipantClassifier(IngesterProperties.Classifier settings, Geofence geofence) {
    this.controllerPattern = Pattern.compile(settings.controllerPattern(), Pattern.CASE_INSENSITIVE);
    this.facilityNames = settings.facilityNames() == null ? List.of() : List.copyOf(settings.facilityNames());
    this.regionIds = upper(settings.regionIds());
    this.routePrefixes = upper(settings.routePrefixes());
    this.geofence = geofence == null ? Geofence.NONE : geofence;
  }

  public ClassificationResult classify(FeedSnapshot snapshot) {
    List<ClassifiedEntry> entries = new ArrayList<>();
    int skipped = 0;
    for (FeedController row : snapshot.controllers()) {
      try {
        classifyController(row).ifPresent(entries::add);
      } catch (RuntimeException ex) {
        skipped++;
        log.debug("Skipping malformed controller row {}: {}", row, ex.getMessage());
      }
    }
    for (FeedPilot row : snapshot.pilots()) {
      try {
        classifyPilot(row).ifPresent(entries::add);
      } catch (RuntimeException ex) {
        skipped++;
        log.debug("Skipping malformed pilot row {}: {}", row, ex.getMessage());
      }
    }
    return new ClassificationResult(entries, skipped);
  }

  public Optional<ClassifiedEntry> classifyController(FeedController row) {
    String callsign = requireCallsign(row.callsign());
    if (!controllerPattern.matcher(callsign).matches()) {
      return Optional.empty();
    }
    return Optional.of(ClassifiedEntry.controller(
        callsign,
        cid(row.cid()),
        orDefault(row.name(), ClassifiedEntry.UNKNOWN),
        orDefault(row.frequency(), ClassifiedEntry.NOT_AVAILABLE),
        facilityName(row.facility()),
        regionFromCallsign(callsign)));
  }

  Optional<ClassifiedEntry> classifyPilot(FeedPilot row) {
    String callsign = requireCallsign(row.callsign());
    String departure = route(row.departure());
    String arrival = route(row.arrival());
    String region = null;
    if (row.latitude() != null && row.longitude() != null) {
      region = geofence.regionAt(row.latitude(), row.longitude()).orElse(null);
    }
    if (region == null && !matchesRoute(departure) && !matchesRoute(arrival)) {
      return Optional.empty();
    }
    return Optional.of(ClassifiedEntry.pilot(
        callsign,
        cid(row.cid()),
        orDefault(row.name(), ClassifiedEntry.UNKNOWN),
        departure,
        arrival,
        orDefault(row.aircraft(), ClassifiedEntry.NOT_AVAILABLE),
        region));
  }

  String facilityName(Integer index) {
    // Index 0 (observer) is reported the same way as an absent facility.
    if (index == null || index <= 0 || index >= facilityNames.size()) {
      return UNKNOWN_FACILITY;
    }
    return facilityNames.get(index);
  }

  String regionFromCallsign(String callsign) {
    String normalized = callsign.toUpperCase(Locale.ROOT);
    for (String regionId : regionIds) {
      if (normalized.startsWith(regionId + "_")) {
        return regionId;
      }
    }
    return null;
  }

  private boolean matchesRoute(String airport) {
    if (ClassifiedEntry.NOT_AVAILABLE.equals(airport)) {
      return false;
    }
    for (String prefix : routePrefixes) {
      if (airport.startsWith(prefix)) {
        return true;
      }
    }
    return false;
  }

  private static String requireCallsign(String callsign) {
    if (callsign == null || callsign.isBlank()) {
      throw new IllegalArgumentException("row has no callsign");
    }
    return callsign.trim();
  }

  private static String route(String airport) {
    return airport == null || airport.isBlank()
        ? ClassifiedEntry.NOT_AVAILABLE
        : airport.trim().toUpperCase(Locale.ROOT);
  }

  private static long cid(Long cid) {
    return cid == null || cid < 0 ? 0L : cid;
  }

  private static String orDefault(String value, String fallback) {
    return value == null || value.isBlank() ? fallback : value;
  }

  private static List<String> upper(List<String> values) {
    if (values == null) {
      return List.of();
    }
    return values.stream()
        .filter(v -> v != null && !v.isBlank())
        .map(v -> v.trim().toUpperCase(Locale.ROOT))
        .toList();
  }
}
