package com.sessionradar.ingester.classify;

import java.util.Optional;

/** Maps a position to the id of the configured region containing it. */
public interface Geofence {
  Geofence NONE = (latitude, longitude) -> Optional.empty();

  Optional<String> regionAt(double latitude, double longitude);
}
