package com.sessionradar.ingester.feed;

import java.util.List;

/** One complete poll result. Both lists are always present, possibly empty. */
public record FeedSnapshot(List<FeedController> controllers, List<FeedPilot> pilots) {
  public FeedSnapshot {
    controllers = controllers == null ? List.of() : List.copyOf(controllers);
    pilots = pilots == null ? List.of() : List.copyOf(pilots);
  }

  public int size() {
    return controllers.size() + pilots.size();
  }
}
