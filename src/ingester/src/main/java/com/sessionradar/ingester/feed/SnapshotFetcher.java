package com.sessionradar.ingester.feed;

public interface SnapshotFetcher {

  /**
   * Fetches the list of currently active participants.
   *
   * @throws FeedUnavailableException on timeout, transport failure or an unusable response
   */
  FeedSnapshot fetch();
}
