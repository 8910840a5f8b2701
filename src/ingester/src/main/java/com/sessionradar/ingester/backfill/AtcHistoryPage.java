package com.sessionradar.ingester.backfill;

import java.util.List;

/**
 * @param count total number of items reported by the API, if it reported one
 */
public record AtcHistoryPage(List<AtcHistoryItem> items, Long count) {
  public AtcHistoryPage {
    items = items == null ? List.of() : List.copyOf(items);
  }
}
