package com.sessionradar.ingester.classify;

import com.sessionradar.ingester.session.ClassifiedEntry;
import java.util.List;

/**
 * @param entries rows accepted into tracking
 * @param skipped rows rejected because they could not be read
 */
public record ClassificationResult(List<ClassifiedEntry> entries, int skipped) {
  public ClassificationResult {
    entries = List.copyOf(entries);
  }
}
