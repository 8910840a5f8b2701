package com.sessionradar.dashboard.service;

import com.sessionradar.dashboard.config.DashboardProperties;
import com.sessionradar.dashboard.model.SessionRecord;
import java.util.List;
import java.util.Locale;
import org.springframework.stereotype.Component;

/**
 * Recognizes pseudo sessions (controller positions such as {@code _ATIS}).
 *
 * <p>Applied on every read, so records written before a suffix was configured are still excluded
 * from totals.
 */
@Component
public class PseudoSessionFilter {
  private final List<String> suffixes;

  public PseudoSessionFilter(DashboardProperties properties) {
    this(properties.getTracking().getPseudoSuffixes());
  }

  PseudoSessionFilter(List<String> suffixes) {
    this.suffixes = suffixes == null
        ? List.of()
        : suffixes.stream()
            .filter(s -> s != null && !s.isBlank())
            .map(s -> s.trim().toUpperCase(Locale.ROOT))
            .toList();
  }

  public boolean isPseudo(SessionRecord session) {
    if (!SessionRecord.CONTROLLER.equals(session.type()) || session.callsign() == null) {
      return false;
    }
    String callsign = session.callsign().trim().toUpperCase(Locale.ROOT);
    return suffixes.stream().anyMatch(callsign::endsWith);
  }

  public boolean isCountable(SessionRecord session) {
    return !isPseudo(session);
  }
}
