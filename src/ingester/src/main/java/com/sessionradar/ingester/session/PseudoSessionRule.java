package com.sessionradar.ingester.session;

import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Recognizes broadcast/auxiliary controller positions (for example {@code OPKR_ATIS}).
 *
 * <p>Such sessions stay visible in history but never contribute minutes, counts or a "last
 * active callsign". The rule is evaluated on read as well as on write so that records written
 * before a suffix was configured are excluded too.
 */
public final class PseudoSessionRule {
  private final List<String> suffixes;

  public PseudoSessionRule(List<String> suffixes) {
    this.suffixes = suffixes == null
        ? List.of()
        : suffixes.stream()
            .filter(Objects::nonNull)
            .map(String::trim)
            .filter(s -> !s.isEmpty())
            .map(s -> s.toUpperCase(Locale.ROOT))
            .toList();
  }

  public boolean isPseudo(ParticipantCategory type, String callsign) {
    if (type != ParticipantCategory.CONTROLLER || callsign == null) {
      return false;
    }
    String normalized = callsign.trim().toUpperCase(Locale.ROOT);
    for (String suffix : suffixes) {
      if (normalized.endsWith(suffix)) {
        return true;
      }
    }
    return false;
  }

  public boolean isPseudoCallsign(String callsign) {
    return isPseudo(ParticipantCategory.CONTROLLER, callsign);
  }

  public boolean isCountable(ClosedSession session) {
    return !isPseudo(session.type(), session.callsign());
  }

  public List<String> suffixes() {
    return suffixes;
  }
}
