package com.sessionradar.ingester.roster;

import com.sessionradar.ingester.session.ClosedSession;
import com.sessionradar.ingester.session.ParticipantCategory;
import com.sessionradar.ingester.session.PseudoSessionRule;
import com.sessionradar.ingester.store.DocumentStore;
import com.sessionradar.ingester.store.StoreIoException;
import jakarta.annotation.PostConstruct;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Per-member activity kept in the {@code roster} document.
 *
 * <p>Members are added the first time they are seen. Display names only replace placeholder
 * values, and the last callsign is never set to a pseudo-session callsign.
 */
@Component
public class MemberActivityRoster implements RosterNotifier {
  static final String DOCUMENT = "roster";
  private static final Logger log = LoggerFactory.getLogger(MemberActivityRoster.class);
  private static final Pattern POSITION_NAME =
      Pattern.compile("^(APP|TWR|GND|DEL|CTR|FSS|ATIS)$", Pattern.CASE_INSENSITIVE);
  private static final List<String> PLACEHOLDER_NAMES = List.of("unknown", "not tracked");

  private final DocumentStore documents;
  private final PseudoSessionRule pseudoSessionRule;
  private final Clock clock;
  private final Map<Long, MemberActivity> members = new LinkedHashMap<>();
  private boolean dirty;

  public MemberActivityRoster(DocumentStore documents, PseudoSessionRule pseudoSessionRule, Clock clock) {
    this.documents = documents;
    this.pseudoSessionRule = pseudoSessionRule;
    this.clock = clock;
  }

  @PostConstruct
  public synchronized void loadFromDisk() {
    members.clear();
    documents.read(DOCUMENT, RosterDocument.class).ifPresent(document -> {
      if (document.members() == null) {
        return;
      }
      for (MemberActivity member : document.members().values()) {
        if (member != null && member.cid() > 0) {
          members.put(member.cid(), member);
        }
      }
    });
    log.info("Loaded {} roster members from {}", members.size(), documents.describe());
  }

  @Override
  public synchronized void notifyObserved(long cid, String name, String callsign) {
    if (cid <= 0) {
      return;
    }
    MemberActivity member = members.get(cid);
    if (member == null) {
      member = MemberActivity.detected(cid, clock.instant());
      log.info("Added member {} to roster", cid);
    }
    if (isPlaceholder(member.name(), cid) && !isPlaceholder(name, cid)) {
      member = member.withName(name.trim());
    }
    member = member.withLastSeen(clock.instant());
    if (isUsableCallsign(callsign)) {
      member = member.withLastCallsign(callsign);
    }
    members.put(cid, member);
    dirty = true;
  }

  @Override
  public synchronized void recordClosedSession(ClosedSession session) {
    if (session.cid() <= 0 || !pseudoSessionRule.isCountable(session)) {
      return;
    }
    MemberActivity existing = members.get(session.cid());
    MemberActivity member = existing != null ? existing : MemberActivity.detected(session.cid(), clock.instant());
    // A sighting newer than this session's end keeps its callsign and timestamp.
    boolean newerSighting = existing != null && existing.lastSeen() != null
        && existing.lastSeen().isAfter(session.endTime());
    if (session.type() == ParticipantCategory.CONTROLLER) {
      member = member.plusControllerSession(session.durationMinutes());
      if (!newerSighting) {
        member = member.withLastCallsign(session.callsign());
      }
    } else {
      member = member.plusPilotSession(session.durationMinutes());
    }
    members.put(session.cid(), newerSighting ? member : member.withLastSeen(session.endTime()));
    dirty = true;
  }

  @Override
  public synchronized void updateLastCallsign(long cid, String callsign) {
    MemberActivity member = members.get(cid);
    if (member == null || !isUsableCallsign(callsign) || callsign.equals(member.lastCallsign())) {
      return;
    }
    members.put(cid, member.withLastCallsign(callsign));
    dirty = true;
  }

  @Override
  public synchronized void flush() {
    if (!dirty) {
      return;
    }
    Map<String, MemberActivity> byCid = new LinkedHashMap<>();
    members.forEach((cid, member) -> byCid.put(String.valueOf(cid), member));
    try {
      documents.write(DOCUMENT, new RosterDocument(clock.instant(), byCid));
      dirty = false;
    } catch (StoreIoException ex) {
      log.warn("Roster not persisted, will retry on the next flush", ex);
    }
  }

  public synchronized Optional<MemberActivity> get(long cid) {
    return Optional.ofNullable(members.get(cid));
  }

  public synchronized List<MemberActivity> listAll() {
    return new ArrayList<>(members.values());
  }

  private boolean isUsableCallsign(String callsign) {
    return callsign != null && !callsign.isBlank() && !pseudoSessionRule.isPseudoCallsign(callsign);
  }

  static boolean isPlaceholder(String name, long cid) {
    if (name == null || name.isBlank()) {
      return true;
    }
    String trimmed = name.trim();
    return PLACEHOLDER_NAMES.contains(trimmed.toLowerCase(Locale.ROOT))
        || trimmed.equals(String.valueOf(cid))
        || POSITION_NAME.matcher(trimmed).matches();
  }
}
