package com.sessionradar.ingester.roster;

import com.fasterxml.jackson.annotation.JsonInclude;
import java.time.Instant;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record MemberActivity(
    long cid,
    String name,
    String lastCallsign,
    Instant lastSeen,
    long totalControllerMinutes,
    long totalPilotMinutes,
    int sessionsCount,
    Instant addedAt) {

  public static MemberActivity detected(long cid, Instant now) {
    return new MemberActivity(cid, null, null, now, 0, 0, 0, now);
  }

  public MemberActivity withName(String value) {
    return new MemberActivity(cid, value, lastCallsign, lastSeen, totalControllerMinutes,
        totalPilotMinutes, sessionsCount, addedAt);
  }

  public MemberActivity withLastCallsign(String value) {
    return new MemberActivity(cid, name, value, lastSeen, totalControllerMinutes,
        totalPilotMinutes, sessionsCount, addedAt);
  }

  public MemberActivity withLastSeen(Instant value) {
    return new MemberActivity(cid, name, lastCallsign, value, totalControllerMinutes,
        totalPilotMinutes, sessionsCount, addedAt);
  }

  public MemberActivity plusControllerSession(int minutes) {
    return new MemberActivity(cid, name, lastCallsign, lastSeen, totalControllerMinutes + minutes,
        totalPilotMinutes, sessionsCount + 1, addedAt);
  }

  public MemberActivity plusPilotSession(int minutes) {
    return new MemberActivity(cid, name, lastCallsign, lastSeen, totalControllerMinutes,
        totalPilotMinutes + minutes, sessionsCount + 1, addedAt);
  }
}
