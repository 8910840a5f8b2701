package com.sessionradar.ingester.durable;

import com.sessionradar.ingester.session.ClosedSession;
import com.sessionradar.ingester.session.OpenSession;
import com.sessionradar.ingester.session.ParticipantCategory;
import com.sessionradar.ingester.session.ParticipantKey;
import com.sessionradar.ingester.session.SessionTimes;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;

/** SQLite implementation; timestamps are stored as ISO-8601 UTC text with millisecond precision. */
public class JdbcDurableSessionStore implements DurableSessionStore {
  private static final Logger log = LoggerFactory.getLogger(JdbcDurableSessionStore.class);

  private final JdbcTemplate jdbcTemplate;

  private final RowMapper<ClosedSession> closedRowMapper = (rs, rowNum) -> mapClosed(rs);
  private final RowMapper<OpenSession> openRowMapper = (rs, rowNum) -> mapOpen(rs);

  public JdbcDurableSessionStore(JdbcTemplate jdbcTemplate) {
    this.jdbcTemplate = jdbcTemplate;
  }

  public void initSchema() {
    jdbcTemplate.execute("""
        CREATE TABLE IF NOT EXISTS closed_sessions (
          id TEXT PRIMARY KEY,
          type TEXT NOT NULL,
          cid INTEGER NOT NULL DEFAULT 0,
          name TEXT,
          callsign TEXT NOT NULL,
          frequency TEXT,
          facility TEXT,
          departure TEXT,
          arrival TEXT,
          aircraft TEXT,
          region TEXT,
          start_time TEXT NOT NULL,
          end_time TEXT NOT NULL,
          duration_minutes INTEGER NOT NULL,
          session_date TEXT NOT NULL
        )
        """);
    jdbcTemplate.execute(
        "CREATE INDEX IF NOT EXISTS idx_closed_sessions_cid ON closed_sessions (cid, type, end_time)");
    jdbcTemplate.execute("""
        CREATE TABLE IF NOT EXISTS open_sessions (
          category TEXT NOT NULL,
          callsign TEXT NOT NULL,
          id TEXT NOT NULL,
          cid INTEGER NOT NULL DEFAULT 0,
          name TEXT,
          frequency TEXT,
          facility TEXT,
          departure TEXT,
          arrival TEXT,
          aircraft TEXT,
          region TEXT,
          start_time TEXT NOT NULL,
          last_seen TEXT NOT NULL,
          PRIMARY KEY (category, callsign)
        )
        """);
  }

  @Override
  public boolean insertClosedSession(ClosedSession session) {
    String sql = """
        INSERT INTO closed_sessions (id, type, cid, name, callsign, frequency, facility, departure,
          arrival, aircraft, region, start_time, end_time, duration_minutes, session_date)
        VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
        ON CONFLICT(id) DO NOTHING
        """;
    try {
      int rows = jdbcTemplate.update(sql,
          session.id(),
          session.type().name(),
          session.cid(),
          session.name(),
          session.callsign(),
          session.frequency(),
          session.facility(),
          session.departure(),
          session.arrival(),
          session.aircraft(),
          session.region(),
          SessionTimes.iso(session.startTime()),
          SessionTimes.iso(session.endTime()),
          session.durationMinutes(),
          session.date().toString());
      return rows > 0;
    } catch (DataAccessException ex) {
      throw new DurableWriteException("Unable to insert closed session " + session.id(), ex);
    }
  }

  @Override
  public void upsertOpenSession(OpenSession session) {
    String sql = """
        INSERT INTO open_sessions (category, callsign, id, cid, name, frequency, facility, departure,
          arrival, aircraft, region, start_time, last_seen)
        VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
        ON CONFLICT(category, callsign) DO UPDATE SET
          id = excluded.id,
          start_time = excluded.start_time,
          cid = excluded.cid,
          name = excluded.name,
          frequency = excluded.frequency,
          facility = excluded.facility,
          departure = excluded.departure,
          arrival = excluded.arrival,
          aircraft = excluded.aircraft,
          region = excluded.region,
          last_seen = excluded.last_seen
        """;
    try {
      jdbcTemplate.update(sql,
          session.type().name(),
          session.callsign(),
          session.id(),
          session.cid(),
          session.name(),
          session.frequency(),
          session.facility(),
          session.departure(),
          session.arrival(),
          session.aircraft(),
          session.region(),
          SessionTimes.iso(session.startTime()),
          SessionTimes.iso(session.lastSeen()));
    } catch (DataAccessException ex) {
      throw new DurableWriteException("Unable to checkpoint open session " + session.id(), ex);
    }
  }

  @Override
  public void deleteOpenSession(ParticipantKey key) {
    try {
      jdbcTemplate.update(
          "DELETE FROM open_sessions WHERE category = ? AND callsign = ?",
          key.category().name(), key.callsign());
    } catch (DataAccessException ex) {
      throw new DurableWriteException("Unable to delete open session " + key.storeId(), ex);
    }
  }

  @Override
  public List<OpenSession> listOpenSessions() {
    try {
      return jdbcTemplate.query("SELECT * FROM open_sessions ORDER BY start_time", openRowMapper)
          .stream()
          .filter(Objects::nonNull)
          .toList();
    } catch (DataAccessException ex) {
      throw new DurableStoreException("Unable to list open sessions", ex);
    }
  }

  @Override
  public List<ClosedSession> listClosedSessions(ClosedSessionFilter filter) {
    ClosedSessionFilter criteria = filter == null ? ClosedSessionFilter.ALL : filter;
    StringBuilder sql = new StringBuilder("SELECT * FROM closed_sessions WHERE 1 = 1");
    List<Object> args = new ArrayList<>();
    if (criteria.type() != null) {
      sql.append(" AND type = ?");
      args.add(criteria.type().name());
    }
    if (criteria.cid() != null) {
      sql.append(" AND cid = ?");
      args.add(criteria.cid());
    }
    if (criteria.startedOnOrAfter() != null) {
      sql.append(" AND start_time >= ?");
      args.add(SessionTimes.iso(criteria.startedOnOrAfter()));
    }
    sql.append(" ORDER BY end_time DESC");
    if (criteria.limit() != null && criteria.limit() > 0) {
      sql.append(" LIMIT ?");
      args.add(criteria.limit());
    }
    try {
      return jdbcTemplate.query(sql.toString(), closedRowMapper, args.toArray())
          .stream()
          .filter(Objects::nonNull)
          .toList();
    } catch (DataAccessException ex) {
      throw new DurableStoreException("Unable to list closed sessions", ex);
    }
  }

  private ClosedSession mapClosed(ResultSet rs) throws SQLException {
    String id = rs.getString("id");
    try {
      Instant start = SessionTimes.parse(rs.getString("start_time"));
      Instant end = SessionTimes.parse(rs.getString("end_time"));
      String date = rs.getString("session_date");
      return new ClosedSession(
          id,
          ParticipantCategory.valueOf(rs.getString("type")),
          rs.getLong("cid"),
          rs.getString("name"),
          rs.getString("callsign"),
          rs.getString("frequency"),
          rs.getString("facility"),
          rs.getString("departure"),
          rs.getString("arrival"),
          rs.getString("aircraft"),
          rs.getString("region"),
          start,
          end,
          rs.getInt("duration_minutes"),
          date == null ? null : LocalDate.parse(date));
    } catch (RuntimeException ex) {
      log.warn("Skipping malformed closed session row {}: {}", id, ex.getMessage());
      return null;
    }
  }

  private OpenSession mapOpen(ResultSet rs) throws SQLException {
    String id = rs.getString("id");
    try {
      return new OpenSession(
          id,
          ParticipantCategory.valueOf(rs.getString("category")),
          rs.getLong("cid"),
          rs.getString("name"),
          rs.getString("callsign"),
          rs.getString("frequency"),
          rs.getString("facility"),
          rs.getString("departure"),
          rs.getString("arrival"),
          rs.getString("aircraft"),
          rs.getString("region"),
          SessionTimes.parse(rs.getString("start_time")),
          SessionTimes.parse(rs.getString("last_seen")));
    } catch (RuntimeException ex) {
      log.warn("Skipping malformed open session row {}: {}", id, ex.getMessage());
      return null;
    }
  }
}
