package com.sessionradar.dashboard.store;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.sessionradar.dashboard.model.HistoryDocument;
import com.sessionradar.dashboard.model.OpenSessionsDocument;
import com.sessionradar.dashboard.model.SessionRecord;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.time.LocalDate;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class FileDocumentReaderTest {
  private final ObjectMapper objectMapper = new ObjectMapper().registerModule(new JavaTimeModule());

  @TempDir Path dir;

  @Test
  void readsHistoryWrittenByTheIngester() throws Exception {
    Files.writeString(dir.resolve("history.json"), """
        {
          "lastUpdated" : "2024-03-01T11:00:15Z",
          "sessions" : [ {
            "id" : "atc-OPKC_TWR-2024-03-01T10:00:00.000Z",
            "type" : "controller",
            "cid" : 11,
            "name" : "Jane",
            "callsign" : "OPKC_TWR",
            "frequency" : "118.300",
            "facility" : "TWR",
            "startTime" : "2024-03-01T10:00:00Z",
            "endTime" : "2024-03-01T11:00:00Z",
            "durationMinutes" : 60,
            "date" : "2024-03-01"
          } ],
          "stats" : { "totalControllerMinutes" : 60, "totalPilotMinutes" : 0 }
        }
        """);

    HistoryDocument history = new FileDocumentReader(dir, objectMapper)
        .read(DocumentReader.HISTORY, HistoryDocument.class)
        .orElseThrow();

    assertEquals(Instant.parse("2024-03-01T11:00:15Z"), history.lastUpdated());
    SessionRecord session = history.sessions().get(0);
    assertEquals(SessionRecord.CONTROLLER, session.type());
    assertEquals(60, session.minutes());
    assertEquals(LocalDate.of(2024, 3, 1), session.periodDate());
  }

  @Test
  void readsOpenSessionMap() throws Exception {
    Files.writeString(dir.resolve("sessions.json"), """
        {"lastUpdated":"2024-03-01T11:00:15Z","sessions":{"pilot-PIA301":{"id":"pilot-PIA301",
        "type":"pilot","cid":7,"callsign":"PIA301","departure":"OPKC","arrival":"OPLA",
        "startTime":"2024-03-01T10:00:00Z","lastSeen":"2024-03-01T11:00:15Z"}}}
        """);

    OpenSessionsDocument open = new FileDocumentReader(dir, objectMapper)
        .read(DocumentReader.SESSIONS, OpenSessionsDocument.class)
        .orElseThrow();

    assertEquals("OPLA", open.sessionsOrEmpty().get("pilot-PIA301").arrival());
  }

  @Test
  void missingFileIsEmptyAndCorruptFileFails() throws Exception {
    FileDocumentReader reader = new FileDocumentReader(dir, objectMapper);
    assertTrue(reader.read(DocumentReader.HISTORY, HistoryDocument.class).isEmpty());

    Files.writeString(dir.resolve("history.json"), "{\"sessions\": [");
    assertThrows(StoreReadException.class, () -> reader.read(DocumentReader.HISTORY, HistoryDocument.class));
  }
}
