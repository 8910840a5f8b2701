package com.sessionradar.ingester.backfill;

/**
 * @param imported rows written to the durable store
 * @param duplicates rows whose session id was already stored
 * @param filtered rows outside the tracked positions or before the start date
 * @param malformed rows without a usable callsign or timestamps
 */
public record BackfillReport(int pages, int imported, int duplicates, int filtered, int malformed) {}
