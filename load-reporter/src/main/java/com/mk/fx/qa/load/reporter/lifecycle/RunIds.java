package com.mk.fx.qa.load.reporter.lifecycle;

import java.time.Instant;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.temporal.TemporalAccessor;

/** Parsing of run identifiers handed from the coordinator to the participants. */
public final class RunIds {

  private RunIds() {
    // Utility class, no instantiation
  }

  /**
   * Parses a run id written as an ISO-8601 instant ({@code 2024-05-01T10:15:30Z}), offset
   * date-time ({@code 2024-05-01T10:15:30+02:00}) or local date-time, which is taken as UTC.
   *
   * @throws IllegalArgumentException if the value is blank or in none of these forms
   */
  public static Instant parse(String value) {
    if (value == null || value.isBlank()) {
      throw new IllegalArgumentException("Run id must not be blank");
    }
    TemporalAccessor parsed;
    try {
      parsed =
          DateTimeFormatter.ISO_DATE_TIME.parseBest(
              value.trim(), OffsetDateTime::from, LocalDateTime::from);
    } catch (DateTimeParseException e) {
      throw new IllegalArgumentException("Unrecognised run id '" + value + "'", e);
    }
    if (parsed instanceof OffsetDateTime offset) {
      return offset.toInstant();
    }
    return ((LocalDateTime) parsed).toInstant(ZoneOffset.UTC);
  }
}
