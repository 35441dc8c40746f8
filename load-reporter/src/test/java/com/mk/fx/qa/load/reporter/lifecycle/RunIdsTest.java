package com.mk.fx.qa.load.reporter.lifecycle;

import static org.junit.jupiter.api.Assertions.*;

import java.time.Instant;
import org.junit.jupiter.api.Test;

class RunIdsTest {

  @Test
  void parse_acceptsInstantOffsetAndLocalForms() {
    Instant expected = Instant.parse("2024-05-01T10:15:30Z");

    assertEquals(expected, RunIds.parse("2024-05-01T10:15:30Z"));
    assertEquals(expected, RunIds.parse("2024-05-01T12:15:30+02:00"));
    assertEquals(expected, RunIds.parse(" 2024-05-01T10:15:30 "));
    assertEquals(
        Instant.parse("2024-05-01T10:15:30.123456Z"),
        RunIds.parse("2024-05-01T10:15:30.123456+00:00"));
  }

  @Test
  void parse_rejectsBlankAndGarbage() {
    assertThrows(IllegalArgumentException.class, () -> RunIds.parse(null));
    assertThrows(IllegalArgumentException.class, () -> RunIds.parse("  "));
    assertThrows(IllegalArgumentException.class, () -> RunIds.parse("yesterday"));
  }
}
