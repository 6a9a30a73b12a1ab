package io.intellixity.querydog.query;

import org.junit.jupiter.api.Test;

import java.time.LocalDateTime;
import java.time.ZoneId;
import java.time.ZoneOffset;

import static org.junit.jupiter.api.Assertions.*;

final class TimeWindowNormalizerTest {
  private final TimeWindowNormalizer utc = new TimeWindowNormalizer(ZoneOffset.UTC);

  @Test
  void identicalStartAndEndWidensToEndOfMinute() {
    LocalDateTime t = LocalDateTime.of(2024, 5, 1, 10, 15, 0);
    assertEquals("2024-05-01 10:15:59", TimeWindowNormalizer.normalizeEnd(t, t));
  }

  @Test
  void differentBoundsLeaveEndUnchanged() {
    LocalDateTime s = LocalDateTime.of(2024, 5, 1, 10, 15, 0);
    LocalDateTime e = LocalDateTime.of(2024, 5, 1, 10, 16, 0);
    assertEquals("2024-05-01 10:16:00", TimeWindowNormalizer.normalizeEnd(s, e));
  }

  @Test
  void boundsWithinTheSameSecondAreNotWidened() {
    TimeWindow w = utc.window("2024-05-01T10:00:00.100Z", "2024-05-01T10:00:00.900Z");
    assertEquals("2024-05-01 10:00:00", TimeWindowNormalizer.normalizeEnd(w.start(), w.end()));
    assertEquals("2024-05-01 10:00:00", TimeWindowNormalizer.format(w.start()));
  }

  @Test
  void identicalFractionalBoundsStillWiden() {
    TimeWindow w = utc.window("2024-05-01T10:00:00.500Z", "2024-05-01T10:00:00.500Z");
    assertEquals("2024-05-01 10:00:59", TimeWindowNormalizer.normalizeEnd(w.start(), w.end()));
  }

  @Test
  void missingStartLeavesEndUnchanged() {
    LocalDateTime e = LocalDateTime.of(2024, 5, 1, 10, 16, 0);
    assertEquals("2024-05-01 10:16:00", TimeWindowNormalizer.normalizeEnd(null, e));
    assertNull(TimeWindowNormalizer.normalizeEnd(e, null));
  }

  @Test
  void parsesStoreLiteralIsoAndOffsetForms() {
    LocalDateTime expected = LocalDateTime.of(2024, 5, 1, 10, 15, 30);
    assertEquals(expected, utc.parse("2024-05-01 10:15:30", "start"));
    assertEquals(expected, utc.parse("2024-05-01T10:15:30", "start"));
    assertEquals(expected.withNano(250_000_000), utc.parse("2024-05-01T10:15:30.250Z", "start"));
    assertEquals(expected, utc.parse("2024-05-01T12:15:30+02:00", "start"));
    assertEquals(LocalDateTime.of(2024, 5, 1, 0, 0), utc.parse("2024-05-01", "start"));
    assertNull(utc.parse("  ", "start"));
  }

  @Test
  void offsetInputsShiftIntoConfiguredZone() {
    TimeWindowNormalizer berlin = new TimeWindowNormalizer(ZoneId.of("Europe/Berlin"));
    assertEquals(LocalDateTime.of(2024, 1, 10, 13, 0), berlin.parse("2024-01-10T12:00:00Z", "end"));
  }

  @Test
  void rejectsGarbage() {
    QueryValidationException ex = assertThrows(QueryValidationException.class, () -> utc.parse("yesterday", "start"));
    assertEquals(QueryValidationException.Reason.MALFORMED_PARAMETER, ex.reason());
    assertTrue(ex.getMessage().contains("start"));
  }
}
