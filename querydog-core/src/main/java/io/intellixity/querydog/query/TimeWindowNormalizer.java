package io.intellixity.querydog.query;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.temporal.TemporalAccessor;
import java.util.Locale;
import java.util.Objects;

/**
 * Parses client timestamps and renders them as store DateTime literals ({@code yyyy-MM-dd HH:mm:ss}).
 * <p>
 * Offset-bearing inputs ({@code ...Z}, {@code ...+02:00}) are shifted into {@link #zone()};
 * local inputs are taken as-is.
 */
public final class TimeWindowNormalizer {
  public static final DateTimeFormatter STORE_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss", Locale.ROOT);

  private final ZoneId zone;

  public TimeWindowNormalizer(ZoneId zone) {
    this.zone = Objects.requireNonNull(zone, "zone");
  }

  public ZoneId zone() { return zone; }

  public TimeWindow window(String start, String end) {
    return new TimeWindow(parse(start, "start"), parse(end, "end"));
  }

  /** Returns null for a blank input. Sub-second precision is kept; {@link #format} drops it. */
  public LocalDateTime parse(String raw, String param) {
    if (raw == null || raw.isBlank()) return null;
    String s = raw.trim();
    try {
      if (s.length() == 10) return LocalDate.parse(s).atStartOfDay();
      if (s.length() > 10 && s.charAt(10) == ' ') s = s.substring(0, 10) + 'T' + s.substring(11);
      TemporalAccessor t = DateTimeFormatter.ISO_DATE_TIME.parseBest(s, ZonedDateTime::from, LocalDateTime::from);
      LocalDateTime local = (t instanceof ZonedDateTime z)
          ? z.withZoneSameInstant(zone).toLocalDateTime()
          : (LocalDateTime) t;
      return local;
    } catch (DateTimeParseException e) {
      throw new QueryValidationException(QueryValidationException.Reason.MALFORMED_PARAMETER,
          "Invalid timestamp for '" + param + "': " + raw, e);
    }
  }

  public static String format(LocalDateTime t) {
    return (t == null) ? null : STORE_FORMAT.format(t);
  }

  /**
   * Effective inclusive end of a window. When start and end are the same instant the end is
   * widened to second 59 of that minute; otherwise the end is returned unchanged. Bounds are
   * compared at full precision, before formatting.
   */
  public static String normalizeEnd(LocalDateTime start, LocalDateTime end) {
    if (end == null) return null;
    if (start == null || !start.equals(end)) return format(end);
    return format(end.withSecond(59));
  }
}
