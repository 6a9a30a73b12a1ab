package io.intellixity.querydog.query;

import java.time.LocalDateTime;

/** Optional inclusive time bounds, already parsed into store-local time. */
public record TimeWindow(LocalDateTime start, LocalDateTime end) {
  public static final TimeWindow UNBOUNDED = new TimeWindow(null, null);

  public boolean isUnbounded() { return start == null && end == null; }
}
