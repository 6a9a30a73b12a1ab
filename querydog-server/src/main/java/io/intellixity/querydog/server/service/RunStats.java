package io.intellixity.querydog.server.service;

import java.util.List;

/**
 * Snapshot of one saved query's run history. Derived values are null until the first run.
 *
 * @param lastRunTime ISO-8601 instant of the latest run
 */
public record RunStats(String lastRunTime,
                       Long lastDuration,
                       Integer lastRowCount,
                       Double avgRunTime,
                       Long slowestRunTime,
                       Long fastestRunTime,
                       int runCount) {
  public static final RunStats NONE = new RunStats(null, null, null, null, null, null, 0);

  static RunStats of(String lastRunTime, long lastDuration, int lastRowCount, List<Long> durations) {
    if (durations.isEmpty()) return new RunStats(lastRunTime, lastDuration, lastRowCount, null, null, null, 0);
    long sum = 0;
    long max = Long.MIN_VALUE;
    long min = Long.MAX_VALUE;
    for (long d : durations) {
      sum += d;
      max = Math.max(max, d);
      min = Math.min(min, d);
    }
    return new RunStats(lastRunTime, lastDuration, lastRowCount, (double) sum / durations.size(), max, min,
        durations.size());
  }
}
