package io.intellixity.querydog.server.service;

/** A saved {@code .sql} file with its trimmed text and run statistics, flattened for the listing. */
public record SavedQuery(String filename,
                         String query,
                         String lastRunTime,
                         Long lastDuration,
                         Integer lastRowCount,
                         Double avgRunTime,
                         Long slowestRunTime,
                         Long fastestRunTime,
                         int runCount) {
  static SavedQuery of(String filename, String query, RunStats s) {
    return new SavedQuery(filename, query, s.lastRunTime(), s.lastDuration(), s.lastRowCount(),
        s.avgRunTime(), s.slowestRunTime(), s.fastestRunTime(), s.runCount());
  }
}
