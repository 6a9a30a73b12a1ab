package io.intellixity.querydog.server.service;

/** Per-file run history of saved queries. Implementations are shared by concurrent requests. */
public interface RunStatsStore {
  /** Records one run and returns the updated snapshot. */
  RunStats record(String filename, long durationMs, int rowCount);

  /** {@link RunStats#NONE} for a file that never ran. */
  RunStats get(String filename);

  void clear(String filename);

  void clear();
}
