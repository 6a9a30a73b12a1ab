package io.intellixity.querydog.server.service;

import java.time.Clock;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

/** Keeps the last {@code historySize} durations per file; lost on restart. */
public final class InMemoryRunStatsStore implements RunStatsStore {
  private final int historySize;
  private final Clock clock;
  private final Map<String, History> byFile = new ConcurrentHashMap<>();

  public InMemoryRunStatsStore(int historySize, Clock clock) {
    if (historySize <= 0) throw new IllegalArgumentException("historySize must be > 0");
    this.historySize = historySize;
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  @Override
  public RunStats record(String filename, long durationMs, int rowCount) {
    Objects.requireNonNull(filename, "filename");
    History h = byFile.computeIfAbsent(filename, k -> new History());
    synchronized (h) {
      h.durations.addLast(durationMs);
      while (h.durations.size() > historySize) h.durations.removeFirst();
      h.lastRun = clock.instant().toString();
      h.lastDuration = durationMs;
      h.lastRowCount = rowCount;
      return h.snapshot();
    }
  }

  @Override
  public RunStats get(String filename) {
    History h = (filename == null) ? null : byFile.get(filename);
    if (h == null) return RunStats.NONE;
    synchronized (h) {
      return h.snapshot();
    }
  }

  @Override
  public void clear(String filename) {
    if (filename != null) byFile.remove(filename);
  }

  @Override
  public void clear() {
    byFile.clear();
  }

  private static final class History {
    final Deque<Long> durations = new ArrayDeque<>();
    String lastRun;
    long lastDuration;
    int lastRowCount;

    RunStats snapshot() {
      return RunStats.of(lastRun, lastDuration, lastRowCount, new ArrayList<>(durations));
    }
  }
}
