package io.intellixity.querydog.server.service;

import io.intellixity.querydog.exec.AdHocQueryGateway;
import io.intellixity.querydog.exec.AdHocResult;
import io.intellixity.querydog.server.config.QueryDogProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.stream.Stream;

/** Operator-maintained {@code *.sql} files and their run statistics. */
@Service
public final class SavedQueryService {
  private static final Logger log = LoggerFactory.getLogger(SavedQueryService.class);

  private final Path dir;
  private final AdHocQueryGateway gateway;
  private final RunStatsStore stats;

  @Autowired
  public SavedQueryService(QueryDogProperties props, AdHocQueryGateway gateway, RunStatsStore stats) {
    this(Path.of(props.getQueriesDir()), gateway, stats);
  }

  SavedQueryService(Path dir, AdHocQueryGateway gateway, RunStatsStore stats) {
    this.dir = dir.toAbsolutePath().normalize();
    this.gateway = Objects.requireNonNull(gateway, "gateway");
    this.stats = Objects.requireNonNull(stats, "stats");
  }

  public Path dir() { return dir; }

  public boolean exists() { return Files.isDirectory(dir); }

  /** Files sorted by name; empty when the folder is missing. */
  public List<SavedQuery> list() {
    if (!exists()) return List.of();
    List<Path> files;
    try (Stream<Path> s = Files.list(dir)) {
      files = s.filter(p -> p.getFileName().toString().endsWith(".sql"))
          .filter(Files::isRegularFile)
          .sorted()
          .toList();
    } catch (IOException e) {
      throw new UncheckedIOException("Failed to list " + dir, e);
    }

    List<SavedQuery> out = new ArrayList<>(files.size());
    for (Path f : files) {
      String name = f.getFileName().toString();
      out.add(SavedQuery.of(name, read(f), stats.get(name)));
    }
    return out;
  }

  /** SELECT only. Statistics are recorded when a filename is given. */
  public SavedQueryRun run(String filename, String query) {
    AdHocResult r = gateway.executeSelect(query);
    RunStats updated = null;
    if (filename != null && !filename.isBlank()) {
      updated = stats.record(filename, r.duration(), r.rowCount());
      log.debug("Saved query {} ran in {}ms, {} row(s)", filename, r.duration(), r.rowCount());
    }
    return new SavedQueryRun(r.data(), r.rowCount(), r.duration(), updated);
  }

  public void clearStats() { stats.clear(); }

  public void clearStats(String filename) { stats.clear(filename); }

  private static String read(Path f) {
    try {
      return Files.readString(f, StandardCharsets.UTF_8).trim();
    } catch (IOException e) {
      throw new UncheckedIOException("Failed to read " + f, e);
    }
  }
}
