package io.intellixity.querydog.server.web;

import io.intellixity.querydog.server.service.SavedQuery;
import io.intellixity.querydog.server.service.SavedQueryRun;
import io.intellixity.querydog.server.service.SavedQueryService;
import org.springframework.web.bind.annotation.*;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** Saved {@code .sql} files under the configured queries directory, with per-file run statistics. */
@RestController
@RequestMapping("/api/my-queries")
public final class MyQueriesController {
  private final SavedQueryService saved;

  public MyQueriesController(SavedQueryService saved) {
    this.saved = saved;
  }

  public record RunBody(String filename, String query) {}

  @GetMapping("/exists")
  public Map<String, Object> exists() {
    Map<String, Object> out = new LinkedHashMap<>();
    out.put("exists", saved.exists());
    out.put("path", saved.dir().toString());
    return out;
  }

  @GetMapping
  public List<SavedQuery> list() {
    return saved.list();
  }

  @PostMapping("/run")
  public SavedQueryRun run(@RequestBody RunBody body) {
    return saved.run(body == null ? null : body.filename(), body == null ? null : body.query());
  }

  @DeleteMapping("/stats")
  public Map<String, Object> clearStats() {
    saved.clearStats();
    return Map.of("success", true);
  }

  @DeleteMapping("/stats/{filename}")
  public Map<String, Object> clearStats(@PathVariable("filename") String filename) {
    saved.clearStats(filename);
    return Map.of("success", true);
  }
}
