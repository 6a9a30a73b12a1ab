package io.intellixity.querydog.server.web;

import io.intellixity.querydog.server.service.CatalogService;
import io.intellixity.querydog.server.service.SystemTableService;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api")
public final class ServerStateController {
  private final CatalogService catalog;
  private final SystemTableService tables;

  public ServerStateController(CatalogService catalog, SystemTableService tables) {
    this.catalog = catalog;
    this.tables = tables;
  }

  @GetMapping("/metrics")
  public List<Map<String, Object>> metrics() { return catalog.metrics(); }

  @GetMapping("/async-metrics")
  public List<Map<String, Object>> asyncMetrics() { return catalog.asyncMetrics(); }

  @GetMapping("/events")
  public List<Map<String, Object>> events() { return catalog.events(); }

  @GetMapping("/users")
  public List<Map<String, Object>> users() { return catalog.users(); }

  @GetMapping("/users/columns")
  public List<Map<String, Object>> usersColumns() { return tables.columns("users"); }

  @GetMapping("/settings")
  public List<Map<String, Object>> settings() { return catalog.settings(); }

  @GetMapping("/settings/columns")
  public List<Map<String, Object>> settingsColumns() { return tables.columns("settings"); }
}
