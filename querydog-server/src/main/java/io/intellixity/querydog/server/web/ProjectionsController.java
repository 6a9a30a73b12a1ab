package io.intellixity.querydog.server.web;

import io.intellixity.querydog.dataset.SystemDatasets;
import io.intellixity.querydog.server.service.CatalogService;
import io.intellixity.querydog.server.service.SystemTableService;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api")
public final class ProjectionsController {
  private final SystemTableService tables;
  private final CatalogService catalog;

  public ProjectionsController(SystemTableService tables, CatalogService catalog) {
    this.tables = tables;
    this.catalog = catalog;
  }

  @GetMapping("/projections")
  public List<Map<String, Object>> projections(@RequestParam Map<String, String> params) {
    return tables.list(SystemDatasets.PROJECTIONS.id(), params);
  }

  @GetMapping("/projection-parts/{database}/{table}/{projection}")
  public List<Map<String, Object>> projectionParts(@PathVariable("database") String database,
                                                   @PathVariable("table") String table,
                                                   @PathVariable("projection") String projection) {
    return catalog.projectionParts(database, table, projection);
  }

  @GetMapping("/indexes")
  public List<Map<String, Object>> indexes(@RequestParam Map<String, String> params) {
    return tables.list(SystemDatasets.INDEXES.id(), params);
  }
}
