package io.intellixity.querydog.server.web;

import io.intellixity.querydog.server.service.CatalogService;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

/** Database/table drill-down. Path segments are validated as identifiers before any SQL is built. */
@RestController
@RequestMapping("/api/browser")
public final class BrowserController {
  private final CatalogService catalog;

  public BrowserController(CatalogService catalog) {
    this.catalog = catalog;
  }

  @GetMapping("/databases")
  public List<Map<String, Object>> databases() {
    return catalog.databases();
  }

  @GetMapping("/tables/{database}")
  public List<Map<String, Object>> tables(@PathVariable("database") String database) {
    return catalog.tables(database);
  }

  @GetMapping("/partitions/{database}/{table}")
  public List<Map<String, Object>> partitions(@PathVariable("database") String database,
                                              @PathVariable("table") String table) {
    return catalog.partitions(database, table);
  }

  @GetMapping("/columns/{database}/{table}")
  public List<Map<String, Object>> columns(@PathVariable("database") String database,
                                           @PathVariable("table") String table) {
    return catalog.columns(database, table);
  }

  @GetMapping("/parts/{database}/{table}/{partition}")
  public List<Map<String, Object>> parts(@PathVariable("database") String database,
                                         @PathVariable("table") String table,
                                         @PathVariable("partition") String partition) {
    return catalog.parts(database, table, partition);
  }

  @GetMapping("/projections/{database}/{table}")
  public List<Map<String, Object>> projections(@PathVariable("database") String database,
                                               @PathVariable("table") String table) {
    return catalog.projections(database, table);
  }

  @GetMapping("/projection-parts/{database}/{table}/{projection}")
  public List<Map<String, Object>> projectionParts(@PathVariable("database") String database,
                                                   @PathVariable("table") String table,
                                                   @PathVariable("projection") String projection) {
    return catalog.projectionParts(database, table, projection);
  }

  @GetMapping("/indexes/{database}/{table}")
  public List<Map<String, Object>> indexes(@PathVariable("database") String database,
                                           @PathVariable("table") String table) {
    return catalog.indexes(database, table);
  }
}
