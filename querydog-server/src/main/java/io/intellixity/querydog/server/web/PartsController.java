package io.intellixity.querydog.server.web;

import io.intellixity.querydog.dataset.SystemDatasets;
import io.intellixity.querydog.dataset.VirtualColumn;
import io.intellixity.querydog.server.service.CatalogService;
import io.intellixity.querydog.server.service.SystemTableService;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

/** {@code system.parts} reads: raw parts, per-table and per-partition rollups, and part drill-downs. */
@RestController
@RequestMapping("/api")
public final class PartsController {
  private static final String DATASET = SystemDatasets.PARTS.id();

  private final SystemTableService tables;
  private final CatalogService catalog;

  public PartsController(SystemTableService tables, CatalogService catalog) {
    this.tables = tables;
    this.catalog = catalog;
  }

  @GetMapping({"/parts", "/partitions"})
  public List<Map<String, Object>> list(@RequestParam Map<String, String> params) {
    return tables.list(DATASET, params);
  }

  @GetMapping({"/parts/columns", "/partitions/columns"})
  public List<Map<String, Object>> columns() {
    return tables.columns("parts");
  }

  @GetMapping({"/parts/count", "/partitions/count"})
  public Map<String, Object> count(@RequestParam Map<String, String> params) {
    return tables.count(DATASET, params);
  }

  @GetMapping("/parts/grouped")
  public List<Map<String, Object>> grouped(@RequestParam Map<String, String> params) {
    return tables.summary(DATASET, SystemDatasets.PARTS_BY_TABLE.id(), params);
  }

  @GetMapping("/parts/histogram/{field}")
  public List<Map<String, Object>> histogram(@PathVariable("field") String field, @RequestParam Map<String, String> params) {
    return tables.histogram(DATASET, field, params);
  }

  @GetMapping("/parts/distinct/{field}")
  public List<String> distinct(@PathVariable("field") String field, @RequestParam Map<String, String> params) {
    return tables.distinct(DATASET, field, params);
  }

  @GetMapping("/partitions-summary")
  public List<Map<String, Object>> partitionsSummary(@RequestParam Map<String, String> params) {
    return tables.summary(DATASET, SystemDatasets.PARTITIONS.id(), params);
  }

  @GetMapping("/partitions-summary/count")
  public Map<String, Object> partitionsSummaryCount(@RequestParam Map<String, String> params) {
    return tables.summaryCount(DATASET, SystemDatasets.PARTITIONS.id(), params);
  }

  @GetMapping("/partitions-summary/columns")
  public List<VirtualColumn> partitionsSummaryColumns() {
    return tables.summaryColumns(SystemDatasets.PARTITIONS.id());
  }

  @GetMapping("/table-compression/{database}/{table}")
  public List<Map<String, Object>> tableCompression(@PathVariable("database") String database,
                                                    @PathVariable("table") String table) {
    return catalog.tableCompression(database, table);
  }

  @GetMapping("/partition-parts/{database}/{table}/{partitionId}")
  public List<Map<String, Object>> partitionParts(@PathVariable("database") String database,
                                                  @PathVariable("table") String table,
                                                  @PathVariable("partitionId") String partitionId,
                                                  @RequestParam(name = "activeOnly", defaultValue = "1") String activeOnly) {
    return catalog.partitionParts(database, table, partitionId, "1".equals(activeOnly));
  }

  @GetMapping("/table-partitions/{database}/{table}")
  public List<Map<String, Object>> tablePartitions(@PathVariable("database") String database,
                                                   @PathVariable("table") String table,
                                                   @RequestParam(name = "activeOnly", defaultValue = "1") String activeOnly) {
    return catalog.tablePartitions(database, table, "1".equals(activeOnly));
  }
}
