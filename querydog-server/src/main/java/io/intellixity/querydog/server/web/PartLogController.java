package io.intellixity.querydog.server.web;

import io.intellixity.querydog.dataset.SystemDatasets;
import io.intellixity.querydog.server.service.SystemTableService;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/part-log")
public final class PartLogController {
  private static final String DATASET = SystemDatasets.PART_LOG.id();

  private final SystemTableService tables;

  public PartLogController(SystemTableService tables) {
    this.tables = tables;
  }

  @GetMapping
  public List<Map<String, Object>> list(@RequestParam Map<String, String> params) {
    return tables.list(DATASET, params);
  }

  @GetMapping("/columns")
  public List<Map<String, Object>> columns() {
    return tables.columns("part_log");
  }

  @GetMapping("/count")
  public Map<String, Object> count(@RequestParam Map<String, String> params) {
    return tables.count(DATASET, params);
  }

  @GetMapping("/timeseries")
  public List<Map<String, Object>> timeSeries(@RequestParam Map<String, String> params) {
    return tables.timeSeries(DATASET, params);
  }

  @GetMapping("/timeseries-stacked")
  public List<Map<String, Object>> stacked(@RequestParam Map<String, String> params) {
    return tables.stackedTimeSeries(DATASET, params);
  }

  @GetMapping("/histogram/{field}")
  public List<Map<String, Object>> histogram(@PathVariable("field") String field, @RequestParam Map<String, String> params) {
    return tables.histogram(DATASET, field, params);
  }

  @GetMapping("/distinct/{field}")
  public List<String> distinct(@PathVariable("field") String field, @RequestParam Map<String, String> params) {
    return tables.distinct(DATASET, field, params);
  }
}
