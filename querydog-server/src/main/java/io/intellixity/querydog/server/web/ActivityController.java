package io.intellixity.querydog.server.web;

import io.intellixity.querydog.dataset.SystemDatasets;
import io.intellixity.querydog.server.service.SystemTableService;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

/** Live server activity: running queries, merges, mutations and view refreshes. */
@RestController
@RequestMapping("/api")
public final class ActivityController {
  private final SystemTableService tables;

  public ActivityController(SystemTableService tables) {
    this.tables = tables;
  }

  @GetMapping("/processes")
  public List<Map<String, Object>> processes(@RequestParam Map<String, String> params) {
    return tables.list(SystemDatasets.PROCESSES.id(), params);
  }

  @GetMapping("/processes/columns")
  public List<Map<String, Object>> processesColumns() {
    return tables.columns("processes");
  }

  @GetMapping("/processes/distinct/{field}")
  public List<String> processesDistinct(@PathVariable("field") String field, @RequestParam Map<String, String> params) {
    return tables.distinct(SystemDatasets.PROCESSES.id(), field, params);
  }

  @GetMapping("/merges")
  public List<Map<String, Object>> merges(@RequestParam Map<String, String> params) {
    return tables.list(SystemDatasets.MERGES.id(), params);
  }

  @GetMapping("/merges/columns")
  public List<Map<String, Object>> mergesColumns() {
    return tables.columns("merges");
  }

  @GetMapping("/merges/distinct/{field}")
  public List<String> mergesDistinct(@PathVariable("field") String field, @RequestParam Map<String, String> params) {
    return tables.distinct(SystemDatasets.MERGES.id(), field, params);
  }

  @GetMapping("/mutations")
  public List<Map<String, Object>> mutations(@RequestParam Map<String, String> params) {
    return tables.list(SystemDatasets.MUTATIONS.id(), params);
  }

  @GetMapping("/mutations/columns")
  public List<Map<String, Object>> mutationsColumns() {
    return tables.columns("mutations");
  }

  @GetMapping("/mutations/distinct/{field}")
  public List<String> mutationsDistinct(@PathVariable("field") String field, @RequestParam Map<String, String> params) {
    return tables.distinct(SystemDatasets.MUTATIONS.id(), field, params);
  }

  @GetMapping("/view-refreshes")
  public List<Map<String, Object>> viewRefreshes(@RequestParam Map<String, String> params) {
    return tables.list(SystemDatasets.VIEW_REFRESHES.id(), params);
  }

  @GetMapping("/view-refreshes/columns")
  public List<Map<String, Object>> viewRefreshesColumns() {
    return tables.columns("view_refreshes");
  }

  @GetMapping("/view-refreshes/distinct/{field}")
  public List<String> viewRefreshesDistinct(@PathVariable("field") String field, @RequestParam Map<String, String> params) {
    return tables.distinct(SystemDatasets.VIEW_REFRESHES.id(), field, params);
  }
}
