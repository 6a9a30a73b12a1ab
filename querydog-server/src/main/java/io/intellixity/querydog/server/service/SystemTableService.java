package io.intellixity.querydog.server.service;

import io.intellixity.querydog.compile.CatalogStatements;
import io.intellixity.querydog.compile.QueryAssembler;
import io.intellixity.querydog.dataset.Dataset;
import io.intellixity.querydog.dataset.DatasetCatalog;
import io.intellixity.querydog.dataset.SummaryShape;
import io.intellixity.querydog.dataset.VirtualColumn;
import io.intellixity.querydog.exec.StatementExecutor;
import io.intellixity.querydog.query.QueryRequest;
import io.intellixity.querydog.query.QueryRequestParser;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Read patterns over the introspection datasets. Each call parses the raw parameter bag once,
 * compiles it against the dataset and hands the statement to the executor.
 */
@Service
public final class SystemTableService {
  private final DatasetCatalog catalog;
  private final QueryAssembler assembler;
  private final QueryRequestParser parser;
  private final StatementExecutor executor;

  public SystemTableService(DatasetCatalog catalog,
                            QueryAssembler assembler,
                            QueryRequestParser parser,
                            StatementExecutor executor) {
    this.catalog = Objects.requireNonNull(catalog, "catalog");
    this.assembler = Objects.requireNonNull(assembler, "assembler");
    this.parser = Objects.requireNonNull(parser, "parser");
    this.executor = Objects.requireNonNull(executor, "executor");
  }

  public List<Map<String, Object>> list(String datasetId, Map<String, String> params) {
    return executor.rows(assembler.list(catalog.get(datasetId), parser.parse(params)));
  }

  /** {@code {<count label>: n}}. */
  public Map<String, Object> count(String datasetId, Map<String, String> params) {
    Dataset ds = catalog.get(datasetId);
    List<Map<String, Object>> rows = executor.rows(assembler.count(ds, parser.parse(params)));
    return single(ds.countLabel(), countOf(rows, ds.countLabel()));
  }

  public List<Map<String, Object>> timeSeries(String datasetId, Map<String, String> params) {
    return executor.rows(assembler.timeSeries(catalog.get(datasetId), parser.parse(params)));
  }

  public List<Map<String, Object>> stackedTimeSeries(String datasetId, Map<String, String> params) {
    return executor.rows(assembler.stackedTimeSeries(catalog.get(datasetId), parser.parse(params)));
  }

  public List<Map<String, Object>> histogram(String datasetId, String field, Map<String, String> params) {
    return executor.rows(assembler.histogram(catalog.get(datasetId), field, parser.parse(params)));
  }

  /** Distinct values as strings, without empty ones. */
  public List<String> distinct(String datasetId, String field, Map<String, String> params) {
    List<Map<String, Object>> rows = executor.rows(assembler.distinct(catalog.get(datasetId), field, parser.parse(params)));
    return rows.stream()
        .map(r -> r.get("value"))
        .filter(Objects::nonNull)
        .map(String::valueOf)
        .filter(v -> !v.isEmpty())
        .collect(Collectors.toList());
  }

  public List<Map<String, Object>> summary(String datasetId, String summaryId, Map<String, String> params) {
    return executor.rows(assembler.summary(catalog.get(datasetId), catalog.summary(summaryId), parser.parse(params)));
  }

  /** {@code {count: n}} where n is the number of groups. */
  public Map<String, Object> summaryCount(String datasetId, String summaryId, Map<String, String> params) {
    QueryRequest r = parser.parse(params);
    List<Map<String, Object>> rows = executor.rows(assembler.summaryCount(catalog.get(datasetId), catalog.summary(summaryId), r));
    return single("count", countOf(rows, "count"));
  }

  public List<VirtualColumn> summaryColumns(String summaryId) {
    SummaryShape s = catalog.summary(summaryId);
    return s.columns();
  }

  public List<Map<String, Object>> profileEvents(String datasetId, Map<String, String> params) {
    return executor.rows(assembler.profileEvents(catalog.get(datasetId), parser.parse(params)));
  }

  /** Column metadata of {@code system.<table>}. */
  public List<Map<String, Object>> columns(String systemTable) {
    return executor.rows(CatalogStatements.systemColumns(systemTable));
  }

  static long countOf(List<Map<String, Object>> rows, String label) {
    if (rows == null || rows.isEmpty()) return 0L;
    Object v = rows.get(0).get(label);
    if (v instanceof Number n) return n.longValue();
    if (v instanceof CharSequence cs && !cs.toString().isBlank()) return Long.parseLong(cs.toString().trim());
    return 0L;
  }

  private static Map<String, Object> single(String key, Object value) {
    Map<String, Object> out = new LinkedHashMap<>();
    out.put(key, value);
    return out;
  }
}
