package io.intellixity.querydog.server.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.intellixity.querydog.compile.QueryAssembler;
import io.intellixity.querydog.dataset.DatasetCatalog;
import io.intellixity.querydog.dataset.SystemDatasets;
import io.intellixity.querydog.query.QueryRequestParser;
import io.intellixity.querydog.query.QueryValidationException;
import io.intellixity.querydog.query.TimeWindowNormalizer;
import io.intellixity.querydog.server.FakeStatementExecutor;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.ZoneOffset;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

final class SystemTableServiceTest {
  private FakeStatementExecutor executor;
  private SystemTableService service;

  @BeforeEach
  void setUp() {
    executor = new FakeStatementExecutor();
    service = new SystemTableService(DatasetCatalog.standard(), new QueryAssembler(),
        new QueryRequestParser(new ObjectMapper(), new TimeWindowNormalizer(ZoneOffset.UTC)), executor);
  }

  @Test
  void countUsesDatasetLabel() {
    executor.rows = List.of(Map.of("total", 42L));
    assertEquals(Map.of("total", 42L), service.count(SystemDatasets.QUERY_LOG.id(), Map.of()));
  }

  @Test
  void countAcceptsQuotedNumbers() {
    // UInt64 arrives as text from the HTTP driver
    assertEquals(7L, SystemTableService.countOf(List.of(Map.of("count", "7")), "count"));
    assertEquals(0L, SystemTableService.countOf(List.of(), "count"));
    Map<String, Object> blank = new HashMap<>();
    blank.put("count", null);
    assertEquals(0L, SystemTableService.countOf(List.of(blank), "count"));
  }

  @Test
  void summaryCountCountsGroups() {
    executor.rows = List.of(Map.of("count", 3));
    Map<String, Object> out = service.summaryCount(SystemDatasets.PARTS.id(), SystemDatasets.PARTITIONS.id(), Map.of());
    assertEquals(Map.of("count", 3L), out);
    assertTrue(executor.last().sql().startsWith("SELECT count() AS count FROM ("), executor.last().sql());
  }

  @Test
  void distinctDropsEmptyAndNullValues() {
    Map<String, Object> nullRow = new HashMap<>();
    nullRow.put("value", null);
    executor.rows = Arrays.asList(Map.of("value", "alice"), Map.of("value", ""), nullRow, Map.of("value", "bob"));

    List<String> out = service.distinct(SystemDatasets.QUERY_LOG.id(), "user", Map.of());

    assertEquals(List.of("alice", "bob"), out);
  }

  @Test
  void unknownDistinctFieldIsRejectedBeforeExecution() {
    assertThrows(QueryValidationException.class,
        () -> service.distinct(SystemDatasets.QUERY_LOG.id(), "user; DROP TABLE x", Map.of()));
    assertTrue(executor.seen.isEmpty());
  }

  @Test
  void listBindsPaging() {
    service.list(SystemDatasets.QUERY_LOG.id(), Map.of("limit", "25", "offset", "50"));
    assertEquals(25, executor.last().bindings().get("limit").value());
    assertEquals(50, executor.last().bindings().get("offset").value());
  }

  @Test
  void columnsReadSystemColumns() {
    service.columns("query_log");
    assertEquals("query_log", executor.last().bindings().get("table").value());
  }

  @Test
  void summaryColumnsAreStatic() {
    assertEquals(13, service.summaryColumns(SystemDatasets.PARTITIONS.id()).size());
    assertTrue(executor.seen.isEmpty());
  }
}
