package io.intellixity.querydog.compile;

import io.intellixity.querydog.dataset.SystemDatasets;
import io.intellixity.querydog.query.*;
import org.junit.jupiter.api.Test;

import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static io.intellixity.querydog.query.QueryValidationException.Reason.INVALID_FIELD;
import static org.junit.jupiter.api.Assertions.*;

final class QueryAssemblerTest {
  private static final LocalDateTime T10 = LocalDateTime.of(2024, 5, 1, 10, 0);
  private static final LocalDateTime T11 = LocalDateTime.of(2024, 5, 1, 11, 0);

  private final QueryAssembler assembler = new QueryAssembler();

  @Test
  void bareListIsPagedWithDefaults() {
    CompiledStatement s = assembler.list(SystemDatasets.QUERY_LOG, new QueryRequest());
    assertEquals("SELECT * FROM system.query_log ORDER BY event_time DESC LIMIT :limit OFFSET :offset", s.sql());
    assertEquals(new Bind(1000, ParamType.UINT32), s.bindings().get("limit"));
    assertEquals(new Bind(0, ParamType.UINT32), s.bindings().get("offset"));
  }

  @Test
  void listCombinesEveryPredicateInOrder() {
    Map<String, List<String>> filters = new LinkedHashMap<>();
    filters.put("user", List.of("default"));
    filters.put("databases", List.of("db1", "db2"));
    filters.put("bogus", List.of("x"));
    filters.put("type", List.of());

    QueryRequest r = new QueryRequest()
        .withWindow(new TimeWindow(T10, T11))
        .withSearch("foo")
        .withLimit(50)
        .withOffset(100)
        .withSort(new SortRequest("query_duration_ms", "ASC"))
        .withFilters(new FilterRequest(filters))
        .withRanges(new RangeFilterRequest(Map.of("read_rows", new RangeBounds(10L, null))));

    CompiledStatement s = assembler.list(SystemDatasets.QUERY_LOG, r);

    assertEquals("SELECT * FROM system.query_log WHERE event_time >= :start AND event_time <= :end"
        + " AND (query ILIKE :search OR query_id ILIKE :search)"
        + " AND toString(user) IN :filter_0 AND hasAny(databases, :filter_1)"
        + " AND read_rows >= :read_rows_min"
        + " ORDER BY query_duration_ms ASC LIMIT :limit OFFSET :offset", s.sql());
    assertEquals(new Bind("2024-05-01 10:00:00", ParamType.DATETIME), s.bindings().get("start"));
    assertEquals(new Bind("2024-05-01 11:00:00", ParamType.DATETIME), s.bindings().get("end"));
    assertEquals(new Bind("%foo%", ParamType.STRING), s.bindings().get("search"));
    assertEquals(List.of("db1", "db2"), s.bindings().get("filter_1").value());
    assertEquals(new Bind(50, ParamType.UINT32), s.bindings().get("limit"));
    assertEquals(new Bind(100, ParamType.UINT32), s.bindings().get("offset"));
    assertEquals(8, s.bindings().size());
  }

  @Test
  void hostileSortFieldFallsBackToDefault() {
    QueryRequest r = new QueryRequest().withSort(new SortRequest("event_time; DROP TABLE x", "ASC"));
    CompiledStatement s = assembler.list(SystemDatasets.QUERY_LOG, r);
    assertTrue(s.sql().contains("ORDER BY event_time ASC"));
    assertFalse(s.sql().contains("DROP"));
  }

  @Test
  void allowListedSortRejectsOtherKnownColumns() {
    QueryRequest r = new QueryRequest().withSort(new SortRequest("source_file", "ASC"));
    assertTrue(assembler.list(SystemDatasets.TEXT_LOG, r).sql().contains("ORDER BY event_time ASC"));
    r.withSort(new SortRequest("level", null));
    assertTrue(assembler.list(SystemDatasets.TEXT_LOG, r).sql().contains("ORDER BY level DESC"));
  }

  @Test
  void identicalBoundsWidenToEndOfMinute() {
    CompiledStatement s = assembler.list(SystemDatasets.TEXT_LOG, new QueryRequest().withWindow(new TimeWindow(T10, T10)));
    assertEquals(new Bind("2024-05-01 10:00:59", ParamType.DATETIME), s.bindings().get("end"));
  }

  @Test
  void activityListsAreUnpagedWithFixedOrder() {
    QueryRequest r = new QueryRequest().withSort(new SortRequest("user", "ASC")).withLimit(5);
    CompiledStatement s = assembler.list(SystemDatasets.PROCESSES, r);
    assertEquals("SELECT * FROM system.processes ORDER BY elapsed DESC", s.sql());
    assertTrue(s.bindings().isEmpty());
  }

  @Test
  void countUsesDatasetLabel() {
    CompiledStatement s = assembler.count(SystemDatasets.QUERY_LOG,
        new QueryRequest().withWindow(new TimeWindow(T10, null)));
    assertEquals("SELECT count() AS total FROM system.query_log WHERE event_time >= :start", s.sql());
    assertEquals("SELECT count() AS count FROM system.parts",
        assembler.count(SystemDatasets.PARTS, new QueryRequest()).sql());
  }

  @Test
  void timeSeriesBucketsByRequestedGranularity() {
    CompiledStatement s = assembler.timeSeries(SystemDatasets.QUERY_LOG, new QueryRequest().withExtra("bucket", "hour"));
    assertTrue(s.sql().startsWith("SELECT toStartOfHour(event_time) AS time, count() AS count, avg(query_duration_ms) AS avg_duration"));
    assertTrue(s.sql().endsWith(" FROM system.query_log GROUP BY time ORDER BY time ASC"));

    String second = assembler.timeSeries(SystemDatasets.TEXT_LOG, new QueryRequest().withExtra("bucket", "second")).sql();
    assertTrue(second.startsWith("SELECT toStartOfSecond(event_time_microseconds) AS time"));
    String fallback = assembler.timeSeries(SystemDatasets.PART_LOG, new QueryRequest().withExtra("bucket", "week")).sql();
    assertTrue(fallback.startsWith("SELECT toStartOfMinute(event_time) AS time"));
  }

  @Test
  void stackedSeriesAddsOtherCategory() {
    String sql = assembler.stackedTimeSeries(SystemDatasets.QUERY_LOG, new QueryRequest()).sql();
    assertTrue(sql.contains("countIf(query_kind = 'Select') AS `Select`"));
    assertTrue(sql.contains("countIf(query_kind NOT IN ('Select', 'Insert', 'Delete')) AS Other"));
    assertThrows(IllegalArgumentException.class, () -> assembler.stackedTimeSeries(SystemDatasets.TEXT_LOG, new QueryRequest()));
  }

  @Test
  void histogramUnrollsArrayFields() {
    CompiledStatement s = assembler.histogram(SystemDatasets.QUERY_LOG, "tables", new QueryRequest());
    assertEquals("SELECT arrayJoin(tables) AS name, count() AS count FROM system.query_log"
        + " GROUP BY name HAVING name != '' ORDER BY count DESC LIMIT :limit", s.sql());
    assertEquals(new Bind(20, ParamType.UINT32), s.bindings().get("limit"));

    CompiledStatement scalar = assembler.histogram(SystemDatasets.QUERY_LOG, "user", new QueryRequest().withLimit(5));
    assertEquals("SELECT toString(user) AS name, count() AS count FROM system.query_log"
        + " GROUP BY name ORDER BY count DESC LIMIT :limit", scalar.sql());
    assertEquals(5, scalar.bindings().get("limit").value());
  }

  @Test
  void histogramRejectsFieldsOffTheAllowList() {
    QueryValidationException ex = assertThrows(QueryValidationException.class,
        () -> assembler.histogram(SystemDatasets.QUERY_LOG, "query", new QueryRequest()));
    assertEquals(INVALID_FIELD, ex.reason());
    assertEquals("Invalid field: query", ex.getMessage());
    assertThrows(QueryValidationException.class,
        () -> assembler.histogram(SystemDatasets.QUERY_LOG, "user) --", new QueryRequest()));
  }

  @Test
  void distinctIgnoresEverythingButTime() {
    QueryRequest r = new QueryRequest()
        .withWindow(new TimeWindow(T10, null))
        .withSearch("x")
        .withFilters(new FilterRequest(Map.of("user", List.of("a"))));
    CompiledStatement s = assembler.distinct(SystemDatasets.QUERY_LOG, "user", r);
    assertEquals("SELECT DISTINCT toString(user) AS value FROM system.query_log WHERE event_time >= :start"
        + " ORDER BY value LIMIT :limit", s.sql());
    assertEquals(new Bind(100, ParamType.UINT32), s.bindings().get("limit"));
    assertThrows(QueryValidationException.class,
        () -> assembler.distinct(SystemDatasets.PROCESSES, "query", new QueryRequest()));
  }

  @Test
  void partitionSummaryMapsSortAliases() {
    QueryRequest r = new QueryRequest().withSearch("events").withSort(new SortRequest("rows", null));
    CompiledStatement s = assembler.summary(SystemDatasets.PARTS, SystemDatasets.PARTITIONS, r);
    assertTrue(s.sql().contains(" FROM system.parts WHERE active = 1"
        + " AND (table ILIKE :search OR database ILIKE :search OR partition_id ILIKE :search)"
        + " GROUP BY database, table, partition_id, partition ORDER BY total_rows DESC LIMIT :limit OFFSET :offset"), s.sql());
    assertEquals(2500, s.bindings().get("limit").value());

    String fallback = assembler.summary(SystemDatasets.PARTS, SystemDatasets.PARTITIONS,
        new QueryRequest().withSort(new SortRequest("name", "ASC"))).sql();
    assertTrue(fallback.contains("ORDER BY latest_modification ASC"));
  }

  @Test
  void unpagedSummaryHasFixedOrder() {
    String sql = assembler.summary(SystemDatasets.PARTS, SystemDatasets.PARTS_BY_TABLE, new QueryRequest()).sql();
    assertTrue(sql.endsWith(" FROM system.parts GROUP BY database, table ORDER BY total_bytes DESC"), sql);
  }

  @Test
  void summaryCountWrapsGroupedKeys() {
    CompiledStatement s = assembler.summaryCount(SystemDatasets.QUERY_LOG, SystemDatasets.QUERIES_BY_HASH,
        new QueryRequest().withWindow(new TimeWindow(T10, T11)));
    assertEquals("SELECT count() AS count FROM (SELECT normalized_query_hash FROM system.query_log"
        + " WHERE event_time >= :start AND event_time <= :end GROUP BY normalized_query_hash)", s.sql());
  }

  @Test
  void profileEventsDropsInvalidNames() {
    QueryRequest r = new QueryRequest().withExtra("eventColumns", "SelectedRows, bad-name, ReadCompressedBytes,SelectedRows");
    CompiledStatement s = assembler.profileEvents(SystemDatasets.QUERY_LOG, r);
    assertEquals("SELECT event_time, query_id, ProfileEvents['SelectedRows'] AS SelectedRows,"
        + " ProfileEvents['ReadCompressedBytes'] AS ReadCompressedBytes FROM system.query_log"
        + " ORDER BY event_time DESC LIMIT :limit", s.sql());
    assertEquals(1000, s.bindings().get("limit").value());
    assertEquals(List.of(), QueryAssembler.eventNames(null));
  }

  @Test
  void compilationIsDeterministic() {
    QueryRequest r = new QueryRequest()
        .withWindow(new TimeWindow(T10, T11))
        .withFilters(new FilterRequest(Map.of("user", List.of("a"))))
        .withSearch("s");
    assertEquals(assembler.list(SystemDatasets.PART_LOG, r), assembler.list(SystemDatasets.PART_LOG, r));
  }
}
