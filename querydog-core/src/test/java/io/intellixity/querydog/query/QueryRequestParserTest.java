package io.intellixity.querydog.query;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static io.intellixity.querydog.query.QueryValidationException.Reason.*;
import static org.junit.jupiter.api.Assertions.*;

final class QueryRequestParserTest {
  private final QueryRequestParser parser =
      new QueryRequestParser(new ObjectMapper(), new TimeWindowNormalizer(ZoneOffset.UTC));

  @Test
  void parsesFullParameterBag() {
    Map<String, String> p = new HashMap<>();
    p.put("start", "2024-05-01 10:00:00");
    p.put("end", "2024-05-01T11:00:00");
    p.put("search", "select");
    p.put("limit", "50");
    p.put("offset", "100");
    p.put("sortField", "query_duration_ms");
    p.put("sortOrder", "ASC");
    p.put("filters", "{\"user\":[\"default\",\"etl\"],\"databases\":[\"db1\"]}");
    p.put("rangeFilters", "{\"read_rows\":{\"min\":10,\"max\":\"5000\"}}");
    p.put("bucket", "hour");

    QueryRequest r = parser.parse(p);

    assertEquals(LocalDateTime.of(2024, 5, 1, 10, 0), r.window().start());
    assertEquals(LocalDateTime.of(2024, 5, 1, 11, 0), r.window().end());
    assertEquals("select", r.search());
    assertEquals(50, r.limit());
    assertEquals(100, r.offset());
    assertEquals(new SortRequest("query_duration_ms", "ASC"), r.sort());
    assertEquals(List.of("default", "etl"), r.filters().values().get("user"));
    assertEquals(List.of("user", "databases"), List.copyOf(r.filters().values().keySet()));
    assertEquals(new RangeBounds(10L, 5000L), r.ranges().ranges().get("read_rows"));
    assertEquals("hour", r.extra("bucket"));
    assertFalse(r.extras().containsKey("filters"));
  }

  @Test
  void absentParametersYieldEmptyRequest() {
    QueryRequest r = parser.parse(Map.of());
    assertTrue(r.window().isUnbounded());
    assertNull(r.limit());
    assertEquals(0, r.offset());
    assertTrue(r.filters().isEmpty());
    assertTrue(r.ranges().isEmpty());
    assertEquals(new OffsetPage(0, 1000), r.page(1000));
  }

  @Test
  void scalarFilterValuesAreReadAsStrings() {
    FilterRequest f = parser.filters("{\"exception_code\":[0, 60], \"is_initial_query\":[true], \"type\":null}");
    assertEquals(List.of("0", "60"), f.values().get("exception_code"));
    assertEquals(List.of("true"), f.values().get("is_initial_query"));
    assertEquals(List.of(), f.values().get("type"));
  }

  @Test
  void malformedFiltersJsonIsRejected() {
    QueryValidationException ex = assertThrows(QueryValidationException.class, () -> parser.filters("{user:"));
    assertEquals(MALFORMED_FILTERS, ex.reason());
  }

  @Test
  void trailingTextAfterJsonIsRejected() {
    assertEquals(MALFORMED_FILTERS,
        assertThrows(QueryValidationException.class, () -> parser.filters("{\"user\":[\"a\"]} junk")).reason());
    assertEquals(MALFORMED_FILTERS,
        assertThrows(QueryValidationException.class, () -> parser.filters("{\"user\":[\"a\"]}{}")).reason());
    assertEquals(MALFORMED_RANGE_FILTERS,
        assertThrows(QueryValidationException.class, () -> parser.ranges("{\"rows\":{\"min\":1}} 2")).reason());
  }

  @Test
  void extrasAreReadOnly() {
    QueryRequest r = parser.parse(Map.of("bucket", "hour"));
    assertThrows(UnsupportedOperationException.class, () -> r.extras().put("bucket", "second"));
    assertEquals("hour", r.extra("bucket"));
  }

  @Test
  void filtersWithWrongShapeAreRejected() {
    assertEquals(MALFORMED_FILTERS,
        assertThrows(QueryValidationException.class, () -> parser.filters("[\"user\"]")).reason());
    assertEquals(MALFORMED_FILTERS,
        assertThrows(QueryValidationException.class, () -> parser.filters("{\"user\":\"default\"}")).reason());
    assertEquals(MALFORMED_FILTERS,
        assertThrows(QueryValidationException.class, () -> parser.filters("{\"user\":[{\"a\":1}]}")).reason());
  }

  @Test
  void rangeBoundsMustBeNonNegativeIntegers() {
    assertEquals(MALFORMED_RANGE_FILTERS,
        assertThrows(QueryValidationException.class, () -> parser.ranges("{\"rows\":{\"min\":\"ten\"}}")).reason());
    assertEquals(MALFORMED_RANGE_FILTERS,
        assertThrows(QueryValidationException.class, () -> parser.ranges("{\"rows\":{\"min\":-1}}")).reason());
    assertEquals(MALFORMED_RANGE_FILTERS,
        assertThrows(QueryValidationException.class, () -> parser.ranges("{\"rows\":{\"max\":1.5}}")).reason());
    assertEquals(MALFORMED_RANGE_FILTERS,
        assertThrows(QueryValidationException.class, () -> parser.ranges("{\"rows\":7}")).reason());
  }

  @Test
  void nonNumericPagingIsRejected() {
    assertEquals(MALFORMED_PARAMETER,
        assertThrows(QueryValidationException.class, () -> parser.parse(Map.of("limit", "abc"))).reason());
    assertEquals(MALFORMED_PARAMETER,
        assertThrows(QueryValidationException.class, () -> parser.parse(Map.of("limit", "0"))).reason());
    assertEquals(MALFORMED_PARAMETER,
        assertThrows(QueryValidationException.class, () -> parser.parse(Map.of("offset", "-5"))).reason());
  }
}
