package io.intellixity.querydog.query;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectReader;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

import static io.intellixity.querydog.query.QueryValidationException.Reason.*;

/**
 * Maps the raw string parameter bag of a read request into a validated {@link QueryRequest}.
 * <p>
 * Malformed {@code filters}/{@code rangeFilters} JSON and non-numeric paging values are rejected;
 * unknown parameters are kept as extras.
 */
public final class QueryRequestParser {
  private static final Set<String> KNOWN = Set.of(
      "start", "end", "search", "limit", "offset", "sortField", "sortOrder", "filters", "rangeFilters");

  private final ObjectReader filterReader;
  private final ObjectReader rangeReader;
  private final TimeWindowNormalizer times;

  public QueryRequestParser(ObjectMapper mapper, TimeWindowNormalizer times) {
    Objects.requireNonNull(mapper, "mapper");
    // Text after the JSON value is a malformed parameter, not something to ignore.
    this.filterReader = mapper.readerFor(FilterRequest.class).with(DeserializationFeature.FAIL_ON_TRAILING_TOKENS);
    this.rangeReader = mapper.readerFor(RangeFilterRequest.class).with(DeserializationFeature.FAIL_ON_TRAILING_TOKENS);
    this.times = Objects.requireNonNull(times, "times");
  }

  public QueryRequest parse(Map<String, String> params) {
    Map<String, String> p = (params == null) ? Map.of() : params;

    Map<String, String> extras = new LinkedHashMap<>();
    p.forEach((k, v) -> { if (!KNOWN.contains(k)) extras.put(k, v); });

    return new QueryRequest()
        .withWindow(times.window(p.get("start"), p.get("end")))
        .withSearch(p.get("search"))
        .withLimit(positiveOrNull(p.get("limit"), "limit"))
        .withOffset(offsetOrZero(p.get("offset")))
        .withSort(new SortRequest(p.get("sortField"), p.get("sortOrder")))
        .withFilters(filters(p.get("filters")))
        .withRanges(ranges(p.get("rangeFilters")))
        .withExtras(extras);
  }

  public FilterRequest filters(String json) {
    if (json == null || json.isBlank()) return FilterRequest.EMPTY;
    try {
      FilterRequest f = filterReader.readValue(json);
      return (f == null) ? FilterRequest.EMPTY : f;
    } catch (JsonProcessingException | IllegalArgumentException e) {
      throw new QueryValidationException(MALFORMED_FILTERS, "Malformed filters: " + messageOf(e), e);
    }
  }

  public RangeFilterRequest ranges(String json) {
    if (json == null || json.isBlank()) return RangeFilterRequest.EMPTY;
    try {
      RangeFilterRequest r = rangeReader.readValue(json);
      return (r == null) ? RangeFilterRequest.EMPTY : r;
    } catch (JsonProcessingException | IllegalArgumentException e) {
      throw new QueryValidationException(MALFORMED_RANGE_FILTERS, "Malformed rangeFilters: " + messageOf(e), e);
    }
  }

  /** Parses a strictly positive integer parameter; null when blank. */
  public static Integer positiveOrNull(String raw, String name) {
    if (raw == null || raw.isBlank()) return null;
    int v = intOrReject(raw, name);
    if (v <= 0) throw new QueryValidationException(MALFORMED_PARAMETER, "'" + name + "' must be > 0");
    return v;
  }

  private static int offsetOrZero(String raw) {
    if (raw == null || raw.isBlank()) return 0;
    int v = intOrReject(raw, "offset");
    if (v < 0) throw new QueryValidationException(MALFORMED_PARAMETER, "'offset' must be >= 0");
    return v;
  }

  private static String messageOf(Exception e) {
    return (e instanceof JsonProcessingException jpe) ? jpe.getOriginalMessage() : e.getMessage();
  }

  private static int intOrReject(String raw, String name) {
    try {
      return Integer.parseInt(raw.trim());
    } catch (NumberFormatException e) {
      throw new QueryValidationException(MALFORMED_PARAMETER, "'" + name + "' must be an integer", e);
    }
  }
}
