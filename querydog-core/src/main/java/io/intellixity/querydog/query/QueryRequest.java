package io.intellixity.querydog.query;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Request-scoped bag of structured read parameters. The {@code withX} setters mutate and return
 * {@code this}. Created fresh per request by {@link QueryRequestParser}; never shared between requests.
 */
public final class QueryRequest {
  private TimeWindow window = TimeWindow.UNBOUNDED;
  private String search;
  private Integer limit;
  private int offset;
  private SortRequest sort = SortRequest.NONE;
  private FilterRequest filters = FilterRequest.EMPTY;
  private RangeFilterRequest ranges = RangeFilterRequest.EMPTY;
  private Map<String, String> extras = new LinkedHashMap<>();

  public QueryRequest() {}

  public TimeWindow window() { return window; }
  public String search() { return search; }
  /** Client-requested page size, or null when absent. */
  public Integer limit() { return limit; }
  public int offset() { return offset; }
  public SortRequest sort() { return sort; }
  public FilterRequest filters() { return filters; }
  public RangeFilterRequest ranges() { return ranges; }
  /** Dataset-specific parameters such as {@code bucket}, {@code normalize} or {@code eventColumns}. */
  public Map<String, String> extras() { return Collections.unmodifiableMap(extras); }
  public String extra(String name) { return extras.get(name); }

  public boolean hasSearch() { return search != null && !search.isEmpty(); }

  public OffsetPage page(int defaultLimit) {
    return new OffsetPage(offset, limit == null ? defaultLimit : limit);
  }

  public QueryRequest withWindow(TimeWindow window) { this.window = window == null ? TimeWindow.UNBOUNDED : window; return this; }
  public QueryRequest withSearch(String search) { this.search = search; return this; }
  public QueryRequest withLimit(Integer limit) { this.limit = limit; return this; }
  public QueryRequest withOffset(int offset) { this.offset = offset; return this; }
  public QueryRequest withSort(SortRequest sort) { this.sort = sort == null ? SortRequest.NONE : sort; return this; }
  public QueryRequest withFilters(FilterRequest filters) { this.filters = filters == null ? FilterRequest.EMPTY : filters; return this; }
  public QueryRequest withRanges(RangeFilterRequest ranges) { this.ranges = ranges == null ? RangeFilterRequest.EMPTY : ranges; return this; }
  public QueryRequest withExtras(Map<String, String> extras) { this.extras = new LinkedHashMap<>(extras == null ? Map.of() : extras); return this; }
  public QueryRequest withExtra(String name, String value) { this.extras.put(name, value); return this; }
}
