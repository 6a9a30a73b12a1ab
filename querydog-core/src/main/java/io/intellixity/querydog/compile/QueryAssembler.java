package io.intellixity.querydog.compile;

import io.intellixity.querydog.dataset.*;
import io.intellixity.querydog.query.*;

import java.util.*;
import java.util.stream.Collectors;

import static io.intellixity.querydog.query.QueryValidationException.Reason.INVALID_FIELD;

/**
 * Compiles a {@link QueryRequest} against a {@link Dataset} into a {@link CompiledStatement}.
 * <p>
 * Every read pattern runs the same pipeline: predicates, then projection and grouping, then
 * ORDER BY, then paging. Predicates are AND-ed into a single WHERE clause that is omitted when
 * empty. Only identifiers from the dataset tables, or ones that passed {@link Identifiers}, reach
 * the statement text; all client values are bound. Compilation is a pure function of its inputs.
 */
public final class QueryAssembler {
  public static final int DEFAULT_HISTOGRAM_LIMIT = 20;
  public static final int DEFAULT_DISTINCT_LIMIT = 100;
  public static final int DEFAULT_PROFILE_EVENTS_LIMIT = 1000;

  /** Point list. Unpaged datasets get no LIMIT/OFFSET. */
  public CompiledStatement list(Dataset ds, QueryRequest r) {
    Bindings b = new Bindings();
    StringBuilder sql = new StringBuilder("SELECT ").append(ds.projection()).append(" FROM ").append(ds.table());
    appendWhere(sql, predicates(ds, r, b, ds.searchColumns(), List.of()));
    appendOrderBy(sql, ds.sort().resolve(r.sort(), ds::isKnown));
    if (ds.defaultLimit() != null) appendPage(sql, r.page(ds.defaultLimit()), b);
    return CompiledStatement.of(sql, b);
  }

  public CompiledStatement count(Dataset ds, QueryRequest r) {
    Bindings b = new Bindings();
    StringBuilder sql = new StringBuilder("SELECT count() AS ").append(ds.countLabel()).append(" FROM ").append(ds.table());
    appendWhere(sql, predicates(ds, r, b, ds.searchColumns(), List.of()));
    return CompiledStatement.of(sql, b);
  }

  /** Bucketed aggregates; the {@code bucket} extra selects second/minute/hour, defaulting to minute. */
  public CompiledStatement timeSeries(Dataset ds, QueryRequest r) {
    TimeSeriesShape shape = ds.timeSeries()
        .orElseThrow(() -> new IllegalArgumentException("Dataset has no time series: " + ds.id()));
    return bucketed(ds, r, shape.projections());
  }

  public CompiledStatement stackedTimeSeries(Dataset ds, QueryRequest r) {
    StackedShape shape = ds.stacked()
        .orElseThrow(() -> new IllegalArgumentException("Dataset has no stacked series: " + ds.id()));
    return bucketed(ds, r, shape.projections());
  }

  public CompiledStatement summary(Dataset ds, SummaryShape shape, QueryRequest r) {
    Bindings b = new Bindings();
    StringBuilder sql = new StringBuilder("SELECT ")
        .append(String.join(", ", shape.projections()))
        .append(" FROM ").append(ds.table());
    appendWhere(sql, predicates(ds, r, b, searchColumns(ds, shape), shape.fixedPredicates()));
    sql.append(" GROUP BY ").append(String.join(", ", shape.keys()));
    appendOrderBy(sql, shape.sort().resolve(r.sort(), f -> false));
    if (shape.paged()) appendPage(sql, r.page(shape.defaultLimit()), b);
    return CompiledStatement.of(sql, b);
  }

  /** Number of groups the matching {@link #summary} would produce without paging. */
  public CompiledStatement summaryCount(Dataset ds, SummaryShape shape, QueryRequest r) {
    Bindings b = new Bindings();
    String keys = String.join(", ", shape.keys());
    StringBuilder inner = new StringBuilder("SELECT ").append(keys).append(" FROM ").append(ds.table());
    appendWhere(inner, predicates(ds, r, b, searchColumns(ds, shape), shape.fixedPredicates()));
    inner.append(" GROUP BY ").append(keys);
    return CompiledStatement.of("SELECT count() AS count FROM (" + inner + ")", b);
  }

  /**
   * Value frequencies of one field. The field must be on the dataset's histogram allow-list;
   * its kind picks the projection (array fields are unrolled).
   */
  public CompiledStatement histogram(Dataset ds, String field, QueryRequest r) {
    FieldKind kind = selectorKind(ds, ds.histogramFields(), field);
    Bindings b = new Bindings();
    StringBuilder sql = new StringBuilder("SELECT ").append(selectorExpr(field, kind))
        .append(" AS name, count() AS count FROM ").append(ds.table());
    appendWhere(sql, predicates(ds, r, b, ds.searchColumns(), List.of()));
    sql.append(" GROUP BY name");
    if (kind == FieldKind.ARRAY_OF_STRING) sql.append(" HAVING name != ''");
    sql.append(" ORDER BY count DESC");
    appendLimit(sql, limitOr(r, DEFAULT_HISTOGRAM_LIMIT), b);
    return CompiledStatement.of(sql, b);
  }

  /** Distinct values of one field for filter pickers. Only the time window narrows the scan. */
  public CompiledStatement distinct(Dataset ds, String field, QueryRequest r) {
    FieldKind kind = selectorKind(ds, ds.distinctFields(), field);
    Bindings b = new Bindings();
    StringBuilder sql = new StringBuilder("SELECT DISTINCT ").append(selectorExpr(field, kind))
        .append(" AS value FROM ").append(ds.table());
    appendWhere(sql, timePredicates(ds, r.window(), b));
    sql.append(" ORDER BY value");
    appendLimit(sql, limitOr(r, DEFAULT_DISTINCT_LIMIT), b);
    return CompiledStatement.of(sql, b);
  }

  /**
   * Per-query ProfileEvents counters. {@code eventColumns} is a comma-separated list; entries that
   * are not plain identifiers are dropped.
   */
  public CompiledStatement profileEvents(Dataset ds, QueryRequest r) {
    if (!ds.isKnown("ProfileEvents") || ds.timeColumn() == null) {
      throw new IllegalArgumentException("Dataset has no ProfileEvents: " + ds.id());
    }
    List<String> cols = new ArrayList<>();
    cols.add(ds.timeColumn());
    cols.add("query_id");
    for (String e : eventNames(r.extra("eventColumns"))) cols.add("ProfileEvents['" + e + "'] AS " + e);

    Bindings b = new Bindings();
    StringBuilder sql = new StringBuilder("SELECT ").append(String.join(", ", cols)).append(" FROM ").append(ds.table());
    appendWhere(sql, predicates(ds, r, b, ds.searchColumns(), List.of()));
    sql.append(" ORDER BY ").append(ds.timeColumn()).append(" DESC");
    appendLimit(sql, limitOr(r, DEFAULT_PROFILE_EVENTS_LIMIT), b);
    return CompiledStatement.of(sql, b);
  }

  static List<String> eventNames(String raw) {
    if (raw == null || raw.isBlank()) return List.of();
    return Arrays.stream(raw.split(","))
        .map(String::trim)
        .filter(Identifiers::isValid)
        .distinct()
        .collect(Collectors.toList());
  }

  private CompiledStatement bucketed(Dataset ds, QueryRequest r, List<String> projections) {
    String bucketExpr = ds.bucketExpression(Bucket.parse(r.extra("bucket")));
    Bindings b = new Bindings();
    StringBuilder sql = new StringBuilder("SELECT ").append(bucketExpr).append(" AS time, ")
        .append(String.join(", ", projections))
        .append(" FROM ").append(ds.table());
    appendWhere(sql, predicates(ds, r, b, ds.searchColumns(), List.of()));
    sql.append(" GROUP BY time ORDER BY time ASC");
    return CompiledStatement.of(sql, b);
  }

  /** Fixed, time, search, filter and range predicates, in that order. */
  private List<String> predicates(Dataset ds, QueryRequest r, Bindings b,
                                  List<String> searchColumns, List<String> extraFixed) {
    List<String> out = new ArrayList<>(ds.fixedPredicates());
    out.addAll(extraFixed);
    out.addAll(timePredicates(ds, r.window(), b));

    if (r.hasSearch() && !searchColumns.isEmpty()) {
      String p = b.add("search", "%" + r.search() + "%", ParamType.STRING);
      out.add(searchColumns.stream().map(c -> c + " ILIKE " + p).collect(Collectors.joining(" OR ", "(", ")")));
    }

    for (Map.Entry<String, List<String>> e : r.filters().values().entrySet()) {
      FieldKind kind = FieldClassifier.classify(ds, e.getKey());
      ConditionBuilder.build(e.getKey(), e.getValue(), kind, b).ifPresent(out::add);
    }

    out.addAll(RangeConditionBuilder.build(r.ranges(), ds::isKnown, b));
    return out;
  }

  private static List<String> timePredicates(Dataset ds, TimeWindow w, Bindings b) {
    if (ds.timeColumn() == null || w == null || w.isUnbounded()) return List.of();
    List<String> out = new ArrayList<>(2);
    if (w.start() != null) {
      out.add(ds.timeColumn() + " >= " + b.add("start", TimeWindowNormalizer.format(w.start()), ParamType.DATETIME));
    }
    if (w.end() != null) {
      String end = TimeWindowNormalizer.normalizeEnd(w.start(), w.end());
      out.add(ds.timeColumn() + " <= " + b.add("end", end, ParamType.DATETIME));
    }
    return out;
  }

  private static FieldKind selectorKind(Dataset ds, Set<String> allowed, String field) {
    if (!Identifiers.isValid(field) || !allowed.contains(field)) {
      throw new QueryValidationException(INVALID_FIELD, "Invalid field: " + field);
    }
    FieldKind kind = FieldClassifier.classify(ds, field);
    if (kind == FieldKind.UNKNOWN) throw new QueryValidationException(INVALID_FIELD, "Invalid field: " + field);
    return kind;
  }

  private static String selectorExpr(String field, FieldKind kind) {
    return (kind == FieldKind.ARRAY_OF_STRING) ? "arrayJoin(" + field + ")" : "toString(" + field + ")";
  }

  private static List<String> searchColumns(Dataset ds, SummaryShape shape) {
    return shape.searchColumns() != null ? shape.searchColumns() : ds.searchColumns();
  }

  private static int limitOr(QueryRequest r, int fallback) {
    return (r.limit() == null) ? fallback : r.limit();
  }

  private static void appendWhere(StringBuilder sql, List<String> predicates) {
    if (predicates.isEmpty()) return;
    sql.append(" WHERE ").append(String.join(" AND ", predicates));
  }

  private static void appendOrderBy(StringBuilder sql, List<SortField> sort) {
    if (sort.isEmpty()) return;
    sql.append(" ORDER BY ").append(sort.stream().map(SortField::render).collect(Collectors.joining(", ")));
  }

  private static void appendLimit(StringBuilder sql, int limit, Bindings b) {
    sql.append(" LIMIT ").append(b.add("limit", limit, ParamType.UINT32));
  }

  private static void appendPage(StringBuilder sql, OffsetPage page, Bindings b) {
    appendLimit(sql, page.limit(), b);
    sql.append(" OFFSET ").append(b.add("offset", page.offset(), ParamType.UINT32));
  }
}
