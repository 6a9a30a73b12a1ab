package io.intellixity.querydog.dataset;

import java.util.*;

/**
 * Static description of one introspection table: its known columns and how each read pattern may
 * touch them. A column absent from {@link #fields()} is never filtered, sorted, histogrammed or
 * listed as distinct values.
 */
public final class Dataset {
  private final String id;
  private final String table;
  private final Map<String, FieldSpec> fields;
  private final String timeColumn;
  private final List<String> searchColumns;
  private final List<String> fixedPredicates;
  private final String projection;
  private final SortPolicy sort;
  private final Integer defaultLimit;
  private final String countLabel;
  private final Set<String> histogramFields;
  private final Set<String> distinctFields;
  private final Map<Bucket, String> buckets;
  private final TimeSeriesShape timeSeries;
  private final StackedShape stacked;

  private Dataset(Builder b) {
    this.id = Objects.requireNonNull(b.id, "id");
    this.table = Objects.requireNonNull(b.table, "table");
    this.fields = Collections.unmodifiableMap(new LinkedHashMap<>(b.fields));
    this.timeColumn = b.timeColumn;
    this.searchColumns = List.copyOf(b.searchColumns);
    this.fixedPredicates = List.copyOf(b.fixedPredicates);
    this.projection = b.projection;
    this.sort = Objects.requireNonNull(b.sort, "sort");
    this.defaultLimit = b.defaultLimit;
    this.countLabel = b.countLabel;
    this.histogramFields = Set.copyOf(b.histogramFields);
    this.distinctFields = Set.copyOf(b.distinctFields);
    this.buckets = Collections.unmodifiableMap(new EnumMap<>(b.buckets));
    this.timeSeries = b.timeSeries;
    this.stacked = b.stacked;

    for (String f : histogramFields) requireKnown(f, "histogram");
    for (String f : distinctFields) requireKnown(f, "distinct");
    if ((timeSeries != null || stacked != null) && buckets.size() != Bucket.values().length) {
      throw new IllegalArgumentException("Dataset '" + id + "' has series shapes but incomplete bucket expressions");
    }
  }

  public String id() { return id; }
  public String table() { return table; }
  public Map<String, FieldSpec> fields() { return fields; }
  public FieldSpec field(String name) { return fields.get(name); }
  public boolean isKnown(String name) { return fields.containsKey(name); }
  /** Column used for time-window predicates, or null when the dataset is not time-indexed. */
  public String timeColumn() { return timeColumn; }
  public List<String> searchColumns() { return searchColumns; }
  public List<String> fixedPredicates() { return fixedPredicates; }
  public String projection() { return projection; }
  public SortPolicy sort() { return sort; }
  /** Default page size, or null when list reads are unpaged. */
  public Integer defaultLimit() { return defaultLimit; }
  public String countLabel() { return countLabel; }
  public Set<String> histogramFields() { return histogramFields; }
  public Set<String> distinctFields() { return distinctFields; }
  public String bucketExpression(Bucket bucket) { return buckets.get(bucket); }
  public Optional<TimeSeriesShape> timeSeries() { return Optional.ofNullable(timeSeries); }
  public Optional<StackedShape> stacked() { return Optional.ofNullable(stacked); }

  private void requireKnown(String f, String what) {
    if (!fields.containsKey(f)) throw new IllegalArgumentException(what + " field '" + f + "' is not a column of " + id);
  }

  @Override public String toString() { return "Dataset[" + id + " -> " + table + "]"; }

  public static Builder builder(String id, String table) { return new Builder(id, table); }

  public static final class Builder {
    private final String id;
    private final String table;
    private final Map<String, FieldSpec> fields = new LinkedHashMap<>();
    private String timeColumn;
    private final List<String> searchColumns = new ArrayList<>();
    private final List<String> fixedPredicates = new ArrayList<>();
    private String projection = "*";
    private SortPolicy sort;
    private Integer defaultLimit;
    private String countLabel = "count";
    private final Set<String> histogramFields = new LinkedHashSet<>();
    private final Set<String> distinctFields = new LinkedHashSet<>();
    private final Map<Bucket, String> buckets = new EnumMap<>(Bucket.class);
    private TimeSeriesShape timeSeries;
    private StackedShape stacked;

    private Builder(String id, String table) {
      this.id = id;
      this.table = table;
    }

    public Builder scalars(String... names) {
      for (String n : names) fields.put(n, FieldSpec.scalar(n));
      return this;
    }

    public Builder arrays(String... names) {
      for (String n : names) fields.put(n, FieldSpec.array(n));
      return this;
    }

    public Builder timeColumn(String c) { this.timeColumn = c; return this; }
    public Builder search(String... columns) { searchColumns.addAll(List.of(columns)); return this; }
    public Builder fixedPredicate(String sql) { fixedPredicates.add(sql); return this; }
    public Builder projection(String sql) { this.projection = sql; return this; }
    public Builder sort(SortPolicy p) { this.sort = p; return this; }
    public Builder defaultLimit(Integer n) { this.defaultLimit = n; return this; }
    public Builder countLabel(String l) { this.countLabel = l; return this; }
    public Builder histogram(String... names) { histogramFields.addAll(List.of(names)); return this; }
    public Builder histogram(Collection<String> names) { histogramFields.addAll(names); return this; }
    public Builder distinct(String... names) { distinctFields.addAll(List.of(names)); return this; }
    public Builder distinct(Collection<String> names) { distinctFields.addAll(names); return this; }
    public Builder bucket(Bucket b, String expr) { buckets.put(b, expr); return this; }
    public Builder timeSeries(TimeSeriesShape s) { this.timeSeries = s; return this; }
    public Builder stacked(StackedShape s) { this.stacked = s; return this; }

    public Dataset build() { return new Dataset(this); }
  }
}
