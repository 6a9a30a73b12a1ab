package io.intellixity.querydog.dataset;

import io.intellixity.querydog.query.SortField;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static io.intellixity.querydog.query.SortField.Direction.ASC;
import static io.intellixity.querydog.query.SortField.Direction.DESC;

/** Field tables and read shapes for the ClickHouse {@code system.*} tables the console exposes. */
public final class SystemDatasets {
  private SystemDatasets() {}

  public static final List<String> QUERY_LOG_ARRAYS = List.of(
      "databases", "tables", "columns", "partitions", "projections", "views",
      "used_functions", "used_aggregate_functions", "used_aggregate_function_combinators",
      "used_database_engines", "used_data_type_families", "used_dictionaries",
      "used_formats", "used_storages", "used_table_functions",
      "used_executable_user_defined_functions", "used_sql_user_defined_functions",
      "used_row_policies", "used_privileges", "missing_privileges", "thread_ids");

  private static final String SAVINGS_PCT =
      "round((sum(data_uncompressed_bytes) - sum(data_compressed_bytes)) / nullIf(sum(data_uncompressed_bytes), 0) * 100, 1)";

  public static final Dataset QUERY_LOG = Dataset.builder("query_log", "system.query_log")
      .scalars("hostname", "type", "event_date", "event_time", "event_time_microseconds",
          "query_start_time", "query_start_time_microseconds", "query_duration_ms",
          "read_rows", "read_bytes", "written_rows", "written_bytes", "result_rows", "result_bytes",
          "memory_usage", "current_database", "query", "formatted_query", "normalized_query_hash",
          "query_kind", "exception_code", "exception", "stack_trace", "is_initial_query", "user",
          "query_id", "address", "port", "initial_user", "initial_query_id", "initial_address",
          "initial_port", "initial_query_start_time", "initial_query_start_time_microseconds",
          "interface", "is_secure", "os_user", "client_hostname", "client_name", "client_revision",
          "client_version_major", "client_version_minor", "client_version_patch",
          "script_query_number", "script_line_number", "http_method", "http_user_agent",
          "http_referer", "forwarded_for", "quota_key", "distributed_depth", "revision",
          "log_comment", "peak_threads_usage", "ProfileEvents", "Settings", "transaction_id",
          "query_cache_usage", "asynchronous_read_counters")
      .arrays(QUERY_LOG_ARRAYS.toArray(String[]::new))
      .timeColumn("event_time")
      .search("query", "query_id")
      .sort(SortPolicy.knownFields("event_time"))
      .defaultLimit(1000)
      .countLabel("total")
      .histogram("client_name", "user", "type", "query_kind", "current_database",
          "exception_code", "is_initial_query", "client_hostname")
      .histogram(QUERY_LOG_ARRAYS)
      .distinct("client_name", "user", "type", "query_kind", "current_database",
          "exception_code", "is_initial_query", "client_hostname")
      .distinct(QUERY_LOG_ARRAYS)
      .bucket(Bucket.SECOND, "toStartOfSecond(event_time_microseconds)")
      .bucket(Bucket.MINUTE, "toStartOfMinute(event_time)")
      .bucket(Bucket.HOUR, "toStartOfHour(event_time)")
      .timeSeries(new TimeSeriesShape(concat(
          List.of("count() AS count"),
          TimeSeriesShape.stats("query_duration_ms", "duration"),
          TimeSeriesShape.stats("memory_usage", "memory"),
          TimeSeriesShape.stats("read_rows", "read_rows"),
          TimeSeriesShape.stats("written_rows", "written_rows"),
          TimeSeriesShape.stats("result_rows", "result_rows"))))
      .stacked(new StackedShape("query_kind", List.of("Select", "Insert", "Delete")))
      .build();

  public static final Dataset PART_LOG = Dataset.builder("part_log", "system.part_log")
      .scalars("hostname", "query_id", "event_type", "merge_reason", "merge_algorithm",
          "event_date", "event_time", "event_time_microseconds", "duration_ms", "database", "table",
          "table_uuid", "part_name", "partition_id", "partition", "part_type", "disk_name",
          "path_on_disk", "rows", "size_in_bytes", "bytes_uncompressed", "read_rows", "read_bytes",
          "peak_memory_usage", "error", "exception", "ProfileEvents")
      .arrays("merged_from")
      .timeColumn("event_time")
      .search("table", "database", "part_name")
      .sort(SortPolicy.knownFields("event_time"))
      .defaultLimit(2500)
      .countLabel("total")
      .histogram("table", "event_type", "merge_reason", "database", "merge_algorithm")
      .distinct("event_type", "database", "table", "part_name", "partition_id", "merge_reason", "merge_algorithm")
      .bucket(Bucket.SECOND, "event_time")
      .bucket(Bucket.MINUTE, "toStartOfMinute(event_time)")
      .bucket(Bucket.HOUR, "toStartOfHour(event_time)")
      .timeSeries(new TimeSeriesShape(concat(
          List.of("count() AS count",
              "sumIf(rows, event_type = 'NewPart') AS new_rows",
              "sumIf(rows, event_type = 'MergeParts') AS merged_rows"),
          TimeSeriesShape.stats("duration_ms", "duration"))))
      .stacked(new StackedShape("event_type",
          List.of("NewPart", "MergeParts", "DownloadPart", "RemovePart", "MutatePart")))
      .build();

  public static final Dataset TEXT_LOG = Dataset.builder("text_log", "system.text_log")
      .scalars("hostname", "event_date", "event_time", "event_time_microseconds", "thread_name",
          "thread_id", "level", "query_id", "logger_name", "message", "revision", "source_file",
          "source_line", "message_format_string", "value1", "value2", "value3", "value4", "value5",
          "value6", "value7", "value8", "value9", "value10")
      .timeColumn("event_time")
      .search("message", "logger_name")
      .sort(SortPolicy.allowList("event_time",
          Set.of("event_time", "level", "logger_name", "message", "thread_name", "thread_id", "query_id")))
      .defaultLimit(1000)
      .countLabel("total")
      .histogram("level", "logger_name", "thread_name", "query_id")
      .distinct("level", "logger_name", "thread_name", "query_id")
      .bucket(Bucket.SECOND, "toStartOfSecond(event_time_microseconds)")
      .bucket(Bucket.MINUTE, "toStartOfMinute(event_time)")
      .bucket(Bucket.HOUR, "toStartOfHour(event_time)")
      .timeSeries(new TimeSeriesShape(List.of(
          "count() AS count",
          "countIf(level = 'Error' OR level = 'Fatal') AS errors",
          "countIf(level = 'Warning') AS warnings")))
      .build();

  public static final Dataset PARTS = Dataset.builder("parts", "system.parts")
      .scalars("partition", "name", "uuid", "part_type", "active", "marks", "rows", "bytes_on_disk",
          "data_compressed_bytes", "data_uncompressed_bytes", "primary_key_size", "marks_bytes",
          "secondary_indices_compressed_bytes", "secondary_indices_uncompressed_bytes",
          "secondary_indices_marks_bytes", "modification_time", "remove_time", "refcount",
          "min_date", "max_date", "min_time", "max_time", "partition_id", "min_block_number",
          "max_block_number", "level", "data_version", "primary_key_bytes_in_memory",
          "primary_key_bytes_in_memory_allocated", "is_frozen", "database", "table", "engine",
          "disk_name", "path", "hash_of_all_files", "hash_of_uncompressed_files",
          "uncompressed_hash_of_compressed_files", "delete_ttl_info_min", "delete_ttl_info_max",
          "default_compression_codec", "visible", "has_lightweight_delete",
          "last_removal_attempt_time", "removal_state")
      .arrays("projections")
      .search("table", "database", "partition_id", "name")
      .sort(SortPolicy.knownFields("modification_time"))
      .defaultLimit(2500)
      .countLabel("count")
      .histogram("database", "table", "partition_id", "part_type", "active", "disk_name")
      .distinct("database", "table", "partition_id", "part_type", "active", "disk_name")
      .build();

  public static final Dataset PROCESSES = Dataset.builder("processes", "system.processes")
      .scalars("is_initial_query", "user", "query_id", "address", "port", "initial_user",
          "initial_query_id", "initial_address", "initial_port", "interface", "os_user",
          "client_hostname", "client_name", "client_revision", "client_version_major",
          "client_version_minor", "client_version_patch", "http_method", "http_user_agent",
          "http_referer", "forwarded_for", "quota_key", "distributed_depth", "elapsed",
          "is_cancelled", "is_all_data_sent", "read_rows", "read_bytes", "total_rows_approx",
          "written_rows", "written_bytes", "memory_usage", "peak_memory_usage", "query",
          "normalized_query_hash", "query_kind", "peak_threads_usage", "ProfileEvents", "Settings",
          "current_database", "is_internal")
      .arrays("thread_ids")
      .search("query", "query_id", "user")
      .sort(SortPolicy.fixed(new SortField("elapsed", DESC)))
      .distinct("user", "initial_user", "current_database", "query_kind", "client_name",
          "client_hostname", "os_user", "is_initial_query")
      .build();

  public static final Dataset MERGES = Dataset.builder("merges", "system.merges")
      .scalars("database", "table", "elapsed", "progress", "num_parts", "result_part_name",
          "result_part_path", "partition_id", "partition", "is_mutation",
          "total_size_bytes_compressed", "total_size_bytes_uncompressed", "total_size_marks",
          "bytes_read_uncompressed", "rows_read", "bytes_written_uncompressed", "rows_written",
          "columns_written", "memory_usage", "thread_id", "merge_type", "merge_algorithm")
      .arrays("source_part_names", "source_part_paths")
      .search("database", "table", "result_part_name")
      .sort(SortPolicy.fixed(new SortField("progress", DESC)))
      .distinct("database", "table", "partition_id", "merge_type", "merge_algorithm", "is_mutation")
      .build();

  public static final Dataset MUTATIONS = Dataset.builder("mutations", "system.mutations")
      .scalars("database", "table", "mutation_id", "command", "create_time", "parts_to_do",
          "is_done", "is_killed", "latest_failed_part", "latest_fail_time", "latest_fail_reason",
          "parts_postpone_reasons")
      .arrays("parts_to_do_names", "parts_in_progress_names")
      .search("database", "table", "command", "mutation_id")
      .sort(SortPolicy.fixed(new SortField("create_time", DESC)))
      .distinct("database", "table", "is_done", "is_killed")
      .build();

  public static final Dataset VIEW_REFRESHES = Dataset.builder("view_refreshes", "system.view_refreshes")
      .scalars("database", "view", "uuid", "status", "last_success_time", "last_success_duration_ms",
          "last_refresh_time", "last_refresh_replica", "next_refresh_time", "exception", "retry",
          "progress", "read_rows", "read_bytes", "total_rows", "written_rows", "written_bytes")
      .search("database", "view")
      .sort(SortPolicy.fixed(new SortField("next_refresh_time", ASC)))
      .distinct("database", "view", "status")
      .build();

  public static final Dataset PROJECTIONS = Dataset.builder("projections", "system.projections")
      .scalars("database", "table", "name", "type", "query")
      .arrays("sorting_key")
      .projection("database, table, name, type, sorting_key, query")
      .search("database", "table", "name")
      .sort(SortPolicy.fixed(new SortField("database", ASC), new SortField("table", ASC), new SortField("name", ASC)))
      .build();

  public static final Dataset INDEXES = Dataset.builder("indexes", "system.data_skipping_indices")
      .scalars("database", "table", "name", "type", "type_full", "expr", "granularity",
          "data_compressed_bytes", "data_uncompressed_bytes", "marks")
      .projection("database, table, name, type, type_full, expr, granularity, "
          + "data_compressed_bytes, data_uncompressed_bytes, marks")
      .search("database", "table", "name")
      .sort(SortPolicy.fixed(new SortField("database", ASC), new SortField("table", ASC), new SortField("name", ASC)))
      .build();

  /** Parts rolled up per table, largest first. */
  public static final SummaryShape PARTS_BY_TABLE = new SummaryShape(
      "parts_by_table",
      List.of("database", "table"),
      List.of("database", "table",
          "count(DISTINCT partition_id) AS partition_count",
          "count() AS part_count",
          "sum(rows) AS total_rows",
          "sum(bytes_on_disk) AS total_bytes",
          "sum(data_compressed_bytes) AS compressed_bytes",
          "sum(data_uncompressed_bytes) AS uncompressed_bytes",
          SAVINGS_PCT + " AS savings_pct",
          "max(modification_time) AS last_modification_time"),
      SortPolicy.fixed(new SortField("total_bytes", DESC)),
      null,
      List.of("table", "database"),
      null,
      null);

  private static final Set<String> PARTITION_SUMMARY_SORTABLE = Set.of(
      "database", "table", "partition_id", "partition", "parts_count", "total_rows", "total_bytes",
      "total_compressed", "total_uncompressed", "savings_pct", "latest_modification", "min_block", "max_block");

  /** Active parts rolled up per partition. */
  public static final SummaryShape PARTITIONS = new SummaryShape(
      "partitions",
      List.of("database", "table", "partition_id", "partition"),
      List.of("database", "table", "partition_id", "partition",
          "count() AS parts_count",
          "sum(rows) AS total_rows",
          "sum(bytes_on_disk) AS total_bytes",
          "sum(data_compressed_bytes) AS total_compressed",
          "sum(data_uncompressed_bytes) AS total_uncompressed",
          SAVINGS_PCT + " AS savings_pct",
          "max(modification_time) AS latest_modification",
          "min(min_block_number) AS min_block",
          "max(max_block_number) AS max_block"),
      SortPolicy.allowList("latest_modification", PARTITION_SUMMARY_SORTABLE, Map.of(
          "rows", "total_rows",
          "bytes_on_disk", "total_bytes",
          "modification_time", "latest_modification")),
      List.of("active = 1"),
      List.of("table", "database", "partition_id"),
      2500,
      List.of(
          new VirtualColumn("database", "String", "Database name"),
          new VirtualColumn("table", "String", "Table name"),
          new VirtualColumn("partition_id", "String", "Partition ID"),
          new VirtualColumn("partition", "String", "Partition value"),
          new VirtualColumn("parts_count", "UInt64", "Number of parts in partition"),
          new VirtualColumn("total_rows", "UInt64", "Total rows in partition"),
          new VirtualColumn("total_bytes", "UInt64", "Total bytes on disk"),
          new VirtualColumn("total_compressed", "UInt64", "Total compressed bytes"),
          new VirtualColumn("total_uncompressed", "UInt64", "Total uncompressed bytes"),
          new VirtualColumn("savings_pct", "Float64", "Compression savings percentage"),
          new VirtualColumn("latest_modification", "DateTime", "Latest modification time"),
          new VirtualColumn("min_block", "UInt64", "Minimum block number"),
          new VirtualColumn("max_block", "UInt64", "Maximum block number")));

  private static final Set<String> GROUPED_QUERY_SORTABLE = Set.of(
      "count", "total_duration", "avg_duration", "max_duration", "min_duration",
      "total_memory", "avg_memory", "max_memory", "total_read_rows", "avg_read_rows",
      "total_read_bytes", "total_result_rows", "avg_result_rows", "first_seen", "last_seen");

  private static final List<String> GROUPED_QUERY_MEASURES = List.of(
      "any(user) AS user",
      "any(current_database) AS current_database",
      "count() AS count",
      "sum(query_duration_ms) AS total_duration",
      "avg(query_duration_ms) AS avg_duration",
      "max(query_duration_ms) AS max_duration",
      "min(query_duration_ms) AS min_duration",
      "sum(memory_usage) AS total_memory",
      "avg(memory_usage) AS avg_memory",
      "max(memory_usage) AS max_memory",
      "sum(read_rows) AS total_read_rows",
      "avg(read_rows) AS avg_read_rows",
      "sum(read_bytes) AS total_read_bytes",
      "sum(written_rows) AS total_written_rows",
      "avg(written_rows) AS avg_written_rows",
      "sum(result_rows) AS total_result_rows",
      "avg(result_rows) AS avg_result_rows",
      "min(event_time) AS first_seen",
      "max(event_time) AS last_seen");

  /** Query log grouped by exact query text. */
  public static final SummaryShape QUERIES_BY_TEXT = new SummaryShape(
      "queries_by_text",
      List.of("query"),
      concat(List.of("any(query) AS example_query"), GROUPED_QUERY_MEASURES),
      SortPolicy.allowList("count", GROUPED_QUERY_SORTABLE),
      null, null, 1000, null);

  /** Query log grouped by normalized query hash (literals stripped). */
  public static final SummaryShape QUERIES_BY_HASH = new SummaryShape(
      "queries_by_hash",
      List.of("normalized_query_hash"),
      concat(List.of("any(query) AS example_query", "normalized_query_hash"), GROUPED_QUERY_MEASURES),
      SortPolicy.allowList("count", GROUPED_QUERY_SORTABLE),
      null, null, 1000, null);

  public static List<Dataset> all() {
    return List.of(QUERY_LOG, PART_LOG, TEXT_LOG, PARTS, PROCESSES, MERGES, MUTATIONS, VIEW_REFRESHES,
        PROJECTIONS, INDEXES);
  }

  public static List<SummaryShape> summaries() {
    return List.of(PARTS_BY_TABLE, PARTITIONS, QUERIES_BY_TEXT, QUERIES_BY_HASH);
  }

  @SafeVarargs
  private static List<String> concat(List<String>... parts) {
    List<String> out = new ArrayList<>();
    for (List<String> p : parts) out.addAll(p);
    return List.copyOf(out);
  }
}
