package io.intellixity.querydog.compile;

/**
 * Fixed-shape reads of table, partition and server metadata.
 * Path values (database, table, partition, projection) are always bound, never spliced.
 */
public final class CatalogStatements {
  private CatalogStatements() {}

  /** Column metadata of a {@code system.<table>} introspection table. */
  public static CompiledStatement systemColumns(String systemTable) {
    Bindings b = new Bindings();
    String sql = "SELECT name, type, comment FROM system.columns WHERE database = 'system' AND table = "
        + b.add("table", systemTable, ParamType.STRING) + " ORDER BY position";
    return CompiledStatement.of(sql, b);
  }

  public static CompiledStatement tableCompression(String database, String table) {
    Bindings b = new Bindings();
    String sql = "SELECT name, type, sum(data_compressed_bytes) AS compressed_bytes, "
        + "sum(data_uncompressed_bytes) AS uncompressed_bytes, "
        + "round((sum(data_uncompressed_bytes) - sum(data_compressed_bytes)) / nullIf(sum(data_uncompressed_bytes), 0) * 100, 1) AS savings_pct "
        + "FROM system.columns WHERE " + tableKey(database, table, b)
        + " GROUP BY name, type ORDER BY compressed_bytes DESC";
    return CompiledStatement.of(sql, b);
  }

  public static CompiledStatement partitionParts(String database, String table, String partitionId, boolean activeOnly) {
    Bindings b = new Bindings();
    String sql = "SELECT name, rows, bytes_on_disk, data_compressed_bytes, data_uncompressed_bytes, marks, "
        + "modification_time, min_block_number, max_block_number, level, primary_key_bytes_in_memory, active "
        + "FROM system.parts WHERE " + tableKey(database, table, b)
        + " AND partition_id = " + b.add("partition", partitionId, ParamType.STRING)
        + (activeOnly ? " AND active = 1" : "")
        + " ORDER BY modification_time DESC";
    return CompiledStatement.of(sql, b);
  }

  public static CompiledStatement tablePartitions(String database, String table, boolean activeOnly) {
    Bindings b = new Bindings();
    String sql = "SELECT partition_id, count() AS parts_count, sum(rows) AS total_rows, "
        + "sum(bytes_on_disk) AS total_bytes, min(min_block_number) AS min_block, "
        + "max(max_block_number) AS max_block, min(modification_time) AS oldest_part, "
        + "max(modification_time) AS newest_part "
        + "FROM system.parts WHERE " + tableKey(database, table, b)
        + (activeOnly ? " AND active = 1" : "")
        + " GROUP BY partition_id ORDER BY partition_id";
    return CompiledStatement.of(sql, b);
  }

  // Browser tree

  public static CompiledStatement databases() {
    return CompiledStatement.unbound("SELECT name, engine, data_path, metadata_path, uuid FROM system.databases "
        + "WHERE name != 'information_schema' ORDER BY name");
  }

  public static CompiledStatement tables(String database) {
    Bindings b = new Bindings();
    String sql = "SELECT name, engine, total_rows, total_bytes, metadata_modification_time FROM system.tables "
        + "WHERE database = " + b.add("database", database, ParamType.STRING) + " ORDER BY name";
    return CompiledStatement.of(sql, b);
  }

  public static CompiledStatement partitions(String database, String table) {
    Bindings b = new Bindings();
    String sql = "SELECT partition_id, partition, count() AS part_count, sum(rows) AS total_rows, "
        + "sum(bytes_on_disk) AS total_bytes, min(min_time) AS min_time, max(max_time) AS max_time "
        + "FROM system.parts WHERE " + tableKey(database, table, b) + " AND active = 1 "
        + "GROUP BY partition_id, partition ORDER BY partition_id";
    return CompiledStatement.of(sql, b);
  }

  public static CompiledStatement columns(String database, String table) {
    Bindings b = new Bindings();
    String sql = "SELECT name, type, default_kind, default_expression, comment, is_in_partition_key, "
        + "is_in_sorting_key, is_in_primary_key, compression_codec FROM system.columns WHERE "
        + tableKey(database, table, b) + " ORDER BY position";
    return CompiledStatement.of(sql, b);
  }

  public static CompiledStatement parts(String database, String table, String partitionId) {
    Bindings b = new Bindings();
    String sql = "SELECT name, partition_id, rows, bytes_on_disk, data_compressed_bytes, data_uncompressed_bytes, "
        + "marks, modification_time, min_time, max_time, level, primary_key_bytes_in_memory "
        + "FROM system.parts WHERE " + tableKey(database, table, b)
        + " AND partition_id = " + b.add("partition", partitionId, ParamType.STRING)
        + " AND active = 1 ORDER BY name";
    return CompiledStatement.of(sql, b);
  }

  public static CompiledStatement projections(String database, String table) {
    Bindings b = new Bindings();
    String sql = "SELECT name, type, sorting_key, query, toString(storage_policy) AS storage_policy, "
        + "toString(partition_key) AS partition_key, toString(primary_key) AS primary_key "
        + "FROM system.projections WHERE " + tableKey(database, table, b) + " ORDER BY name";
    return CompiledStatement.of(sql, b);
  }

  public static CompiledStatement projectionParts(String database, String table, String projection) {
    Bindings b = new Bindings();
    String sql = "SELECT name, part_name, partition_id, rows, bytes_on_disk, data_compressed_bytes, "
        + "data_uncompressed_bytes, marks, modification_time, parent_part_name, is_broken "
        + "FROM system.projection_parts WHERE " + tableKey(database, table, b)
        + " AND name = " + b.add("projection", projection, ParamType.STRING)
        + " AND active = 1 ORDER BY part_name";
    return CompiledStatement.of(sql, b);
  }

  public static CompiledStatement indexes(String database, String table) {
    Bindings b = new Bindings();
    String sql = "SELECT name, type, type_full, expr, granularity, data_compressed_bytes, "
        + "data_uncompressed_bytes, marks FROM system.data_skipping_indices WHERE "
        + tableKey(database, table, b) + " ORDER BY name";
    return CompiledStatement.of(sql, b);
  }

  // Server state

  public static CompiledStatement metrics() {
    return CompiledStatement.unbound("SELECT * FROM system.metrics ORDER BY metric");
  }

  public static CompiledStatement asyncMetrics() {
    return CompiledStatement.unbound("SELECT * FROM system.asynchronous_metrics ORDER BY metric");
  }

  public static CompiledStatement events() {
    return CompiledStatement.unbound("SELECT event, value, description FROM system.events ORDER BY event");
  }

  public static CompiledStatement users() {
    return CompiledStatement.unbound("SELECT * FROM system.users ORDER BY name");
  }

  public static CompiledStatement settings() {
    return CompiledStatement.unbound("SELECT * FROM system.settings ORDER BY name");
  }

  private static String tableKey(String database, String table, Bindings b) {
    return "database = " + b.add("database", database, ParamType.STRING)
        + " AND table = " + b.add("table", table, ParamType.STRING);
  }
}
