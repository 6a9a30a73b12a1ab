package io.intellixity.querydog.server.service;

import io.intellixity.querydog.compile.CatalogStatements;
import io.intellixity.querydog.compile.CompiledStatement;
import io.intellixity.querydog.exec.StatementExecutor;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Map;
import java.util.Objects;

/** Fixed-shape catalog and server-state reads; path values are always bound. */
@Service
public final class CatalogService {
  private final StatementExecutor executor;

  public CatalogService(StatementExecutor executor) {
    this.executor = Objects.requireNonNull(executor, "executor");
  }

  public List<Map<String, Object>> databases() { return run(CatalogStatements.databases()); }
  public List<Map<String, Object>> tables(String database) { return run(CatalogStatements.tables(database)); }
  public List<Map<String, Object>> partitions(String database, String table) { return run(CatalogStatements.partitions(database, table)); }
  public List<Map<String, Object>> columns(String database, String table) { return run(CatalogStatements.columns(database, table)); }
  public List<Map<String, Object>> parts(String database, String table, String partitionId) {
    return run(CatalogStatements.parts(database, table, partitionId));
  }
  public List<Map<String, Object>> projections(String database, String table) { return run(CatalogStatements.projections(database, table)); }
  public List<Map<String, Object>> projectionParts(String database, String table, String projection) {
    return run(CatalogStatements.projectionParts(database, table, projection));
  }
  public List<Map<String, Object>> indexes(String database, String table) { return run(CatalogStatements.indexes(database, table)); }

  public List<Map<String, Object>> tableCompression(String database, String table) {
    return run(CatalogStatements.tableCompression(database, table));
  }

  public List<Map<String, Object>> partitionParts(String database, String table, String partitionId, boolean activeOnly) {
    return run(CatalogStatements.partitionParts(database, table, partitionId, activeOnly));
  }

  public List<Map<String, Object>> tablePartitions(String database, String table, boolean activeOnly) {
    return run(CatalogStatements.tablePartitions(database, table, activeOnly));
  }

  public List<Map<String, Object>> metrics() { return run(CatalogStatements.metrics()); }
  public List<Map<String, Object>> asyncMetrics() { return run(CatalogStatements.asyncMetrics()); }
  public List<Map<String, Object>> events() { return run(CatalogStatements.events()); }
  public List<Map<String, Object>> users() { return run(CatalogStatements.users()); }
  public List<Map<String, Object>> settings() { return run(CatalogStatements.settings()); }

  private List<Map<String, Object>> run(CompiledStatement st) {
    return executor.rows(st);
  }
}
