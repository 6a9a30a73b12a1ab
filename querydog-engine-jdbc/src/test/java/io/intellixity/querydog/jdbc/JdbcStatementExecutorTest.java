package io.intellixity.querydog.jdbc;

import io.intellixity.querydog.compile.Bindings;
import io.intellixity.querydog.compile.CompiledStatement;
import io.intellixity.querydog.compile.ParamType;
import io.intellixity.querydog.exec.AdHocQueryGateway;
import io.intellixity.querydog.exec.StorageException;
import org.junit.jupiter.api.Test;

import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.*;

import static org.junit.jupiter.api.Assertions.*;

final class JdbcStatementExecutorTest {
  @Test
  void boundStatementIsPreparedAndBoundPerMarker() {
    FakeJdbc jdbc = new FakeJdbc(List.of("user", "total"), List.<Object[]>of(new Object[]{"default", 3L}));
    JdbcStatementExecutor exec = new JdbcStatementExecutor(jdbc.dataSource());

    Bindings b = new Bindings();
    String sql = "SELECT user, count() AS total FROM t WHERE (a ILIKE " + b.add("search", "%x%", ParamType.STRING)
        + " OR c ILIKE :search) AND toString(user) IN " + b.addIndexed("filter", List.of("default", "etl"), ParamType.ARRAY_STRING)
        + " AND event_time >= " + b.add("start", "2024-05-01 10:00:00", ParamType.DATETIME)
        + " LIMIT " + b.add("limit", 10, ParamType.UINT32);

    List<Map<String, Object>> rows = exec.rows(CompiledStatement.of(sql, b));

    assertEquals(List.of(Map.of("user", "default", "total", 3L)), rows);
    assertEquals(List.of(
        "prepare SELECT user, count() AS total FROM t WHERE (a ILIKE ? OR c ILIKE ?) AND toString(user) IN ? AND event_time >= ? LIMIT ?",
        "setString 1 %x%",
        "setString 2 %x%",
        "setArray 3 String[default, etl]",
        "setString 4 2024-05-01 10:00:00",
        "setLong 5 10"), jdbc.calls);
    assertEquals(0, jdbc.openConnections);
  }

  @Test
  void adHocLimitIsBoundPastEscapedQuotesAndComments() {
    FakeJdbc jdbc = new FakeJdbc(List.of("user"), List.<Object[]>of(new Object[]{"O'Brien"}));
    JdbcStatementExecutor exec = new JdbcStatementExecutor(jdbc.dataSource());
    AdHocQueryGateway gateway = new AdHocQueryGateway(exec, 100);

    gateway.execute("SELECT user FROM system.query_log WHERE user = 'O\\'Brien' -- who's that", 5);

    assertEquals(List.of(
        "prepare SELECT user FROM system.query_log WHERE user = 'O\\'Brien' -- who's that\nLIMIT ?",
        "setLong 1 5"), jdbc.calls);
  }

  @Test
  void unboundStatementRunsAsWritten() {
    FakeJdbc jdbc = new FakeJdbc(List.of("x"), List.<Object[]>of(new Object[]{1}));
    JdbcStatementExecutor exec = new JdbcStatementExecutor(jdbc.dataSource());

    exec.rows(CompiledStatement.unbound("SELECT ? AS x, ':name'"));

    assertEquals(List.of("create", "execute SELECT ? AS x, ':name'"), jdbc.calls);
  }

  @Test
  void valuesAreNormalizedForJson() {
    UUID id = UUID.fromString("7f1c0a4e-1b2c-4d3e-8f90-123456789abc");
    Map<String, Long> events = new TreeMap<>(Map.of("SelectedRows", 5L));
    FakeJdbc jdbc = new FakeJdbc(
        List.of("event_time", "event_time_microseconds", "event_date", "query_id", "databases", "ProfileEvents", "thread_ids"),
        List.<Object[]>of(new Object[]{
            Timestamp.valueOf(LocalDateTime.of(2024, 5, 1, 10, 0, 5)),
            LocalDateTime.of(2024, 5, 1, 10, 0, 5, 123_456_000),
            LocalDate.of(2024, 5, 1),
            id,
            FakeJdbc.array(new String[]{"db1", "db2"}),
            events,
            new long[]{7L, 8L}}));

    Map<String, Object> row = new JdbcStatementExecutor(jdbc.dataSource())
        .rows(CompiledStatement.unbound("SELECT * FROM system.query_log")).get(0);

    assertEquals("2024-05-01 10:00:05", row.get("event_time"));
    assertEquals("2024-05-01 10:00:05.123456", row.get("event_time_microseconds"));
    assertEquals("2024-05-01", row.get("event_date"));
    assertEquals(id.toString(), row.get("query_id"));
    assertEquals(List.of("db1", "db2"), row.get("databases"));
    assertEquals(Map.of("SelectedRows", 5L), row.get("ProfileEvents"));
    assertEquals(List.of(7L, 8L), row.get("thread_ids"));
    assertEquals(List.of("event_time", "event_time_microseconds", "event_date", "query_id", "databases",
        "ProfileEvents", "thread_ids"), new ArrayList<>(row.keySet()));
  }

  @Test
  void textLinesSplitFirstColumn() {
    FakeJdbc jdbc = new FakeJdbc(List.of("explain"), List.<Object[]>of(
        new Object[]{"SelectWithUnionQuery (children 1)\n ExpressionList"},
        new Object[]{"  SelectQuery"}));

    List<String> lines = new JdbcStatementExecutor(jdbc.dataSource())
        .textLines(CompiledStatement.unbound("EXPLAIN AST SELECT 1"));

    assertEquals(List.of("SelectWithUnionQuery (children 1)", " ExpressionList", "  SelectQuery"), lines);
  }

  @Test
  void driverFailuresSurfaceAsStorageErrors() {
    FakeJdbc jdbc = new FakeJdbc(List.of(), List.of());
    jdbc.failure = new SQLException("Code: 60. DB::Exception: Table default.nope does not exist");

    StorageException ex = assertThrows(StorageException.class,
        () -> new JdbcStatementExecutor(jdbc.dataSource()).rows(CompiledStatement.unbound("SELECT * FROM nope")));

    assertEquals("Code: 60. DB::Exception: Table default.nope does not exist", ex.getMessage());
    assertSame(jdbc.failure, ex.getCause());
    assertEquals(0, jdbc.openConnections);
  }
}
