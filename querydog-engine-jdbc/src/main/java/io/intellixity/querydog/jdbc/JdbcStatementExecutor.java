package io.intellixity.querydog.jdbc;

import io.intellixity.querydog.compile.Bind;
import io.intellixity.querydog.compile.CompiledStatement;
import io.intellixity.querydog.exec.StatementExecutor;
import io.intellixity.querydog.exec.StorageException;
import io.intellixity.querydog.jdbc.bind.JdbcBindContext;
import io.intellixity.querydog.jdbc.bind.JdbcParamBinders;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.*;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * {@link StatementExecutor} over a pooled JDBC {@link DataSource}.
 * <p>
 * Statements with bindings run as prepared statements with one marker per placeholder occurrence.
 * Unbound statements run as plain statements, so operator-written text is sent exactly as written.
 * Connections are borrowed per call; nothing is retried.
 */
public final class JdbcStatementExecutor implements StatementExecutor {
  private static final Logger log = LoggerFactory.getLogger(JdbcStatementExecutor.class);

  private final DataSource ds;
  private final JdbcParamBinders binders;

  public JdbcStatementExecutor(DataSource ds) {
    this(ds, new JdbcParamBinders());
  }

  public JdbcStatementExecutor(DataSource ds, JdbcParamBinders binders) {
    this.ds = Objects.requireNonNull(ds, "ds");
    this.binders = Objects.requireNonNull(binders, "binders");
  }

  @Override
  public List<Map<String, Object>> rows(CompiledStatement statement) {
    return run("ROWS", statement, JdbcRowReader::readAll);
  }

  @Override
  public List<String> textLines(CompiledStatement statement) {
    return run("TEXT", statement, JdbcRowReader::readLines);
  }

  @FunctionalInterface
  private interface ResultHandler<T> {
    T handle(JdbcRowReader reader) throws SQLException;
  }

  private <T extends List<?>> T run(String op, CompiledStatement st, ResultHandler<T> handler) {
    Objects.requireNonNull(st, "statement");
    long start = System.nanoTime();
    try (Connection c = ds.getConnection()) {
      T out;
      if (st.bindings().isEmpty()) {
        debugSql(op, st, st.sql(), List.of());
        try (Statement s = c.createStatement();
             ResultSet rs = s.executeQuery(st.sql())) {
          out = handler.handle(new JdbcRowReader(rs));
        }
      } else {
        NamedParamCompiler.JdbcSql jdbc = NamedParamCompiler.compile(st.sql(), st.bindings().keySet());
        debugSql(op, st, jdbc.sql(), jdbc.params());
        try (PreparedStatement ps = c.prepareStatement(jdbc.sql())) {
          bindAll(c, ps, jdbc.params(), st.bindings());
          try (ResultSet rs = ps.executeQuery()) {
            out = handler.handle(new JdbcRowReader(rs));
          }
        }
      }
      debugDone(op, out.size(), System.nanoTime() - start);
      return out;
    } catch (SQLException e) {
      throw new StorageException(e.getMessage(), e);
    }
  }

  private void bindAll(Connection c, PreparedStatement ps, List<String> params, Map<String, Bind> bindings)
      throws SQLException {
    for (int i = 0; i < params.size(); i++) {
      String name = params.get(i);
      binders.bind(ps, new JdbcBindContext(c, name, i + 1), bindings.get(name));
    }
  }

  private void debugSql(String op, CompiledStatement st, String jdbcSql, List<String> params) {
    if (!log.isDebugEnabled()) return;
    log.debug("querydog.jdbc op={} bindCount={} markerCount={} sql={}",
        op, st.bindings().size(), params.size(), jdbcSql);

    // TRACE: bind summary only, values may carry operator search text
    if (log.isTraceEnabled()) {
      int idx = 1;
      for (String name : params) {
        Bind b = st.bindings().get(name);
        Object v = b.value();
        log.trace("querydog.jdbc bind index={} name={} type={} valueType={}",
            idx++, name, b.type().clickHouseType(), v == null ? "null" : v.getClass().getSimpleName());
      }
    }
  }

  private void debugDone(String op, int rows, long durationNanos) {
    if (!log.isDebugEnabled()) return;
    log.debug("querydog.jdbc_done op={} durationMs={} rows={}", op, durationNanos / 1_000_000.0, rows);
  }
}
