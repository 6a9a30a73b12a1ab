package io.intellixity.querydog.exec;

import io.intellixity.querydog.compile.CompiledStatement;
import io.intellixity.querydog.query.QueryValidationException;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Collectors;

import static io.intellixity.querydog.query.QueryValidationException.Reason.INVALID_EXPLAIN_MODE;
import static io.intellixity.querydog.query.QueryValidationException.Reason.MISSING_QUERY;

/**
 * Runs {@code EXPLAIN <mode> <query>}. Plain-text modes come back as one {@code {"explain": line}}
 * row per non-blank line, so every mode yields the same row-array shape.
 */
public final class ExplainDispatcher {
  public static final String TEXT_COLUMN = "explain";

  private final StatementExecutor executor;

  public ExplainDispatcher(StatementExecutor executor) {
    this.executor = Objects.requireNonNull(executor, "executor");
  }

  public List<Map<String, Object>> dispatch(String modeToken, String rawQuery) {
    if (rawQuery == null || rawQuery.isBlank()) throw new QueryValidationException(MISSING_QUERY, "Query is required");
    ExplainMode mode = ExplainMode.fromToken(modeToken)
        .orElseThrow(() -> new QueryValidationException(INVALID_EXPLAIN_MODE, "Invalid explain type: " + modeToken));
    return dispatch(mode, rawQuery);
  }

  public List<Map<String, Object>> dispatch(ExplainMode mode, String rawQuery) {
    if (rawQuery == null || rawQuery.isBlank()) throw new QueryValidationException(MISSING_QUERY, "Query is required");
    CompiledStatement stmt = CompiledStatement.unbound(mode.prefix() + " " + rawQuery.trim());
    if (!mode.plainText()) return executor.rows(stmt);

    return executor.textLines(stmt).stream()
        .filter(line -> !line.isBlank())
        .map(ExplainDispatcher::row)
        .collect(Collectors.toList());
  }

  private static Map<String, Object> row(String line) {
    Map<String, Object> m = new LinkedHashMap<>();
    m.put(TEXT_COLUMN, line);
    return m;
  }
}
