package io.intellixity.querydog.server;

import io.intellixity.querydog.compile.CompiledStatement;
import io.intellixity.querydog.exec.StatementExecutor;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/** Captures statements and replays canned results. */
public final class FakeStatementExecutor implements StatementExecutor {
  public final List<CompiledStatement> seen = new ArrayList<>();
  public List<Map<String, Object>> rows = List.of();
  public List<String> lines = List.of();

  @Override
  public List<Map<String, Object>> rows(CompiledStatement statement) {
    seen.add(statement);
    return rows;
  }

  @Override
  public List<String> textLines(CompiledStatement statement) {
    seen.add(statement);
    return lines;
  }

  public CompiledStatement last() { return seen.get(seen.size() - 1); }
}
