package io.intellixity.querydog.exec;

import io.intellixity.querydog.compile.CompiledStatement;

import java.util.List;
import java.util.Map;

/**
 * Storage collaborator. Implementations must be safe for concurrent use by in-flight requests.
 * Failures surface as {@link StorageException}; nothing is retried.
 */
public interface StatementExecutor {
  /** Rows as ordered column-label to value maps. */
  List<Map<String, Object>> rows(CompiledStatement statement);

  /** Plain-text result: the first column of every row, split on line breaks. Blank lines are kept. */
  List<String> textLines(CompiledStatement statement);
}
