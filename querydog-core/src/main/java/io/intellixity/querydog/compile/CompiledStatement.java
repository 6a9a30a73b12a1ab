package io.intellixity.querydog.compile;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Final statement text with its named bindings. The only object handed to storage.
 * Placeholders in {@link #sql()} have the form {@code :name}; a name may occur more than once.
 */
public record CompiledStatement(String sql, Map<String, Bind> bindings) {
  public CompiledStatement {
    Objects.requireNonNull(sql, "sql");
    bindings = Collections.unmodifiableMap(new LinkedHashMap<>(bindings == null ? Map.of() : bindings));
  }

  public static CompiledStatement of(CharSequence sql, Bindings bindings) {
    return new CompiledStatement(sql.toString(), bindings.snapshot());
  }

  public static CompiledStatement unbound(String sql) {
    return new CompiledStatement(sql, Map.of());
  }
}
