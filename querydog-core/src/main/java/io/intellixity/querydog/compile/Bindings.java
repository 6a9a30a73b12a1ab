package io.intellixity.querydog.compile;

import io.intellixity.querydog.query.Identifiers;

import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Ordered, append-only parameter set built while compiling one statement.
 * Each {@code add} returns the placeholder to splice into the statement text ({@code :name}).
 */
public final class Bindings {
  private final Map<String, Bind> binds = new LinkedHashMap<>();
  private final Map<String, Integer> counters = new HashMap<>();

  public String add(String name, Object value, ParamType type) {
    if (!Identifiers.isValid(name)) throw new IllegalArgumentException("Invalid parameter name: " + name);
    if (binds.containsKey(name)) throw new IllegalStateException("Duplicate parameter: " + name);
    binds.put(name, new Bind(value, type));
    return ":" + name;
  }

  /** Adds {@code <prefix>_<n>} where n counts up from 0 per prefix. */
  public String addIndexed(String prefix, Object value, ParamType type) {
    int n = counters.merge(prefix, 1, Integer::sum) - 1;
    return add(prefix + "_" + n, value, type);
  }

  public boolean contains(String name) { return binds.containsKey(name); }
  public int size() { return binds.size(); }

  public Map<String, Bind> snapshot() {
    return Collections.unmodifiableMap(new LinkedHashMap<>(binds));
  }
}
