package io.intellixity.querydog.compile;

import java.util.List;
import java.util.Objects;

/** A typed parameter value. Array values are copied into an immutable list of strings. */
public record Bind(Object value, ParamType type) {
  public Bind {
    Objects.requireNonNull(type, "type");
    if (type == ParamType.ARRAY_STRING) {
      if (!(value instanceof List<?> l)) throw new IllegalArgumentException("Array(String) bind requires a List");
      value = l.stream().map(String::valueOf).toList();
    }
  }
}
