package io.intellixity.querydog.dataset;

import java.util.Objects;

public record FieldSpec(String name, FieldKind kind) {
  public FieldSpec {
    Objects.requireNonNull(name, "name");
    Objects.requireNonNull(kind, "kind");
    if (kind == FieldKind.UNKNOWN) throw new IllegalArgumentException("FieldSpec kind cannot be UNKNOWN: " + name);
  }

  public static FieldSpec scalar(String name) { return new FieldSpec(name, FieldKind.SCALAR); }
  public static FieldSpec array(String name) { return new FieldSpec(name, FieldKind.ARRAY_OF_STRING); }
}
