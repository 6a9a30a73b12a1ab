package io.intellixity.querydog.compile;

import io.intellixity.querydog.dataset.FieldKind;
import io.intellixity.querydog.query.Identifiers;

import java.util.List;
import java.util.Optional;

/**
 * One predicate per (field, values) pair:
 * scalars compare by string cast ({@code toString(f) IN :filter_n}),
 * arrays by intersection ({@code hasAny(f, :filter_n)}).
 */
public final class ConditionBuilder {
  static final String PARAM_PREFIX = "filter";

  private ConditionBuilder() {}

  /** Empty when the pair cannot produce a well-formed predicate; in that case nothing is bound. */
  public static Optional<String> build(String field, List<String> values, FieldKind kind, Bindings bindings) {
    if (values == null || values.isEmpty()) return Optional.empty();
    if (kind == null || kind == FieldKind.UNKNOWN || !Identifiers.isValid(field)) return Optional.empty();

    String param = bindings.addIndexed(PARAM_PREFIX, values, ParamType.ARRAY_STRING);
    return Optional.of(switch (kind) {
      case SCALAR -> "toString(" + field + ") IN " + param;
      case ARRAY_OF_STRING -> "hasAny(" + field + ", " + param + ")";
      case UNKNOWN -> throw new IllegalStateException("unreachable");
    });
  }
}
