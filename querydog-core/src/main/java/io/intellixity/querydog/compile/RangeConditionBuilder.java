package io.intellixity.querydog.compile;

import io.intellixity.querydog.query.Identifiers;
import io.intellixity.querydog.query.RangeBounds;
import io.intellixity.querydog.query.RangeFilterRequest;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.function.Predicate;

/** Emits {@code f >= :f_min} and/or {@code f <= :f_max}, bound as UInt64. */
public final class RangeConditionBuilder {
  private RangeConditionBuilder() {}

  /**
   * @param acceptField extra membership test applied after the identifier check
   */
  public static List<String> build(RangeFilterRequest request, Predicate<String> acceptField, Bindings bindings) {
    if (request == null || request.isEmpty()) return List.of();
    List<String> out = new ArrayList<>();
    for (Map.Entry<String, RangeBounds> e : request.ranges().entrySet()) {
      String field = e.getKey();
      RangeBounds r = e.getValue();
      if (!Identifiers.isValid(field) || !acceptField.test(field) || r == null) continue;
      if (r.min() != null) out.add(field + " >= " + bindings.add(field + "_min", r.min(), ParamType.UINT64));
      if (r.max() != null) out.add(field + " <= " + bindings.add(field + "_max", r.max(), ParamType.UINT64));
    }
    return out;
  }
}
