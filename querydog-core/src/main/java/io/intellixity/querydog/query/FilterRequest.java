package io.intellixity.querydog.query;

import com.fasterxml.jackson.databind.annotation.JsonDeserialize;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Field to requested-values mapping, in client order.
 * Entries may carry empty lists; the compiler drops those.
 */
@JsonDeserialize(using = FilterRequestJsonDeserializer.class)
public record FilterRequest(Map<String, List<String>> values) {
  public static final FilterRequest EMPTY = new FilterRequest(Map.of());

  public FilterRequest {
    Map<String, List<String>> copy = new LinkedHashMap<>();
    if (values != null) values.forEach((k, v) -> copy.put(k, v == null ? List.of() : List.copyOf(v)));
    values = Collections.unmodifiableMap(copy);
  }

  public boolean isEmpty() { return values.isEmpty(); }
}
