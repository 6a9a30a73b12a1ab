package io.intellixity.querydog.query;

import com.fasterxml.jackson.databind.annotation.JsonDeserialize;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

@JsonDeserialize(using = RangeFilterRequestJsonDeserializer.class)
public record RangeFilterRequest(Map<String, RangeBounds> ranges) {
  public static final RangeFilterRequest EMPTY = new RangeFilterRequest(Map.of());

  public RangeFilterRequest {
    ranges = Collections.unmodifiableMap(new LinkedHashMap<>(ranges == null ? Map.of() : ranges));
  }

  public boolean isEmpty() { return ranges.isEmpty(); }
}
