package io.intellixity.querydog.query;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonDeserializer;
import com.fasterxml.jackson.databind.JsonNode;

import java.io.IOException;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Accepts {@code {"field": {"min": 10, "max": 200}, ...}}.
 * Bounds are non-negative integers, given either as JSON numbers or digit strings.
 */
public final class RangeFilterRequestJsonDeserializer extends JsonDeserializer<RangeFilterRequest> {
  @Override
  public RangeFilterRequest deserialize(JsonParser p, DeserializationContext ctxt) throws IOException {
    JsonNode root = p.getCodec().readTree(p);
    if (root == null || root.isNull()) return RangeFilterRequest.EMPTY;
    if (!root.isObject()) return ctxt.reportInputMismatch(this, "rangeFilters must be a JSON object");

    Map<String, RangeBounds> out = new LinkedHashMap<>();
    Iterator<Map.Entry<String, JsonNode>> it = root.fields();
    while (it.hasNext()) {
      Map.Entry<String, JsonNode> e = it.next();
      JsonNode r = e.getValue();
      if (r == null || r.isNull()) continue;
      if (!r.isObject()) return ctxt.reportInputMismatch(this, "rangeFilters.%s must be an object", e.getKey());
      Long min = boundOrNull(r.get("min"), e.getKey() + ".min", ctxt);
      Long max = boundOrNull(r.get("max"), e.getKey() + ".max", ctxt);
      out.put(e.getKey(), new RangeBounds(min, max));
    }
    return new RangeFilterRequest(out);
  }

  private Long boundOrNull(JsonNode n, String path, DeserializationContext ctxt) throws IOException {
    if (n == null || n.isNull()) return null;
    if (n.isIntegralNumber() && n.canConvertToLong() && n.asLong() >= 0) return n.asLong();
    if (n.isTextual() && n.asText().matches("\\d{1,18}")) return Long.parseLong(n.asText());
    return ctxt.reportInputMismatch(this, "rangeFilters.%s must be a non-negative integer", path);
  }
}
