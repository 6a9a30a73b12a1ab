package io.intellixity.querydog.query;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonDeserializer;
import com.fasterxml.jackson.databind.JsonNode;

import java.io.IOException;
import java.util.*;

/** Accepts {@code {"field": ["v1", "v2"], ...}}; array elements must be scalars. */
public final class FilterRequestJsonDeserializer extends JsonDeserializer<FilterRequest> {
  @Override
  public FilterRequest deserialize(JsonParser p, DeserializationContext ctxt) throws IOException {
    JsonNode root = p.getCodec().readTree(p);
    if (root == null || root.isNull()) return FilterRequest.EMPTY;
    if (!root.isObject()) return ctxt.reportInputMismatch(this, "filters must be a JSON object");

    Map<String, List<String>> out = new LinkedHashMap<>();
    Iterator<Map.Entry<String, JsonNode>> it = root.fields();
    while (it.hasNext()) {
      Map.Entry<String, JsonNode> e = it.next();
      JsonNode v = e.getValue();
      if (v == null || v.isNull()) {
        out.put(e.getKey(), List.of());
        continue;
      }
      if (!v.isArray()) return ctxt.reportInputMismatch(this, "filters.%s must be an array", e.getKey());
      List<String> values = new ArrayList<>(v.size());
      for (JsonNode x : v) {
        if (!x.isValueNode() || x.isNull()) {
          return ctxt.reportInputMismatch(this, "filters.%s must contain only scalar values", e.getKey());
        }
        values.add(x.asText());
      }
      out.put(e.getKey(), values);
    }
    return new FilterRequest(out);
  }
}
