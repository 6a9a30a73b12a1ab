package io.intellixity.querydog.exec;

import java.util.List;
import java.util.Map;

/**
 * @param duration wall-clock execution time in milliseconds
 */
public record AdHocResult(List<Map<String, Object>> data, int rowCount, long duration) {
  public AdHocResult {
    data = (data == null) ? List.of() : data;
  }

  public static AdHocResult of(List<Map<String, Object>> data, long durationMs) {
    return new AdHocResult(data, data == null ? 0 : data.size(), durationMs);
  }
}
