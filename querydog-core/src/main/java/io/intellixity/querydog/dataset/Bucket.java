package io.intellixity.querydog.dataset;

/** Time-series truncation granularity. */
public enum Bucket {
  SECOND, MINUTE, HOUR;

  /** Unrecognized or missing tokens fall back to {@link #MINUTE}. */
  public static Bucket parse(String token) {
    if ("second".equals(token)) return SECOND;
    if ("hour".equals(token)) return HOUR;
    return MINUTE;
  }
}
