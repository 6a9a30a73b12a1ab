package io.intellixity.querydog.query;

/** Inclusive numeric bounds; either side may be absent. */
public record RangeBounds(Long min, Long max) {
  public RangeBounds {
    if (min != null && min < 0) throw new IllegalArgumentException("min must be >= 0");
    if (max != null && max < 0) throw new IllegalArgumentException("max must be >= 0");
  }

  public boolean isEmpty() { return min == null && max == null; }
}
