package io.intellixity.querydog.dataset;

import java.util.List;
import java.util.Objects;

/** Fixed aggregate projections of a bucketed time series. Projections are trusted constant text. */
public record TimeSeriesShape(List<String> projections) {
  public TimeSeriesShape {
    projections = List.copyOf(Objects.requireNonNull(projections, "projections"));
  }

  /** avg/max/min/sum of {@code column}, aliased {@code <agg>_<alias>}. */
  public static List<String> stats(String column, String alias) {
    return List.of(
        "avg(" + column + ") AS avg_" + alias,
        "max(" + column + ") AS max_" + alias,
        "min(" + column + ") AS min_" + alias,
        "sum(" + column + ") AS sum_" + alias);
  }
}
