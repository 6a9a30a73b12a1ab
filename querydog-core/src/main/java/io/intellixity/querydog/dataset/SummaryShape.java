package io.intellixity.querydog.dataset;

import java.util.List;
import java.util.Objects;

/**
 * A grouped read over a dataset: fixed key tuple, fixed aggregate projections.
 *
 * @param searchColumns overrides the dataset's search columns when non-null
 * @param defaultLimit page size, or null for an unpaged summary
 * @param columns column metadata of the derived rows, or empty when not published
 */
public record SummaryShape(String id,
                           List<String> keys,
                           List<String> projections,
                           SortPolicy sort,
                           List<String> fixedPredicates,
                           List<String> searchColumns,
                           Integer defaultLimit,
                           List<VirtualColumn> columns) {
  public SummaryShape {
    Objects.requireNonNull(id, "id");
    keys = List.copyOf(Objects.requireNonNull(keys, "keys"));
    projections = List.copyOf(Objects.requireNonNull(projections, "projections"));
    Objects.requireNonNull(sort, "sort");
    fixedPredicates = (fixedPredicates == null) ? List.of() : List.copyOf(fixedPredicates);
    searchColumns = (searchColumns == null) ? null : List.copyOf(searchColumns);
    columns = (columns == null) ? List.of() : List.copyOf(columns);
    if (keys.isEmpty()) throw new IllegalArgumentException("keys must not be empty");
  }

  public boolean paged() { return defaultLimit != null; }
}
