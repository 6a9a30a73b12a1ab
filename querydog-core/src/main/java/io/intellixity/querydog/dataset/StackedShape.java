package io.intellixity.querydog.dataset;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/** Conditional counts of {@code column} per category, plus an {@code Other} catch-all. */
public record StackedShape(String column, List<String> categories) {
  public static final String OTHER = "Other";

  public StackedShape {
    Objects.requireNonNull(column, "column");
    categories = List.copyOf(Objects.requireNonNull(categories, "categories"));
    if (categories.isEmpty()) throw new IllegalArgumentException("categories must not be empty");
  }

  public List<String> projections() {
    List<String> out = new ArrayList<>(categories.size() + 1);
    for (String c : categories) out.add("countIf(" + column + " = '" + c + "') AS `" + c + "`");
    String all = categories.stream().map(c -> "'" + c + "'").collect(Collectors.joining(", "));
    out.add("countIf(" + column + " NOT IN (" + all + ")) AS " + OTHER);
    return out;
  }
}
