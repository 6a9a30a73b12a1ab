package io.intellixity.querydog.query;

import java.util.Objects;

public record SortField(String field, Direction direction) {
  public SortField {
    Objects.requireNonNull(field, "field");
    direction = (direction == null) ? Direction.DESC : direction;
  }

  public String render() { return field + " " + direction.name(); }

  public enum Direction {
    ASC, DESC;

    /** Only the exact token "ASC" sorts ascending; anything else (including null or "asc") is DESC. */
    public static Direction parse(String order) {
      return "ASC".equals(order) ? ASC : DESC;
    }
  }
}
