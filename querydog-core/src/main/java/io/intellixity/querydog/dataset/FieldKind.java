package io.intellixity.querydog.dataset;

public enum FieldKind {
  /** Compared by exact string-cast equality. */
  SCALAR,
  /** Array column, compared by "contains any of". */
  ARRAY_OF_STRING,
  /** Not in the dataset's field table; never compiled into a condition. */
  UNKNOWN
}
