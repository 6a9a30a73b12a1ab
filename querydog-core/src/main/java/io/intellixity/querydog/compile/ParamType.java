package io.intellixity.querydog.compile;

/** ClickHouse parameter types a compiled statement may bind. */
public enum ParamType {
  ARRAY_STRING("Array(String)"),
  UINT64("UInt64"),
  UINT32("UInt32"),
  DATETIME("DateTime"),
  STRING("String");

  private final String clickHouseType;

  ParamType(String clickHouseType) {
    this.clickHouseType = clickHouseType;
  }

  public String clickHouseType() { return clickHouseType; }
}
