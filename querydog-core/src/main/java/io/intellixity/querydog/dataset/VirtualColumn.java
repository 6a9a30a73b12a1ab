package io.intellixity.querydog.dataset;

/** Column metadata for a derived view that has no backing table in {@code system.columns}. */
public record VirtualColumn(String name, String type, String comment) {}
