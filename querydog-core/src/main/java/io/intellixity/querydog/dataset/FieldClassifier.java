package io.intellixity.querydog.dataset;

public final class FieldClassifier {
  private FieldClassifier() {}

  public static FieldKind classify(Dataset dataset, String field) {
    if (dataset == null || field == null) return FieldKind.UNKNOWN;
    FieldSpec spec = dataset.field(field);
    return (spec == null) ? FieldKind.UNKNOWN : spec.kind();
  }
}
