package io.intellixity.querydog.dataset;

import java.util.*;

/** In-memory lookup of datasets and summary shapes by id. */
public final class DatasetCatalog {
  private final Map<String, Dataset> datasets = new LinkedHashMap<>();
  private final Map<String, SummaryShape> summaries = new LinkedHashMap<>();

  public DatasetCatalog(Collection<Dataset> datasets, Collection<SummaryShape> summaries) {
    for (Dataset d : datasets) {
      if (this.datasets.putIfAbsent(d.id(), d) != null) throw new IllegalArgumentException("Duplicate dataset: " + d.id());
    }
    for (SummaryShape s : summaries) {
      if (this.summaries.putIfAbsent(s.id(), s) != null) throw new IllegalArgumentException("Duplicate summary: " + s.id());
    }
  }

  public static DatasetCatalog standard() {
    return new DatasetCatalog(SystemDatasets.all(), SystemDatasets.summaries());
  }

  public Dataset get(String id) {
    Dataset d = datasets.get(id);
    if (d == null) throw new IllegalArgumentException("Unknown dataset: " + id);
    return d;
  }

  public SummaryShape summary(String id) {
    SummaryShape s = summaries.get(id);
    if (s == null) throw new IllegalArgumentException("Unknown summary: " + id);
    return s;
  }

  public Collection<Dataset> all() { return Collections.unmodifiableCollection(datasets.values()); }
}
