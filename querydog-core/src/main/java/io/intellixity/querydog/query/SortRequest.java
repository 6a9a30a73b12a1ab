package io.intellixity.querydog.query;

/** Raw, unvalidated sort parameters as received from the client. Both parts may be null. */
public record SortRequest(String field, String order) {
  public static final SortRequest NONE = new SortRequest(null, null);
}
