package io.intellixity.querydog.query;

import java.util.Locale;
import java.util.Objects;

/**
 * Raised when client input fails validation before anything is sent to storage.
 * <p>
 * Carries a machine-readable {@link Reason}; the HTTP layer maps it to a 4xx status.
 */
public final class QueryValidationException extends RuntimeException {
  public enum Reason {
    MISSING_QUERY,
    INVALID_FIELD,
    INVALID_EXPLAIN_MODE,
    DESTRUCTIVE_STATEMENT,
    NON_SELECT_STATEMENT,
    MALFORMED_FILTERS,
    MALFORMED_RANGE_FILTERS,
    MALFORMED_PARAMETER;

    public String code() { return name().toLowerCase(Locale.ROOT); }
  }

  private final Reason reason;

  public QueryValidationException(Reason reason, String message) {
    super(message);
    this.reason = Objects.requireNonNull(reason, "reason");
  }

  public QueryValidationException(Reason reason, String message, Throwable cause) {
    super(message, cause);
    this.reason = Objects.requireNonNull(reason, "reason");
  }

  public Reason reason() { return reason; }
}
