package io.intellixity.querydog.exec;

import io.intellixity.querydog.compile.Bindings;
import io.intellixity.querydog.compile.CompiledStatement;
import io.intellixity.querydog.compile.ParamType;
import io.intellixity.querydog.query.QueryValidationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import static io.intellixity.querydog.query.QueryValidationException.Reason.*;

/**
 * Execution path for complete, operator-written statements.
 * <p>
 * This is not a SQL parser. It blocks a fixed set of destructive leading keywords, drops a trailing
 * {@code FORMAT x} directive so rows always come back in the executor's own shape, and caps
 * unbounded SELECTs with a bound LIMIT.
 */
public final class AdHocQueryGateway {
  private static final Logger log = LoggerFactory.getLogger(AdHocQueryGateway.class);

  public static final List<String> DESTRUCTIVE_KEYWORDS =
      List.of("DROP", "TRUNCATE", "DELETE", "ALTER", "DETACH", "ATTACH", "RENAME", "KILL");

  private static final Pattern FORMAT_DIRECTIVE = Pattern.compile("\\s+FORMAT\\s+\\w+\\s*$", Pattern.CASE_INSENSITIVE);
  private static final Pattern LIMIT_CLAUSE = Pattern.compile("\\bLIMIT\\b");

  private final StatementExecutor executor;
  private final int defaultLimit;

  public AdHocQueryGateway(StatementExecutor executor, int defaultLimit) {
    if (defaultLimit <= 0) throw new IllegalArgumentException("defaultLimit must be > 0");
    this.executor = Objects.requireNonNull(executor, "executor");
    this.defaultLimit = defaultLimit;
  }

  public int defaultLimit() { return defaultLimit; }

  public AdHocResult execute(String rawQuery, Integer limit) {
    return timed(prepare(rawQuery, limit));
  }

  /** Saved-query path: SELECT only, run as written apart from the FORMAT directive. */
  public AdHocResult executeSelect(String rawQuery) {
    String text = requireText(rawQuery);
    if (!text.toUpperCase(Locale.ROOT).startsWith("SELECT")) {
      throw new QueryValidationException(NON_SELECT_STATEMENT, "Only SELECT queries are allowed");
    }
    return timed(CompiledStatement.unbound(stripFormat(text)));
  }

  /** Applies the gateway rules without executing. */
  public CompiledStatement prepare(String rawQuery, Integer limit) {
    String text = requireText(rawQuery);
    String upper = text.toUpperCase(Locale.ROOT);
    for (String kw : DESTRUCTIVE_KEYWORDS) {
      if (upper.startsWith(kw)) {
        log.warn("Rejected ad-hoc statement starting with {}", kw);
        throw new QueryValidationException(DESTRUCTIVE_STATEMENT,
            "Dangerous operations are not allowed through this interface");
      }
    }
    int effectiveLimit = (limit == null) ? defaultLimit : limit;
    if (effectiveLimit <= 0) throw new QueryValidationException(MALFORMED_PARAMETER, "'limit' must be > 0");

    String sql = stripFormat(text);
    String sqlUpper = sql.toUpperCase(Locale.ROOT);
    boolean addLimit = sqlUpper.startsWith("SELECT")
        && !LIMIT_CLAUSE.matcher(sqlUpper).find()
        && !sql.endsWith(")");
    if (!addLimit) return CompiledStatement.unbound(sql);

    Bindings b = new Bindings();
    return CompiledStatement.of(sql + limitSeparator(sql) + "LIMIT " + b.add("limit", effectiveLimit, ParamType.UINT32), b);
  }

  // A trailing line comment would swallow a LIMIT appended on the same line.
  private static String limitSeparator(String sql) {
    return sql.substring(sql.lastIndexOf('\n') + 1).contains("--") ? "\n" : " ";
  }

  private AdHocResult timed(CompiledStatement stmt) {
    long start = System.nanoTime();
    List<Map<String, Object>> rows = executor.rows(stmt);
    long ms = (System.nanoTime() - start) / 1_000_000L;
    log.debug("Ad-hoc statement returned {} row(s) in {}ms", rows.size(), ms);
    return AdHocResult.of(rows, ms);
  }

  private static String requireText(String rawQuery) {
    if (rawQuery == null || rawQuery.isBlank()) throw new QueryValidationException(MISSING_QUERY, "Query is required");
    String t = rawQuery.trim();
    while (t.endsWith(";")) t = t.substring(0, t.length() - 1).trim();
    if (t.isEmpty()) throw new QueryValidationException(MISSING_QUERY, "Query is required");
    return t;
  }

  private static String stripFormat(String sql) {
    Matcher m = FORMAT_DIRECTIVE.matcher(sql);
    return m.find() ? sql.substring(0, m.start()) : sql;
  }
}
