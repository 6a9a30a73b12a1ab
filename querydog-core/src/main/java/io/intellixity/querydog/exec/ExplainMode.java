package io.intellixity.querydog.exec;

import io.intellixity.querydog.query.Identifiers;

import java.util.Optional;

public enum ExplainMode {
  PLAN("plan", "EXPLAIN", false),
  INDEXES("indexes", "EXPLAIN indexes = 1", false),
  ACTIONS("actions", "EXPLAIN actions = 1", false),
  PIPELINE("pipeline", "EXPLAIN PIPELINE", false),
  AST("ast", "EXPLAIN AST", true),
  SYNTAX("syntax", "EXPLAIN SYNTAX", true),
  ESTIMATE("estimate", "EXPLAIN ESTIMATE", false);

  private final String token;
  private final String prefix;
  private final boolean plainText;

  ExplainMode(String token, String prefix, boolean plainText) {
    this.token = token;
    this.prefix = prefix;
    this.plainText = plainText;
  }

  public String token() { return token; }
  public String prefix() { return prefix; }
  /** Output is line-oriented text rather than structured rows. */
  public boolean plainText() { return plainText; }

  /** Case-sensitive lookup of the lower-case token. */
  public static Optional<ExplainMode> fromToken(String token) {
    if (!Identifiers.isValid(token)) return Optional.empty();
    for (ExplainMode m : values()) if (m.token.equals(token)) return Optional.of(m);
    return Optional.empty();
  }
}
