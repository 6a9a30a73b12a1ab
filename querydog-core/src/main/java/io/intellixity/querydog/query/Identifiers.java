package io.intellixity.querydog.query;

import java.util.regex.Pattern;

/**
 * Gatekeeper for any client string that ends up literally in statement text.
 * A candidate is accepted iff it matches {@code ^[A-Za-z_][A-Za-z0-9_]*$}.
 */
public final class Identifiers {
  private static final Pattern IDENTIFIER = Pattern.compile("^[A-Za-z_][A-Za-z0-9_]*$");

  private Identifiers() {}

  public static boolean isValid(String candidate) {
    return candidate != null && IDENTIFIER.matcher(candidate).matches();
  }

  /** Returns the candidate when valid, otherwise the fallback. Never throws. */
  public static String orDefault(String candidate, String fallback) {
    return isValid(candidate) ? candidate : fallback;
  }
}
