package io.intellixity.querydog.dataset;

import io.intellixity.querydog.query.Identifiers;
import io.intellixity.querydog.query.SortField;
import io.intellixity.querydog.query.SortRequest;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.function.Predicate;

/**
 * How a client sort request becomes an ORDER BY list.
 * <p>
 * Three flavours:
 * <ul>
 *   <li>fixed: the client cannot influence ordering;</li>
 *   <li>known-field: any identifier-shaped field present in the dataset's field table;</li>
 *   <li>allow-list: only the listed (post-alias) fields.</li>
 * </ul>
 * A rejected field is silently replaced by the default; it never fails the request.
 */
public final class SortPolicy {
  private final List<SortField> fixed;
  private final String defaultField;
  private final Set<String> allowList;
  private final Map<String, String> aliases;

  private SortPolicy(List<SortField> fixed, String defaultField, Set<String> allowList, Map<String, String> aliases) {
    this.fixed = fixed;
    this.defaultField = defaultField;
    this.allowList = allowList;
    this.aliases = aliases;
  }

  public static SortPolicy fixed(SortField... order) {
    if (order.length == 0) throw new IllegalArgumentException("fixed order must not be empty");
    return new SortPolicy(List.of(order), null, null, Map.of());
  }

  public static SortPolicy knownFields(String defaultField) {
    return new SortPolicy(List.of(), Objects.requireNonNull(defaultField, "defaultField"), null, Map.of());
  }

  public static SortPolicy allowList(String defaultField, Set<String> allowed) {
    return allowList(defaultField, allowed, Map.of());
  }

  public static SortPolicy allowList(String defaultField, Set<String> allowed, Map<String, String> aliases) {
    Objects.requireNonNull(defaultField, "defaultField");
    if (!allowed.contains(defaultField)) throw new IllegalArgumentException("default sort field not allowed: " + defaultField);
    return new SortPolicy(List.of(), defaultField, Set.copyOf(allowed), Map.copyOf(aliases));
  }

  public boolean isFixed() { return !fixed.isEmpty(); }
  public String defaultField() { return defaultField; }

  public List<SortField> resolve(SortRequest request, Predicate<String> knownField) {
    if (isFixed()) return fixed;
    SortRequest r = (request == null) ? SortRequest.NONE : request;
    String candidate = (r.field() == null) ? null : aliases.getOrDefault(r.field(), r.field());
    boolean accepted = Identifiers.isValid(candidate)
        && (allowList != null ? allowList.contains(candidate) : knownField.test(candidate));
    return List.of(new SortField(accepted ? candidate : defaultField, SortField.Direction.parse(r.order())));
  }
}
