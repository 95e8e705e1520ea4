package io.intellixity.vigil.query;

import java.util.*;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Compiles a {@link QuerySpec} into a {@link Query}.\n
 *
 * Filter grammar per raw value, first match wins:\n
 * - {@code gte:X}, {@code gt:X}, {@code lte:X}, {@code lt:X}: range condition on operand X\n
 * - a value containing a comma: OR-list of trimmed sub-values, empty ones included\n
 * - anything else: a single match condition\n
 *
 * Distinct keys are AND-ed, and so are the values of a repeated key.\n
 */
public final class QuerySpecParser {
  private static final Pattern RANGE = Pattern.compile("(gte|gt|lte|lt):(.+)");

  public Query parse(QuerySpec spec) {
    if (spec == null) return new Query();
    return new Query()
        .withFilter(parseFilter(spec.filters()))
        .withSort(parseSort(spec.sort().orElse(null)))
        .withProjection(parseFields(spec.fields().orElse(null)))
        .withPage(PageRequest.parse(spec.page().orElse(null), spec.limit().orElse(null)));
  }

  /** Null when there is nothing to filter on. */
  public QueryElement parseFilter(Map<String, List<String>> filters) {
    if (filters == null || filters.isEmpty()) return null;
    List<QueryElement> els = new ArrayList<>();
    for (var e : filters.entrySet()) {
      for (String raw : e.getValue()) {
        if (raw != null) els.add(parseValue(e.getKey(), raw));
      }
    }
    if (els.isEmpty()) return null;
    if (els.size() == 1) return els.get(0);
    return new LogicalGroup(Clause.AND, els);
  }

  public QueryElement parseValue(String property, String raw) {
    Matcher m = RANGE.matcher(raw);
    if (m.matches()) {
      return Condition.of(property, Operator.forPrefix(m.group(1)), m.group(2));
    }
    if (raw.indexOf(',') >= 0) {
      return QueryFilters.anyOf(property, splitKeepingEmpty(raw));
    }
    return QueryFilters.match(property, raw);
  }

  public List<SortField> parseSort(String raw) {
    if (raw == null || raw.isBlank()) return List.of();
    List<SortField> out = new ArrayList<>();
    for (String token : raw.split(",")) {
      SortField sf = SortField.parse(token);
      if (sf != null) out.add(sf);
    }
    return out;
  }

  /**
   * Null when no projection was asked for (absent or empty {@code fields}). A value naming no field,
   * such as {@code " , "}, yields an empty list: every item is projected to no fields.
   */
  public List<String> parseFields(String raw) {
    if (raw == null || raw.isEmpty()) return null;
    return List.copyOf(new LinkedHashSet<>(splitDroppingEmpty(raw)));
  }

  private static List<String> splitKeepingEmpty(String raw) {
    List<String> out = new ArrayList<>();
    for (String s : raw.split(",", -1)) out.add(s.trim());
    return out;
  }

  private static List<String> splitDroppingEmpty(String raw) {
    List<String> out = new ArrayList<>();
    for (String s : raw.split(",")) {
      String t = s.trim();
      if (!t.isEmpty()) out.add(t);
    }
    return out;
  }
}
