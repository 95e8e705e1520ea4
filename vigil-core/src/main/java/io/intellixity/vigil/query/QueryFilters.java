package io.intellixity.vigil.query;

import java.util.*;

public final class QueryFilters {
  private QueryFilters() {}

  public static Condition match(String property, String value) { return Condition.of(property, Operator.MATCH, value); }
  public static Condition gt(String property, String operand) { return Condition.of(property, Operator.GT, operand); }
  public static Condition ge(String property, String operand) { return Condition.of(property, Operator.GE, operand); }
  public static Condition lt(String property, String operand) { return Condition.of(property, Operator.LT, operand); }
  public static Condition le(String property, String operand) { return Condition.of(property, Operator.LE, operand); }

  /** Satisfied when any of the values matches. */
  public static LogicalGroup anyOf(String property, Collection<String> values) {
    List<QueryElement> els = new ArrayList<>(values.size());
    for (String v : values) els.add(match(property, v));
    return new LogicalGroup(Clause.OR, els);
  }

  /** Inclusive range; either bound may be null. */
  public static QueryElement between(String property, String lower, String upper) {
    List<QueryElement> els = new ArrayList<>(2);
    if (lower != null) els.add(ge(property, lower));
    if (upper != null) els.add(le(property, upper));
    if (els.size() == 1) return els.get(0);
    return new LogicalGroup(Clause.AND, els);
  }

  public static LogicalGroup and(QueryElement... elements) {
    return new LogicalGroup(Clause.AND, List.of(elements));
  }

  public static LogicalGroup or(QueryElement... elements) {
    return new LogicalGroup(Clause.OR, List.of(elements));
  }
}
