package io.intellixity.vigil.query;

/**
 * Single-condition operators.\n
 *
 * {@link #MATCH} is case-insensitive containment for text fields and loose equality otherwise.
 * The range operators carry the prefix used in query strings ({@code gte:5}).\n
 */
public enum Operator {
  MATCH(null),
  GT("gt"),
  GE("gte"),
  LT("lt"),
  LE("lte");

  private final String prefix;

  Operator(String prefix) {
    this.prefix = prefix;
  }

  public String prefix() {
    return prefix;
  }

  public boolean isRange() {
    return prefix != null;
  }

  /** Range operator for a query-string prefix, or null when the prefix is not one. */
  public static Operator forPrefix(String prefix) {
    if (prefix == null) return null;
    for (Operator op : values()) {
      if (prefix.equals(op.prefix)) return op;
    }
    return null;
  }
}
