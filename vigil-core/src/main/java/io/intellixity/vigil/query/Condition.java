package io.intellixity.vigil.query;

import java.util.Objects;

/**
 * Test of one record field against one raw query value.\n
 *
 * For range operators {@code value} is the operand after the prefix, still unparsed: whether it is
 * a timestamp or a number is decided per record at evaluation time.\n
 */
public final class Condition implements QueryElement {
  private final String property;
  private final Operator operator;
  private final String value;

  public Condition(String property, Operator operator, String value) {
    this.property = Objects.requireNonNull(property, "property");
    this.operator = Objects.requireNonNull(operator, "operator");
    this.value = Objects.requireNonNull(value, "value");
  }

  public String property() { return property; }
  public Operator operator() { return operator; }
  public String value() { return value; }

  @Override
  public <Q> Q accept(QueryVisitor<Q> visitor) { return visitor.visit(this); }

  public static Condition of(String property, Operator operator, String value) {
    return new Condition(property, operator, value);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof Condition c)) return false;
    return property.equals(c.property) && operator == c.operator && value.equals(c.value);
  }

  @Override
  public int hashCode() { return Objects.hash(property, operator, value); }

  @Override
  public String toString() {
    return operator.isRange()
        ? property + " " + operator.prefix() + ":" + value
        : property + " ~ " + value;
  }
}
