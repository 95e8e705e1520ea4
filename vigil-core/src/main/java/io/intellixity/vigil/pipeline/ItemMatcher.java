package io.intellixity.vigil.pipeline;

import io.intellixity.vigil.item.Item;
import io.intellixity.vigil.query.*;

import java.util.Objects;
import java.util.Optional;

/** Evaluates a filter tree against one item. */
final class ItemMatcher implements QueryVisitor<Boolean> {
  private final Item item;

  ItemMatcher(Item item) {
    this.item = Objects.requireNonNull(item, "item");
  }

  static boolean matches(Item item, QueryElement filter) {
    if (filter == null) return true;
    return filter.accept(new ItemMatcher(item));
  }

  @Override
  public Boolean visit(Condition c) {
    Optional<Object> fv = item.get(c.property());
    // absent or null field fails every condition on it
    if (fv.isEmpty()) return false;
    if (c.operator().isRange()) return ValueComparisons.compareRange(fv.get(), c.operator(), c.value());
    return ValueComparisons.matches(fv.get(), c.value());
  }

  @Override
  public Boolean visit(LogicalGroup g) {
    if (g.clause() == Clause.OR) {
      for (QueryElement e : g.elements()) {
        if (e.accept(this)) return true;
      }
      return false;
    }
    for (QueryElement e : g.elements()) {
      if (!e.accept(this)) return false;
    }
    return true;
  }
}
