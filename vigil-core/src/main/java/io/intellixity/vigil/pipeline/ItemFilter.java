package io.intellixity.vigil.pipeline;

import io.intellixity.vigil.item.Item;
import io.intellixity.vigil.query.QueryElement;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/** Filter stage: keeps the items satisfying the whole filter tree, in input order. */
public final class ItemFilter {

  public List<Item> apply(List<Item> items, QueryElement filter) {
    if (items == null || items.isEmpty()) return List.of();
    List<Item> out = new ArrayList<>();
    for (Item item : items) {
      if (item != null && ItemMatcher.matches(item, filter)) out.add(item);
    }
    return Collections.unmodifiableList(out);
  }
}
