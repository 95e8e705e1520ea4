package io.intellixity.vigil.pipeline;

import io.intellixity.vigil.item.Item;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Projection stage. Requested fields an item does not carry are left out, never defaulted. A null
 * field list keeps items whole.
 */
public final class FieldProjector {

  public List<Item> apply(List<Item> items, List<String> fields) {
    if (items == null || items.isEmpty()) return List.of();
    if (fields == null) return List.copyOf(items);
    List<Item> out = new ArrayList<>(items.size());
    for (Item item : items) out.add(item.select(fields));
    return Collections.unmodifiableList(out);
  }
}
