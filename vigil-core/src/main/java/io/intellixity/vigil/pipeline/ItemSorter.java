package io.intellixity.vigil.pipeline;

import io.intellixity.vigil.item.Item;
import io.intellixity.vigil.query.SortField;

import java.util.*;

/**
 * Sort stage: stable multi-key ordering.\n
 *
 * Keys are compared in order; the first unequal key decides. Items equal on every key keep their
 * input order. Null and missing values sort last ascending and first descending.\n
 */
public final class ItemSorter {

  public List<Item> apply(List<Item> items, List<SortField> sort) {
    if (items == null || items.isEmpty()) return List.of();
    if (sort == null || sort.isEmpty()) return List.copyOf(items);

    List<Keyed> keyed = new ArrayList<>(items.size());
    for (Item item : items) keyed.add(new Keyed(item, keysOf(item, sort)));

    // List.sort is a stable merge sort
    keyed.sort((a, b) -> compare(a.keys, b.keys, sort));

    List<Item> out = new ArrayList<>(keyed.size());
    for (Keyed k : keyed) out.add(k.item);
    return Collections.unmodifiableList(out);
  }

  private static ValueComparisons.SortKey[] keysOf(Item item, List<SortField> sort) {
    ValueComparisons.SortKey[] keys = new ValueComparisons.SortKey[sort.size()];
    for (int i = 0; i < keys.length; i++) {
      keys[i] = ValueComparisons.sortKey(item.get(sort.get(i).field()).orElse(null));
    }
    return keys;
  }

  private static int compare(ValueComparisons.SortKey[] a, ValueComparisons.SortKey[] b, List<SortField> sort) {
    for (int i = 0; i < a.length; i++) {
      int c = ValueComparisons.compareKeys(a[i], b[i]);
      if (c != 0) return sort.get(i).direction() == SortField.Direction.DESC ? -c : c;
    }
    return 0;
  }

  private record Keyed(Item item, ValueComparisons.SortKey[] keys) {}
}
