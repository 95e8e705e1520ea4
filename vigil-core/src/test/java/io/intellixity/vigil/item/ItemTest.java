package io.intellixity.vigil.item;

import org.junit.jupiter.api.Test;

import java.util.*;

import static org.junit.jupiter.api.Assertions.*;

final class ItemTest {

  @Test
  void nullValueIsPresentButEmpty() {
    Map<String, Object> m = new LinkedHashMap<>();
    m.put("owner", null);
    Item item = Item.of(m);

    assertTrue(item.has("owner"));
    assertTrue(item.get("owner").isEmpty());
    assertFalse(item.has("missing"));
    assertTrue(item.get(null).isEmpty());
  }

  @Test
  void selectKeepsRequestedOrderAndSkipsMissing() {
    Item item = Item.of("a", 1, "b", 2, "c", 3);
    Item picked = item.select(List.of("c", "zzz", "a"));

    assertEquals(List.of("c", "a"), new ArrayList<>(picked.fieldNames()));
    assertEquals(2, picked.size());
    assertEquals(Optional.of(3), picked.get("c"));
  }

  @Test
  void copiesInputAndRejectsMutation() {
    Map<String, Object> m = new LinkedHashMap<>();
    m.put("k", "v");
    Item item = Item.of(m);
    m.put("k", "changed");

    assertEquals(Optional.of("v"), item.get("k"));
    assertThrows(UnsupportedOperationException.class, () -> item.asMap().put("x", 1));
  }

  @Test
  void equalityFollowsFields() {
    assertEquals(Item.of("a", 1), Item.of(Map.of("a", 1)));
    assertNotEquals(Item.of("a", 1), Item.of("a", 2));
    assertEquals(Item.of(Map.of()), Item.of((Map<String, ?>) null));
  }
}
