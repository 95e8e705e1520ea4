package io.intellixity.vigil.pipeline;

import io.intellixity.vigil.item.Item;
import io.intellixity.vigil.query.PageRequest;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

final class PaginatorTest {
  private final Paginator paginator = new Paginator();

  private static List<Item> items(int n) {
    List<Item> out = new ArrayList<>();
    for (int i = 0; i < n; i++) out.add(Item.of("i", i));
    return out;
  }

  @Test
  void slicesMiddlePage() {
    PagedResult r = paginator.apply(items(10), new PageRequest(2, 3));
    assertEquals(List.of(Item.of("i", 3), Item.of("i", 4), Item.of("i", 5)), r.data());
    assertEquals(new PageMetadata(2, 3, 10, 4, true, true), r.pagination());
  }

  @Test
  void lastPageIsShort() {
    PagedResult r = paginator.apply(items(10), new PageRequest(4, 3));
    assertEquals(List.of(Item.of("i", 9)), r.data());
    assertFalse(r.pagination().hasNextPage());
  }

  @Test
  void exactMultipleHasNoExtraPage() {
    assertEquals(2, paginator.apply(items(10), new PageRequest(1, 5)).pagination().totalPages());
  }

  @Test
  void hugePageDoesNotOverflow() {
    PagedResult r = paginator.apply(items(5), new PageRequest(Integer.MAX_VALUE, Integer.MAX_VALUE));
    assertTrue(r.data().isEmpty());
    assertEquals(1, r.pagination().totalPages());
    assertTrue(r.pagination().hasPrevPage());
  }

  @Test
  void nullRequestUsesDefaults() {
    PagedResult r = paginator.apply(items(150), null);
    assertEquals(100, r.data().size());
    assertEquals(new PageMetadata(1, 100, 150, 2, true, false), r.pagination());
  }
}
