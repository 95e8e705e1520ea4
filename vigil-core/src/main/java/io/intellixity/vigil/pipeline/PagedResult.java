package io.intellixity.vigil.pipeline;

import io.intellixity.vigil.item.Item;

import java.util.List;
import java.util.Objects;

public record PagedResult(List<Item> data, PageMetadata pagination) {
  public PagedResult {
    data = List.copyOf(Objects.requireNonNull(data, "data"));
    Objects.requireNonNull(pagination, "pagination");
  }
}
