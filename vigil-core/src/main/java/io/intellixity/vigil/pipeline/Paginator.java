package io.intellixity.vigil.pipeline;

import io.intellixity.vigil.item.Item;
import io.intellixity.vigil.query.PageRequest;

import java.util.List;

/** Pagination stage. A page past the end is empty; metadata still counts the whole input. */
public final class Paginator {

  public PagedResult apply(List<Item> items, PageRequest request) {
    List<Item> in = (items == null) ? List.of() : items;
    PageRequest req = (request == null) ? PageRequest.defaults() : request;

    int total = in.size();
    long from = Math.min(req.offset(), total);
    long to = Math.min(from + req.limit(), total);
    return new PagedResult(in.subList((int) from, (int) to), PageMetadata.of(req, total));
  }
}
