package io.intellixity.vigil.query;

import java.util.*;

/** Compiled form of a {@link QuerySpec}: filter tree, sort keys, projection and page. */
public final class Query {
  private QueryElement filter;
  private PageRequest page = PageRequest.defaults();
  private List<String> projection;
  private List<SortField> sort = new ArrayList<>();

  public Query() {}

  /** Null when nothing is filtered. */
  public QueryElement filter() { return filter; }
  public PageRequest page() { return page; }
  /** Null when every field is kept; empty when no field is. */
  public List<String> projection() { return projection; }
  public List<SortField> sort() { return sort; }

  public Query withFilter(QueryElement filter) { this.filter = filter; return this; }
  public Query withPage(PageRequest page) { this.page = (page == null) ? PageRequest.defaults() : page; return this; }
  public Query withProjection(List<String> projection) { this.projection = (projection == null) ? null : List.copyOf(projection); return this; }
  public Query withSort(List<SortField> sort) { this.sort = new ArrayList<>(sort == null ? List.of() : sort); return this; }

  public static Query of(QueryElement filter) {
    return new Query().withFilter(filter);
  }

  public static Query and(QueryElement... elements) {
    return Query.of(QueryFilters.and(elements));
  }

  public static Query or(QueryElement... elements) {
    return Query.of(QueryFilters.or(elements));
  }

  @Override
  public String toString() {
    return "Query{filter=" + filter + ", sort=" + sort + ", projection=" + projection + ", page=" + page + "}";
  }
}
