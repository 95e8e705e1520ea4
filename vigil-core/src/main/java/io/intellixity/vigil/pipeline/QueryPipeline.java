package io.intellixity.vigil.pipeline;

import io.intellixity.vigil.item.Item;
import io.intellixity.vigil.query.Query;
import io.intellixity.vigil.query.QuerySpec;
import io.intellixity.vigil.query.QuerySpecParser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;

/**
 * Filter, sort, project, paginate: always in that order, each stage reading the previous one's
 * output.\n
 *
 * Instances hold no per-call state and can be shared between threads. Input lists are only read.\n
 */
public final class QueryPipeline {
  private static final Logger log = LoggerFactory.getLogger(QueryPipeline.class);

  private final QuerySpecParser parser;
  private final ItemFilter filter;
  private final ItemSorter sorter;
  private final FieldProjector projector;
  private final Paginator paginator;

  public QueryPipeline() {
    this(new QuerySpecParser(), new ItemFilter(), new ItemSorter(), new FieldProjector(), new Paginator());
  }

  public QueryPipeline(QuerySpecParser parser,
                       ItemFilter filter,
                       ItemSorter sorter,
                       FieldProjector projector,
                       Paginator paginator) {
    this.parser = Objects.requireNonNull(parser, "parser");
    this.filter = Objects.requireNonNull(filter, "filter");
    this.sorter = Objects.requireNonNull(sorter, "sorter");
    this.projector = Objects.requireNonNull(projector, "projector");
    this.paginator = Objects.requireNonNull(paginator, "paginator");
  }

  public PagedResult execute(List<Item> items, QuerySpec spec) {
    return execute(items, parser.parse(spec));
  }

  public PagedResult execute(List<Item> items, Query query) {
    Query q = (query == null) ? new Query() : query;
    List<Item> in = (items == null) ? List.of() : items;
    long started = System.nanoTime();

    List<Item> filtered = filter.apply(in, q.filter());
    List<Item> sorted = sorter.apply(filtered, q.sort());
    List<Item> projected = projector.apply(sorted, q.projection());
    PagedResult result = paginator.apply(projected, q.page());

    if (log.isDebugEnabled()) {
      log.debug("vigil.query in={} matched={} returned={} page={} limit={} sortKeys={} fields={} durationMs={}",
          in.size(), filtered.size(), result.data().size(), q.page().page(), q.page().limit(),
          q.sort().size(), q.projection() == null ? "all" : q.projection().size(), (System.nanoTime() - started) / 1_000_000.0);
    }
    return result;
  }
}
