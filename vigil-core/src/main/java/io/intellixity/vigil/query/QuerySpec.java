package io.intellixity.vigil.query;

import java.util.*;

/**
 * Caller-supplied query parameters: an ordered multimap from key to raw text values.\n
 *
 * A key supplied once carries one value; a key supplied several times (for example
 * {@code duration=gte:5&duration=lte:10}) carries them all, in order. The reserved keys
 * {@code page}, {@code sort}, {@code limit} and {@code fields} drive sorting, projection and
 * pagination; every other key is a filter.\n
 */
public final class QuerySpec {
  public static final String PAGE = "page";
  public static final String SORT = "sort";
  public static final String LIMIT = "limit";
  public static final String FIELDS = "fields";
  public static final Set<String> RESERVED = Set.of(PAGE, SORT, LIMIT, FIELDS);

  private static final QuerySpec EMPTY = new QuerySpec(Map.of());

  private final Map<String, List<String>> params;

  private QuerySpec(Map<String, List<String>> params) {
    this.params = params;
  }

  public static QuerySpec empty() { return EMPTY; }

  /**
   * Builds a spec from loosely typed values: a {@link Collection} or array contributes one raw
   * value per element, anything else its {@code toString()}. Null keys and null values are dropped.
   */
  public static QuerySpec of(Map<String, ?> raw) {
    if (raw == null || raw.isEmpty()) return EMPTY;
    Builder b = builder();
    for (var e : raw.entrySet()) {
      if (e.getKey() == null) continue;
      Object v = e.getValue();
      if (v instanceof Collection<?> c) {
        for (Object x : c) b.add(e.getKey(), x);
      } else if (v instanceof Object[] arr) {
        for (Object x : arr) b.add(e.getKey(), x);
      } else {
        b.add(e.getKey(), v);
      }
    }
    return b.build();
  }

  public static Builder builder() { return new Builder(); }

  /** All values for a key, empty when absent. */
  public List<String> values(String key) {
    List<String> v = params.get(key);
    return v == null ? List.of() : v;
  }

  /** First value for a key. Reserved keys use this when supplied more than once. */
  public Optional<String> first(String key) {
    List<String> v = values(key);
    return v.isEmpty() ? Optional.empty() : Optional.of(v.get(0));
  }

  public Optional<String> page() { return first(PAGE); }
  public Optional<String> limit() { return first(LIMIT); }
  public Optional<String> sort() { return first(SORT); }
  public Optional<String> fields() { return first(FIELDS); }

  /** Non-reserved keys with their values, in insertion order. */
  public Map<String, List<String>> filters() {
    Map<String, List<String>> out = new LinkedHashMap<>();
    for (var e : params.entrySet()) {
      if (!RESERVED.contains(e.getKey())) out.put(e.getKey(), e.getValue());
    }
    return Collections.unmodifiableMap(out);
  }

  /** Copy without the given keys. */
  public QuerySpec without(String... keys) {
    Map<String, List<String>> out = new LinkedHashMap<>(params);
    for (String k : keys) out.remove(k);
    return out.isEmpty() ? EMPTY : new QuerySpec(Collections.unmodifiableMap(out));
  }

  public Map<String, List<String>> asMap() { return params; }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    return (o instanceof QuerySpec q) && params.equals(q.params);
  }

  @Override
  public int hashCode() { return params.hashCode(); }

  @Override
  public String toString() { return "QuerySpec" + params; }

  public static final class Builder {
    private final Map<String, List<String>> params = new LinkedHashMap<>();

    private Builder() {}

    public Builder add(String key, Object value) {
      Objects.requireNonNull(key, "key");
      if (value == null) return this;
      params.computeIfAbsent(key, k -> new ArrayList<>()).add(String.valueOf(value));
      return this;
    }

    public Builder addAll(String key, Iterable<?> values) {
      if (values == null) return this;
      for (Object v : values) add(key, v);
      return this;
    }

    public Builder page(int page) { return set(PAGE, String.valueOf(page)); }
    public Builder limit(int limit) { return set(LIMIT, String.valueOf(limit)); }
    public Builder sort(String sort) { return set(SORT, sort); }
    public Builder fields(String fields) { return set(FIELDS, fields); }

    private Builder set(String key, String value) {
      params.remove(key);
      return add(key, value);
    }

    public QuerySpec build() {
      if (params.isEmpty()) return EMPTY;
      Map<String, List<String>> out = new LinkedHashMap<>();
      for (var e : params.entrySet()) out.put(e.getKey(), List.copyOf(e.getValue()));
      return new QuerySpec(Collections.unmodifiableMap(out));
    }
  }
}
