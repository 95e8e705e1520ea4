package io.intellixity.vigil.item;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.*;

/**
 * One schemaless record flowing through the query pipeline.\n
 *
 * Field values are plain Java values as Jackson produces them: {@link String}, {@link Number},
 * {@link Boolean}, {@code null}, nested {@link Map} or {@link List}. Field order is preserved.\n
 */
public final class Item {
  private final Map<String, Object> fields;

  private Item(Map<String, Object> fields) {
    this.fields = fields;
  }

  @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
  public static Item of(Map<String, ?> fields) {
    if (fields == null || fields.isEmpty()) return new Item(Map.of());
    // LinkedHashMap (not Map.copyOf): null values are legal and order matters.
    return new Item(Collections.unmodifiableMap(new LinkedHashMap<>(fields)));
  }

  public static Item of(String k1, Object v1) {
    Map<String, Object> m = new LinkedHashMap<>();
    m.put(k1, v1);
    return new Item(Collections.unmodifiableMap(m));
  }

  public static Item of(String k1, Object v1, String k2, Object v2) {
    Map<String, Object> m = new LinkedHashMap<>();
    m.put(k1, v1);
    m.put(k2, v2);
    return new Item(Collections.unmodifiableMap(m));
  }

  public static Item of(String k1, Object v1, String k2, Object v2, String k3, Object v3) {
    Map<String, Object> m = new LinkedHashMap<>();
    m.put(k1, v1);
    m.put(k2, v2);
    m.put(k3, v3);
    return new Item(Collections.unmodifiableMap(m));
  }

  /** Value of a field; empty when the field is absent or explicitly null. */
  public Optional<Object> get(String field) {
    if (field == null) return Optional.empty();
    return Optional.ofNullable(fields.get(field));
  }

  /** True when the field key exists, even if its value is null. */
  public boolean has(String field) {
    return field != null && fields.containsKey(field);
  }

  public Set<String> fieldNames() { return fields.keySet(); }

  public int size() { return fields.size(); }

  /** Copy restricted to the given fields; fields the item does not carry are skipped. */
  public Item select(Collection<String> names) {
    Map<String, Object> out = new LinkedHashMap<>();
    for (String n : names) {
      if (fields.containsKey(n)) out.put(n, fields.get(n));
    }
    return new Item(Collections.unmodifiableMap(out));
  }

  @JsonValue
  public Map<String, Object> asMap() { return fields; }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    return (o instanceof Item other) && fields.equals(other.fields);
  }

  @Override
  public int hashCode() { return fields.hashCode(); }

  @Override
  public String toString() { return "Item" + fields; }
}
