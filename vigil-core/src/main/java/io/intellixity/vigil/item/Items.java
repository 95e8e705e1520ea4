package io.intellixity.vigil.item;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

import java.util.*;

/** Conversions from Jackson trees and POJOs into {@link Item}s. */
public final class Items {
  private static final ObjectMapper JSON = new ObjectMapper()
      .registerModule(new JavaTimeModule())
      .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
  private static final TypeReference<LinkedHashMap<String, Object>> MAP = new TypeReference<>() {};

  private Items() {}

  /** Converts a JSON object node; any other node kind is rejected. */
  public static Item fromJson(JsonNode node) {
    if (node == null || node.isNull()) return Item.of(Map.of());
    if (!node.isObject()) throw new IllegalArgumentException("Item JSON must be an object but was: " + node.getNodeType());
    return Item.of(JSON.convertValue(node, MAP));
  }

  /** Converts every element of a JSON array; a missing or null node yields an empty list. */
  public static List<Item> fromJsonArray(JsonNode node) {
    if (node == null || node.isNull() || node.isMissingNode()) return List.of();
    if (!node.isArray()) throw new IllegalArgumentException("Expected JSON array but was: " + node.getNodeType());
    List<Item> out = new ArrayList<>(node.size());
    for (JsonNode x : node) out.add(fromJson(x));
    return out;
  }

  /** Converts a POJO or record through its Jackson bean view. */
  public static Item fromObject(Object pojo) {
    if (pojo == null) return Item.of(Map.of());
    if (pojo instanceof Item item) return item;
    if (pojo instanceof JsonNode n) return fromJson(n);
    return Item.of(JSON.convertValue(pojo, MAP));
  }

  public static List<Item> fromObjects(Collection<?> pojos) {
    if (pojos == null) return List.of();
    List<Item> out = new ArrayList<>(pojos.size());
    for (Object o : pojos) out.add(fromObject(o));
    return out;
  }
}
