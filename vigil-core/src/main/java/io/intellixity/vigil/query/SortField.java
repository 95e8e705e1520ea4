package io.intellixity.vigil.query;

import java.util.Objects;

public record SortField(String field, Direction direction) {
  public SortField {
    Objects.requireNonNull(field, "field");
    direction = (direction == null) ? Direction.ASC : direction;
  }

  public enum Direction { ASC, DESC }

  public static SortField asc(String field) { return new SortField(field, Direction.ASC); }
  public static SortField desc(String field) { return new SortField(field, Direction.DESC); }

  /** Parses one sort token: {@code duration} or {@code -duration}. Returns null for blank tokens. */
  public static SortField parse(String token) {
    if (token == null) return null;
    String t = token.trim();
    boolean desc = t.startsWith("-");
    String f = desc ? t.substring(1).trim() : t;
    if (f.isEmpty()) return null;
    return new SortField(f, desc ? Direction.DESC : Direction.ASC);
  }
}
