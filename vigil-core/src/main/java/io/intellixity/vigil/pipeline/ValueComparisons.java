package io.intellixity.vigil.pipeline;

import io.intellixity.vigil.query.Operator;

import java.math.BigDecimal;
import java.time.*;
import java.time.format.DateTimeParseException;
import java.util.*;

/**
 * Coercion rules shared by filtering and sorting.\n
 *
 * Record values are untyped, query values are text. Every comparison here tries a timestamp
 * reading first, then a numeric one, then falls back to text. Nothing in this class throws for
 * malformed input: an operand that cannot be read makes the comparison false.\n
 */
public final class ValueComparisons {
  private ValueComparisons() {}

  /**
   * Range test of a record value against a {@code gt/gte/lt/lte} operand.\n
   *
   * Both sides readable as timestamps: compared as instants. Otherwise both sides must read as
   * numbers. Anything else is false.
   */
  public static boolean compareRange(Object fieldValue, Operator op, String operand) {
    if (fieldValue == null || op == null || operand == null || !op.isRange()) return false;

    Optional<Instant> operandTime = parseInstant(operand);
    if (operandTime.isPresent()) {
      Optional<Instant> fieldTime = parseInstant(fieldValue);
      if (fieldTime.isPresent()) return test(fieldTime.get().compareTo(operandTime.get()), op);
    }

    OptionalDouble n = parseNumber(operand);
    if (n.isEmpty()) return false;
    OptionalDouble f = parseNumber(fieldValue);
    if (f.isEmpty()) return false;
    return test(f.getAsDouble(), n.getAsDouble(), op);
  }

  /** Default and OR-list rule: containment for text, loose equality for everything else. */
  public static boolean matches(Object fieldValue, String raw) {
    if (fieldValue == null || raw == null) return false;
    if (fieldValue instanceof CharSequence cs) return containsIgnoreCase(cs.toString(), raw);
    return looseEquals(fieldValue, raw);
  }

  public static boolean containsIgnoreCase(String haystack, String needle) {
    if (haystack == null || needle == null) return false;
    return haystack.toLowerCase(Locale.ROOT).contains(needle.toLowerCase(Locale.ROOT));
  }

  /**
   * Equality of a record value and a raw query value.\n
   *
   * Numbers compare numerically ({@code 5} equals {@code "5"} and {@code "5.0"}), booleans
   * compare to {@code true}/{@code false} ignoring case, text compares exactly. Nested maps and
   * lists never equal a raw value.
   */
  public static boolean looseEquals(Object fieldValue, String raw) {
    if (fieldValue == null || raw == null) return false;
    if (fieldValue instanceof Number num) {
      OptionalDouble n = parseNumber(raw);
      OptionalDouble f = parseNumber(num);
      return n.isPresent() && f.isPresent() && f.getAsDouble() == n.getAsDouble();
    }
    if (fieldValue instanceof Boolean b) return raw.trim().equalsIgnoreCase(b.toString());
    if (fieldValue instanceof CharSequence cs) return cs.toString().equals(raw);
    if (fieldValue instanceof Character c) return raw.equals(String.valueOf(c));
    return false;
  }

  /**
   * Reads a timestamp from text. Accepts ISO-8601 instants, offset and zoned date-times, and local
   * date-times or dates (taken as UTC). Numbers are never timestamps.
   */
  public static Optional<Instant> parseInstant(Object value) {
    if (value instanceof Instant i) return Optional.of(i);
    if (value instanceof OffsetDateTime odt) return Optional.of(odt.toInstant());
    if (value instanceof ZonedDateTime zdt) return Optional.of(zdt.toInstant());
    if (!(value instanceof CharSequence cs)) return Optional.empty();

    String s = cs.toString().trim();
    // yyyy-MM-dd at minimum
    if (s.length() < 10 || !Character.isDigit(s.charAt(0)) || s.charAt(4) != '-') return Optional.empty();

    try {
      return Optional.of(Instant.parse(s));
    } catch (DateTimeParseException ignore) {
      // try the next form
    }
    try {
      return Optional.of(OffsetDateTime.parse(s).toInstant());
    } catch (DateTimeParseException ignore) {
      // try the next form
    }
    try {
      return Optional.of(ZonedDateTime.parse(s).toInstant());
    } catch (DateTimeParseException ignore) {
      // try the next form
    }
    try {
      return Optional.of(LocalDateTime.parse(s).toInstant(ZoneOffset.UTC));
    } catch (DateTimeParseException ignore) {
      // try the next form
    }
    try {
      return Optional.of(LocalDate.parse(s).atStartOfDay(ZoneOffset.UTC).toInstant());
    } catch (DateTimeParseException ignore) {
      return Optional.empty();
    }
  }

  /** Reads a finite number from a {@link Number} or decimal text. Booleans are not numbers. */
  public static OptionalDouble parseNumber(Object value) {
    if (value instanceof Number n) {
      double d = n.doubleValue();
      return Double.isFinite(d) ? OptionalDouble.of(d) : OptionalDouble.empty();
    }
    if (!(value instanceof CharSequence cs)) return OptionalDouble.empty();
    String s = cs.toString().trim();
    if (s.isEmpty()) return OptionalDouble.empty();
    try {
      double d = new BigDecimal(s).doubleValue();
      return Double.isFinite(d) ? OptionalDouble.of(d) : OptionalDouble.empty();
    } catch (NumberFormatException e) {
      return OptionalDouble.empty();
    }
  }

  /**
   * Total order over record values, nulls last.\n
   *
   * Values of different kinds order by kind: booleans, numbers, text, nested values, null.
   * Text that reads as a timestamp orders before other text and by instant among itself.
   */
  public static int compare(Object a, Object b) {
    return compareKeys(sortKey(a), sortKey(b));
  }

  private static final SortKey NULL_KEY = new SortKey(Kind.NULL, null, null);

  /** Precomputed form of a value for repeated comparisons. */
  public static SortKey sortKey(Object value) {
    if (value == null) return NULL_KEY;
    if (value instanceof Boolean) return new SortKey(Kind.BOOLEAN, value, null);
    if (value instanceof Number) return new SortKey(Kind.NUMBER, value, null);
    if (value instanceof CharSequence cs) {
      String s = cs.toString();
      return new SortKey(Kind.TEXT, s, parseInstant(s).orElse(null));
    }
    return new SortKey(Kind.NESTED, String.valueOf(value), null);
  }

  /** Same order as {@link #compare(Object, Object)} over precomputed keys; a null key is a null value. */
  static int compareKeys(SortKey a, SortKey b) {
    if (a == null) a = NULL_KEY;
    if (b == null) b = NULL_KEY;
    if (a.kind() != b.kind()) return Integer.compare(a.kind().ordinal(), b.kind().ordinal());
    switch (a.kind()) {
      case NULL:
        return 0;
      case BOOLEAN:
        return Boolean.compare((Boolean) a.value(), (Boolean) b.value());
      case NUMBER:
        return Integer.signum(Double.compare(((Number) a.value()).doubleValue(), ((Number) b.value()).doubleValue()));
      case TEXT:
        if (a.instant() != null && b.instant() != null) {
          int c = a.instant().compareTo(b.instant());
          if (c != 0) return Integer.signum(c);
        } else if (a.instant() != null) {
          return -1;
        } else if (b.instant() != null) {
          return 1;
        }
        return Integer.signum(((String) a.value()).compareTo((String) b.value()));
      default:
        return Integer.signum(((String) a.value()).compareTo((String) b.value()));
    }
  }

  public enum Kind { BOOLEAN, NUMBER, TEXT, NESTED, NULL }

  public record SortKey(Kind kind, Object value, Instant instant) {}

  private static boolean test(int cmp, Operator op) {
    switch (op) {
      case GT: return cmp > 0;
      case GE: return cmp >= 0;
      case LT: return cmp < 0;
      case LE: return cmp <= 0;
      default: return false;
    }
  }

  private static boolean test(double f, double n, Operator op) {
    switch (op) {
      case GT: return f > n;
      case GE: return f >= n;
      case LT: return f < n;
      case LE: return f <= n;
      default: return false;
    }
  }
}
