package io.intellixity.vigil.query;

/**
 * Page-number pagination. Both values are 1-based and always at least 1.\n
 */
public record PageRequest(int page, int limit) {
  public static final int DEFAULT_PAGE = 1;
  public static final int DEFAULT_LIMIT = 100;

  public PageRequest {
    if (page <= 0) throw new IllegalArgumentException("page must be > 0");
    if (limit <= 0) throw new IllegalArgumentException("limit must be > 0");
  }

  public static PageRequest defaults() {
    return new PageRequest(DEFAULT_PAGE, DEFAULT_LIMIT);
  }

  /** Lenient parse of raw query values; unparseable or non-positive values fall back to the defaults. */
  public static PageRequest parse(String page, String limit) {
    return new PageRequest(positiveOr(page, DEFAULT_PAGE), positiveOr(limit, DEFAULT_LIMIT));
  }

  /** Number of items before this page. Long so that huge page numbers cannot overflow. */
  public long offset() {
    return (long) (page - 1) * limit;
  }

  private static int positiveOr(String raw, int def) {
    if (raw == null || raw.isBlank()) return def;
    try {
      int v = Integer.parseInt(raw.trim());
      return v > 0 ? v : def;
    } catch (NumberFormatException e) {
      return def;
    }
  }
}
