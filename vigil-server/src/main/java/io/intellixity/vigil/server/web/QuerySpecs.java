package io.intellixity.vigil.server.web;

import io.intellixity.vigil.query.QuerySpec;
import org.springframework.util.MultiValueMap;

/** Builds a {@link QuerySpec} from request parameters; repeated keys keep every value in order. */
final class QuerySpecs {
  private QuerySpecs() {}

  static QuerySpec from(MultiValueMap<String, String> params) {
    if (params == null || params.isEmpty()) return QuerySpec.empty();
    QuerySpec.Builder b = QuerySpec.builder();
    for (var e : params.entrySet()) b.addAll(e.getKey(), e.getValue());
    return b.build();
  }

  static void require(String message, String... values) {
    for (String v : values) {
      if (v == null || v.isBlank()) throw new IllegalArgumentException(message);
    }
  }
}
