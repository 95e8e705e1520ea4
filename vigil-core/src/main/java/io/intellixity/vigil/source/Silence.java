package io.intellixity.vigil.source;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.ArrayList;
import java.util.List;

/** Alertmanager silence as accepted by {@code POST /api/v2/silences}. */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record Silence(String id,
                      List<Matcher> matchers,
                      String startsAt,
                      String endsAt,
                      String createdBy,
                      String comment) {

  /** Names of the required fields that are missing or blank. Matcher contents are left to Alertmanager. */
  public List<String> missingFields() {
    List<String> out = new ArrayList<>();
    if (matchers == null) out.add("matchers");
    if (startsAt == null || startsAt.isBlank()) out.add("startsAt");
    if (endsAt == null || endsAt.isBlank()) out.add("endsAt");
    if (createdBy == null || createdBy.isBlank()) out.add("createdBy");
    if (comment == null || comment.isBlank()) out.add("comment");
    return out;
  }
}
