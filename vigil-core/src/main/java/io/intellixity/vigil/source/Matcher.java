package io.intellixity.vigil.source;

import com.fasterxml.jackson.annotation.JsonInclude;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record Matcher(String name, String value, Boolean isRegex, Boolean isEqual) {}
