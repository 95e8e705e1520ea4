package io.intellixity.vigil.source.http;

import java.time.Duration;

/**
 * Where an upstream API lives.\n
 *
 * @param name short label used in logs and error messages ({@code prometheus})\n
 * @param baseUrl URL every API path is appended to; may carry a path prefix\n
 * @param timeout connect and read timeout\n
 */
public record UpstreamEndpoint(String name, String baseUrl, Duration timeout) {
  public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(10);

  public UpstreamEndpoint {
    if (name == null || name.isBlank()) throw new IllegalArgumentException("name is required");
    if (baseUrl == null || baseUrl.isBlank()) throw new IllegalArgumentException("baseUrl is required");
    baseUrl = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
    timeout = (timeout == null || timeout.isNegative() || timeout.isZero()) ? DEFAULT_TIMEOUT : timeout;
  }
}
