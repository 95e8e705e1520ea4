package io.intellixity.vigil.source;

public record HealthStatus(String status) {
  public static final HealthStatus HEALTHY = new HealthStatus("healthy");
  public static final HealthStatus UNHEALTHY = new HealthStatus("unhealthy");
}
