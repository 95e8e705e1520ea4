package io.intellixity.vigil.server.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.List;

@ConfigurationProperties(prefix = "vigil.cors")
public class CorsProperties {
  /** Origin patterns; {@code *} allows any origin. */
  private List<String> allowedOrigins = new ArrayList<>(List.of("*"));

  public List<String> getAllowedOrigins() { return allowedOrigins; }
  public void setAllowedOrigins(List<String> allowedOrigins) { this.allowedOrigins = allowedOrigins; }
}
