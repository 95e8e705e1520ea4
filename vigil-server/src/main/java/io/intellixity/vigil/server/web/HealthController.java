package io.intellixity.vigil.server.web;

import org.springframework.core.env.Environment;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

@RestController
public final class HealthController {
  private final Environment env;

  public HealthController(Environment env) {
    this.env = env;
  }

  @GetMapping("/health")
  public Map<String, Object> health() {
    String[] profiles = env.getActiveProfiles();
    Map<String, Object> out = new LinkedHashMap<>();
    out.put("status", "ok");
    out.put("timestamp", Instant.now().toString());
    out.put("environment", profiles.length == 0 ? "default" : String.join(",", profiles));
    return out;
  }
}
