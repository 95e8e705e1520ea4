package io.intellixity.vigil.server.web;

import com.fasterxml.jackson.databind.JsonNode;
import io.intellixity.vigil.source.HealthStatus;
import io.intellixity.vigil.source.MetricsSource;
import org.springframework.web.bind.annotation.*;

import java.util.List;

/** Prometheus API passthrough. */
@RestController
@RequestMapping("/api/prometheus/raw")
public final class PrometheusRawController {
  private final MetricsSource metrics;

  public PrometheusRawController(MetricsSource metrics) {
    this.metrics = metrics;
  }

  @GetMapping("/query")
  public ApiResponse<JsonNode> query(@RequestParam(value = "query", required = false) String query,
                                     @RequestParam(value = "time", required = false) String time) {
    QuerySpecs.require("Query parameter is required", query);
    return ApiResponse.ok(metrics.query(query, time));
  }

  @GetMapping("/query_range")
  public ApiResponse<JsonNode> queryRange(@RequestParam(value = "query", required = false) String query,
                                          @RequestParam(value = "start", required = false) String start,
                                          @RequestParam(value = "end", required = false) String end,
                                          @RequestParam(value = "step", required = false) String step) {
    QuerySpecs.require("Query, start, end, and step parameters are required", query, start, end, step);
    return ApiResponse.ok(metrics.queryRange(query, start, end, step));
  }

  @GetMapping("/labels")
  public ApiResponse<JsonNode> labels() {
    return ApiResponse.ok(metrics.labels());
  }

  @GetMapping("/label/{label}/values")
  public ApiResponse<JsonNode> labelValues(@PathVariable("label") String label) {
    return ApiResponse.ok(metrics.labelValues(label));
  }

  @GetMapping("/metrics")
  public ApiResponse<JsonNode> metricNames() {
    return ApiResponse.ok(metrics.metricNames());
  }

  @GetMapping("/series")
  public ApiResponse<JsonNode> series(@RequestParam(value = "match", required = false) List<String> match,
                                      @RequestParam(value = "start", required = false) String start,
                                      @RequestParam(value = "end", required = false) String end) {
    if (match == null || match.isEmpty()) throw new IllegalArgumentException("Match parameter is required");
    return ApiResponse.ok(metrics.series(match, start, end));
  }

  @GetMapping("/targets")
  public ApiResponse<JsonNode> targets() {
    return ApiResponse.ok(metrics.targets());
  }

  @GetMapping("/rules")
  public ApiResponse<JsonNode> rules() {
    return ApiResponse.ok(metrics.rawRules());
  }

  @GetMapping("/alerts")
  public ApiResponse<JsonNode> alerts() {
    return ApiResponse.ok(metrics.alerts());
  }

  @GetMapping("/health")
  public ApiResponse<HealthStatus> health() {
    return ApiResponse.ok(metrics.health());
  }
}
