package io.intellixity.vigil.server.web;

import io.intellixity.vigil.item.Item;
import io.intellixity.vigil.pipeline.QueryPipeline;
import io.intellixity.vigil.source.ClusterMetrics;
import io.intellixity.vigil.source.CpuMetric;
import io.intellixity.vigil.source.JvmMetric;
import io.intellixity.vigil.source.MetricsSource;
import org.springframework.util.MultiValueMap;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/prometheus")
public final class PrometheusController {
  static final String RANGE_REQUIRED = "start, end, and step parameters are required";

  private final MetricsSource metrics;
  private final QueryPipeline pipeline;

  public PrometheusController(MetricsSource metrics, QueryPipeline pipeline) {
    this.metrics = metrics;
    this.pipeline = pipeline;
  }

  @GetMapping("/cluster-metrics")
  public ApiResponse<ClusterMetrics> clusterMetrics() {
    return ApiResponse.ok(metrics.clusterMetrics());
  }

  @GetMapping("/cpu-metrics")
  public ApiResponse<List<CpuMetric>> cpuMetrics(@RequestParam(value = "start", required = false) String start,
                                                 @RequestParam(value = "end", required = false) String end,
                                                 @RequestParam(value = "step", required = false) String step) {
    QuerySpecs.require(RANGE_REQUIRED, start, end, step);
    return ApiResponse.ok(metrics.cpuMetrics(start, end, step));
  }

  @GetMapping("/jvm-metrics")
  public ApiResponse<List<JvmMetric>> jvmMetrics(@RequestParam(value = "start", required = false) String start,
                                                 @RequestParam(value = "end", required = false) String end,
                                                 @RequestParam(value = "step", required = false) String step) {
    QuerySpecs.require(RANGE_REQUIRED, start, end, step);
    return ApiResponse.ok(metrics.jvmMetrics(start, end, step));
  }

  /** Rules with filtering, sorting, field selection and pagination from the query string. */
  @GetMapping("/rules")
  public ApiResponse<List<Item>> rules(@RequestParam MultiValueMap<String, String> params) {
    return ApiResponse.page(pipeline.execute(metrics.rules(), QuerySpecs.from(params)));
  }

  @GetMapping("/rule-groups")
  public ApiResponse<List<String>> ruleGroups() {
    return ApiResponse.ok(metrics.ruleGroups());
  }
}
