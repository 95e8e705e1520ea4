package io.intellixity.vigil.source;

import com.fasterxml.jackson.databind.JsonNode;
import io.intellixity.vigil.item.Item;

import java.util.List;

/**
 * Read access to a Prometheus server.\n
 *
 * Every method throws {@link UpstreamException} when the upstream call fails.\n
 */
public interface MetricsSource {
  ClusterMetrics clusterMetrics();

  List<CpuMetric> cpuMetrics(String start, String end, String step);

  List<JvmMetric> jvmMetrics(String start, String end, String step);

  /** Alerting and recording rules flattened across groups, one item per rule. */
  List<Item> rules();

  /** Distinct rule group names in first-seen order. */
  List<String> ruleGroups();

  JsonNode query(String query, String time);

  JsonNode queryRange(String query, String start, String end, String step);

  JsonNode labels();

  JsonNode labelValues(String label);

  JsonNode metricNames();

  JsonNode series(List<String> match, String start, String end);

  JsonNode targets();

  JsonNode rawRules();

  JsonNode alerts();

  HealthStatus health();
}
