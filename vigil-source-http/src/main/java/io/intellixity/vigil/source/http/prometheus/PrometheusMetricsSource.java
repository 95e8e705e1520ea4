package io.intellixity.vigil.source.http.prometheus;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.intellixity.vigil.item.Item;
import io.intellixity.vigil.item.Items;
import io.intellixity.vigil.source.*;
import io.intellixity.vigil.source.http.UpstreamClient;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.Instant;
import java.util.*;

import static io.intellixity.vigil.source.http.UpstreamClient.params;

/** {@link MetricsSource} over the Prometheus HTTP API v1. */
public final class PrometheusMetricsSource implements MetricsSource {
  static final String HEALTH_STATUS = "elasticsearch_cluster_health_status";
  static final String NODES = "elasticsearch_cluster_health_number_of_nodes";
  static final String DATA_NODES = "elasticsearch_cluster_health_number_of_data_nodes";
  static final String PRIMARY_SHARDS = "elasticsearch_cluster_health_active_primary_shards";
  static final String UNASSIGNED_SHARDS = "elasticsearch_cluster_health_unassigned_shards";
  static final String DOCS_TOTAL = "elasticsearch_indices_docs_total";
  static final String CPU_PERCENT = "elasticsearch_process_cpu_percent";
  static final String HEAP_USED = "elasticsearch_jvm_memory_used_bytes{area=\"heap\"}";
  static final String HEAP_MAX = "elasticsearch_jvm_memory_max_bytes";

  private static final ObjectMapper JSON = new ObjectMapper();
  private static final BigDecimal KIB = BigDecimal.valueOf(1024);
  private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

  private final UpstreamClient client;
  private final Clock clock;

  public PrometheusMetricsSource(UpstreamClient client) {
    this(client, Clock.systemUTC());
  }

  public PrometheusMetricsSource(UpstreamClient client, Clock clock) {
    this.client = Objects.requireNonNull(client, "client");
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  @Override
  public ClusterMetrics clusterMetrics() {
    String failure = "Failed to get Cluster metrics";
    String health = "";
    for (JsonNode r : result(failure, instant(failure, HEALTH_STATUS, null))) {
      if ("1".equals(r.path("value").path(1).asText())) {
        health = r.path("metric").path("color").asText("");
        break;
      }
    }
    long docs = 0;
    for (JsonNode r : result(failure, instant(failure, DOCS_TOTAL, null))) {
      docs += toLong(failure, r.path("value").path(1));
    }
    return new ClusterMetrics(
        health,
        gauge(failure, NODES),
        gauge(failure, DATA_NODES),
        gauge(failure, PRIMARY_SHARDS),
        gauge(failure, UNASSIGNED_SHARDS),
        docs,
        Instant.now(clock)
    );
  }

  @Override
  public List<CpuMetric> cpuMetrics(String start, String end, String step) {
    String failure = "Failed to get CPU metrics";
    List<CpuMetric> out = new ArrayList<>();
    for (JsonNode node : result(failure, range(failure, CPU_PERCENT, start, end, step))) {
      String nodeName = node.path("metric").path("name").asText(null);
      for (JsonNode v : node.path("values")) {
        out.add(new CpuMetric(epoch(v.path(0)), nodeName, toDecimal(failure, v.path(1)).doubleValue()));
      }
    }
    return out;
  }

  @Override
  public List<JvmMetric> jvmMetrics(String start, String end, String step) {
    String failure = "Failed to get JVM metrics";
    JsonNode used = range(failure, HEAP_USED, start, end, step);
    JsonNode max = range(failure, HEAP_MAX, start, end, step);

    Map<String, BigDecimal> maxByPoint = new HashMap<>();
    for (JsonNode node : result(failure, max)) {
      String nodeName = node.path("metric").path("name").asText(null);
      for (JsonNode v : node.path("values")) {
        maxByPoint.put(pointKey(epoch(v.path(0)), nodeName), kib(toDecimal(failure, v.path(1))));
      }
    }

    List<JvmMetric> out = new ArrayList<>();
    for (JsonNode node : result(failure, used)) {
      String nodeName = node.path("metric").path("name").asText(null);
      for (JsonNode v : node.path("values")) {
        Instant ts = epoch(v.path(0));
        BigDecimal heapMax = maxByPoint.get(pointKey(ts, nodeName));
        // no matching max sample for this point
        if (heapMax == null) continue;
        BigDecimal heapUsed = kib(toDecimal(failure, v.path(1)));
        BigDecimal percent = heapMax.signum() == 0
            ? BigDecimal.ZERO.setScale(2)
            : heapUsed.multiply(HUNDRED).divide(heapMax, 2, RoundingMode.HALF_UP);
        out.add(new JvmMetric(ts, nodeName, heapUsed, heapMax, percent));
      }
    }
    return out;
  }

  @Override
  public List<Item> rules() {
    String failure = "Failed to fetch rules";
    JsonNode groups = data(failure, client.get(failure, "/api/v1/rules", Map.of())).path("groups");
    List<Item> out = new ArrayList<>();
    for (JsonNode g : groups) {
      String groupName = g.path("name").asText(null);
      for (JsonNode r : g.path("rules")) out.add(toRuleItem(groupName, r));
    }
    return out;
  }

  @Override
  public List<String> ruleGroups() {
    String failure = "Failed to fetch rule groups";
    JsonNode groups = data(failure, client.get(failure, "/api/v1/rules", Map.of())).path("groups");
    Set<String> names = new LinkedHashSet<>();
    for (JsonNode g : groups) {
      if (g.hasNonNull("name")) names.add(g.get("name").asText());
    }
    return List.copyOf(names);
  }

  @Override
  public JsonNode query(String query, String time) {
    return instant("Prometheus query failed", query, time);
  }

  @Override
  public JsonNode queryRange(String query, String start, String end, String step) {
    return range("Prometheus range query failed", query, start, end, step);
  }

  @Override
  public JsonNode labels() {
    String failure = "Failed to fetch labels";
    return data(failure, client.get(failure, "/api/v1/labels", Map.of()));
  }

  @Override
  public JsonNode labelValues(String label) {
    String failure = "Failed to fetch label values";
    return data(failure, client.get(failure, "/api/v1/label/{label}/values", Map.of("label", label), Map.of()));
  }

  @Override
  public JsonNode metricNames() {
    String failure = "Failed to fetch metrics";
    return data(failure, client.get(failure, "/api/v1/label/__name__/values", Map.of()));
  }

  @Override
  public JsonNode series(List<String> match, String start, String end) {
    String failure = "Failed to fetch series";
    Map<String, List<String>> q = new LinkedHashMap<>();
    q.put("match[]", List.copyOf(match));
    q.putAll(params("start", start, "end", end));
    return data(failure, client.get(failure, "/api/v1/series", q));
  }

  @Override
  public JsonNode targets() {
    String failure = "Failed to fetch targets";
    return data(failure, client.get(failure, "/api/v1/targets", Map.of()));
  }

  @Override
  public JsonNode rawRules() {
    String failure = "Failed to fetch rules";
    return data(failure, client.get(failure, "/api/v1/rules", Map.of()));
  }

  @Override
  public JsonNode alerts() {
    String failure = "Failed to fetch alerts";
    return data(failure, client.get(failure, "/api/v1/alerts", Map.of())).path("alerts");
  }

  @Override
  public HealthStatus health() {
    return client.ping("Prometheus health check failed", "/-/healthy") ? HealthStatus.HEALTHY : HealthStatus.UNHEALTHY;
  }

  private JsonNode instant(String failure, String query, String time) {
    return client.get(failure, "/api/v1/query", params("query", query, "time", time));
  }

  private JsonNode range(String failure, String query, String start, String end, String step) {
    return client.get(failure, "/api/v1/query_range", params("query", query, "start", start, "end", end, "step", step));
  }

  /** Single-sample instant query read as an integer; failures nest under the caller's prefix. */
  private long gauge(String caller, String metric) {
    String failure = caller + ": Prometheus query failed";
    JsonNode result = result(failure, instant(failure, metric, null));
    if (result.isEmpty()) throw client.malformed(failure, "no sample for " + metric);
    return toLong(failure, result.get(0).path("value").path(1));
  }

  private Item toRuleItem(String groupName, JsonNode r) {
    List<Object> alerts = new ArrayList<>();
    for (JsonNode a : r.path("alerts")) {
      Map<String, Object> alert = new LinkedHashMap<>();
      alert.put("id", UUID.randomUUID().toString());
      alert.putAll(Items.fromJson(a).asMap());
      alerts.add(alert);
    }
    Map<String, Object> m = new LinkedHashMap<>();
    m.put("id", textOrNull(r.get("name")));
    m.put("name", textOrNull(r.get("name")));
    m.put("groupName", groupName);
    m.put("state", textOrNull(r.get("state")));
    m.put("query", textOrNull(r.get("query")));
    m.put("duration", plain(r.get("duration")));
    m.put("severity", textOrNull(r.path("labels").get("severity")));
    m.put("annotations", plain(r.get("annotations")));
    m.put("alerts", alerts);
    m.put("lastEvaluation", textOrNull(r.get("lastEvaluation")));
    return Item.of(m);
  }

  private JsonNode data(String failure, JsonNode root) {
    if (root == null || !root.has("data")) throw client.malformed(failure, "response has no data");
    return root.get("data");
  }

  private JsonNode result(String failure, JsonNode root) {
    JsonNode result = data(failure, root).path("result");
    if (!result.isArray()) throw client.malformed(failure, "response has no result array");
    return result;
  }

  private long toLong(String failure, JsonNode n) {
    return toDecimal(failure, n).longValue();
  }

  private BigDecimal toDecimal(String failure, JsonNode n) {
    try {
      return new BigDecimal(n.asText());
    } catch (NumberFormatException e) {
      throw client.malformed(failure, "sample value is not a number: " + n);
    }
  }

  private static BigDecimal kib(BigDecimal bytes) {
    return bytes.divide(KIB, 2, RoundingMode.HALF_UP);
  }

  private static Instant epoch(JsonNode seconds) {
    return Instant.ofEpochMilli(Math.round(seconds.asDouble() * 1000));
  }

  private static String pointKey(Instant ts, String nodeName) {
    return ts.toEpochMilli() + "|" + nodeName;
  }

  private static String textOrNull(JsonNode n) {
    return (n == null || n.isNull()) ? null : n.asText();
  }

  private static Object plain(JsonNode n) {
    return (n == null || n.isNull()) ? null : JSON.convertValue(n, Object.class);
  }
}
