package io.intellixity.vigil.source.http.alertmanager;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.intellixity.vigil.item.Item;
import io.intellixity.vigil.item.Items;
import io.intellixity.vigil.source.AlertsSource;
import io.intellixity.vigil.source.HealthStatus;
import io.intellixity.vigil.source.Silence;
import io.intellixity.vigil.source.http.UpstreamClient;

import java.util.*;

import static io.intellixity.vigil.source.http.UpstreamClient.params;

/** {@link AlertsSource} over the Alertmanager API v2. */
public final class AlertmanagerAlertsSource implements AlertsSource {
  private static final ObjectMapper JSON = new ObjectMapper();

  private final UpstreamClient client;

  public AlertmanagerAlertsSource(UpstreamClient client) {
    this.client = Objects.requireNonNull(client, "client");
  }

  @Override
  public List<Item> alerts(String filter) {
    String failure = "Failed to fetch alerts";
    JsonNode alerts = array(failure, client.get(failure, "/api/v2/alerts", params("filter", filter)));
    List<Item> out = new ArrayList<>(alerts.size());
    for (JsonNode a : alerts) out.add(toAlertItem(a));
    return out;
  }

  @Override
  public JsonNode alertGroups(String filter) {
    String failure = "Failed to fetch alert groups";
    return client.get(failure, "/api/v2/alerts/groups", params("filter", filter));
  }

  @Override
  public void postAlerts(JsonNode alerts) {
    client.post("Failed to post alerts", "/api/v2/alerts", alerts);
  }

  @Override
  public List<Item> silences(String filter) {
    String failure = "Failed to fetch silences";
    return Items.fromJsonArray(array(failure, client.get(failure, "/api/v2/silences", params("filter", filter))));
  }

  @Override
  public JsonNode silence(String id) {
    return client.get("Failed to fetch silence", "/api/v2/silence/{id}", Map.of("id", id), Map.of());
  }

  @Override
  public String createSilence(Silence silence) {
    String failure = "Failed to create silence";
    JsonNode resp = client.post(failure, "/api/v2/silences", silence);
    if (resp == null || !resp.hasNonNull("silenceID")) throw client.malformed(failure, "response has no silenceID");
    return resp.get("silenceID").asText();
  }

  @Override
  public void deleteSilence(String id) {
    client.delete("Failed to delete silence", "/api/v2/silence/{id}", Map.of("id", id));
  }

  @Override
  public JsonNode receivers() {
    return client.get("Failed to fetch receivers", "/api/v2/receivers", Map.of());
  }

  @Override
  public JsonNode status() {
    return client.get("Failed to fetch status", "/api/v2/status", Map.of());
  }

  @Override
  public HealthStatus health() {
    return client.ping("Alertmanager health check failed", "/-/healthy") ? HealthStatus.HEALTHY : HealthStatus.UNHEALTHY;
  }

  private JsonNode array(String failure, JsonNode root) {
    if (root == null || !root.isArray()) throw client.malformed(failure, "expected a JSON array");
    return root;
  }

  private static Item toAlertItem(JsonNode a) {
    JsonNode labels = a.path("labels");
    Map<String, Object> labelSubset = new LinkedHashMap<>();
    labelSubset.put("cluster", textOrNull(labels.get("cluster")));
    labelSubset.put("alertname", textOrNull(labels.get("alertname")));
    labelSubset.put("instance", textOrNull(labels.get("instance")));

    Map<String, Object> m = new LinkedHashMap<>();
    m.put("id", textOrNull(a.get("fingerprint")));
    m.put("name", textOrNull(labels.get("alertname")));
    m.put("severity", textOrNull(labels.get("severity")));
    m.put("status", plain(a.get("status")));
    m.put("description", textOrNull(a.path("annotations").get("description")));
    m.put("labels", labelSubset);
    m.put("startsAt", textOrNull(a.get("startsAt")));
    return Item.of(m);
  }

  private static String textOrNull(JsonNode n) {
    return (n == null || n.isNull()) ? null : n.asText();
  }

  private static Object plain(JsonNode n) {
    return (n == null || n.isNull()) ? null : JSON.convertValue(n, Object.class);
  }
}
