package io.intellixity.vigil.server.web;

import com.fasterxml.jackson.databind.JsonNode;
import io.intellixity.vigil.item.Item;
import io.intellixity.vigil.pipeline.QueryPipeline;
import io.intellixity.vigil.source.AlertsSource;
import io.intellixity.vigil.source.HealthStatus;
import io.intellixity.vigil.source.Silence;
import org.springframework.http.ResponseEntity;
import org.springframework.util.MultiValueMap;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/alertmanager")
public final class AlertmanagerController {
  /** Forwarded to Alertmanager as a matcher expression, never used as a local filter. */
  static final String UPSTREAM_FILTER = "filter";
  static final String SILENCE_REQUIRED = "Missing required fields: matchers, startsAt, endsAt, createdBy, comment";

  private final AlertsSource alerts;
  private final QueryPipeline pipeline;

  public AlertmanagerController(AlertsSource alerts, QueryPipeline pipeline) {
    this.alerts = alerts;
    this.pipeline = pipeline;
  }

  @GetMapping("/alerts")
  public ApiResponse<List<Item>> alerts(@RequestParam MultiValueMap<String, String> params) {
    List<Item> all = alerts.alerts(params.getFirst(UPSTREAM_FILTER));
    return ApiResponse.page(pipeline.execute(all, QuerySpecs.from(params).without(UPSTREAM_FILTER)));
  }

  @GetMapping("/alerts/groups")
  public ApiResponse<JsonNode> alertGroups(@RequestParam(value = UPSTREAM_FILTER, required = false) String filter) {
    return ApiResponse.ok(alerts.alertGroups(filter));
  }

  @PostMapping("/alerts")
  public ResponseEntity<ApiResponse<Void>> postAlerts(@RequestBody(required = false) JsonNode body) {
    if (body == null || !body.isArray()) {
      return ResponseEntity.badRequest().body(ApiResponse.error("Request body must be an array of alerts"));
    }
    alerts.postAlerts(body);
    return ResponseEntity.ok(ApiResponse.message("Alerts posted successfully"));
  }

  @GetMapping("/silences")
  public ApiResponse<List<Item>> silences(@RequestParam MultiValueMap<String, String> params) {
    List<Item> all = alerts.silences(params.getFirst(UPSTREAM_FILTER));
    return ApiResponse.page(pipeline.execute(all, QuerySpecs.from(params).without(UPSTREAM_FILTER)));
  }

  @GetMapping("/silence/{id}")
  public ApiResponse<JsonNode> silence(@PathVariable("id") String id) {
    return ApiResponse.ok(alerts.silence(id));
  }

  @PostMapping("/silences")
  public ResponseEntity<ApiResponse<Map<String, String>>> createSilence(@RequestBody(required = false) Silence silence) {
    if (silence == null || !silence.missingFields().isEmpty()) {
      return ResponseEntity.badRequest().body(new ApiResponse<>(false, null, null, null, SILENCE_REQUIRED));
    }
    String id = alerts.createSilence(silence);
    return ResponseEntity.ok(ApiResponse.ok(Map.of("silenceID", id)));
  }

  @DeleteMapping("/silence/{id}")
  public ApiResponse<Void> deleteSilence(@PathVariable("id") String id) {
    alerts.deleteSilence(id);
    return ApiResponse.message("Silence deleted successfully");
  }

  @GetMapping("/receivers")
  public ApiResponse<JsonNode> receivers() {
    return ApiResponse.ok(alerts.receivers());
  }

  @GetMapping("/status")
  public ApiResponse<JsonNode> status() {
    return ApiResponse.ok(alerts.status());
  }

  @GetMapping("/health")
  public ApiResponse<HealthStatus> health() {
    return ApiResponse.ok(alerts.health());
  }
}
