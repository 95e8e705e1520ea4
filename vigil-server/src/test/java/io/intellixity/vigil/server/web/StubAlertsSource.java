package io.intellixity.vigil.server.web;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import io.intellixity.vigil.item.Item;
import io.intellixity.vigil.source.AlertsSource;
import io.intellixity.vigil.source.HealthStatus;
import io.intellixity.vigil.source.Silence;

import java.util.List;

/** In-memory {@link AlertsSource} capturing what the controller forwards. */
final class StubAlertsSource implements AlertsSource {
  List<Item> alerts = List.of();
  RuntimeException failure;
  String lastFilter;
  JsonNode posted;
  Silence created;
  String deleted;

  private void check() {
    if (failure != null) throw failure;
  }

  @Override public List<Item> alerts(String filter) { check(); lastFilter = filter; return alerts; }
  @Override public JsonNode alertGroups(String filter) { check(); lastFilter = filter; return JsonNodeFactory.instance.arrayNode(); }
  @Override public void postAlerts(JsonNode alerts) { check(); posted = alerts; }
  @Override public List<Item> silences(String filter) { check(); lastFilter = filter; return List.of(); }
  @Override public JsonNode silence(String id) { check(); return JsonNodeFactory.instance.objectNode().put("id", id); }
  @Override public String createSilence(Silence silence) { check(); created = silence; return "s-1"; }
  @Override public void deleteSilence(String id) { check(); deleted = id; }
  @Override public JsonNode receivers() { check(); return JsonNodeFactory.instance.arrayNode(); }
  @Override public JsonNode status() { check(); return JsonNodeFactory.instance.objectNode(); }
  @Override public HealthStatus health() { check(); return HealthStatus.HEALTHY; }
}
