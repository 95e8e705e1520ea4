package io.intellixity.vigil.source;

import com.fasterxml.jackson.databind.JsonNode;
import io.intellixity.vigil.item.Item;

import java.util.List;

/**
 * Access to an Alertmanager instance.\n
 *
 * {@code filter} arguments are Alertmanager matcher expressions passed through verbatim; null
 * means no filter. Every method throws {@link UpstreamException} when the upstream call fails.\n
 */
public interface AlertsSource {
  List<Item> alerts(String filter);

  JsonNode alertGroups(String filter);

  void postAlerts(JsonNode alerts);

  List<Item> silences(String filter);

  JsonNode silence(String id);

  /** Returns the id Alertmanager assigned. */
  String createSilence(Silence silence);

  void deleteSilence(String id);

  JsonNode receivers();

  JsonNode status();

  HealthStatus health();
}
