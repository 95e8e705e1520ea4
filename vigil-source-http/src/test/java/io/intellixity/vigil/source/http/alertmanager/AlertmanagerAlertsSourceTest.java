package io.intellixity.vigil.source.http.alertmanager;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.intellixity.vigil.item.Item;
import io.intellixity.vigil.source.Matcher;
import io.intellixity.vigil.source.Silence;
import io.intellixity.vigil.source.UpstreamException;
import io.intellixity.vigil.source.http.UpstreamClient;
import io.intellixity.vigil.source.http.UpstreamEndpoint;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.mock.http.client.MockClientHttpRequest;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestTemplate;

import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withStatus;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

final class AlertmanagerAlertsSourceTest {
  private static final ObjectMapper JSON = new ObjectMapper();

  private static final String ALERTS = """
      [{"fingerprint":"f1","startsAt":"2024-05-01T10:00:00Z",
        "labels":{"alertname":"HighCpu","severity":"critical","cluster":"prod","instance":"es-1:9114","job":"es"},
        "annotations":{"description":"CPU above 90%"},
        "status":{"state":"active","silencedBy":[],"inhibitedBy":[]}},
       {"fingerprint":"f2","labels":{"alertname":"Watchdog"},"status":{"state":"suppressed"}}]
      """;

  private MockRestServiceServer server;
  private AlertmanagerAlertsSource source;

  @BeforeEach
  void setUp() {
    RestTemplate rest = new RestTemplate();
    server = MockRestServiceServer.bindTo(rest).build();
    source = new AlertmanagerAlertsSource(new UpstreamClient(new UpstreamEndpoint("alertmanager", "http://am", null), rest));
  }

  @Test
  void alertsAreReshaped() {
    server.expect(requestTo("http://am/api/v2/alerts")).andRespond(withSuccess(ALERTS, MediaType.APPLICATION_JSON));

    List<Item> alerts = source.alerts(null);
    server.verify();

    assertEquals(2, alerts.size());
    Item cpu = alerts.get(0);
    assertEquals(List.of("id", "name", "severity", "status", "description", "labels", "startsAt"), List.copyOf(cpu.fieldNames()));
    assertEquals(Optional.of("f1"), cpu.get("id"));
    assertEquals(Optional.of("HighCpu"), cpu.get("name"));
    assertEquals(Optional.of("critical"), cpu.get("severity"));
    assertEquals(Optional.of("CPU above 90%"), cpu.get("description"));
    assertEquals(Optional.of(Map.of("cluster", "prod", "alertname", "HighCpu", "instance", "es-1:9114")), cpu.get("labels"));
    assertEquals("active", ((Map<?, ?>) cpu.get("status").orElseThrow()).get("state"));

    Item watchdog = alerts.get(1);
    assertTrue(watchdog.get("severity").isEmpty());
    assertTrue(watchdog.get("startsAt").isEmpty());
  }

  @Test
  void filterIsForwarded() {
    server.expect(request -> {
          assertEquals("/api/v2/alerts", request.getURI().getPath());
          assertEquals("filter=severity=\"critical\"", request.getURI().getQuery());
        })
        .andRespond(withSuccess("[]", MediaType.APPLICATION_JSON));

    assertTrue(source.alerts("severity=\"critical\"").isEmpty());
    server.verify();
  }

  @Test
  void nonArrayAlertsAreMalformed() {
    server.expect(requestTo("http://am/api/v2/alerts")).andRespond(withSuccess("{}", MediaType.APPLICATION_JSON));
    assertEquals(500, assertThrows(UpstreamException.class, () -> source.alerts(null)).status());
  }

  @Test
  void silencesPassThroughAsItems() {
    server.expect(requestTo("http://am/api/v2/silences"))
        .andRespond(withSuccess("[{\"id\":\"s1\",\"createdBy\":\"ops\",\"status\":{\"state\":\"active\"}}]", MediaType.APPLICATION_JSON));

    List<Item> silences = source.silences(null);
    assertEquals(1, silences.size());
    assertEquals(Optional.of("ops"), silences.get(0).get("createdBy"));
  }

  @Test
  void createSilencePostsBodyAndReturnsId() {
    Silence silence = new Silence(null,
        List.of(new Matcher("alertname", "HighCpu", false, true)),
        "2024-05-01T10:00:00Z", "2024-05-01T12:00:00Z", "ops", "maintenance");

    server.expect(requestTo("http://am/api/v2/silences"))
        .andExpect(method(HttpMethod.POST))
        .andExpect(request -> {
          JsonNode body = JSON.readTree(((MockClientHttpRequest) request).getBodyAsString());
          assertFalse(body.has("id"));
          assertEquals("HighCpu", body.path("matchers").path(0).path("value").asText());
          assertTrue(body.path("matchers").path(0).path("isEqual").asBoolean());
          assertEquals("maintenance", body.path("comment").asText());
        })
        .andRespond(withSuccess("{\"silenceID\":\"s-42\"}", MediaType.APPLICATION_JSON));

    assertEquals("s-42", source.createSilence(silence));
    server.verify();
  }

  @Test
  void createSilenceWithoutIdInResponseFails() {
    server.expect(requestTo("http://am/api/v2/silences")).andRespond(withSuccess("{}", MediaType.APPLICATION_JSON));
    Silence silence = new Silence(null, List.of(new Matcher("a", "b", null, null)), "s", "e", "ops", "c");

    UpstreamException e = assertThrows(UpstreamException.class, () -> source.createSilence(silence));
    assertTrue(e.getMessage().startsWith("Failed to create silence"));
  }

  @Test
  void unknownSilenceKeepsNotFound() {
    server.expect(requestTo("http://am/api/v2/silence/nope")).andRespond(withStatus(HttpStatus.NOT_FOUND));
    assertEquals(404, assertThrows(UpstreamException.class, () -> source.silence("nope")).status());
  }

  @Test
  void deleteSilenceUsesDelete() {
    server.expect(requestTo("http://am/api/v2/silence/s-42"))
        .andExpect(method(HttpMethod.DELETE))
        .andRespond(withSuccess());

    source.deleteSilence("s-42");
    server.verify();
  }
}
