package io.intellixity.vigil.server.web;

import io.intellixity.vigil.item.Item;
import io.intellixity.vigil.pipeline.QueryPipeline;
import io.intellixity.vigil.source.UpstreamException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

final class AlertmanagerControllerTest {
  private StubAlertsSource alerts;
  private MockMvc mvc;

  @BeforeEach
  void setUp() {
    alerts = new StubAlertsSource();
    alerts.alerts = List.of(
        Item.of("id", "f1", "name", "HighCpu", "severity", "critical"),
        Item.of("id", "f2", "name", "Watchdog", "severity", "none"),
        Item.of("id", "f3", "name", "HighHeap", "severity", "critical")
    );
    mvc = MockMvcBuilders
        .standaloneSetup(new AlertmanagerController(alerts, new QueryPipeline()))
        .setControllerAdvice(new ApiExceptionHandler())
        .build();
  }

  @Test
  void upstreamFilterIsForwardedAndNotAppliedLocally() throws Exception {
    mvc.perform(get("/api/alertmanager/alerts")
            .param("filter", "alertname=\"HighCpu\"")
            .param("severity", "critical")
            .param("sort", "-id"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.data.length()").value(2))
        .andExpect(jsonPath("$.data[0].id").value("f3"))
        .andExpect(jsonPath("$.data[1].id").value("f1"))
        .andExpect(jsonPath("$.pagination.total").value(2));
    assertEquals("alertname=\"HighCpu\"", alerts.lastFilter);
  }

  @Test
  void alertsWithoutFilterSendNone() throws Exception {
    mvc.perform(get("/api/alertmanager/alerts"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.data.length()").value(3));
    assertNull(alerts.lastFilter);
  }

  @Test
  void postAlertsRequiresArray() throws Exception {
    mvc.perform(post("/api/alertmanager/alerts").contentType(MediaType.APPLICATION_JSON).content("{\"labels\":{}}"))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.error").value("Request body must be an array of alerts"));
    assertNull(alerts.posted);

    mvc.perform(post("/api/alertmanager/alerts").contentType(MediaType.APPLICATION_JSON)
            .content("[{\"labels\":{\"alertname\":\"Test\"}}]"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.success").value(true))
        .andExpect(jsonPath("$.message").value("Alerts posted successfully"));
    assertEquals("Test", alerts.posted.path(0).path("labels").path("alertname").asText());
  }

  @Test
  void malformedBodyIsBadRequest() throws Exception {
    mvc.perform(post("/api/alertmanager/alerts").contentType(MediaType.APPLICATION_JSON).content("[{"))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.error").value("Malformed JSON request body"));
  }

  @Test
  void createSilenceValidatesFields() throws Exception {
    mvc.perform(post("/api/alertmanager/silences").contentType(MediaType.APPLICATION_JSON)
            .content("{\"matchers\":[],\"createdBy\":\"ops\"}"))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.success").value(false))
        .andExpect(jsonPath("$.error").value(AlertmanagerController.SILENCE_REQUIRED));
    assertNull(alerts.created);
  }

  @Test
  void createSilenceReturnsId() throws Exception {
    String body = "{\"matchers\":[{\"name\":\"alertname\",\"value\":\"HighCpu\",\"isRegex\":false}],"
        + "\"startsAt\":\"2024-05-01T10:00:00Z\",\"endsAt\":\"2024-05-01T12:00:00Z\","
        + "\"createdBy\":\"ops\",\"comment\":\"maintenance\"}";

    mvc.perform(post("/api/alertmanager/silences").contentType(MediaType.APPLICATION_JSON).content(body))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.data.silenceID").value("s-1"));
    assertEquals("HighCpu", alerts.created.matchers().get(0).value());
    assertEquals("ops", alerts.created.createdBy());
  }

  @Test
  void emptyMatcherListIsForwarded() throws Exception {
    String body = "{\"matchers\":[],\"startsAt\":\"2024-05-01T10:00:00Z\",\"endsAt\":\"2024-05-01T12:00:00Z\","
        + "\"createdBy\":\"ops\",\"comment\":\"maintenance\"}";

    mvc.perform(post("/api/alertmanager/silences").contentType(MediaType.APPLICATION_JSON).content(body))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.data.silenceID").value("s-1"));
    assertEquals(List.of(), alerts.created.matchers());
  }

  @Test
  void deleteSilence() throws Exception {
    mvc.perform(delete("/api/alertmanager/silence/s-9"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.message").value("Silence deleted successfully"));
    assertEquals("s-9", alerts.deleted);
  }

  @Test
  void missingSilenceKeepsUpstreamNotFound() throws Exception {
    alerts.failure = new UpstreamException("Failed to fetch silence: 404 Not Found", 404);
    mvc.perform(get("/api/alertmanager/silence/nope"))
        .andExpect(status().isNotFound())
        .andExpect(jsonPath("$.error").value("Failed to fetch silence: 404 Not Found"));
  }
}
