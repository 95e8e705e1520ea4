package io.intellixity.vigil.server.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

@ConfigurationProperties(prefix = "vigil.upstream")
public class UpstreamProperties {
  private String prometheusUrl = "http://localhost:9090/prometheus";
  private String alertmanagerUrl = "http://localhost:9093";

  /** Connect and read timeout for both upstreams. */
  private Duration timeout = Duration.ofSeconds(10);

  public String getPrometheusUrl() { return prometheusUrl; }
  public void setPrometheusUrl(String prometheusUrl) { this.prometheusUrl = prometheusUrl; }
  public String getAlertmanagerUrl() { return alertmanagerUrl; }
  public void setAlertmanagerUrl(String alertmanagerUrl) { this.alertmanagerUrl = alertmanagerUrl; }
  public Duration getTimeout() { return timeout; }
  public void setTimeout(Duration timeout) { this.timeout = timeout; }
}
