package io.intellixity.vigil.server.config;

import io.intellixity.vigil.pipeline.QueryPipeline;
import io.intellixity.vigil.source.AlertsSource;
import io.intellixity.vigil.source.MetricsSource;
import io.intellixity.vigil.source.http.UpstreamClient;
import io.intellixity.vigil.source.http.UpstreamEndpoint;
import io.intellixity.vigil.source.http.alertmanager.AlertmanagerAlertsSource;
import io.intellixity.vigil.source.http.prometheus.PrometheusMetricsSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.servlet.config.annotation.CorsRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

@Configuration
@EnableConfigurationProperties({UpstreamProperties.class, CorsProperties.class})
public class VigilServerConfig {
  private static final Logger log = LoggerFactory.getLogger(VigilServerConfig.class);

  @Bean
  public QueryPipeline queryPipeline() {
    return new QueryPipeline();
  }

  @Bean
  public MetricsSource metricsSource(UpstreamProperties props) {
    UpstreamEndpoint endpoint = new UpstreamEndpoint("prometheus", props.getPrometheusUrl(), props.getTimeout());
    log.info("vigil.upstream name={} url={} timeout={}", endpoint.name(), endpoint.baseUrl(), endpoint.timeout());
    return new PrometheusMetricsSource(new UpstreamClient(endpoint));
  }

  @Bean
  public AlertsSource alertsSource(UpstreamProperties props) {
    UpstreamEndpoint endpoint = new UpstreamEndpoint("alertmanager", props.getAlertmanagerUrl(), props.getTimeout());
    log.info("vigil.upstream name={} url={} timeout={}", endpoint.name(), endpoint.baseUrl(), endpoint.timeout());
    return new AlertmanagerAlertsSource(new UpstreamClient(endpoint));
  }

  @Bean
  public WebMvcConfigurer corsConfigurer(CorsProperties cors) {
    String[] origins = cors.getAllowedOrigins().stream()
        .map(String::trim)
        .filter(s -> !s.isEmpty())
        .toArray(String[]::new);
    return new WebMvcConfigurer() {
      @Override
      public void addCorsMappings(CorsRegistry registry) {
        registry.addMapping("/**")
            .allowedOriginPatterns(origins.length == 0 ? new String[] {"*"} : origins)
            .allowedMethods("GET", "POST", "DELETE", "OPTIONS")
            .allowCredentials(true);
      }
    };
  }
}
