package io.intellixity.vigil.source.http;

import com.fasterxml.jackson.databind.JsonNode;
import io.intellixity.vigil.source.UpstreamException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestClientResponseException;
import org.springframework.web.client.RestTemplate;
import org.springframework.web.util.UriComponentsBuilder;

import java.net.URI;
import java.util.*;
import java.util.function.Supplier;

/**
 * JSON-over-HTTP calls against one {@link UpstreamEndpoint}.\n
 *
 * Every call takes a failure prefix ({@code "Failed to fetch alerts"}); any transport or HTTP
 * error is rethrown as {@link UpstreamException} with that prefix and the upstream status.\n
 */
public final class UpstreamClient {
  private static final Logger log = LoggerFactory.getLogger(UpstreamClient.class);

  private final UpstreamEndpoint endpoint;
  private final RestTemplate rest;

  public UpstreamClient(UpstreamEndpoint endpoint) {
    this(endpoint, restTemplate(endpoint));
  }

  public UpstreamClient(UpstreamEndpoint endpoint, RestTemplate rest) {
    this.endpoint = Objects.requireNonNull(endpoint, "endpoint");
    this.rest = Objects.requireNonNull(rest, "rest");
  }

  public static RestTemplate restTemplate(UpstreamEndpoint endpoint) {
    SimpleClientHttpRequestFactory f = new SimpleClientHttpRequestFactory();
    f.setConnectTimeout((int) endpoint.timeout().toMillis());
    f.setReadTimeout((int) endpoint.timeout().toMillis());
    return new RestTemplate(f);
  }

  public JsonNode get(String failure, String path, Map<String, List<String>> query) {
    URI uri = uri(path, Map.of(), query);
    return call(failure, "GET", uri, () -> rest.getForObject(uri, JsonNode.class));
  }

  public JsonNode get(String failure, String path, Map<String, ?> pathVars, Map<String, List<String>> query) {
    URI uri = uri(path, pathVars, query);
    return call(failure, "GET", uri, () -> rest.getForObject(uri, JsonNode.class));
  }

  public JsonNode post(String failure, String path, Object body) {
    URI uri = uri(path, Map.of(), Map.of());
    HttpHeaders h = new HttpHeaders();
    h.setContentType(MediaType.APPLICATION_JSON);
    HttpEntity<Object> req = new HttpEntity<>(body, h);
    return call(failure, "POST", uri, () -> rest.exchange(uri, HttpMethod.POST, req, JsonNode.class).getBody());
  }

  public void delete(String failure, String path, Map<String, ?> pathVars) {
    URI uri = uri(path, pathVars, Map.of());
    call(failure, "DELETE", uri, () -> {
      rest.delete(uri);
      return null;
    });
  }

  /** True on a 2xx answer; a non-2xx answer or an unreachable upstream raises. */
  public boolean ping(String failure, String path) {
    URI uri = uri(path, Map.of(), Map.of());
    ResponseEntity<String> resp = call(failure, "GET", uri, () -> rest.getForEntity(uri, String.class));
    return resp != null && resp.getStatusCode().value() == 200;
  }

  /** Query parameters from name/value pairs; pairs with a null value are skipped. */
  public static Map<String, List<String>> params(String... nameValues) {
    if (nameValues.length % 2 != 0) throw new IllegalArgumentException("name/value pairs expected");
    Map<String, List<String>> out = new LinkedHashMap<>();
    for (int i = 0; i < nameValues.length; i += 2) {
      if (nameValues[i + 1] != null) out.computeIfAbsent(nameValues[i], k -> new ArrayList<>()).add(nameValues[i + 1]);
    }
    return out;
  }

  /** Upstream payload present but not in the expected shape. */
  public UpstreamException malformed(String failure, String detail) {
    return new UpstreamException(failure + ": " + detail, UpstreamException.DEFAULT_STATUS);
  }

  private <T> T call(String failure, String method, URI uri, Supplier<T> work) {
    long started = System.nanoTime();
    try {
      T out = work.get();
      if (log.isDebugEnabled()) {
        log.debug("vigil.upstream name={} method={} uri={} durationMs={}",
            endpoint.name(), method, uri, (System.nanoTime() - started) / 1_000_000.0);
      }
      return out;
    } catch (RestClientResponseException e) {
      log.debug("vigil.upstream_failed name={} method={} uri={} status={}",
          endpoint.name(), method, uri, e.getStatusCode().value());
      throw new UpstreamException(failure + ": " + e.getMessage(), e.getStatusCode().value(), e);
    } catch (RestClientException e) {
      log.debug("vigil.upstream_failed name={} method={} uri={} error={}",
          endpoint.name(), method, uri, e.getClass().getSimpleName());
      throw new UpstreamException(failure + ": " + e.getMessage(), UpstreamException.DEFAULT_STATUS, e);
    }
  }

  // Values go through URI variables so PromQL braces and quotes are encoded, not expanded.
  private URI uri(String path, Map<String, ?> pathVars, Map<String, List<String>> query) {
    UriComponentsBuilder b = UriComponentsBuilder.fromUriString(endpoint.baseUrl()).path(path);
    Map<String, Object> vars = new HashMap<>(pathVars);
    int i = 0;
    for (var e : query.entrySet()) {
      List<String> values = e.getValue();
      if (values == null || values.isEmpty()) continue;
      Object[] placeholders = new Object[values.size()];
      for (int j = 0; j < values.size(); j++) {
        String var = "q" + (i++);
        vars.put(var, values.get(j));
        placeholders[j] = "{" + var + "}";
      }
      b.queryParam(e.getKey(), placeholders);
    }
    return b.encode().buildAndExpand(vars).toUri();
  }
}
