package io.intellixity.vigil.server.web;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;

/** One access log line per request: method, path, status, duration. */
@Component
public final class RequestLoggingFilter extends OncePerRequestFilter {
  private static final Logger log = LoggerFactory.getLogger(RequestLoggingFilter.class);

  @Override
  protected void doFilterInternal(HttpServletRequest request,
                                  HttpServletResponse response,
                                  FilterChain filterChain) throws ServletException, IOException {
    long started = System.nanoTime();
    try {
      filterChain.doFilter(request, response);
    } finally {
      if (log.isInfoEnabled()) {
        String query = request.getQueryString();
        log.info("{} {}{} {} {} ms",
            request.getMethod(),
            request.getRequestURI(),
            query == null ? "" : "?" + query,
            response.getStatus(),
            String.format("%.3f", (System.nanoTime() - started) / 1_000_000.0));
      }
    }
  }
}
