package com.skyfeed.dashboard.rate;

import com.skyfeed.dashboard.config.DashboardProperties;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.time.Instant;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

/**
 * Servlet filter applying per-client rate limiting to {@code /api/**} writes.
 *
 * <p>Rejected requests get HTTP 429 with the same error shape as the exception handler.
 */
@Component
public class ApiRateLimitFilter extends OncePerRequestFilter {
  private static final Logger LOGGER = LoggerFactory.getLogger(ApiRateLimitFilter.class);
  private static final String FLIGHTS_PATH = "/api/flights";

  private final DashboardProperties properties;
  private final InMemoryRateLimiter limiter;

  public ApiRateLimitFilter(DashboardProperties properties, InMemoryRateLimiter limiter) {
    this.properties = properties;
    this.limiter = limiter;
  }

  /**
   * Skips non-API paths, preflight requests and flight reads.
   *
   * <p>{@code GET /api/flights} always answers with the current snapshot, so it is never throttled.
   *
   * @param request current HTTP request
   * @return {@code true} when filtering should be skipped
   */
  @Override
  protected boolean shouldNotFilter(HttpServletRequest request) {
    String path = request.getRequestURI();
    if (path == null || !path.startsWith("/api/")) {
      return true;
    }
    String method = request.getMethod();
    return "OPTIONS".equals(method) || ("GET".equals(method) && FLIGHTS_PATH.equals(path));
  }

  @Override
  protected void doFilterInternal(
      HttpServletRequest request,
      HttpServletResponse response,
      FilterChain filterChain)
      throws ServletException, IOException {
    DashboardProperties.RateLimit limits = properties.getApi().getRateLimit();
    String client = clientKey(request);
    if (!limiter.allow(client, limits.getWindowSeconds(), limits.getMaxRequests())) {
      LOGGER.debug("Rate limit exceeded for client {} on {}", client, request.getRequestURI());
      response.setStatus(HttpStatus.TOO_MANY_REQUESTS.value());
      response.setHeader("Retry-After", String.valueOf(Math.max(1, limits.getWindowSeconds())));
      response.setContentType(MediaType.APPLICATION_JSON_VALUE);
      response.getWriter().write("{\"error\":\"too_many_requests\",\"message\":\"rate limit exceeded\","
          + "\"timestamp\":\"" + Instant.now() + "\"}");
      return;
    }

    filterChain.doFilter(request, response);
  }

  static String clientKey(HttpServletRequest request) {
    String forwardedFor = request.getHeader("X-Forwarded-For");
    if (forwardedFor != null && !forwardedFor.isBlank()) {
      return forwardedFor.split(",")[0].trim();
    }
    return request.getRemoteAddr() == null ? "unknown" : request.getRemoteAddr();
  }
}
