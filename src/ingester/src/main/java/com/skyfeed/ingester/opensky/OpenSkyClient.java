package com.skyfeed.ingester.opensky;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.skyfeed.ingester.config.OpenSkyProperties;
import com.skyfeed.ingester.region.Region;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

@Component
public class OpenSkyClient {
  private static final Logger log = LoggerFactory.getLogger(OpenSkyClient.class);

  private final OpenSkyProperties properties;
  private final OpenSkyTokenService tokenService;
  private final HttpClient httpClient;
  private final ObjectMapper objectMapper;
  private final Timer statesRequestTimer;
  private final Counter statesRequestSuccessCounter;
  private final Counter statesRequestRateLimitedCounter;
  private final Counter statesRequestClientErrorCounter;
  private final Counter statesRequestServerErrorCounter;
  private final Counter statesRequestExceptionCounter;
  private final Counter malformedRowCounter;
  private final AtomicInteger lastStatusCode = new AtomicInteger(0);

  public OpenSkyClient(
      OpenSkyProperties properties,
      OpenSkyTokenService tokenService,
      MeterRegistry meterRegistry,
      HttpClient httpClient,
      ObjectMapper objectMapper) {
    this.properties = properties;
    this.tokenService = tokenService;
    this.httpClient = httpClient;
    this.objectMapper = objectMapper;

    this.statesRequestTimer = Timer.builder("ingester.opensky.states.http.duration")
        .description("OpenSky /states/all HTTP request duration (seconds)")
        .publishPercentileHistogram(true)
        .register(meterRegistry);

    // Keep cardinality low: a handful of outcomes, no URL labels.
    this.statesRequestSuccessCounter = outcomeCounter(meterRegistry, "success");
    this.statesRequestRateLimitedCounter = outcomeCounter(meterRegistry, "rate_limited");
    this.statesRequestClientErrorCounter = outcomeCounter(meterRegistry, "client_error");
    this.statesRequestServerErrorCounter = outcomeCounter(meterRegistry, "server_error");
    this.statesRequestExceptionCounter = outcomeCounter(meterRegistry, "exception");
    this.malformedRowCounter = meterRegistry.counter("ingester.opensky.states.malformed.total");

    meterRegistry.gauge("ingester.opensky.states.http.last_status", lastStatusCode);
  }

  /**
   * Queries the current state vectors inside one region.
   *
   * <p>Never throws for upstream trouble: timeouts, I/O errors, token failures and non-2xx
   * answers are reported through {@link FetchResult#status()}.
   */
  public FetchResult fetchStates(Region region) {
    long httpStartNs = -1L;
    boolean recorded = false;
    try {
      String baseUrl = properties.baseUrl();
      if (baseUrl == null || baseUrl.isBlank()) {
        throw new IllegalStateException("OpenSky base URL is missing.");
      }
      String url = String.format(
          Locale.ROOT,
          "%s/states/all?lamin=%s&lamax=%s&lomin=%s&lomax=%s",
          stripTrailingSlash(baseUrl.trim()),
          region.southWestLat(),
          region.northEastLat(),
          region.southWestLon(),
          region.northEastLon());

      HttpRequest.Builder builder = HttpRequest.newBuilder()
          .uri(URI.create(url))
          .timeout(properties.requestTimeout())
          .GET();
      Optional<String> token = tokenService.currentToken();
      token.ifPresent(value -> builder.header("Authorization", "Bearer " + value));

      httpStartNs = System.nanoTime();
      HttpResponse<String> response = httpClient.send(builder.build(), HttpResponse.BodyHandlers.ofString());
      lastStatusCode.set(response.statusCode());
      statesRequestTimer.record(System.nanoTime() - httpStartNs, TimeUnit.NANOSECONDS);
      recorded = true;
      Integer remainingCredits = parseIntHeader(response.headers().firstValue("X-Rate-Limit-Remaining"));

      if (response.statusCode() == 429) {
        statesRequestRateLimitedCounter.increment();
        log.warn("OpenSky rate limit hit (429) for region {}", region.id());
        return FetchResult.rateLimited(remainingCredits);
      }
      if (response.statusCode() >= 400) {
        if (response.statusCode() >= 500) {
          statesRequestServerErrorCounter.increment();
        } else {
          statesRequestClientErrorCounter.increment();
        }
        log.warn("OpenSky fetch failed: status={} region={}", response.statusCode(), region.id());
        return FetchResult.failed(response.statusCode(), remainingCredits);
      }
      statesRequestSuccessCounter.increment();

      JsonNode root = objectMapper.readTree(response.body());
      JsonNode states = root.path("states");
      if (!states.isArray()) {
        // OpenSky answers "states": null when nothing is airborne in the box.
        return FetchResult.success(List.of(), response.statusCode(), remainingCredits);
      }

      // Each row is a fixed-position array defined by OpenSky; we map selected fields.
      List<FlightState> results = new ArrayList<>();
      for (JsonNode row : states) {
        FlightState state = row.isArray() ? parseState(row) : null;
        if (state == null) {
          malformedRowCounter.increment();
          log.debug("Skipping malformed OpenSky row: {}", row);
          continue;
        }
        results.add(state);
      }
      return FetchResult.success(results, response.statusCode(), remainingCredits);
    } catch (InterruptedException ex) {
      lastStatusCode.set(0);
      recordIfPending(httpStartNs, recorded);
      statesRequestExceptionCounter.increment();
      Thread.currentThread().interrupt();
      log.warn("OpenSky fetch interrupted for region {}", region.id());
      return FetchResult.failed(null, null);
    } catch (Exception ex) {
      lastStatusCode.set(0);
      recordIfPending(httpStartNs, recorded);
      statesRequestExceptionCounter.increment();
      log.warn("Failed to fetch OpenSky states for region {}: {}", region.id(), ex.toString());
      log.debug("OpenSky fetch failure detail", ex);
      return FetchResult.failed(null, null);
    }
  }

  FlightState parseState(JsonNode row) {
    String icao24 = text(row, 0);
    if (icao24 == null || icao24.isBlank()) {
      return null;
    }
    Long timePosition = longNumber(row, 3);
    Long lastContact = longNumber(row, 4);
    Long observedAt = lastContact != null ? lastContact : timePosition;
    if (observedAt == null) {
      return null;
    }
    String callsign = text(row, 1);
    return new FlightState(
        icao24.toLowerCase(Locale.ROOT),
        callsign == null || callsign.isBlank() ? null : callsign,
        text(row, 2),
        number(row, 6),
        number(row, 5),
        number(row, 9),
        number(row, 10),
        number(row, 11),
        number(row, 7),
        number(row, 13),
        bool(row, 8),
        text(row, 14),
        observedAt);
  }

  private Counter outcomeCounter(MeterRegistry meterRegistry, String outcome) {
    return Counter.builder("ingester.opensky.states.http.requests.total")
        .description("OpenSky /states/all HTTP requests (by outcome)")
        .tag("outcome", outcome)
        .register(meterRegistry);
  }

  private void recordIfPending(long httpStartNs, boolean recorded) {
    if (!recorded && httpStartNs > 0) {
      statesRequestTimer.record(System.nanoTime() - httpStartNs, TimeUnit.NANOSECONDS);
    }
  }

  private static String stripTrailingSlash(String value) {
    return value.endsWith("/") ? value.substring(0, value.length() - 1) : value;
  }

  private String text(JsonNode row, int idx) {
    JsonNode node = row.get(idx);
    return node == null || node.isNull() ? null : node.asText().trim();
  }

  private Double number(JsonNode row, int idx) {
    JsonNode node = row.get(idx);
    return node == null || node.isNull() || !node.isNumber() ? null : node.asDouble();
  }

  private Long longNumber(JsonNode row, int idx) {
    JsonNode node = row.get(idx);
    return node == null || node.isNull() || !node.isNumber() ? null : node.asLong();
  }

  private Boolean bool(JsonNode row, int idx) {
    JsonNode node = row.get(idx);
    return node == null || node.isNull() ? null : node.asBoolean();
  }

  private Integer parseIntHeader(Optional<String> header) {
    if (header.isEmpty()) {
      return null;
    }
    try {
      return Integer.parseInt(header.get().trim());
    } catch (NumberFormatException ex) {
      log.debug("Unable to parse int header value: {}", header.get());
      return null;
    }
  }
}
