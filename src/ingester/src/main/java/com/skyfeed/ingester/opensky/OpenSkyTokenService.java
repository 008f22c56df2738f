package com.skyfeed.ingester.opensky;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.skyfeed.ingester.config.OpenSkyProperties;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * OAuth2 client-credentials token cache for the OpenSky API.
 *
 * <p>Tokens are reused until shortly before expiry. After a failed refresh, further attempts are
 * refused for a growing cooldown so a broken auth server is not hammered every poll cycle.
 */
@Component
public class OpenSkyTokenService {
  private static final Logger log = LoggerFactory.getLogger(OpenSkyTokenService.class);
  private static final long[] TOKEN_FAILURE_BACKOFF_SECONDS = {15L, 30L, 60L, 120L, 300L, 600L};

  private final OpenSkyCredentialsProvider credentialsProvider;
  private final OpenSkyProperties properties;
  private final HttpClient httpClient;
  private final ObjectMapper objectMapper;
  private final Timer tokenRequestTimer;
  private final Counter tokenRequestSuccessCounter;
  private final Counter tokenRequestFailureCounter;

  private String accessToken;
  private Instant expiry;
  private int tokenFailureCount;
  private Instant nextTokenAttemptAt = Instant.EPOCH;

  public static class TokenRefreshException extends RuntimeException {
    private TokenRefreshException(String message) {
      super(message);
    }

    private TokenRefreshException(String message, Throwable cause) {
      super(message, cause);
    }
  }

  public OpenSkyTokenService(
      OpenSkyCredentialsProvider credentialsProvider,
      OpenSkyProperties properties,
      MeterRegistry meterRegistry,
      HttpClient httpClient,
      ObjectMapper objectMapper) {
    this.credentialsProvider = credentialsProvider;
    this.properties = properties;
    this.httpClient = httpClient;
    this.objectMapper = objectMapper;

    this.tokenRequestTimer = Timer.builder("ingester.opensky.token.http.duration")
        .description("OpenSky token HTTP request duration (seconds)")
        .register(meterRegistry);
    this.tokenRequestSuccessCounter = Counter.builder("ingester.opensky.token.http.requests.total")
        .description("OpenSky token HTTP requests (by outcome)")
        .tag("outcome", "success")
        .register(meterRegistry);
    this.tokenRequestFailureCounter = Counter.builder("ingester.opensky.token.http.requests.total")
        .description("OpenSky token HTTP requests (by outcome)")
        .tag("outcome", "failure")
        .register(meterRegistry);
  }

  /** Returns the bearer token to send, or empty when the API is used anonymously. */
  public synchronized Optional<String> currentToken() {
    Optional<OpenSkyCredentials> credentials = credentialsProvider.get();
    if (credentials.isEmpty()) {
      return Optional.empty();
    }
    return Optional.of(fetchToken(credentials.get()));
  }

  private String fetchToken(OpenSkyCredentials credentials) {
    // Cache token until near expiry to avoid unnecessary auth calls.
    if (accessToken != null && expiry != null && expiry.isAfter(Instant.now().plusSeconds(15))) {
      return accessToken;
    }

    Instant now = Instant.now();
    if (now.isBefore(nextTokenAttemptAt)) {
      long waitSeconds = Math.max(1L, Duration.between(now, nextTokenAttemptAt).toSeconds());
      throw new TokenRefreshException("Token refresh cooldown active (" + waitSeconds + "s remaining)");
    }

    String tokenUrl = properties.tokenUrl();
    if (tokenUrl == null || tokenUrl.isBlank()) {
      throw registerTokenFailure("OpenSky token URL is missing", null);
    }

    long httpStartNs = System.nanoTime();
    try {
      String body = "grant_type=client_credentials&client_id="
          + URLEncoder.encode(credentials.clientId(), StandardCharsets.UTF_8)
          + "&client_secret=" + URLEncoder.encode(credentials.clientSecret(), StandardCharsets.UTF_8);

      HttpRequest request = HttpRequest.newBuilder()
          .uri(URI.create(tokenUrl))
          .timeout(properties.requestTimeout())
          .header("Content-Type", "application/x-www-form-urlencoded")
          .POST(HttpRequest.BodyPublishers.ofString(body))
          .build();

      HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
      tokenRequestTimer.record(System.nanoTime() - httpStartNs, TimeUnit.NANOSECONDS);

      if (response.statusCode() != 200) {
        tokenRequestFailureCounter.increment();
        throw registerTokenFailure("token endpoint returned " + response.statusCode(), null);
      }

      JsonNode json = objectMapper.readTree(response.body());
      JsonNode token = json.path("access_token");
      if (!token.isTextual() || token.asText().isBlank()) {
        tokenRequestFailureCounter.increment();
        throw registerTokenFailure("token response has no access_token", null);
      }
      tokenRequestSuccessCounter.increment();
      accessToken = token.asText();
      long expiresIn = json.path("expires_in").asLong(300L);
      expiry = Instant.now().plusSeconds(expiresIn);
      tokenFailureCount = 0;
      nextTokenAttemptAt = Instant.EPOCH;

      log.info("OpenSky token refreshed, expires in {} seconds", expiresIn);
      return accessToken;
    } catch (TokenRefreshException ex) {
      throw ex;
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      tokenRequestFailureCounter.increment();
      throw registerTokenFailure("token request interrupted", ex);
    } catch (Exception ex) {
      tokenRequestTimer.record(System.nanoTime() - httpStartNs, TimeUnit.NANOSECONDS);
      tokenRequestFailureCounter.increment();
      throw registerTokenFailure("token request failed: " + ex.getMessage(), ex);
    }
  }

  private TokenRefreshException registerTokenFailure(String message, Throwable cause) {
    accessToken = null;
    expiry = null;
    tokenFailureCount++;
    int index = Math.min(tokenFailureCount - 1, TOKEN_FAILURE_BACKOFF_SECONDS.length - 1);
    long cooldownSeconds = TOKEN_FAILURE_BACKOFF_SECONDS[index];
    nextTokenAttemptAt = Instant.now().plusSeconds(cooldownSeconds);
    log.warn("OpenSky token refresh failed (attempt {}), cooldown {}s", tokenFailureCount, cooldownSeconds);
    if (cause == null) {
      return new TokenRefreshException("Token refresh failed: " + message);
    }
    return new TokenRefreshException("Token refresh failed: " + message, cause);
  }
}
