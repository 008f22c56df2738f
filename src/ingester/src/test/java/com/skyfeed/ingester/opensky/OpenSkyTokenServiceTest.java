package com.skyfeed.ingester.opensky;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.skyfeed.ingester.config.OpenSkyProperties;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.net.http.HttpClient;
import java.net.http.HttpHeaders;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.mockito.ArgumentMatchers;

class OpenSkyTokenServiceTest {
  private OpenSkyProperties properties;
  private HttpClient httpClient;

  @BeforeEach
  void setUp() {
    properties = new OpenSkyProperties(
        "https://opensky.example",
        "https://opensky.example/token",
        "client-id",
        "client-secret",
        null,
        null,
        1_000L,
        1_000L);
    httpClient = mock(HttpClient.class);
  }

  @Test
  void anonymousAccessNeverCallsTokenEndpoint() throws Exception {
    OpenSkyProperties anonymous = new OpenSkyProperties(
        "https://opensky.example", "https://opensky.example/token", null, null, null, null, 0L, 0L);
    OpenSkyTokenService service = service(anonymous);

    assertThat(service.currentToken()).isEmpty();
    verify(httpClient, never()).send(any(HttpRequest.class), ArgumentMatchers.<HttpResponse.BodyHandler<String>>any());
  }

  @Test
  void fetchesTokenWithClientCredentialsGrantAndCachesIt() throws Exception {
    HttpResponse<String> response = response(200, "{\"access_token\":\"cached\",\"expires_in\":3600}");
    when(httpClient.send(any(HttpRequest.class), ArgumentMatchers.<HttpResponse.BodyHandler<String>>any()))
        .thenReturn(response);
    OpenSkyTokenService service = service(properties);

    assertThat(service.currentToken()).hasValue("cached");
    assertThat(service.currentToken()).hasValue("cached");

    ArgumentCaptor<HttpRequest> captor = ArgumentCaptor.forClass(HttpRequest.class);
    verify(httpClient, times(1)).send(captor.capture(), ArgumentMatchers.<HttpResponse.BodyHandler<String>>any());
    HttpRequest request = captor.getValue();
    assertThat(request.method()).isEqualTo("POST");
    assertThat(request.uri().toString()).isEqualTo("https://opensky.example/token");
    assertThat(request.headers().allValues("Content-Type")).containsExactly("application/x-www-form-urlencoded");
  }

  @Test
  void failedRefreshStartsCooldown() throws Exception {
    HttpResponse<String> response = response(401, "{\"error\":\"invalid_client\"}");
    when(httpClient.send(any(HttpRequest.class), ArgumentMatchers.<HttpResponse.BodyHandler<String>>any()))
        .thenReturn(response);
    OpenSkyTokenService service = service(properties);

    assertThatThrownBy(service::currentToken)
        .isInstanceOf(OpenSkyTokenService.TokenRefreshException.class)
        .hasMessageContaining("401");
    assertThatThrownBy(service::currentToken)
        .isInstanceOf(OpenSkyTokenService.TokenRefreshException.class)
        .hasMessageContaining("cooldown");
    verify(httpClient, times(1)).send(any(HttpRequest.class), ArgumentMatchers.<HttpResponse.BodyHandler<String>>any());
  }

  @Test
  void missingAccessTokenIsAFailure() throws Exception {
    HttpResponse<String> response = response(200, "{\"token_type\":\"bearer\"}");
    when(httpClient.send(any(HttpRequest.class), ArgumentMatchers.<HttpResponse.BodyHandler<String>>any()))
        .thenReturn(response);

    assertThatThrownBy(service(properties)::currentToken)
        .isInstanceOf(OpenSkyTokenService.TokenRefreshException.class)
        .hasMessageContaining("access_token");
  }

  @Test
  void interruptedTokenRequestReinterruptsThread() throws Exception {
    when(httpClient.send(any(HttpRequest.class), ArgumentMatchers.<HttpResponse.BodyHandler<String>>any()))
        .thenThrow(new InterruptedException("interrupted"));

    assertThatThrownBy(service(properties)::currentToken)
        .isInstanceOf(OpenSkyTokenService.TokenRefreshException.class)
        .hasMessageContaining("interrupted");
    assertThat(Thread.currentThread().isInterrupted()).isTrue();
    Thread.interrupted();
  }

  private OpenSkyTokenService service(OpenSkyProperties props) {
    return new OpenSkyTokenService(
        new OpenSkyCredentialsProvider(props, Optional.empty()),
        props,
        new SimpleMeterRegistry(),
        httpClient,
        new ObjectMapper());
  }

  @SuppressWarnings("unchecked")
  private static HttpResponse<String> response(int status, String body) {
    HttpResponse<String> response = (HttpResponse<String>) mock(HttpResponse.class);
    when(response.statusCode()).thenReturn(status);
    when(response.body()).thenReturn(body);
    when(response.headers()).thenReturn(HttpHeaders.of(Map.of(), (name, value) -> true));
    return response;
  }
}
