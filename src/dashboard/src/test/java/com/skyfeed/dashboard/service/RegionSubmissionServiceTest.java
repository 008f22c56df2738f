package com.skyfeed.dashboard.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyCollection;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.skyfeed.dashboard.api.BadRequestException;
import com.skyfeed.dashboard.api.ServiceUnavailableException;
import com.skyfeed.dashboard.config.DashboardProperties;
import com.skyfeed.dashboard.model.BoundingBox;
import com.skyfeed.dashboard.model.Coordinates;
import com.skyfeed.dashboard.model.RegionSubmissionResponse;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.data.redis.RedisConnectionFailureException;
import org.springframework.data.redis.core.ListOperations;
import org.springframework.data.redis.core.StringRedisTemplate;

@ExtendWith(MockitoExtension.class)
class RegionSubmissionServiceTest {

  @Mock private StringRedisTemplate redisTemplate;
  @Mock private ListOperations<String, String> listOperations;

  private final ObjectMapper objectMapper = new ObjectMapper();
  private DashboardProperties properties;
  private RegionSubmissionService service;

  @BeforeEach
  void setUp() {
    properties = new DashboardProperties();
    properties.getRedis().setRegionsKey("test:regions");
    properties.getRedis().getPublish().setMaxAttempts(3);
    properties.getRedis().getPublish().setInitialBackoffMs(1);
    properties.getRedis().getPublish().setMaxBackoffMs(4);
    lenient().when(redisTemplate.opsForList()).thenReturn(listOperations);
    service = new RegionSubmissionService(redisTemplate, objectMapper, properties);
  }

  private static BoundingBox box(double neLat, double neLng, double swLat, double swLng) {
    return new BoundingBox(new Coordinates(neLat, neLng), new Coordinates(swLat, swLng));
  }

  @Test
  @SuppressWarnings("unchecked")
  void submit_pushesAllRegionsInOneCallWithSharedSubmissionId() throws Exception {
    RegionSubmissionResponse response = service.submit(
        List.of(box(50.0, 10.0, 45.0, 0.0), box(40.0, -70.0, 35.0, -80.0)));

    ArgumentCaptor<Collection<String>> payloads = ArgumentCaptor.forClass(Collection.class);
    verify(listOperations, times(1)).rightPushAll(eq("test:regions"), payloads.capture());

    List<String> pushed = new ArrayList<>(payloads.getValue());
    assertThat(pushed).hasSize(2);
    JsonNode first = objectMapper.readTree(pushed.get(0));
    JsonNode second = objectMapper.readTree(pushed.get(1));
    assertThat(first.get("submission_id").asText()).isEqualTo(response.submissionId());
    assertThat(second.get("submission_id").asText()).isEqualTo(response.submissionId());
    assertThat(first.get("id").asText()).isNotEqualTo(second.get("id").asText());
    assertThat(first.get("north_east_lat").asDouble()).isEqualTo(50.0);
    assertThat(second.get("south_west_lon").asDouble()).isEqualTo(-80.0);
    assertThat(first.get("created_at").asText()).isNotBlank();
    assertThat(response.regions()).hasSize(2);
  }

  @Test
  void submit_invalidRegionNeverTouchesBroker() {
    assertThatThrownBy(() -> service.submit(List.of(box(40.0, 10.0, 45.0, 0.0))))
        .isInstanceOf(BadRequestException.class);

    verify(redisTemplate, never()).opsForList();
  }

  @Test
  void submit_transientBrokerFailureIsRetried() {
    when(listOperations.rightPushAll(anyString(), anyCollection()))
        .thenThrow(new RedisConnectionFailureException("connection reset"))
        .thenReturn(1L);

    RegionSubmissionResponse response = service.submit(List.of(box(50.0, 10.0, 45.0, 0.0)));

    assertThat(response.submissionId()).isNotBlank();
    assertThat(response.regions()).hasSize(1);
    verify(listOperations, times(2)).rightPushAll(eq("test:regions"), anyCollection());
  }

  @Test
  void submit_brokerFailureBecomesServiceUnavailableOnceAttemptsAreUsed() {
    when(listOperations.rightPushAll(anyString(), anyCollection()))
        .thenThrow(new RedisConnectionFailureException("connection refused"));

    assertThatThrownBy(() -> service.submit(List.of(box(50.0, 10.0, 45.0, 0.0))))
        .isInstanceOf(ServiceUnavailableException.class)
        .hasCauseInstanceOf(RedisConnectionFailureException.class);
    verify(listOperations, times(3)).rightPushAll(eq("test:regions"), anyCollection());
  }
}
