package com.skyfeed.ingester.redis;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.skyfeed.ingester.config.IngesterProperties;
import com.skyfeed.ingester.opensky.FlightState;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.data.redis.RedisConnectionFailureException;
import org.springframework.data.redis.core.ListOperations;
import org.springframework.data.redis.core.StringRedisTemplate;

class RedisPublisherTest {
  private static final List<FlightState> BATCH = List.of(
      new FlightState("abc123", "AFR123", "France", 48.8, 2.3, 230.0, 180.0, 0.0, 11000.0, 11300.0, false, null, 100L));

  private ListOperations<String, String> listOperations;
  private SimpleMeterRegistry meterRegistry;
  private RedisPublisher publisher;

  @BeforeEach
  @SuppressWarnings("unchecked")
  void setUp() {
    StringRedisTemplate redisTemplate = mock(StringRedisTemplate.class);
    listOperations = mock(ListOperations.class);
    when(redisTemplate.opsForList()).thenReturn(listOperations);
    meterRegistry = new SimpleMeterRegistry();
    IngesterProperties properties = new IngesterProperties(
        10_000L,
        new IngesterProperties.Queues("skyfeed:queue:regions", "skyfeed:queue:adsb", ":processing", 1, 100, 1_000),
        new IngesterProperties.Backoff(2.0, 60_000L),
        new IngesterProperties.Publish(3, 1, 4),
        null,
        null);
    publisher = new RedisPublisher(redisTemplate, new ObjectMapper(), properties, meterRegistry);
  }

  @Test
  void retriesTransientFailureThenSucceeds() {
    when(listOperations.rightPush(eq("skyfeed:queue:adsb"), anyString()))
        .thenThrow(new RedisConnectionFailureException("down"))
        .thenReturn(1L);

    assertThat(publisher.publishBatch(BATCH)).isTrue();
    verify(listOperations, times(2)).rightPush(eq("skyfeed:queue:adsb"), anyString());
    assertThat(meterRegistry.counter("ingester.publish.retries.total").count()).isEqualTo(1.0);
  }

  @Test
  void dropsBatchAfterMaxAttempts() {
    when(listOperations.rightPush(eq("skyfeed:queue:adsb"), anyString()))
        .thenThrow(new RedisConnectionFailureException("down"));

    assertThat(publisher.publishBatch(BATCH)).isFalse();
    verify(listOperations, times(3)).rightPush(eq("skyfeed:queue:adsb"), anyString());
    assertThat(meterRegistry.counter("ingester.publish.dropped.total").count()).isEqualTo(1.0);
  }
}
