package com.skyfeed.ingester.redis;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.skyfeed.ingester.config.IngesterProperties;
import com.skyfeed.ingester.opensky.FlightState;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.List;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Component;

@Component
public class RedisPublisher {
  private static final Logger log = LoggerFactory.getLogger(RedisPublisher.class);

  private final StringRedisTemplate redisTemplate;
  private final ObjectMapper objectMapper;
  private final IngesterProperties properties;
  private final Counter retryCounter;
  private final Counter droppedCounter;

  public RedisPublisher(
      StringRedisTemplate redisTemplate,
      ObjectMapper objectMapper,
      IngesterProperties properties,
      MeterRegistry meterRegistry) {
    this.redisTemplate = redisTemplate;
    this.objectMapper = objectMapper;
    this.properties = properties;
    this.retryCounter = meterRegistry.counter("ingester.publish.retries.total");
    this.droppedCounter = meterRegistry.counter("ingester.publish.dropped.total");
  }

  /**
   * Pushes one cycle worth of states to the {@code adsb} queue as a single JSON array message.
   *
   * @return {@code true} when the batch reached Redis, {@code false} when it was dropped
   */
  public boolean publishBatch(List<FlightState> states) {
    String payload;
    try {
      payload = objectMapper.writeValueAsString(states);
    } catch (JsonProcessingException ex) {
      droppedCounter.increment();
      log.warn("Failed to serialize batch of {} states, dropping it", states.size(), ex);
      return false;
    }

    IngesterProperties.Publish publish = properties.publish();
    int maxAttempts = Math.max(1, publish.maxAttempts());
    long backoffMs = Math.max(0L, publish.initialBackoffMs());
    for (int attempt = 1; attempt <= maxAttempts; attempt++) {
      try {
        redisTemplate.opsForList().rightPush(properties.queues().adsbKey(), payload);
        return true;
      } catch (RuntimeException ex) {
        if (attempt == maxAttempts) {
          droppedCounter.increment();
          log.error(
              "Publishing to {} failed after {} attempts, dropping batch of {} states",
              properties.queues().adsbKey(),
              maxAttempts,
              states.size(),
              ex);
          return false;
        }
        retryCounter.increment();
        log.warn("Publish attempt {}/{} failed, retrying in {} ms: {}", attempt, maxAttempts, backoffMs, ex.getMessage());
        if (!pause(backoffMs)) {
          droppedCounter.increment();
          log.warn("Publish interrupted, dropping batch of {} states", states.size());
          return false;
        }
        backoffMs = Math.min(Math.max(1L, backoffMs * 2), Math.max(backoffMs, publish.maxBackoffMs()));
      }
    }
    return false;
  }

  private static boolean pause(long millis) {
    try {
      TimeUnit.MILLISECONDS.sleep(millis);
      return true;
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      return false;
    }
  }
}
