package com.skyfeed.ingester.redis;

import java.time.Duration;
import org.springframework.data.redis.connection.RedisListCommands.Direction;
import org.springframework.data.redis.core.StringRedisTemplate;

/**
 * At-least-once consumer view over a Redis list.
 *
 * <p>{@link #take(Duration)} atomically moves the head message into a processing list; the message
 * only leaves Redis once {@link #acknowledge(String)} is called. Messages still sitting in the
 * processing list after a crash are pushed back to the head of the queue by
 * {@link #requeueInFlight()}.
 */
public class RedisWorkQueue {
  private final StringRedisTemplate redisTemplate;
  private final String queueKey;
  private final String processingKey;

  public RedisWorkQueue(StringRedisTemplate redisTemplate, String queueKey, String processingSuffix) {
    this.redisTemplate = redisTemplate;
    this.queueKey = queueKey;
    this.processingKey = queueKey + processingSuffix;
  }

  public String take(Duration timeout) {
    return redisTemplate.opsForList().move(queueKey, Direction.LEFT, processingKey, Direction.RIGHT, timeout);
  }

  public void acknowledge(String payload) {
    redisTemplate.opsForList().remove(processingKey, 1, payload);
  }

  public int requeueInFlight() {
    int requeued = 0;
    while (redisTemplate.opsForList().move(processingKey, Direction.RIGHT, queueKey, Direction.LEFT) != null) {
      requeued++;
    }
    return requeued;
  }

  public String queueKey() {
    return queueKey;
  }

  public String processingKey() {
    return processingKey;
  }
}
