package com.skyfeed.processor.service;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.fail;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.skyfeed.processor.config.ProcessorProperties;
import com.skyfeed.processor.snapshot.SqliteFlightSnapshotRepository;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.nio.file.Path;
import java.time.Duration;
import java.util.function.BooleanSupplier;
import java.util.concurrent.locks.LockSupport;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.data.redis.connection.RedisConnection;
import org.springframework.data.redis.connection.RedisStandaloneConfiguration;
import org.springframework.data.redis.connection.lettuce.LettuceConnectionFactory;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.testcontainers.containers.GenericContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

@Testcontainers(disabledWithoutDocker = true)
class AdsbBatchProcessorIntegrationTest {

  @Container
  private static final GenericContainer<?> REDIS =
      new GenericContainer<>("redis:7.2-alpine").withExposedPorts(6379);

  private static LettuceConnectionFactory connectionFactory;

  @TempDir
  Path tempDir;

  private StringRedisTemplate redisTemplate;

  @BeforeAll
  static void setupRedis() {
    RedisStandaloneConfiguration config =
        new RedisStandaloneConfiguration(REDIS.getHost(), REDIS.getMappedPort(6379));
    connectionFactory = new LettuceConnectionFactory(config);
    connectionFactory.afterPropertiesSet();
  }

  @AfterAll
  static void shutdownRedis() {
    if (connectionFactory != null) {
      connectionFactory.destroy();
    }
  }

  @BeforeEach
  void clearRedis() {
    redisTemplate = new StringRedisTemplate(connectionFactory);
    redisTemplate.afterPropertiesSet();
    try (RedisConnection connection = connectionFactory.getConnection()) {
      connection.serverCommands().flushAll();
    }
  }

  @Test
  void processor_consumesQueueInOrderAndAcknowledgesEveryBatch() {
    ProcessorProperties properties = new ProcessorProperties();
    properties.setPollTimeoutSeconds(1);
    SqliteFlightSnapshotRepository repository =
        new SqliteFlightSnapshotRepository(tempDir.resolve("snapshot.db"), 1_000);
    AdsbBatchProcessor processor = new AdsbBatchProcessor(
        redisTemplate, new ObjectMapper(), properties, new SimpleMeterRegistry(), repository);
    String inputKey = properties.getRedis().getInputKey();

    redisTemplate.opsForList().rightPushAll(
        inputKey,
        "[{\"icao24\":\"abc123\",\"callsign\":\"AFR123\",\"observed_at\":100}]",
        "definitely not json",
        "[{\"icao24\":\"abc123\",\"callsign\":\"AFR123\",\"observed_at\":90}]");

    processor.start();
    try {
      waitUntil(
          () -> queueDrained(inputKey),
          Duration.ofSeconds(10),
          "processor did not drain and acknowledge the adsb queue");

      assertEquals(100L, repository.findByIcao24("abc123").orElseThrow().state().observedAt());
    } finally {
      processor.stop();
    }
  }

  @Test
  void processor_redeliversBatchLeftInProcessingListByCrash() {
    ProcessorProperties properties = new ProcessorProperties();
    properties.setPollTimeoutSeconds(1);
    SqliteFlightSnapshotRepository repository =
        new SqliteFlightSnapshotRepository(tempDir.resolve("snapshot.db"), 1_000);
    String inputKey = properties.getRedis().getInputKey();
    redisTemplate.opsForList().rightPush(
        inputKey + properties.getRedis().getProcessingSuffix(),
        "[{\"icao24\":\"fed999\",\"observed_at\":42}]");

    AdsbBatchProcessor processor = new AdsbBatchProcessor(
        redisTemplate, new ObjectMapper(), properties, new SimpleMeterRegistry(), repository);
    processor.start();
    try {
      waitUntil(
          () -> repository.findByIcao24("fed999").isPresent() && queueDrained(inputKey),
          Duration.ofSeconds(10),
          "processor did not redeliver the in-flight batch");
    } finally {
      processor.stop();
    }
  }

  private boolean queueDrained(String inputKey) {
    Long pending = redisTemplate.opsForList().size(inputKey);
    Long inFlight = redisTemplate.opsForList().size(inputKey + ":processing");
    return pending != null && pending == 0 && inFlight != null && inFlight == 0;
  }

  private static void waitUntil(BooleanSupplier condition, Duration timeout, String failureMessage) {
    long deadline = System.nanoTime() + timeout.toNanos();
    long pollIntervalNanos = Duration.ofMillis(100).toNanos();
    while (System.nanoTime() < deadline) {
      if (condition.getAsBoolean()) {
        return;
      }
      LockSupport.parkNanos(pollIntervalNanos);
    }
    fail(failureMessage);
  }
}
