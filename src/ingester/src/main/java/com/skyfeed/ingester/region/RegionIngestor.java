package com.skyfeed.ingester.region;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.skyfeed.ingester.config.IngesterProperties;
import com.skyfeed.ingester.redis.RedisWorkQueue;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import java.time.Duration;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Component;

/**
 * Consumes region submissions from the {@code regions} queue into the {@link RegionRegistry}.
 *
 * <p>Every message taken from the queue is acknowledged once handled, valid or not, so a poison
 * message cannot block the queue.
 */
@Component
public class RegionIngestor {
  private static final Logger log = LoggerFactory.getLogger(RegionIngestor.class);
  private static final int MAX_LOGGED_PAYLOAD = 256;

  private final RedisWorkQueue queue;
  private final ObjectMapper objectMapper;
  private final RegionRegistry registry;
  private final IngesterProperties.Queues queues;
  private final ExecutorService executor;
  private final Counter acceptedCounter;
  private final Counter rejectedCounter;
  private final Counter brokerErrorCounter;

  public RegionIngestor(
      StringRedisTemplate redisTemplate,
      ObjectMapper objectMapper,
      RegionRegistry registry,
      IngesterProperties properties,
      MeterRegistry meterRegistry) {
    this.queues = properties.queues();
    this.queue = new RedisWorkQueue(redisTemplate, queues.regionsKey(), queues.processingSuffix());
    this.objectMapper = objectMapper;
    this.registry = registry;
    this.executor = Executors.newSingleThreadExecutor(runnable -> {
      Thread thread = new Thread(runnable, "region-ingestor");
      thread.setDaemon(true);
      return thread;
    });
    this.acceptedCounter = meterRegistry.counter("ingester.regions.accepted.total");
    this.rejectedCounter = meterRegistry.counter("ingester.regions.rejected.total");
    this.brokerErrorCounter = meterRegistry.counter("ingester.regions.broker.errors.total");
  }

  @PostConstruct
  public void start() {
    executor.submit(this::runLoop);
  }

  @PreDestroy
  public void stop() {
    executor.shutdownNow();
    try {
      executor.awaitTermination(5, TimeUnit.SECONDS);
    } catch (InterruptedException ignored) {
      Thread.currentThread().interrupt();
    }
  }

  private void runLoop() {
    Duration timeout = Duration.ofSeconds(Math.max(1L, queues.pollTimeoutSeconds()));
    long reconnectDelayMs = Math.max(1L, queues.reconnectInitialMs());
    boolean recovered = false;
    while (!Thread.currentThread().isInterrupted()) {
      try {
        if (!recovered) {
          int requeued = queue.requeueInFlight();
          if (requeued > 0) {
            log.info("Requeued {} unacknowledged region message(s) from {}", requeued, queue.processingKey());
          }
          recovered = true;
        }
        String payload = queue.take(timeout);
        reconnectDelayMs = Math.max(1L, queues.reconnectInitialMs());
        if (payload != null) {
          handlePayload(payload);
          queue.acknowledge(payload);
        }
      } catch (Exception ex) {
        if (isInterruptedShutdown(ex)) {
          Thread.currentThread().interrupt();
          log.debug("Region ingestor interrupted during shutdown");
          return;
        }
        brokerErrorCounter.increment();
        // A message taken but not acknowledged goes back to the head of the queue on retry.
        recovered = false;
        log.warn("Region queue {} unavailable, retrying in {} ms: {}", queue.queueKey(), reconnectDelayMs, ex.toString());
        try {
          TimeUnit.MILLISECONDS.sleep(reconnectDelayMs);
        } catch (InterruptedException interrupted) {
          Thread.currentThread().interrupt();
          return;
        }
        reconnectDelayMs = Math.min(reconnectDelayMs * 2, Math.max(reconnectDelayMs, queues.reconnectMaxMs()));
      }
    }
  }

  /**
   * Parses, validates and applies one {@code regions} message.
   *
   * @return {@code true} when the region reached the registry
   */
  public boolean handlePayload(String payload) {
    Region region;
    try {
      region = objectMapper.readValue(payload, Region.class);
    } catch (JsonProcessingException ex) {
      rejectedCounter.increment();
      log.warn("Dropping unparseable region message: {} payload={}", ex.getOriginalMessage(), truncate(payload));
      return false;
    }
    try {
      RegionValidator.validate(region);
    } catch (InvalidRegionException ex) {
      rejectedCounter.increment();
      log.warn("Dropping invalid region message: {} payload={}", ex.getMessage(), truncate(payload));
      return false;
    }

    RegionRegistry.Change change = registry.apply(region);
    acceptedCounter.increment();
    log.info(
        "Region {} {} (submission={}, active={}, area={} deg2)",
        region.id(),
        change.name().toLowerCase(),
        region.submissionId(),
        registry.size(),
        String.format("%.2f", region.areaDeg2()));
    return true;
  }

  private static boolean isInterruptedShutdown(Throwable ex) {
    Throwable current = ex;
    while (current != null) {
      if (current instanceof InterruptedException) {
        return true;
      }
      current = current.getCause();
    }
    return false;
  }

  private static String truncate(String payload) {
    if (payload == null || payload.length() <= MAX_LOGGED_PAYLOAD) {
      return payload;
    }
    return payload.substring(0, MAX_LOGGED_PAYLOAD) + "...";
  }
}
