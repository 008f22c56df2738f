package com.skyfeed.processor.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.skyfeed.processor.config.ProcessorProperties;
import com.skyfeed.processor.queue.RedisWorkQueue;
import com.skyfeed.processor.snapshot.FlightSnapshotRepository;
import com.skyfeed.processor.snapshot.UpsertOutcome;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.Duration;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Component;

/**
 * Main processing loop turning {@code adsb} batches into snapshot writes.
 *
 * <p>This component:
 * <ul>
 *   <li>consumes batch payloads from the Redis input list with at-least-once delivery</li>
 *   <li>folds every valid element into the snapshot through a conditional per-aircraft write</li>
 *   <li>emits low-cardinality operational metrics</li>
 * </ul>
 *
 * <p>A batch is acknowledged once every element was attempted. If the store cannot be opened the
 * batch stays unacknowledged and is requeued after a back-off.
 */
@Component
public class AdsbBatchProcessor {
  private static final Logger LOGGER = LoggerFactory.getLogger(AdsbBatchProcessor.class);
  private static final int MAX_LOGGED_PAYLOAD = 256;

  private final RedisWorkQueue queue;
  private final ObjectMapper objectMapper;
  private final ProcessorProperties properties;
  private final FlightSnapshotRepository repository;
  private final ExecutorService executor;
  private final Map<UpsertOutcome, Counter> outcomeCounters;
  private final Counter batchCounter;
  private final Counter droppedBatchCounter;
  private final Counter malformedCounter;
  private final Counter errorCounter;
  private final AtomicLong lastProcessedEpoch;
  private final AtomicLong queueDepth;

  public AdsbBatchProcessor(
    StringRedisTemplate redisTemplate,
    ObjectMapper objectMapper,
    ProcessorProperties properties,
    MeterRegistry meterRegistry,
    FlightSnapshotRepository repository
  ) {
    this.queue = new RedisWorkQueue(
        redisTemplate,
        properties.getRedis().getInputKey(),
        properties.getRedis().getProcessingSuffix());
    this.objectMapper = objectMapper;
    this.properties = properties;
    this.repository = repository;
    this.executor = Executors.newSingleThreadExecutor(runnable -> {
      Thread thread = new Thread(runnable, "processor-loop");
      thread.setDaemon(true);
      return thread;
    });
    this.outcomeCounters = new EnumMap<>(UpsertOutcome.class);
    for (UpsertOutcome outcome : UpsertOutcome.values()) {
      outcomeCounters.put(outcome, Counter.builder("processor.events.processed")
          .description("State vectors folded into the snapshot (by outcome)")
          .tag("outcome", outcome.name().toLowerCase(Locale.ROOT))
          .register(meterRegistry));
    }
    this.batchCounter = meterRegistry.counter("processor.batches.processed");
    this.droppedBatchCounter = meterRegistry.counter("processor.batches.dropped");
    this.malformedCounter = meterRegistry.counter("processor.events.malformed");
    this.errorCounter = meterRegistry.counter("processor.events.errors");
    this.lastProcessedEpoch = meterRegistry.gauge("processor.last_processed_epoch", new AtomicLong(0));
    this.queueDepth = meterRegistry.gauge("processor.queue.depth", new AtomicLong(0));
  }

  /** Starts the background processing loop after Spring context initialization. */
  @jakarta.annotation.PostConstruct
  public void start() {
    executor.submit(this::runLoop);
  }

  /** Stops the processing loop and waits briefly for a clean shutdown. */
  @jakarta.annotation.PreDestroy
  public void stop() {
    executor.shutdownNow();
    try {
      executor.awaitTermination(5, TimeUnit.SECONDS);
    } catch (InterruptedException ignored) {
      Thread.currentThread().interrupt();
    }
  }

  private void runLoop() {
    Duration timeout = Duration.ofSeconds(Math.max(1L, properties.getPollTimeoutSeconds()));
    long retryDelayMs = Math.max(1L, properties.getReconnectInitialMs());
    boolean recovered = false;
    while (!Thread.currentThread().isInterrupted()) {
      try {
        if (!recovered) {
          int requeued = queue.requeueInFlight();
          if (requeued > 0) {
            LOGGER.info("Requeued {} unacknowledged batch(es) from {}", requeued, queue.processingKey());
          }
          recovered = true;
        }
        String payload = queue.take(timeout);
        if (payload != null) {
          processPayload(payload);
          queue.acknowledge(payload);
        }
        queueDepth.set(queue.depth());
        retryDelayMs = Math.max(1L, properties.getReconnectInitialMs());
      } catch (Exception ex) {
        if (isInterruptedShutdown(ex)) {
          Thread.currentThread().interrupt();
          LOGGER.debug("Processor loop interrupted during shutdown");
          return;
        }
        errorCounter.increment();
        LOGGER.warn("Processor loop error, retrying in {} ms", retryDelayMs, ex);
        // Anything taken but not acknowledged goes back to the head of the queue on retry.
        recovered = false;
        try {
          TimeUnit.MILLISECONDS.sleep(retryDelayMs);
        } catch (InterruptedException interrupted) {
          Thread.currentThread().interrupt();
          return;
        }
        retryDelayMs = Math.min(retryDelayMs * 2, Math.max(retryDelayMs, properties.getReconnectMaxMs()));
      }
    }
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

  /**
   * Folds one {@code adsb} message into the snapshot.
   *
   * <p>Unparseable or non-array payloads are dropped and reported as {@link BatchResult#DROPPED}.
   * Store-level failures propagate so the caller can leave the message unacknowledged.
   */
  public BatchResult processPayload(String payload) {
    JsonNode root;
    try {
      root = objectMapper.readTree(payload);
    } catch (Exception ex) {
      droppedBatchCounter.increment();
      LOGGER.warn("Dropping unparseable adsb payload: {}", truncate(payload));
      LOGGER.debug("Failed to parse payload", ex);
      return BatchResult.DROPPED;
    }
    if (root == null || !root.isArray()) {
      droppedBatchCounter.increment();
      LOGGER.warn("Dropping adsb payload that is not a JSON array: {}", truncate(payload));
      return BatchResult.DROPPED;
    }

    List<FlightState> states = new ArrayList<>(root.size());
    int malformed = 0;
    for (JsonNode element : root) {
      FlightState state = toState(element);
      if (state == null) {
        malformed++;
        continue;
      }
      states.add(state);
    }
    malformedCounter.increment(malformed);

    List<UpsertOutcome> outcomes = states.isEmpty()
        ? List.of()
        : repository.upsertAll(states, System.currentTimeMillis());
    Map<UpsertOutcome, Integer> tally = new EnumMap<>(UpsertOutcome.class);
    for (UpsertOutcome outcome : outcomes) {
      tally.merge(outcome, 1, Integer::sum);
      outcomeCounters.get(outcome).increment();
    }

    BatchResult result = new BatchResult(
        tally.getOrDefault(UpsertOutcome.INSERTED, 0),
        tally.getOrDefault(UpsertOutcome.UPDATED, 0),
        tally.getOrDefault(UpsertOutcome.STALE, 0),
        tally.getOrDefault(UpsertOutcome.FAILED, 0),
        malformed);
    if (result.failed() > 0) {
      errorCounter.increment(result.failed());
    }
    batchCounter.increment();
    lastProcessedEpoch.set(System.currentTimeMillis() / 1000);
    LOGGER.debug("Processed adsb batch: {}", result);
    return result;
  }

  private FlightState toState(JsonNode element) {
    FlightState state;
    try {
      state = objectMapper.treeToValue(element, FlightState.class);
    } catch (Exception ex) {
      LOGGER.debug("Skipping unreadable state element: {}", element);
      return null;
    }
    if (state == null || state.icao24() == null || state.icao24().isBlank() || state.observedAt() == null) {
      LOGGER.debug("Skipping state element without icao24 or observed_at: {}", element);
      return null;
    }
    String icao24 = state.icao24().trim().toLowerCase(Locale.ROOT);
    if (icao24.equals(state.icao24())) {
      return state;
    }
    return new FlightState(
        icao24,
        state.callsign(),
        state.originCountry(),
        state.latitude(),
        state.longitude(),
        state.velocity(),
        state.heading(),
        state.verticalRate(),
        state.altitude(),
        state.geoAltitude(),
        state.onGround(),
        state.squawk(),
        state.observedAt());
  }

  private static String truncate(String payload) {
    if (payload == null || payload.length() <= MAX_LOGGED_PAYLOAD) {
      return payload;
    }
    return payload.substring(0, MAX_LOGGED_PAYLOAD) + "...";
  }
}
