package com.skyfeed.ingester;

import com.skyfeed.ingester.config.IngesterProperties;
import com.skyfeed.ingester.opensky.FetchResult;
import com.skyfeed.ingester.opensky.FetchStatus;
import com.skyfeed.ingester.opensky.FlightState;
import com.skyfeed.ingester.opensky.OpenSkyClient;
import com.skyfeed.ingester.redis.RedisPublisher;
import com.skyfeed.ingester.region.Region;
import com.skyfeed.ingester.region.RegionRegistry;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Region-aware OpenSky poller.
 *
 * <p>Every cycle takes a snapshot of the {@link RegionRegistry}, queries each active region once,
 * merges the answers by {@code icao24} and publishes the result as one batch on the {@code adsb}
 * queue. The loop runs on its own thread and sleeps for whatever is left of the current delay
 * after the cycle, so a slow fetch does not stretch the interval.
 */
@Component
public class FlightPollJob {
  private static final Logger log = LoggerFactory.getLogger(FlightPollJob.class);

  private enum RateLimitLevel {
    NORMAL,
    WARN_50,
    WARN_80,
    WARN_95
  }

  private final OpenSkyClient openSkyClient;
  private final RedisPublisher redisPublisher;
  private final RegionRegistry regionRegistry;
  private final IngesterProperties properties;
  private final ExecutorService executor;
  private final Counter cycleCounter;
  private final Counter skippedCounter;
  private final Counter requestCounter;
  private final Counter fetchCounter;
  private final Counter publishCounter;
  private final Counter errorCounter;
  private final AtomicLong remainingCredits = new AtomicLong(-1);
  private volatile long backoffDelayMs;
  private volatile long creditDelayMs;
  private volatile RateLimitLevel lastRateLevel = RateLimitLevel.NORMAL;
  private volatile PollerState state = PollerState.IDLE;
  private volatile boolean lastCycleSkippedEmpty;

  public FlightPollJob(
      OpenSkyClient openSkyClient,
      RedisPublisher redisPublisher,
      RegionRegistry regionRegistry,
      MeterRegistry meterRegistry,
      IngesterProperties properties) {
    this.openSkyClient = openSkyClient;
    this.redisPublisher = redisPublisher;
    this.regionRegistry = regionRegistry;
    this.properties = properties;
    this.executor = Executors.newSingleThreadExecutor(runnable -> {
      Thread thread = new Thread(runnable, "poller-loop");
      thread.setDaemon(true);
      return thread;
    });
    this.cycleCounter = meterRegistry.counter("ingester.poll.cycles.total");
    this.skippedCounter = meterRegistry.counter("ingester.poll.cycles.skipped.total");
    this.requestCounter = meterRegistry.counter("ingester.fetch.requests.total");
    this.fetchCounter = meterRegistry.counter("ingester.fetch.total");
    this.publishCounter = meterRegistry.counter("ingester.publish.total");
    this.errorCounter = meterRegistry.counter("ingester.errors.total");
    this.backoffDelayMs = properties.refreshMs();
    this.creditDelayMs = properties.refreshMs();

    registerGauges(meterRegistry);
  }

  /** Starts the poll loop after Spring context initialization. */
  @PostConstruct
  public void start() {
    log.info(
        "Poller starting: refreshMs={}, backoffMultiplier={}, maxRefreshMs={}",
        properties.refreshMs(),
        multiplier(),
        maxRefreshMs());
    executor.submit(this::runLoop);
  }

  /** Interrupts the loop (sleep or in-flight HTTP call) and waits briefly for it to exit. */
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
    while (!Thread.currentThread().isInterrupted()) {
      long startedAt = System.currentTimeMillis();
      long delayMs;
      try {
        delayMs = runCycle();
      } catch (Exception ex) {
        // Keep the loop alive whatever a single cycle throws.
        errorCounter.increment();
        log.error("Poll cycle failed", ex);
        delayMs = currentDelayMs();
      }
      long sleepMs = delayMs - (System.currentTimeMillis() - startedAt);
      state = PollerState.SLEEPING;
      try {
        if (sleepMs > 0) {
          TimeUnit.MILLISECONDS.sleep(sleepMs);
        }
      } catch (InterruptedException ex) {
        Thread.currentThread().interrupt();
        log.debug("Poller interrupted during shutdown");
        return;
      }
      state = PollerState.IDLE;
    }
  }

  /**
   * Runs one fetch and publish cycle.
   *
   * @return the delay to wait, measured from the start of this cycle, before the next one
   */
  public long runCycle() {
    Set<Region> regions = regionRegistry.snapshot();
    if (regions.isEmpty()) {
      skippedCounter.increment();
      if (!lastCycleSkippedEmpty) {
        log.info("No active region, skipping poll cycles until one is submitted");
        lastCycleSkippedEmpty = true;
      }
      state = PollerState.SLEEPING;
      return currentDelayMs();
    }
    if (lastCycleSkippedEmpty) {
      log.info("Active regions available again ({}), resuming polling", regions.size());
      lastCycleSkippedEmpty = false;
    }

    cycleCounter.increment();
    state = PollerState.FETCHING;
    Map<String, FlightState> merged = new LinkedHashMap<>();
    for (Region region : regions) {
      FetchResult result = openSkyClient.fetchStates(region);
      requestCounter.increment();
      updateCredits(result.remainingCredits());
      if (result.status() != FetchStatus.SUCCESS) {
        errorCounter.increment();
        if (result.status() == FetchStatus.RATE_LIMITED) {
          applyBackoff();
        }
        log.warn(
            "Fetch for region {} failed ({}, status={}), skipping the rest of this cycle",
            region.id(),
            result.status(),
            result.statusCode());
        state = PollerState.SLEEPING;
        return currentDelayMs();
      }
      for (FlightState flight : result.states()) {
        merged.merge(flight.icao24(), flight, FlightPollJob::newest);
      }
    }
    resetBackoff();

    List<FlightState> batch = new ArrayList<>(merged.values());
    fetchCounter.increment(batch.size());
    if (batch.isEmpty()) {
      log.debug("No aircraft in {} active region(s), publishing an empty batch", regions.size());
    }

    state = PollerState.PUBLISHING;
    if (redisPublisher.publishBatch(batch)) {
      publishCounter.increment(batch.size());
      log.info("Fetched {} states from {} region(s), published one batch", batch.size(), regions.size());
    } else {
      errorCounter.increment();
    }
    state = PollerState.SLEEPING;
    return currentDelayMs();
  }

  public PollerState state() {
    return state;
  }

  /** Effective delay: the slower of the 429 back-off and the credit-usage throttle. */
  public long currentDelayMs() {
    return Math.max(backoffDelayMs, creditDelayMs);
  }

  private static FlightState newest(FlightState current, FlightState candidate) {
    return candidate.observedAt() > current.observedAt() ? candidate : current;
  }

  private void applyBackoff() {
    long previous = backoffDelayMs;
    long next = (long) Math.ceil(previous * multiplier());
    backoffDelayMs = Math.min(Math.max(next, previous), Math.max(maxRefreshMs(), properties.refreshMs()));
    if (backoffDelayMs != previous) {
      log.warn("OpenSky rate limited, backing off: delay {}ms -> {}ms", previous, backoffDelayMs);
    }
  }

  private void resetBackoff() {
    if (backoffDelayMs != properties.refreshMs()) {
      log.info("Fetch succeeded, restoring refresh interval to {}ms", properties.refreshMs());
      backoffDelayMs = properties.refreshMs();
    }
  }

  private double multiplier() {
    IngesterProperties.Backoff backoff = properties.backoff();
    return backoff == null || backoff.multiplier() <= 1.0 ? 2.0 : backoff.multiplier();
  }

  private long maxRefreshMs() {
    IngesterProperties.Backoff backoff = properties.backoff();
    return backoff == null || backoff.maxRefreshMs() <= 0 ? properties.refreshMs() * 32 : backoff.maxRefreshMs();
  }

  private void registerGauges(MeterRegistry meterRegistry) {
    meterRegistry.gauge("ingester.opensky.credits.remaining", remainingCredits);
    meterRegistry.gauge("ingester.poll.delay.ms", this, job -> job.currentDelayMs());
    meterRegistry.gauge("ingester.poller.state", this, job -> job.state().ordinal());
    meterRegistry.gauge("ingester.regions.active", regionRegistry, registry -> registry.size());
    meterRegistry.gauge("ingester.regions.area.square_degrees", regionRegistry, FlightPollJob::activeArea);
    meterRegistry.gauge("ingester.opensky.quota", this, job -> job.quotaOrDefault());
  }

  private static double activeArea(RegionRegistry registry) {
    return registry.snapshot().stream().mapToDouble(Region::areaDeg2).sum();
  }

  private double quotaOrDefault() {
    IngesterProperties.RateLimit rateLimit = properties.rateLimit();
    return rateLimit == null ? 0.0 : rateLimit.quota();
  }

  private void updateCredits(Integer remaining) {
    if (remaining == null) {
      return;
    }
    remainingCredits.set(remaining);

    IngesterProperties.RateLimit rateLimit = properties.rateLimit();
    if (rateLimit == null || rateLimit.quota() <= 0) {
      return;
    }
    long quota = rateLimit.quota();
    double consumed = ((double) (quota - remaining) / (double) quota) * 100.0;
    consumed = Math.min(100.0, Math.max(0.0, consumed));

    RateLimitLevel level = resolveLevel(consumed, rateLimit);
    if (level != lastRateLevel) {
      log.warn(
          "OpenSky credits consumed {}% (remaining: {}). Threshold reached: {}%",
          String.format("%.1f", consumed),
          remaining,
          levelToPercent(level, rateLimit));
      lastRateLevel = level;
    }

    long newDelayMs = resolveDelay(level, rateLimit);
    if (newDelayMs != creditDelayMs) {
      log.info("Adjusting refresh interval to {}s based on OpenSky credit usage", newDelayMs / 1000);
      creditDelayMs = newDelayMs;
    }
  }

  private RateLimitLevel resolveLevel(double consumed, IngesterProperties.RateLimit rateLimit) {
    if (consumed >= rateLimit.warn95()) {
      return RateLimitLevel.WARN_95;
    }
    if (consumed >= rateLimit.warn80()) {
      return RateLimitLevel.WARN_80;
    }
    if (consumed >= rateLimit.warn50()) {
      return RateLimitLevel.WARN_50;
    }
    return RateLimitLevel.NORMAL;
  }

  private int levelToPercent(RateLimitLevel level, IngesterProperties.RateLimit rateLimit) {
    return switch (level) {
      case WARN_95 -> rateLimit.warn95();
      case WARN_80 -> rateLimit.warn80();
      case WARN_50 -> rateLimit.warn50();
      default -> 0;
    };
  }

  private long resolveDelay(RateLimitLevel level, IngesterProperties.RateLimit rateLimit) {
    if (level == RateLimitLevel.WARN_95) {
      return rateLimit.refreshCriticalMs();
    }
    if (level == RateLimitLevel.WARN_80) {
      return rateLimit.refreshWarnMs();
    }
    return properties.refreshMs();
  }
}
