package com.skyfeed.dashboard.rate;

import java.time.Clock;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Thread-safe in-memory sliding-window rate limiter.
 *
 * <p>State is local to one application instance.
 */
@Component
public class InMemoryRateLimiter {
  private final Map<String, Deque<Long>> requestsByClient = new ConcurrentHashMap<>();
  private final Clock clock;

  @Autowired
  public InMemoryRateLimiter() {
    this(Clock.systemUTC());
  }

  InMemoryRateLimiter(Clock clock) {
    this.clock = clock;
  }

  /**
   * Records a request and tells whether it fits in the client's window.
   *
   * @param clientKey caller identity key (IP or forwarded IP)
   * @param windowSeconds window size in seconds
   * @param maxRequests maximum requests allowed in the window
   * @return {@code true} when the request can proceed
   */
  public boolean allow(String clientKey, int windowSeconds, int maxRequests) {
    long now = clock.millis();
    long cutoff = now - Math.max(1, windowSeconds) * 1000L;

    Deque<Long> window = requestsByClient.computeIfAbsent(clientKey, ignored -> new ArrayDeque<>());
    synchronized (window) {
      while (!window.isEmpty() && window.peekFirst() <= cutoff) {
        window.pollFirst();
      }
      if (window.size() >= Math.max(1, maxRequests)) {
        return false;
      }
      window.addLast(now);
      return true;
    }
  }
}
