package com.skyfeed.ingester.region;

import com.skyfeed.ingester.config.IngesterProperties;
import java.time.Instant;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.atomic.AtomicReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Holds the active regions of interest.
 *
 * <p>The active set is an immutable value behind an {@link AtomicReference}: writers swap in a new
 * set, readers get the set that was current at call time and never see a partial replacement.
 *
 * <p>Replacement policy: the latest submission replaces the whole active set. Regions belonging
 * to the submission that is already active are added to it. A multi-box submission arrives as
 * several messages, so a poll cycle may briefly see only part of it; the set converges once every
 * message is applied and regions of two submissions are never mixed.
 */
@Component
public class RegionRegistry {
  private static final Logger log = LoggerFactory.getLogger(RegionRegistry.class);
  static final String BOOTSTRAP_ID = "bootstrap";

  /** What {@link #apply(Region)} did to the active set. */
  public enum Change {
    REPLACED,
    ADDED,
    UNCHANGED
  }

  private record State(Set<Region> regions, String submissionId) {
    static final State EMPTY = new State(Set.of(), null);
  }

  private final AtomicReference<State> state = new AtomicReference<>(State.EMPTY);

  public RegionRegistry(IngesterProperties properties) {
    IngesterProperties.Bbox bootstrap = properties.bootstrapRegion();
    if (bootstrap != null) {
      Region region = RegionValidator.validate(new Region(
          BOOTSTRAP_ID,
          bootstrap.latMax(),
          bootstrap.lonMax(),
          bootstrap.latMin(),
          bootstrap.lonMin(),
          Instant.now().toString(),
          BOOTSTRAP_ID));
      replace(Set.of(region), BOOTSTRAP_ID);
      log.info(
          "Region registry seeded with bootstrap bbox: latMin={}, latMax={}, lonMin={}, lonMax={}",
          bootstrap.latMin(),
          bootstrap.latMax(),
          bootstrap.lonMin(),
          bootstrap.lonMax());
    }
  }

  public void replace(Collection<Region> regions) {
    replace(regions, null);
  }

  public void replace(Collection<Region> regions, String submissionId) {
    state.set(new State(freeze(regions), submissionId));
  }

  /**
   * Applies one region message: a new submission replaces the set, a known one grows it.
   *
   * @param region validated region
   * @return what happened to the active set
   */
  public Change apply(Region region) {
    Objects.requireNonNull(region, "region");
    Change[] change = new Change[1];
    state.updateAndGet(current -> {
      String submissionId = region.submissionId();
      if (submissionId != null && submissionId.equals(current.submissionId())) {
        if (current.regions().contains(region)) {
          change[0] = Change.UNCHANGED;
          return current;
        }
        Set<Region> merged = new LinkedHashSet<>(current.regions());
        merged.add(region);
        change[0] = Change.ADDED;
        return new State(Collections.unmodifiableSet(merged), submissionId);
      }
      change[0] = Change.REPLACED;
      return new State(Set.of(region), submissionId);
    });
    return change[0];
  }

  public Set<Region> snapshot() {
    return state.get().regions();
  }

  public String submissionId() {
    return state.get().submissionId();
  }

  public int size() {
    return state.get().regions().size();
  }

  private static Set<Region> freeze(Collection<Region> regions) {
    if (regions == null || regions.isEmpty()) {
      return Set.of();
    }
    return Collections.unmodifiableSet(new LinkedHashSet<>(regions));
  }
}
