package com.skyfeed.dashboard.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.skyfeed.dashboard.api.ServiceUnavailableException;
import com.skyfeed.dashboard.config.DashboardProperties;
import com.skyfeed.dashboard.model.BoundingBox;
import com.skyfeed.dashboard.model.RegionMessage;
import com.skyfeed.dashboard.model.RegionSubmissionResponse;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Service;

/**
 * Validates region submissions and hands them to the ingester through the {@code regions} queue.
 *
 * <p>All regions of one submission share a {@code submission_id} and are pushed in a single
 * {@code RPUSH}, one message per region. The ingester applies them one at a time, so its active
 * set converges on the new submission within a poll cycle and never mixes two submissions.
 */
@Service
public class RegionSubmissionService {
  private static final Logger LOGGER = LoggerFactory.getLogger(RegionSubmissionService.class);

  private final StringRedisTemplate redisTemplate;
  private final ObjectMapper objectMapper;
  private final DashboardProperties properties;

  public RegionSubmissionService(
      StringRedisTemplate redisTemplate,
      ObjectMapper objectMapper,
      DashboardProperties properties) {
    this.redisTemplate = redisTemplate;
    this.objectMapper = objectMapper;
    this.properties = properties;
  }

  /**
   * Validates and enqueues a region set.
   *
   * @param boxes submitted bounding boxes
   * @return acknowledgement listing the queued regions
   * @throws com.skyfeed.dashboard.api.BadRequestException on validation failure
   * @throws ServiceUnavailableException when the broker rejects or cannot be reached
   */
  public RegionSubmissionResponse submit(List<BoundingBox> boxes) {
    RegionValidator.validate(boxes, properties.getApi().getRegions());

    String submissionId = UUID.randomUUID().toString();
    String createdAt = Instant.now().toString();
    List<RegionMessage> regions = new ArrayList<>(boxes.size());
    List<String> payloads = new ArrayList<>(boxes.size());
    for (BoundingBox box : boxes) {
      RegionMessage region = new RegionMessage(
          UUID.randomUUID().toString(),
          box.northEast().lat(),
          box.northEast().lng(),
          box.southWest().lat(),
          box.southWest().lng(),
          createdAt,
          submissionId);
      regions.add(region);
      payloads.add(serialize(region));
    }

    String key = properties.getRedis().getRegionsKey();
    push(key, submissionId, payloads);
    LOGGER.info("Queued submission {} with {} region(s) on {}", submissionId, regions.size(), key);
    return new RegionSubmissionResponse("regions queued", submissionId, List.copyOf(regions));
  }

  private void push(String key, String submissionId, List<String> payloads) {
    DashboardProperties.Publish publish = properties.getRedis().getPublish();
    int maxAttempts = Math.max(1, publish.getMaxAttempts());
    long backoffMs = Math.max(0L, publish.getInitialBackoffMs());
    for (int attempt = 1; ; attempt++) {
      try {
        redisTemplate.opsForList().rightPushAll(key, payloads);
        return;
      } catch (RuntimeException ex) {
        if (attempt >= maxAttempts) {
          throw new ServiceUnavailableException(
              "Failed to enqueue submission " + submissionId + " on " + key + " after "
                  + maxAttempts + " attempts", ex);
        }
        LOGGER.warn("Region push attempt {}/{} failed, retrying in {} ms: {}",
            attempt, maxAttempts, backoffMs, ex.getMessage());
        try {
          TimeUnit.MILLISECONDS.sleep(backoffMs);
        } catch (InterruptedException interrupted) {
          Thread.currentThread().interrupt();
          throw new ServiceUnavailableException(
              "Interrupted while enqueuing submission " + submissionId, interrupted);
        }
        backoffMs = Math.min(Math.max(1L, backoffMs * 2),
            Math.max(backoffMs, publish.getMaxBackoffMs()));
      }
    }
  }

  private String serialize(RegionMessage region) {
    try {
      return objectMapper.writeValueAsString(region);
    } catch (JsonProcessingException ex) {
      throw new IllegalStateException("Failed to serialize region " + region.id(), ex);
    }
  }
}
