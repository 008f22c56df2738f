package com.skyfeed.dashboard.api;

import com.skyfeed.dashboard.model.FlightView;
import com.skyfeed.dashboard.model.RegionSubmissionResponse;
import com.skyfeed.dashboard.model.SetRegionsRequest;
import com.skyfeed.dashboard.service.FlightQueryService;
import com.skyfeed.dashboard.service.RegionSubmissionService;
import java.util.List;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST API for the map client.
 *
 * <p>Reads come from the SQLite snapshot; region submissions are forwarded to the ingester
 * through Redis.
 */
@RestController
@RequestMapping("/api")
public class FlightController {
  private final FlightQueryService flightQueryService;
  private final RegionSubmissionService regionSubmissionService;

  public FlightController(
      FlightQueryService flightQueryService,
      RegionSubmissionService regionSubmissionService) {
    this.flightQueryService = flightQueryService;
    this.regionSubmissionService = regionSubmissionService;
  }

  /**
   * Returns every aircraft updated within the freshness window.
   *
   * @return JSON array of flights, empty when nothing is fresh
   */
  @GetMapping("/flights")
  public List<FlightView> listFlights() {
    return flightQueryService.listFreshFlights();
  }

  /**
   * Replaces the active region set.
   *
   * @param request body carrying {@code boundingBoxes}
   * @return queued regions and their shared submission id
   */
  @PostMapping("/setregions")
  public RegionSubmissionResponse setRegions(@RequestBody SetRegionsRequest request) {
    return regionSubmissionService.submit(request.boundingBoxes());
  }
}
