package com.skyfeed.dashboard.api;

import com.skyfeed.dashboard.config.DashboardProperties;
import com.skyfeed.dashboard.model.ServiceInfoResponse;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

/** Root endpoint identifying the service. */
@RestController
public class ServiceInfoController {
  private final String applicationName;
  private final DashboardProperties properties;

  public ServiceInfoController(
      @Value("${spring.application.name:skyfeed-dashboard}") String applicationName,
      DashboardProperties properties) {
    this.applicationName = applicationName;
    this.properties = properties;
  }

  @GetMapping("/")
  public ServiceInfoResponse info() {
    return new ServiceInfoResponse(applicationName, properties.getVersion());
  }
}
