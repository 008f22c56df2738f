package com.skyfeed.ingester.opensky;

import com.skyfeed.ingester.config.OpenSkyProperties;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import software.amazon.awssdk.services.ssm.SsmClient;
import software.amazon.awssdk.services.ssm.model.GetParameterRequest;

@Component
public class OpenSkyCredentialsProvider {
  private static final Logger log = LoggerFactory.getLogger(OpenSkyCredentialsProvider.class);

  private final OpenSkyProperties properties;
  private final Optional<SsmClient> ssmClient;
  private OpenSkyCredentials cached;
  private boolean resolved;

  public OpenSkyCredentialsProvider(OpenSkyProperties properties, Optional<SsmClient> ssmClient) {
    this.properties = properties;
    this.ssmClient = ssmClient;
  }

  /**
   * Resolves the OpenSky client credentials.
   *
   * <p>Explicit properties win; SSM parameter names are used when no explicit pair is set. An
   * empty result means anonymous access.
   */
  public synchronized Optional<OpenSkyCredentials> get() {
    if (resolved) {
      return Optional.ofNullable(cached);
    }

    if (isPresent(properties.clientId()) && isPresent(properties.clientSecret())) {
      cached = new OpenSkyCredentials(properties.clientId().trim(), properties.clientSecret().trim());
    } else if (isPresent(properties.clientIdSsm()) && isPresent(properties.clientSecretSsm())) {
      SsmClient client = ssmClient.orElseThrow(() -> new IllegalStateException(
          "OpenSky credentials reference SSM parameters but aws.region is not configured"));
      cached = new OpenSkyCredentials(
          getParameter(client, properties.clientIdSsm()),
          getParameter(client, properties.clientSecretSsm()));
    } else {
      log.info("No OpenSky credentials configured, using anonymous access");
    }
    resolved = true;
    return Optional.ofNullable(cached);
  }

  private boolean isPresent(String value) {
    return value != null && !value.isBlank();
  }

  private String getParameter(SsmClient client, String name) {
    return client.getParameter(
        GetParameterRequest.builder().name(name).withDecryption(true).build()).parameter().value();
  }
}
