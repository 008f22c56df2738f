package com.skyfeed.ingester.config;

import java.net.http.HttpClient;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.ssm.SsmClient;

@Configuration
public class AppConfig {
  @Bean
  public HttpClient httpClient(OpenSkyProperties openSkyProperties) {
    return HttpClient.newBuilder()
        .connectTimeout(openSkyProperties.connectTimeout())
        .build();
  }

  // Only needed when OpenSky credentials are stored in SSM Parameter Store.
  @Bean(destroyMethod = "close")
  @ConditionalOnProperty(prefix = "aws", name = "region")
  public SsmClient ssmClient(AwsProperties awsProperties) {
    return SsmClient.builder().region(Region.of(awsProperties.region())).build();
  }
}
