package com.skyfeed.ingester.opensky;

public record OpenSkyCredentials(String clientId, String clientSecret) {
  @Override
  public String toString() {
    return "OpenSkyCredentials[clientId=" + clientId + ", clientSecret=***]";
  }
}
