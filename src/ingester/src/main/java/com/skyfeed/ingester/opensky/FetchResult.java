package com.skyfeed.ingester.opensky;

import java.util.List;

public record FetchResult(
    FetchStatus status,
    List<FlightState> states,
    Integer statusCode,
    Integer remainingCredits) {

  public static FetchResult success(List<FlightState> states, Integer statusCode, Integer remainingCredits) {
    return new FetchResult(FetchStatus.SUCCESS, List.copyOf(states), statusCode, remainingCredits);
  }

  public static FetchResult rateLimited(Integer remainingCredits) {
    return new FetchResult(FetchStatus.RATE_LIMITED, List.of(), 429, remainingCredits);
  }

  public static FetchResult failed(Integer statusCode, Integer remainingCredits) {
    return new FetchResult(FetchStatus.FAILED, List.of(), statusCode, remainingCredits);
  }

  public boolean isSuccess() {
    return status == FetchStatus.SUCCESS;
  }
}
