package com.skyfeed.dashboard.api;

/**
 * Raised when a dependency needed to accept a request (the message broker) is unreachable.
 *
 * <p>Mapped to HTTP 503 by {@link ApiExceptionHandler}; the message is logged, never returned.
 */
public class ServiceUnavailableException extends RuntimeException {
  public ServiceUnavailableException(String message, Throwable cause) {
    super(message, cause);
  }
}
