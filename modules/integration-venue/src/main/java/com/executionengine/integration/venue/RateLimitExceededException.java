package com.executionengine.integration.venue;

public class RateLimitExceededException extends VenueException {
  public RateLimitExceededException(String venueId, String message) {
    super(venueId, message);
  }

  public RateLimitExceededException(String venueId, String message, Throwable cause) {
    super(venueId, message, cause);
  }
}
