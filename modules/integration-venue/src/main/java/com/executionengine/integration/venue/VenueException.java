package com.executionengine.integration.venue;

public class VenueException extends RuntimeException {
  private final String venueId;

  public VenueException(String venueId, String message) {
    super(message);
    this.venueId = venueId;
  }

  public VenueException(String venueId, String message, Throwable cause) {
    super(message, cause);
    this.venueId = venueId;
  }

  public String venueId() {
    return venueId;
  }
}
