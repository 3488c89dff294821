package com.executionengine.integration.venue;

public class OrderNotFoundException extends VenueException {
  public OrderNotFoundException(String venueId, String message) {
    super(venueId, message);
  }

  public OrderNotFoundException(String venueId, String message, Throwable cause) {
    super(venueId, message, cause);
  }
}
