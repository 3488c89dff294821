package com.executionengine.integration.venue;

public class InsufficientFundsException extends VenueException {
  public InsufficientFundsException(String venueId, String message) {
    super(venueId, message);
  }

  public InsufficientFundsException(String venueId, String message, Throwable cause) {
    super(venueId, message, cause);
  }
}
