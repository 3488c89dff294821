package com.executionengine.integration.venue;

public class BadSymbolException extends VenueException {
  public BadSymbolException(String venueId, String message) {
    super(venueId, message);
  }

  public BadSymbolException(String venueId, String message, Throwable cause) {
    super(venueId, message, cause);
  }
}
