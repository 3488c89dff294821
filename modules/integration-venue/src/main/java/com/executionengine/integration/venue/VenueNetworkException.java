package com.executionengine.integration.venue;

public class VenueNetworkException extends VenueException {
  public VenueNetworkException(String venueId, String message) {
    super(venueId, message);
  }

  public VenueNetworkException(String venueId, String message, Throwable cause) {
    super(venueId, message, cause);
  }
}
