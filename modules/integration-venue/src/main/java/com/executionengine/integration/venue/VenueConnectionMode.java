package com.executionengine.integration.venue;

public enum VenueConnectionMode {
  REST,
  STREAM
}
