package com.executionengine.integration.venue;

import java.util.Objects;

public record Venue(
    String id,
    VenueClient client,
    VenueConnectionMode connectionMode,
    int leverage,
    String marginMode) {
  public static final String DEFAULT_MARGIN_MODE = "isolated";

  public Venue {
    if (id == null || id.isBlank()) {
      throw new IllegalArgumentException("id must not be blank");
    }
    Objects.requireNonNull(client, "client must not be null");
    connectionMode = connectionMode == null ? VenueConnectionMode.REST : connectionMode;
    if (leverage < 1) {
      throw new IllegalArgumentException("leverage must be >= 1");
    }
    marginMode = marginMode == null || marginMode.isBlank() ? DEFAULT_MARGIN_MODE : marginMode;
  }

  public static Venue rest(String id, VenueClient client) {
    return new Venue(id, client, VenueConnectionMode.REST, 1, DEFAULT_MARGIN_MODE);
  }

  public static Venue streaming(String id, VenueClient client) {
    return new Venue(id, client, VenueConnectionMode.STREAM, 1, DEFAULT_MARGIN_MODE);
  }

  public boolean streamingCapable() {
    return connectionMode == VenueConnectionMode.STREAM && client.supportsStreaming();
  }
}
