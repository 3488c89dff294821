package com.executionengine.worker.config;

import com.executionengine.integration.venue.Venue;
import java.util.List;

/** The venues every batch is routed against. */
public record VenueCatalog(List<Venue> venues) {
  public VenueCatalog {
    venues = venues == null ? List.of() : List.copyOf(venues);
  }
}
