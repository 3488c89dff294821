package com.executionengine.worker.config;

import com.executionengine.integration.venue.Venue;
import com.executionengine.integration.venue.VenueConnectionMode;
import java.math.BigDecimal;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import org.springframework.boot.context.properties.ConfigurationProperties;

/** Paper venues the worker trades against, each seeded with a static order book. */
@ConfigurationProperties(prefix = "execution")
public class VenueProperties {
  private List<PaperVenue> venues = new ArrayList<>();

  public List<PaperVenue> getVenues() {
    return venues;
  }

  public void setVenues(List<PaperVenue> venues) {
    this.venues = venues;
  }

  public static class PaperVenue {
    private String id;
    private VenueConnectionMode connectionMode = VenueConnectionMode.REST;
    private int leverage = 1;
    private String marginMode = Venue.DEFAULT_MARGIN_MODE;
    private Duration restingFillDelay = Duration.ofSeconds(2);
    private List<BookSeed> books = new ArrayList<>();

    public String getId() {
      return id;
    }

    public void setId(String id) {
      this.id = id;
    }

    public VenueConnectionMode getConnectionMode() {
      return connectionMode;
    }

    public void setConnectionMode(VenueConnectionMode connectionMode) {
      this.connectionMode = connectionMode;
    }

    public int getLeverage() {
      return leverage;
    }

    public void setLeverage(int leverage) {
      this.leverage = leverage;
    }

    public String getMarginMode() {
      return marginMode;
    }

    public void setMarginMode(String marginMode) {
      this.marginMode = marginMode;
    }

    public Duration getRestingFillDelay() {
      return restingFillDelay;
    }

    public void setRestingFillDelay(Duration restingFillDelay) {
      this.restingFillDelay = restingFillDelay;
    }

    public List<BookSeed> getBooks() {
      return books;
    }

    public void setBooks(List<BookSeed> books) {
      this.books = books;
    }
  }

  public static class BookSeed {
    private String symbol;
    private BigDecimal bestBid;
    private BigDecimal bestAsk;
    private BigDecimal tickSize = new BigDecimal("0.01");
    private BigDecimal levelAmount = BigDecimal.ONE;
    private int depth = 6;

    public String getSymbol() {
      return symbol;
    }

    public void setSymbol(String symbol) {
      this.symbol = symbol;
    }

    public BigDecimal getBestBid() {
      return bestBid;
    }

    public void setBestBid(BigDecimal bestBid) {
      this.bestBid = bestBid;
    }

    public BigDecimal getBestAsk() {
      return bestAsk;
    }

    public void setBestAsk(BigDecimal bestAsk) {
      this.bestAsk = bestAsk;
    }

    public BigDecimal getTickSize() {
      return tickSize;
    }

    public void setTickSize(BigDecimal tickSize) {
      this.tickSize = tickSize;
    }

    public BigDecimal getLevelAmount() {
      return levelAmount;
    }

    public void setLevelAmount(BigDecimal levelAmount) {
      this.levelAmount = levelAmount;
    }

    public int getDepth() {
      return depth;
    }

    public void setDepth(int depth) {
      this.depth = depth;
    }
  }
}
