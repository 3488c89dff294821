package com.executionengine.execution.reprice;

import java.math.BigDecimal;
import java.math.MathContext;
import java.time.Duration;
import java.util.Objects;

/** Allows a reprice only when the relative move is at least {@code minChangePct} (inclusive). */
public final class MinChangeRepricePolicy implements RepricePolicy {
  private final BigDecimal minChangePct;

  public MinChangeRepricePolicy(BigDecimal minChangePct) {
    Objects.requireNonNull(minChangePct, "minChangePct must not be null");
    if (minChangePct.signum() < 0) {
      throw new IllegalArgumentException("minChangePct must be >= 0");
    }
    this.minChangePct = minChangePct;
  }

  @Override
  public boolean shouldReprice(BigDecimal oldPrice, BigDecimal newPrice, Duration elapsed) {
    if (oldPrice.signum() == 0) {
      return newPrice.signum() != 0;
    }
    return relativeChange(oldPrice, newPrice).compareTo(minChangePct) >= 0;
  }

  public BigDecimal minChangePct() {
    return minChangePct;
  }

  static BigDecimal relativeChange(BigDecimal oldPrice, BigDecimal newPrice) {
    return newPrice.subtract(oldPrice).abs().divide(oldPrice.abs(), MathContext.DECIMAL64);
  }

  @Override
  public String toString() {
    return "MinChangeRepricePolicy[minChangePct=" + minChangePct + "]";
  }
}
