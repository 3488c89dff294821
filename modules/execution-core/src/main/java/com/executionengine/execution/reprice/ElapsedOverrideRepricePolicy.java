package com.executionengine.execution.reprice;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.Objects;

/** Defers to {@code inner} until the order is old enough, then allows any actual price change. */
public final class ElapsedOverrideRepricePolicy implements RepricePolicy {
  private final Duration overrideAfter;
  private final RepricePolicy inner;

  public ElapsedOverrideRepricePolicy(Duration overrideAfter, RepricePolicy inner) {
    this.overrideAfter = Objects.requireNonNull(overrideAfter, "overrideAfter must not be null");
    this.inner = Objects.requireNonNull(inner, "inner must not be null");
  }

  @Override
  public boolean shouldReprice(BigDecimal oldPrice, BigDecimal newPrice, Duration elapsed) {
    if (elapsed.compareTo(overrideAfter) >= 0) {
      return oldPrice.compareTo(newPrice) != 0;
    }
    return inner.shouldReprice(oldPrice, newPrice, elapsed);
  }

  @Override
  public String toString() {
    return "ElapsedOverrideRepricePolicy[overrideAfter=" + overrideAfter + ", inner=" + inner + "]";
  }
}
