package com.executionengine.execution.reprice;

import java.math.BigDecimal;
import java.time.Duration;

public final class AlwaysRepricePolicy implements RepricePolicy {
  public static final AlwaysRepricePolicy INSTANCE = new AlwaysRepricePolicy();

  private AlwaysRepricePolicy() {}

  @Override
  public boolean shouldReprice(BigDecimal oldPrice, BigDecimal newPrice, Duration elapsed) {
    return true;
  }

  @Override
  public String toString() {
    return "AlwaysRepricePolicy";
  }
}
