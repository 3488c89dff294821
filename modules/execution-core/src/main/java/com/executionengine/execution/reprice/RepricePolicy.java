package com.executionengine.execution.reprice;

import java.math.BigDecimal;
import java.time.Duration;

@FunctionalInterface
public interface RepricePolicy {
  boolean shouldReprice(BigDecimal oldPrice, BigDecimal newPrice, Duration elapsed);
}
