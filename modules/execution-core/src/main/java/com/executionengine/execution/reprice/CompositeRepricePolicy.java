package com.executionengine.execution.reprice;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.List;
import java.util.Objects;

/** Reprices only when every constituent policy agrees. */
public final class CompositeRepricePolicy implements RepricePolicy {
  private final List<RepricePolicy> policies;

  public CompositeRepricePolicy(List<RepricePolicy> policies) {
    this.policies = List.copyOf(Objects.requireNonNull(policies, "policies must not be null"));
  }

  @Override
  public boolean shouldReprice(BigDecimal oldPrice, BigDecimal newPrice, Duration elapsed) {
    for (RepricePolicy policy : policies) {
      if (!policy.shouldReprice(oldPrice, newPrice, elapsed)) {
        return false;
      }
    }
    return true;
  }

  @Override
  public String toString() {
    return "CompositeRepricePolicy" + policies;
  }
}
