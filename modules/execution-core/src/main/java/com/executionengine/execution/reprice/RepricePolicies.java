package com.executionengine.execution.reprice;

import com.executionengine.execution.config.ExecutorConfig;
import java.math.BigDecimal;
import java.time.Duration;

public final class RepricePolicies {
  private RepricePolicies() {}

  public static RepricePolicy fromConfig(ExecutorConfig config) {
    return create(config.minRepriceThresholdPct(), config.repriceOverrideAfter());
  }

  public static RepricePolicy create(BigDecimal minChangePct, Duration overrideAfter) {
    boolean minChangeSet = minChangePct != null && minChangePct.signum() > 0;
    boolean overrideSet = overrideAfter != null && !overrideAfter.isZero();
    if (!minChangeSet && !overrideSet) {
      return AlwaysRepricePolicy.INSTANCE;
    }
    MinChangeRepricePolicy minChange =
        new MinChangeRepricePolicy(minChangeSet ? minChangePct : BigDecimal.ZERO);
    if (!overrideSet) {
      return minChange;
    }
    return new ElapsedOverrideRepricePolicy(overrideAfter, minChange);
  }
}
