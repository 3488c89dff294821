package com.executionengine.execution.rejection;

import com.executionengine.integration.venue.BadSymbolException;
import com.executionengine.integration.venue.InsufficientFundsException;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Maps venue failures to a retry decision. Anything not recognised as fatal is transient; venues
 * with their own fatal error types register them through the constructor.
 */
public class RejectionClassifier {
  private static final List<Class<? extends Throwable>> DEFAULT_FATAL_TYPES =
      List.of(InsufficientFundsException.class, BadSymbolException.class);

  private final List<Class<? extends Throwable>> fatalTypes;

  public RejectionClassifier() {
    this(List.of());
  }

  public RejectionClassifier(List<Class<? extends Throwable>> additionalFatalTypes) {
    Objects.requireNonNull(additionalFatalTypes, "additionalFatalTypes must not be null");
    List<Class<? extends Throwable>> types = new ArrayList<>(DEFAULT_FATAL_TYPES);
    types.addAll(additionalFatalTypes);
    this.fatalTypes = List.copyOf(types);
  }

  public RejectionSeverity classify(Throwable error) {
    Throwable candidate = error;
    while (candidate != null) {
      for (Class<? extends Throwable> fatalType : fatalTypes) {
        if (fatalType.isAssignableFrom(candidate.getClass())) {
          return RejectionSeverity.FATAL;
        }
      }
      if (candidate.getCause() == candidate) {
        break;
      }
      candidate = candidate.getCause();
    }
    return RejectionSeverity.TRANSIENT;
  }

  public boolean isFatal(Throwable error) {
    return classify(error) == RejectionSeverity.FATAL;
  }
}
