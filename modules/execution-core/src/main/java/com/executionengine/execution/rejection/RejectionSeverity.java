package com.executionengine.execution.rejection;

public enum RejectionSeverity {
  /** Retrying cannot help; fail the order now. */
  FATAL,
  /** Retry with backoff. */
  TRANSIENT
}
