package com.executionengine.worker.batch;

/** Delivers the end-of-batch summary to whoever watches the engine. */
public interface BatchSummaryNotifier {
  void send(String message);
}
