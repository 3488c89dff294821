package com.executionengine.worker.batch;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class LoggingBatchSummaryNotifier implements BatchSummaryNotifier {
  private static final Logger log = LoggerFactory.getLogger(LoggingBatchSummaryNotifier.class);

  @Override
  public void send(String message) {
    log.info("Batch summary notification message={}", message);
  }
}
