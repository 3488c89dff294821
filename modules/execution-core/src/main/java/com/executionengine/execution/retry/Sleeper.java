package com.executionengine.execution.retry;

import java.time.Duration;

@FunctionalInterface
public interface Sleeper {
  Sleeper THREAD_SLEEPER = duration -> Thread.sleep(duration.toMillis());

  void sleep(Duration duration) throws InterruptedException;
}
