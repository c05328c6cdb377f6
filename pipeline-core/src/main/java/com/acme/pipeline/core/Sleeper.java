package com.acme.pipeline.core;

import java.time.Duration;

/** Blocking wait used between retry attempts. Replaced by a recording fake in tests. */
@FunctionalInterface
public interface Sleeper {

  Sleeper SYSTEM = duration -> Thread.sleep(duration.toMillis());

  void sleep(Duration duration) throws InterruptedException;
}
