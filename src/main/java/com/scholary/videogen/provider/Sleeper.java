package com.scholary.videogen.provider;

import java.time.Duration;

/** Suspends the polling thread between polls. Replaced in tests so no real time passes. */
@FunctionalInterface
public interface Sleeper {

  Sleeper THREAD = duration -> Thread.sleep(duration.toMillis());

  void sleep(Duration duration) throws InterruptedException;
}
