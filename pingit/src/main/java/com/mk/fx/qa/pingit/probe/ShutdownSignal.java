package com.mk.fx.qa.pingit.probe;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/** One-shot cancellation signal shared by all probers of a generation. */
public final class ShutdownSignal {

  private final CountDownLatch latch = new CountDownLatch(1);

  public void raise() {
    latch.countDown();
  }

  public boolean isRaised() {
    return latch.getCount() == 0;
  }

  /**
   * Waits until the signal is raised or the timeout elapses.
   *
   * @return true if the signal was raised
   */
  public boolean await(long timeout, TimeUnit unit) throws InterruptedException {
    return latch.await(timeout, unit);
  }
}
