package com.streamfirst.history.application;

import com.streamfirst.history.domain.RetrievalCancelledException;
import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * Cooperative cancellation flag shared by one multi-channel retrieval. Sessions check it between
 * batches and the orchestrator checks it between channels; pauses wake up early when it fires.
 */
public final class CancellationSignal {

  private final CountDownLatch cancelled = new CountDownLatch(1);

  public static CancellationSignal create() {
    return new CancellationSignal();
  }

  public void cancel() {
    cancelled.countDown();
  }

  public boolean isCancelled() {
    return cancelled.getCount() == 0;
  }

  /** Throws if cancellation was requested. */
  public void throwIfCancelled(String channel) {
    if (isCancelled()) {
      throw new RetrievalCancelledException("Retrieval cancelled while fetching " + channel);
    }
  }

  /**
   * Sleeps for the given delay, returning early if cancellation is requested meanwhile.
   *
   * @throws RetrievalCancelledException if the signal fires or the thread is interrupted
   */
  public void pause(Duration delay, String channel) {
    if (delay.isZero()) {
      throwIfCancelled(channel);
      return;
    }
    try {
      if (cancelled.await(delay.toNanos(), TimeUnit.NANOSECONDS)) {
        throwIfCancelled(channel);
      }
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new RetrievalCancelledException("Interrupted while fetching " + channel);
    }
  }
}
