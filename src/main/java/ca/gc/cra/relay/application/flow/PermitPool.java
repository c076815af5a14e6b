package ca.gc.cra.relay.application.flow;

import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Bounded pool of interchangeable concurrency permits.
 *
 * <p>The pool starts with exactly {@code max} permits. A permit is held for the duration of one unit of work and
 * must be returned with {@link #release()} when that unit finishes, whatever its outcome. The number of permits in
 * use never exceeds {@code max}.</p>
 *
 * @since 0.1.0
 */
public final class PermitPool {
  private final int max;
  private final ReentrantLock lock = new ReentrantLock();
  private final Condition permitReturned = lock.newCondition();
  private int available;
  private int peakInUse;

  /**
   * Creates a pool pre-filled with {@code max} permits.
   *
   * @param max number of permits; must be positive
   * @throws IllegalArgumentException if {@code max} is not positive
   */
  public PermitPool(int max) {
    if (max <= 0) {
      throw new IllegalArgumentException("max must be positive");
    }
    this.max = max;
    this.available = max;
  }

  /**
   * Takes one permit, waiting until one is returned or {@code cancel} fires.
   *
   * @param cancel cancellation racing the acquisition
   * @return {@code true} when a permit was taken; {@code false} when cancellation won and no permit is held
   * @throws InterruptedException if the calling thread is interrupted while waiting
   */
  public boolean acquire(CancellationSignal cancel) throws InterruptedException {
    CancellationSignal.Registration wake = null;
    lock.lockInterruptibly();
    try {
      while (true) {
        if (cancel.isCancelled()) {
          return false;
        }
        if (available > 0) {
          available--;
          peakInUse = Math.max(peakInUse, max - available);
          return true;
        }
        if (wake == null) {
          wake = cancel.onCancel(this::wakeAll);
          continue;
        }
        permitReturned.await();
      }
    } finally {
      lock.unlock();
      if (wake != null) {
        wake.close();
      }
    }
  }

  /**
   * Returns one permit to the pool.
   *
   * @throws IllegalStateException if more permits are returned than were taken
   */
  public void release() {
    lock.lock();
    try {
      if (available >= max) {
        throw new IllegalStateException("Permit released more times than acquired");
      }
      available++;
      permitReturned.signalAll();
    } finally {
      lock.unlock();
    }
  }

  /**
   * Blocks until every permit is back in the pool. The wait is not cancellable and survives interrupts; the
   * interrupt status is restored before returning.
   */
  public void awaitAllReturned() {
    boolean interrupted = false;
    lock.lock();
    try {
      while (available < max) {
        try {
          permitReturned.await();
        } catch (InterruptedException ie) {
          interrupted = true;
        }
      }
    } finally {
      lock.unlock();
      if (interrupted) {
        Thread.currentThread().interrupt();
      }
    }
  }

  /**
   * Returns the number of permits currently in the pool.
   *
   * @return available permits
   */
  public int available() {
    lock.lock();
    try {
      return available;
    } finally {
      lock.unlock();
    }
  }

  /**
   * Returns the highest number of permits simultaneously checked out since construction.
   *
   * @return peak permits in use
   */
  public int peakInUse() {
    lock.lock();
    try {
      return peakInUse;
    } finally {
      lock.unlock();
    }
  }

  /**
   * Returns the pool size.
   *
   * @return {@code max} given at construction
   */
  public int max() {
    return max;
  }

  private void wakeAll() {
    lock.lock();
    try {
      permitReturned.signalAll();
    } finally {
      lock.unlock();
    }
  }
}
