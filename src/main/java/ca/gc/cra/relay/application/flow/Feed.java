package ca.gc.cra.relay.application.flow;

import ca.gc.cra.relay.domain.item.Item;
import java.util.ArrayDeque;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Bounded multi-producer, multi-consumer conduit carrying {@link Item}s between stages.
 *
 * <p>Every item sent is received by exactly one consumer, so several replicas may read the same feed to share
 * load. Blocking operations race against a {@link CancellationSignal}; cancellation wakes the waiter immediately
 * and wins over a pending transfer. A wake-up listener is registered with the signal only once a call has to
 * wait. Once {@link #close() closed}, receivers drain the remaining items and then observe end-of-feed; senders
 * fail with {@link FeedClosedException}.</p>
 *
 * @since 0.1.0
 */
public final class Feed {
  private final String name;
  private final int capacity;
  private final ArrayDeque<Item> buffer;
  private final ReentrantLock lock = new ReentrantLock();
  private final Condition notEmpty = lock.newCondition();
  private final Condition notFull = lock.newCondition();
  private boolean closed;

  /**
   * Creates an open feed.
   *
   * @param name label used in diagnostics
   * @param capacity maximum number of buffered items; must be positive
   * @throws IllegalArgumentException if {@code capacity} is not positive
   */
  public Feed(String name, int capacity) {
    if (capacity <= 0) {
      throw new IllegalArgumentException("capacity must be positive");
    }
    this.name = Objects.requireNonNull(name, "name");
    this.capacity = capacity;
    this.buffer = new ArrayDeque<>(capacity);
  }

  /**
   * Blocks until {@code item} is buffered or {@code cancel} fires.
   *
   * @param cancel cancellation racing the send
   * @param item item to deliver; ownership passes to the receiver
   * @return {@code true} when the item was buffered; {@code false} when cancellation won and the item was not sent
   * @throws FeedClosedException if the feed is closed
   * @throws InterruptedException if the calling thread is interrupted while waiting
   */
  public boolean send(CancellationSignal cancel, Item item) throws InterruptedException {
    Objects.requireNonNull(cancel, "cancel");
    Objects.requireNonNull(item, "item");
    CancellationSignal.Registration wake = null;
    lock.lockInterruptibly();
    try {
      while (true) {
        if (cancel.isCancelled()) {
          return false;
        }
        if (closed) {
          throw new FeedClosedException(name);
        }
        if (buffer.size() < capacity) {
          buffer.addLast(item);
          notEmpty.signal();
          return true;
        }
        if (wake == null) {
          // Re-check after registering: cancellation may have fired just before.
          wake = cancel.onCancel(this::wakeAll);
          continue;
        }
        notFull.await();
      }
    } finally {
      lock.unlock();
      if (wake != null) {
        wake.close();
      }
    }
  }

  /**
   * Blocks until an item is available, the feed is closed and drained, or {@code cancel} fires.
   *
   * @param cancel cancellation racing the receive
   * @return next item; empty when the feed is exhausted or cancellation won
   * @throws InterruptedException if the calling thread is interrupted while waiting
   */
  public Optional<Item> receive(CancellationSignal cancel) throws InterruptedException {
    Objects.requireNonNull(cancel, "cancel");
    CancellationSignal.Registration wake = null;
    lock.lockInterruptibly();
    try {
      while (true) {
        if (cancel.isCancelled()) {
          return Optional.empty();
        }
        Item next = buffer.pollFirst();
        if (next != null) {
          notFull.signal();
          return Optional.of(next);
        }
        if (closed) {
          return Optional.empty();
        }
        if (wake == null) {
          wake = cancel.onCancel(this::wakeAll);
          continue;
        }
        notEmpty.await();
      }
    } finally {
      lock.unlock();
      if (wake != null) {
        wake.close();
      }
    }
  }

  /**
   * Marks the feed closed. Buffered items remain receivable; blocked senders fail and blocked receivers observe
   * end-of-feed once the buffer is empty. Closing twice is a no-op.
   */
  public void close() {
    lock.lock();
    try {
      closed = true;
      notEmpty.signalAll();
      notFull.signalAll();
    } finally {
      lock.unlock();
    }
  }

  /**
   * Reports whether {@link #close()} has been called.
   *
   * @return {@code true} once closed
   */
  public boolean isClosed() {
    lock.lock();
    try {
      return closed;
    } finally {
      lock.unlock();
    }
  }

  /**
   * Returns the number of buffered items.
   *
   * @return buffered item count
   */
  public int size() {
    lock.lock();
    try {
      return buffer.size();
    } finally {
      lock.unlock();
    }
  }

  /**
   * Returns the feed label.
   *
   * @return name given at construction
   */
  public String name() {
    return name;
  }

  private void wakeAll() {
    lock.lock();
    try {
      notEmpty.signalAll();
      notFull.signalAll();
    } finally {
      lock.unlock();
    }
  }

  @Override
  public String toString() {
    return "Feed[" + name + ", capacity=" + capacity + "]";
  }
}
