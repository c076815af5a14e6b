package ca.gc.cra.relay.application.flow;

import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Broadcast stop notification shared by every stage of a pipeline run.
 *
 * <p>Any thread may {@link #cancel()} the signal; every waiter that registered through
 * {@link #onCancel(Runnable)} is woken exactly once, in no particular order. Cancellation is sticky and cannot be
 * reset; create a fresh signal (or a {@link #newChild() child}) per run.</p>
 *
 * @since 0.1.0
 */
public final class CancellationSignal {
  private static final Logger log = LoggerFactory.getLogger(CancellationSignal.class);

  private final AtomicBoolean cancelled = new AtomicBoolean();
  private final Set<Listener> listeners = ConcurrentHashMap.newKeySet();

  /**
   * Creates an active (not cancelled) signal.
   */
  public CancellationSignal() {}

  /**
   * Cancels the signal and runs every registered listener on the calling thread.
   *
   * @return {@code true} when this call performed the cancellation; {@code false} if it was already cancelled
   */
  public boolean cancel() {
    if (!cancelled.compareAndSet(false, true)) {
      return false;
    }
    for (Listener listener : listeners) {
      listener.fire();
    }
    listeners.clear();
    return true;
  }

  /**
   * Reports whether the signal has been cancelled.
   *
   * @return {@code true} once {@link #cancel()} has been called
   */
  public boolean isCancelled() {
    return cancelled.get();
  }

  /**
   * Registers a callback fired once on cancellation.
   *
   * <p>If the signal is already cancelled the callback runs immediately on the calling thread. Callbacks must be
   * short and non-blocking; they typically wake a condition so that a waiter re-checks {@link #isCancelled()}.</p>
   *
   * @param callback action to run on cancellation
   * @return registration that removes the callback when closed
   */
  public Registration onCancel(Runnable callback) {
    Listener listener = new Listener(Objects.requireNonNull(callback, "callback"));
    listeners.add(listener);
    if (cancelled.get()) {
      listeners.remove(listener);
      listener.fire();
    }
    return () -> listeners.remove(listener);
  }

  /**
   * Creates a signal that is cancelled whenever this signal is cancelled, but can also be cancelled on its own
   * without affecting this one.
   *
   * @return derived signal
   */
  public CancellationSignal newChild() {
    CancellationSignal child = new CancellationSignal();
    Registration link = onCancel(child::cancel);
    child.onCancel(link::close);
    return child;
  }

  int waiterCount() {
    return listeners.size();
  }

  @Override
  public String toString() {
    return "CancellationSignal[cancelled=" + cancelled.get() + ", waiters=" + listeners.size() + "]";
  }

  /** Handle returned by {@link #onCancel(Runnable)}; closing it is idempotent. */
  @FunctionalInterface
  public interface Registration extends AutoCloseable {
    @Override
    void close();
  }

  private static final class Listener {
    private final Runnable callback;
    private final AtomicBoolean fired = new AtomicBoolean();

    private Listener(Runnable callback) {
      this.callback = callback;
    }

    private void fire() {
      if (!fired.compareAndSet(false, true)) {
        return;
      }
      try {
        callback.run();
      } catch (RuntimeException ex) {
        log.error("Cancellation listener failed", ex);
      }
    }
  }
}
