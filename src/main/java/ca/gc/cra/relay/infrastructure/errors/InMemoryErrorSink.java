package ca.gc.cra.relay.infrastructure.errors;

import ca.gc.cra.relay.application.port.ErrorSink;
import ca.gc.cra.relay.application.port.MetricsPort;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ConcurrentLinkedQueue;

/**
 * Thread-safe, non-blocking {@link ErrorSink} retaining failures in arrival order.
 *
 * @since 0.1.0
 */
public final class InMemoryErrorSink implements ErrorSink {
  private final ConcurrentLinkedQueue<Throwable> errors = new ConcurrentLinkedQueue<>();
  private final MetricsPort metrics;

  /**
   * Creates a sink that records no metrics.
   */
  public InMemoryErrorSink() {
    this(MetricsPort.NO_OP);
  }

  /**
   * Creates a sink counting appended failures under {@code pipeline.errors}.
   *
   * @param metrics metrics sink
   */
  public InMemoryErrorSink(MetricsPort metrics) {
    this.metrics = Objects.requireNonNull(metrics, "metrics");
  }

  @Override
  public void append(Throwable error) {
    errors.add(Objects.requireNonNull(error, "error"));
    metrics.increment("pipeline.errors");
  }

  /**
   * Returns a snapshot of appended failures.
   *
   * @return immutable list of failures in arrival order
   */
  public List<Throwable> snapshot() {
    return List.copyOf(errors);
  }

  /**
   * Reports whether any failure was appended.
   *
   * @return {@code true} when no failure has been recorded
   */
  public boolean isEmpty() {
    return errors.isEmpty();
  }

  /**
   * Clears the captured failures.
   */
  public void clear() {
    errors.clear();
  }
}
