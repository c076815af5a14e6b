package ca.gc.cra.relay.application.port;

/**
 * <strong>What:</strong> Append-only collector of non-fatal, annotated pipeline failures.
 * <p><strong>Why:</strong> Stages degrade gracefully; failures are gathered for the driver instead of aborting
 * sibling work.</p>
 * <p><strong>Thread-safety:</strong> Implementations must accept concurrent appends from every worker thread and
 * must never block.</p>
 *
 * @since 0.1.0
 * @see ca.gc.cra.relay.infrastructure.errors.InMemoryErrorSink
 */
@FunctionalInterface
public interface ErrorSink {
  /**
   * Records a failure.
   *
   * @param error failure annotated with its origin; must not be {@code null}
   */
  void append(Throwable error);
}
