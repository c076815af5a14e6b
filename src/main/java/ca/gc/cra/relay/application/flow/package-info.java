/**
 * Blocking primitives that stages coordinate through: {@link ca.gc.cra.relay.application.flow.Feed feeds},
 * {@link ca.gc.cra.relay.application.flow.PermitPool permit pools} and the
 * {@link ca.gc.cra.relay.application.flow.CancellationSignal cancellation signal}.
 * <p>Every wait is a {@code ReentrantLock}/{@code Condition} wait that cancellation wakes directly, so stages never
 * poll for shutdown.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.relay.application.flow;
