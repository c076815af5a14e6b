/**
 * Executor factories for stage worker pools.
 * <p><strong>Role:</strong> Infrastructure utilities configuring named, non-daemon thread pools for replicas and
 * dynamic units.</p>
 * <p><strong>Concurrency:</strong> Provides thread-safe factory methods that return managed executors; pools are
 * created per stage run and fully terminated before the run returns.</p>
 * <p><strong>Diagnostics:</strong> Thread names follow the {@code relay-<stage>-<position>-N} convention.</p>
 */
package ca.gc.cra.relay.infrastructure.exec;
