/**
 * Stage implementations: sequential FIFO, fixed-size pool, permit-bounded dynamic pool and broadcast.
 * <p>Every stage starts its worker threads per run through
 * {@link ca.gc.cra.relay.infrastructure.exec.ExecutorFactories} and joins them before {@code run} returns. Transform
 * failures are wrapped in {@link ca.gc.cra.relay.application.pipeline.StageException} and appended to the context's
 * error sink; they never stop sibling work.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.relay.application.stage;
