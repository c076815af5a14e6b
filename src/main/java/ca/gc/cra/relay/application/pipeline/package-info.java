/**
 * Pipeline driver chaining stages with feeds, plus the failure types it reports.
 * <p>{@link ca.gc.cra.relay.application.pipeline.Pipeline} owns the feeds and the error sink of a run; stages only
 * see them through {@link ca.gc.cra.relay.application.port.StageContext}. Worker threads follow the
 * {@code relay-pipeline-*} naming convention and carry the {@code stage} MDC key.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.relay.application.pipeline;
