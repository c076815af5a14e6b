/**
 * <strong>Purpose:</strong> Application ports defining the stage, transform, source/sink, error and metrics contracts.
 * <p><strong>Pipeline role:</strong> Callers implement {@link ca.gc.cra.relay.application.port.Transform},
 * {@link ca.gc.cra.relay.application.port.ItemSource} and {@link ca.gc.cra.relay.application.port.ItemSink};
 * stages implement {@link ca.gc.cra.relay.application.port.Stage}.</p>
 * <p><strong>Concurrency:</strong> Port implementations must be thread-safe unless documented otherwise.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.relay.application.port;
