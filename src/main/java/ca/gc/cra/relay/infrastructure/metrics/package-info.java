/**
 * OpenTelemetry-backed implementation of {@link ca.gc.cra.relay.application.port.MetricsPort}.
 * <p>Exporting is disabled unless {@code metrics.exporter=otlp} (or {@code OTEL_METRICS_EXPORTER=otlp}) is set.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.relay.infrastructure.metrics;
