/**
 * <strong>Purpose:</strong> Logging utilities that tune RELAY verbosity at runtime.
 * <p><strong>Observability:</strong> Coordinates with SLF4J/Logback; stage workers add the {@code stage} and
 * {@code replica} MDC keys referenced by {@code logback.xml}.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.relay.logging;
