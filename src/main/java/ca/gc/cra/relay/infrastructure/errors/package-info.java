/**
 * Error sink adapters collecting non-fatal stage failures for the pipeline driver.
 *
 * @since 0.1.0
 */
package ca.gc.cra.relay.infrastructure.errors;
