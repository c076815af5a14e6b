/**
 * Input validation helpers for configuration values.
 *
 * @since 0.1.0
 */
package ca.gc.cra.relay.validation;
