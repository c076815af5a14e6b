/**
 * Configuration loading: a profile merged over {@code common} in a YAML settings file, validated into
 * {@link ca.gc.cra.relay.config.PipelineConfig}.
 *
 * @since 0.1.0
 */
package ca.gc.cra.relay.config;
