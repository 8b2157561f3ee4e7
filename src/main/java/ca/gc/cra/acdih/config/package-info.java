/**
 * Validated process configuration for ACDIH: the settings schema, derived credentials and pool
 * configuration, and the {@link ca.gc.cra.acdih.config.ConfigManager} that loads them once.
 * <p><strong>Concurrency:</strong> Configuration records are immutable; the manager publishes them safely.</p>
 * <p><strong>Metrics:</strong> Emits {@code config.load.*} counters and {@code config.load.duration.ms}.</p>
 * <p><strong>Security:</strong> Private key material is redacted from {@code toString()} and never logged;
 * relies on {@code ca.gc.cra.acdih.validation} utilities.</p>
 */
package ca.gc.cra.acdih.config;
