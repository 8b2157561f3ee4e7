/**
 * Metrics adapters that bridge the {@code MetricsPort} to OpenTelemetry.
 * <p><strong>Role:</strong> Adapter layer on the observability plane.</p>
 * <p><strong>Concurrency:</strong> Instruments are cached in concurrent maps; safe for concurrent updates.</p>
 * <p><strong>Metrics:</strong> Publishes under the {@code config.*} namespace.</p>
 * <p><strong>Security:</strong> Only metric keys are exported; configuration values never leave the process.</p>
 */
package ca.gc.cra.acdih.infrastructure.metrics;
