/**
 * Key/value sources the settings schema is resolved against: process environment, {@code .env} files,
 * YAML files and in-memory maps.
 * <p><strong>Concurrency:</strong> All sources are immutable after construction.</p>
 * <p><strong>Security:</strong> Descriptions name files only; values never reach the logs.</p>
 */
package ca.gc.cra.acdih.config.source;
