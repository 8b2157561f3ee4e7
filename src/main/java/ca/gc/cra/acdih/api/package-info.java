/**
 * Command-line entry points for validating and inspecting ACDIH configuration.
 * <p><strong>Role:</strong> Adapter layer on the driving side; parses arguments, configures logging and metrics,
 * and drives {@code ConfigManager}.</p>
 * <p><strong>Security:</strong> Reports never print private key material.</p>
 */
package ca.gc.cra.acdih.api;
