/**
 * Ports the configuration layer depends on without binding to infrastructure.
 *
 * @since 0.1.0
 */
package ca.gc.cra.acdih.application.port;
