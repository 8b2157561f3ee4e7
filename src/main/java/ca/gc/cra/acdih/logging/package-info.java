/**
 * Logging bootstrap helpers that apply validated settings to the SLF4J backend (Logback).
 *
 * @since 0.1.0
 */
package ca.gc.cra.acdih.logging;
