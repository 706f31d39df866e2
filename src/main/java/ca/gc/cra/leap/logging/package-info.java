/**
 * Logging utilities for the bridge.
 * <p><strong>Observability:</strong> Coordinates with SLF4J/Logback; emits no metrics.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.leap.logging;
