/**
 * Configuration loading and composition root wiring.
 * <p><strong>Concurrency:</strong> Configuration objects are immutable; safe to share.</p>
 */
package ca.gc.cra.leap.config;
