/**
 * Simulated event source that delivers on a dedicated thread. Used by tests and for development without a device.
 */
package ca.gc.cra.leap.infrastructure.leap.memory;
