/**
 * Ports between the application layer and its adapters: the event source, listeners, metrics and process
 * termination.
 */
package ca.gc.cra.leap.application.port;
