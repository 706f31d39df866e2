/**
 * <strong>Purpose:</strong> Listener registration and event dispatch.
 * <p><strong>Role:</strong> {@link ca.gc.cra.leap.application.Controller} owns a session and its registrations;
 * {@link ca.gc.cra.leap.application.DispatchBridge} routes each native event to exactly one listener hook inside a
 * failure boundary.</p>
 * <p><strong>Concurrency:</strong> Hooks run on the event-source thread. Registration changes are serialized on the
 * controller.</p>
 * <p><strong>Metrics:</strong> Emits {@code leap.dispatch.*} counters through the
 * {@link ca.gc.cra.leap.application.port.MetricsPort}.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.leap.application;
