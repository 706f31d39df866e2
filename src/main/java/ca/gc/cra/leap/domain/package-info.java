/**
 * <strong>Purpose:</strong> Immutable value types shared by every layer of the bridge: events, frames, timestamps,
 * policies and gesture kinds.
 * <p><strong>Concurrency:</strong> All types are immutable and safe to share across threads.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.leap.domain;
