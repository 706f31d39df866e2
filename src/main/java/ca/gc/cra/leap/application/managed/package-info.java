/**
 * Blocking wait layer over a controller.
 * <p>Level waits use a {@code ReentrantLock} and a pair of conditions per property; edge waits use a monotonic
 * counter per event kind. Signals are taken under the same lock waiters check under, so no wakeup is lost.</p>
 */
package ca.gc.cra.leap.application.managed;
