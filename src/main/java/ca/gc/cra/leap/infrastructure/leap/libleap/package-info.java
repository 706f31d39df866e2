/**
 * JNR-FFI adapter for the tracking service.
 *
 * <p>Binds the {@code LeapShim} C library, a thin wrapper around the vendor SDK that exposes a flat C API and a
 * single event callback. Native buffers are copied into domain snapshots before each query returns.</p>
 */
package ca.gc.cra.leap.infrastructure.leap.libleap;
