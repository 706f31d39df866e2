package ca.gc.cra.leap.infrastructure.leap.libleap;

import ca.gc.cra.leap.application.port.LeapException;
import ca.gc.cra.leap.infrastructure.leap.libleap.cstruct.FrameInfoStruct;
import ca.gc.cra.leap.infrastructure.leap.libleap.cstruct.ImageInfoStruct;
import jnr.ffi.LibraryLoader;
import jnr.ffi.Pointer;
import jnr.ffi.annotations.Delegate;

/**
 * JNR-FFI bindings for the {@code LeapShim} C library that wraps the vendor tracking SDK.
 * <p>Boolean results are C ints: zero is false, anything else is true. Pointer results are {@code null} on
 * failure.</p>
 *
 * @since 0.1.0
 */
public interface JnrLeapLibrary {

  /**
   * Native-to-Java event callback. The shim calls it on the service's delivery thread, once per event per listener.
   */
  interface ListenerCallback {
    /**
     * Receives one event.
     *
     * @param token token given to {@link #leap_listener_new(long, ListenerCallback)}
     * @param eventCode native event code
     * @param controller controller that raised the event
     */
    @Delegate
    void invoke(long token, int eventCode, Pointer controller);
  }

  /**
   * Loads the shim library.
   *
   * @param name library name without platform prefix or suffix (e.g., {@code "LeapShim"})
   * @return bound library
   * @throws LeapException if the library or one of its symbols cannot be linked
   */
  static JnrLeapLibrary load(String name) throws LeapException {
    try {
      return LibraryLoader.create(JnrLeapLibrary.class).failImmediately().load(name);
    } catch (UnsatisfiedLinkError ex) {
      throw new LeapException("Unable to load native library " + name, ex);
    }
  }

  /**
   * Creates a controller and starts connecting to the service in the background.
   *
   * @return controller handle or {@code null} on failure
   */
  Pointer leap_controller_new();

  void leap_controller_delete(Pointer controller);

  /**
   * Creates a native listener that forwards every event to {@code callback} tagged with {@code token}.
   *
   * @param token correlation token
   * @param callback callback; the caller keeps it reachable while the listener exists
   * @return listener handle or {@code null} on failure
   */
  Pointer leap_listener_new(long token, ListenerCallback callback);

  void leap_listener_delete(Pointer listener);

  /**
   * Adds a listener. The service raises init for it before any other event.
   *
   * @return non-zero when accepted
   */
  int leap_controller_add_listener(Pointer controller, Pointer listener);

  /**
   * Removes a listener. The service raises exit for it and waits for in-flight callbacks before returning.
   *
   * @return non-zero when the listener was registered
   */
  int leap_controller_remove_listener(Pointer controller, Pointer listener);

  int leap_controller_is_connected(Pointer controller);

  int leap_controller_is_service_connected(Pointer controller);

  int leap_controller_has_focus(Pointer controller);

  void leap_controller_set_policy(Pointer controller, int flag);

  void leap_controller_clear_policy(Pointer controller, int flag);

  int leap_controller_is_policy_set(Pointer controller, int flag);

  void leap_controller_enable_gesture(Pointer controller, int gesture, int enable);

  int leap_controller_is_gesture_enabled(Pointer controller, int gesture);

  /**
   * Reads the service clock.
   *
   * @return microseconds
   */
  long leap_controller_now(Pointer controller);

  /**
   * Copies the frame {@code history} steps back into {@code out}.
   *
   * @return non-zero when {@code out} was filled
   */
  int leap_controller_frame(Pointer controller, int history, FrameInfoStruct out);

  /**
   * Captures the most recent image set. Release it with {@link #leap_image_list_free(Pointer)}.
   *
   * @return image list handle or {@code null} when no images are available
   */
  Pointer leap_controller_images(Pointer controller);

  int leap_image_list_count(Pointer list);

  /**
   * Describes image {@code index} of {@code list}.
   *
   * @return non-zero when {@code out} was filled
   */
  int leap_image_list_get(Pointer list, int index, ImageInfoStruct out);

  void leap_image_list_free(Pointer list);
}
