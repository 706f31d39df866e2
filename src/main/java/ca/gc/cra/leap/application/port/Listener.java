package ca.gc.cra.leap.application.port;

/**
 * <strong>What:</strong> Application callback set for tracking-service events.
 * <p><strong>Role:</strong> User-implemented port; every hook defaults to a no-op so implementations override only
 * what they need.</p>
 * <p><strong>Thread-safety:</strong> Hooks run on the event-source thread, which is generally not the thread that
 * registered the listener. Implementations must publish any state they share with other threads safely.</p>
 * <p><strong>Performance:</strong> Hooks run synchronously on the service's delivery thread; return quickly and hand
 * long work to an executor.</p>
 *
 * <p>Lifecycle: {@link #onInit} fires once on registration before anything else. {@link #onExit} fires once when
 * the listener is removed or its controller closes, and nothing fires after it. Any exception escaping a hook
 * terminates the process.</p>
 *
 * <p>The {@link ControllerView} argument is borrowed for the duration of the call. Query it freely inside the hook,
 * but do not use it after the owning controller closes.</p>
 *
 * @since 0.1.0
 */
public interface Listener {
  /**
   * Called once when the listener is added to a controller.
   *
   * @param controller session view
   */
  default void onInit(ControllerView controller) {}

  default void onConnect(ControllerView controller) {}

  default void onDisconnect(ControllerView controller) {}

  /**
   * Called once when the listener is removed or when its controller is closed. Resources owned by the listener
   * may be released here.
   *
   * @param controller session view
   */
  default void onExit(ControllerView controller) {}

  /**
   * Called once per new frame of tracking data. Fetch it with {@link ControllerView#frame()}.
   *
   * @param controller session view
   */
  default void onFrame(ControllerView controller) {}

  default void onFocusGained(ControllerView controller) {}

  default void onFocusLost(ControllerView controller) {}

  default void onServiceConnect(ControllerView controller) {}

  default void onServiceDisconnect(ControllerView controller) {}

  /**
   * Called when the device configuration changes: a device is plugged in or removed, robust mode toggles, or the
   * image capture rate changes.
   *
   * @param controller session view
   */
  default void onDeviceChange(ControllerView controller) {}

  /**
   * Called once per new set of camera images. Fetch them with {@link ControllerView#images()}.
   *
   * @param controller session view
   */
  default void onImages(ControllerView controller) {}
}
