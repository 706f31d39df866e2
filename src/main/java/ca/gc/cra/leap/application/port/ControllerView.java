package ca.gc.cra.leap.application.port;

import ca.gc.cra.leap.domain.Frame;
import ca.gc.cra.leap.domain.GestureType;
import ca.gc.cra.leap.domain.Policy;
import ca.gc.cra.leap.domain.Timestamp;
import ca.gc.cra.leap.domain.image.ImageList;

/**
 * <strong>What:</strong> Query surface of a tracking session, without listener management.
 * <p><strong>Why:</strong> Listener hooks and application threads need device state but must not be able to
 * register or remove listeners through the same reference.</p>
 * <p><strong>Role:</strong> Port implemented by event-source sessions and by the owning controller.</p>
 * <p><strong>Thread-safety:</strong> Every operation is a direct, non-blocking call into the session and may be
 * invoked from any thread, including the event-source thread during a hook.</p>
 *
 * @since 0.1.0
 */
public interface ControllerView {
  /** Oldest frame the service retains; {@code frame(59)} is the last accepted history. */
  int MAX_FRAME_HISTORY = 59;

  /**
   * Returns whether the connection to the tracking service is established.
   *
   * @return {@code true} while connected to the service
   */
  boolean isServiceConnected();

  /**
   * Returns whether a tracking device is connected.
   *
   * @return {@code true} while a device is attached
   */
  boolean isConnected();

  /**
   * Returns whether this application currently has device focus.
   *
   * @return {@code true} while focused
   */
  boolean hasFocus();

  /**
   * Requests a service or device policy. The change is applied asynchronously.
   *
   * @param policy policy to set
   */
  void setPolicy(Policy policy);

  /**
   * Clears a service or device policy.
   *
   * @param policy policy to clear
   */
  void clearPolicy(Policy policy);

  /**
   * Returns whether the policy is currently in effect.
   *
   * @param policy policy to query
   * @return {@code true} when active
   */
  boolean isPolicySet(Policy policy);

  /**
   * Returns the current service timestamp.
   *
   * @return service clock reading
   */
  Timestamp now();

  /**
   * Returns the most recent frame.
   *
   * @return latest frame; check {@link Frame#valid()}
   */
  default Frame frame() {
    return frame(0);
  }

  /**
   * Returns a frame of the given age. {@code 0} is the most recent frame, {@code 1} the one before it.
   *
   * @param history age in {@code [0, MAX_FRAME_HISTORY]}
   * @return requested frame, or {@link Frame#invalid()} when {@code history} is out of range or the service has not
   *     accumulated that much history
   */
  Frame frame(int history);

  /**
   * Returns the most recent set of camera images.
   *
   * @return image snapshot; empty when images are unavailable
   */
  ImageList images();

  /**
   * Enables detection and reporting of a gesture.
   *
   * @param gesture gesture to enable
   */
  void enableGesture(GestureType gesture);

  /**
   * Disables detection and reporting of a gesture.
   *
   * @param gesture gesture to disable
   */
  void disableGesture(GestureType gesture);

  /**
   * Returns whether the gesture is enabled.
   *
   * @param gesture gesture to query
   * @return {@code true} when enabled
   */
  boolean isGestureEnabled(GestureType gesture);
}
