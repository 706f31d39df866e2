package ca.gc.cra.leap.infrastructure.leap.libleap;

import ca.gc.cra.leap.application.port.ControllerView;
import ca.gc.cra.leap.application.port.EventDispatcher;
import ca.gc.cra.leap.application.port.LeapException;
import ca.gc.cra.leap.application.port.LeapSession;
import ca.gc.cra.leap.domain.Frame;
import ca.gc.cra.leap.domain.GestureType;
import ca.gc.cra.leap.domain.LeapEvent;
import ca.gc.cra.leap.domain.Policy;
import ca.gc.cra.leap.domain.Timestamp;
import ca.gc.cra.leap.domain.image.Camera;
import ca.gc.cra.leap.domain.image.Image;
import ca.gc.cra.leap.domain.image.ImageList;
import ca.gc.cra.leap.infrastructure.leap.libleap.cstruct.FrameInfoStruct;
import ca.gc.cra.leap.infrastructure.leap.libleap.cstruct.ImageInfoStruct;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import jnr.ffi.Pointer;
import jnr.ffi.Runtime;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> {@link LeapSession} backed by one native controller in the {@code LeapShim} library.
 * <p><strong>Why:</strong> Forwards native callbacks into the {@link EventDispatcher} and copies native frame and
 * image memory into immutable snapshots.</p>
 * <p><strong>Role:</strong> Infrastructure adapter for the event-source port.</p>
 * <p><strong>Thread-safety:</strong> Queries may be called from any thread; the vendor SDK serializes callbacks per
 * controller. The callback delegate is held in a field so the native side never calls into a collected object.</p>
 *
 * @since 0.1.0
 */
final class JnrLeapSession implements LeapSession {
  private static final Logger log = LoggerFactory.getLogger(JnrLeapSession.class);

  private final JnrLeapLibrary lib;
  private final Runtime runtime;
  private final EventDispatcher dispatcher;
  private final Pointer controller;
  private final JnrLeapLibrary.ListenerCallback callback;
  private final Map<Long, Pointer> listeners = new ConcurrentHashMap<>();
  private volatile boolean closed;

  JnrLeapSession(JnrLeapLibrary lib, Runtime runtime, EventDispatcher dispatcher) throws LeapException {
    this.lib = Objects.requireNonNull(lib, "lib");
    this.runtime = Objects.requireNonNull(runtime, "runtime");
    this.dispatcher = Objects.requireNonNull(dispatcher, "dispatcher");
    this.callback = this::onNativeEvent;
    Pointer handle = lib.leap_controller_new();
    if (handle == null) {
      throw new LeapException("leap_controller_new returned null");
    }
    this.controller = handle;
  }

  private void onNativeEvent(long token, int eventCode, Pointer source) {
    LeapEvent.fromCode(eventCode)
        .ifPresentOrElse(
            event -> dispatcher.dispatch(token, event),
            () -> log.warn("Dropping unknown native event code {} for token {}", eventCode, token));
  }

  @Override
  public boolean attach(long token) {
    if (closed || listeners.containsKey(token)) {
      return false;
    }
    Pointer listener = lib.leap_listener_new(token, callback);
    if (listener == null) {
      log.warn("leap_listener_new failed for token {}", token);
      return false;
    }
    listeners.put(token, listener);
    if (lib.leap_controller_add_listener(controller, listener) == 0) {
      listeners.remove(token);
      lib.leap_listener_delete(listener);
      return false;
    }
    return true;
  }

  @Override
  public boolean detach(long token) {
    Pointer listener = listeners.remove(token);
    if (listener == null) {
      return false;
    }
    try {
      lib.leap_controller_remove_listener(controller, listener);
    } finally {
      lib.leap_listener_delete(listener);
    }
    return true;
  }

  @Override
  public boolean isServiceConnected() {
    return lib.leap_controller_is_service_connected(controller) != 0;
  }

  @Override
  public boolean isConnected() {
    return lib.leap_controller_is_connected(controller) != 0;
  }

  @Override
  public boolean hasFocus() {
    return lib.leap_controller_has_focus(controller) != 0;
  }

  @Override
  public void setPolicy(Policy policy) {
    lib.leap_controller_set_policy(controller, policy.flag());
  }

  @Override
  public void clearPolicy(Policy policy) {
    lib.leap_controller_clear_policy(controller, policy.flag());
  }

  @Override
  public boolean isPolicySet(Policy policy) {
    return lib.leap_controller_is_policy_set(controller, policy.flag()) != 0;
  }

  @Override
  public Timestamp now() {
    return new Timestamp(lib.leap_controller_now(controller));
  }

  @Override
  public Frame frame(int history) {
    if (history < 0 || history > ControllerView.MAX_FRAME_HISTORY) {
      return Frame.invalid();
    }
    FrameInfoStruct info = new FrameInfoStruct(runtime);
    if (lib.leap_controller_frame(controller, history, info) == 0) {
      return Frame.invalid();
    }
    return new Frame(
        info.id.get(),
        new Timestamp(info.timestamp.get()),
        info.framesPerSecond.get(),
        info.valid.get() != 0);
  }

  @Override
  public ImageList images() {
    Pointer list = lib.leap_controller_images(controller);
    if (list == null) {
      return ImageList.empty();
    }
    try {
      int count = lib.leap_image_list_count(list);
      List<Image> images = new ArrayList<>(Math.max(count, 0));
      for (int i = 0; i < count; i++) {
        ImageInfoStruct info = new ImageInfoStruct(runtime);
        if (lib.leap_image_list_get(list, i, info) == 0) {
          log.debug("leap_image_list_get skipped index {}", i);
          continue;
        }
        images.add(copyImage(info));
      }
      return new ImageList(images);
    } finally {
      lib.leap_image_list_free(list);
    }
  }

  private static Image copyImage(ImageInfoStruct info) {
    int width = info.width.get();
    int height = info.height.get();
    int bytesPerPixel = info.bytesPerPixel.get();
    byte[] pixels = new byte[Math.multiplyExact(Math.multiplyExact(width, height), bytesPerPixel)];
    Pointer data = info.data.get();
    if (pixels.length > 0 && data != null) {
      data.get(0, pixels, 0, pixels.length);
    }
    float[] distortion = new float[Math.max(info.distortionLength.get(), 0)];
    Pointer map = info.distortion.get();
    if (distortion.length > 0 && map != null) {
      map.get(0, distortion, 0, distortion.length);
    }
    return new Image(
        info.valid.get() != 0,
        info.sequenceId.get(),
        Camera.fromImageId(info.cameraId.get()),
        new Timestamp(info.timestamp.get()),
        width,
        height,
        bytesPerPixel,
        pixels,
        distortion);
  }

  @Override
  public void enableGesture(GestureType gesture) {
    lib.leap_controller_enable_gesture(controller, gesture.code(), 1);
  }

  @Override
  public void disableGesture(GestureType gesture) {
    lib.leap_controller_enable_gesture(controller, gesture.code(), 0);
  }

  @Override
  public boolean isGestureEnabled(GestureType gesture) {
    return lib.leap_controller_is_gesture_enabled(controller, gesture.code()) != 0;
  }

  @Override
  public void close() {
    if (closed) {
      return;
    }
    closed = true;
    for (Long token : List.copyOf(listeners.keySet())) {
      log.warn("Listener token {} still attached at close; detaching", token);
      detach(token);
    }
    lib.leap_controller_delete(controller);
    log.info("Native controller released");
  }
}
