package ca.gc.cra.leap.application.managed;

import ca.gc.cra.leap.application.Controller;
import ca.gc.cra.leap.application.DispatchSettings;
import ca.gc.cra.leap.application.port.ControllerView;
import ca.gc.cra.leap.application.port.LeapException;
import ca.gc.cra.leap.application.port.LeapService;
import ca.gc.cra.leap.application.port.Listener;
import ca.gc.cra.leap.domain.Frame;
import ca.gc.cra.leap.domain.GestureType;
import ca.gc.cra.leap.domain.Policy;
import ca.gc.cra.leap.domain.Timestamp;
import ca.gc.cra.leap.domain.image.ImageList;
import java.time.Duration;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> A {@link Controller} with blocking "wait until" operations.
 * <p><strong>Why:</strong> Lets application threads wait for a connection, a focus change or new data without
 * implementing a listener or polling.</p>
 * <p><strong>Role:</strong> Application-layer wrapper. It registers one internal listener that drives shared
 * counters and conditions.</p>
 * <p><strong>Thread-safety:</strong> Any number of threads may wait concurrently. Queries delegate to the wrapped
 * controller.</p>
 *
 * <p>Level waits ({@code waitUntilDeviceConnected} and friends) return at once when the property already has the
 * awaited value. Edge waits ({@code waitUntilFrame}, {@code waitUntilImages}, {@code waitUntilDeviceChange}) block
 * until at least one new occurrence after the call starts. Untimed waits never time out; use the {@link Duration}
 * overloads for bounded waiting.</p>
 *
 * @since 0.1.0
 */
public final class ManagedController implements ControllerView, AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(ManagedController.class);

  private final Controller controller;
  private final WaitState state;

  /**
   * Wraps an open controller and registers the internal wait listener on it.
   *
   * @param controller controller to wrap; closing this object closes it
   * @throws IllegalStateException if the wait listener cannot be registered; the controller is closed first
   */
  public ManagedController(Controller controller) {
    this.controller = Objects.requireNonNull(controller, "controller");
    this.state = new WaitState(controller);
    if (!controller.addListener(new WaitStateListener(state))) {
      controller.close();
      throw new IllegalStateException("tracking service rejected the wait listener");
    }
  }

  /**
   * Opens a managed controller against the native tracking service.
   *
   * @return unconnected managed controller
   * @throws LeapException if the session cannot be opened
   */
  public static ManagedController create() throws LeapException {
    return new ManagedController(Controller.create());
  }

  /**
   * Opens a managed controller against the supplied service.
   *
   * @param service event-source factory
   * @return unconnected managed controller
   * @throws LeapException if the session cannot be opened
   */
  public static ManagedController create(LeapService service) throws LeapException {
    return new ManagedController(Controller.create(service));
  }

  /**
   * Opens a managed controller against the supplied service with explicit dispatch settings.
   *
   * @param service event-source factory
   * @param settings dispatch metrics and failure policy
   * @return unconnected managed controller
   * @throws LeapException if the session cannot be opened
   */
  public static ManagedController create(LeapService service, DispatchSettings settings) throws LeapException {
    return new ManagedController(Controller.create(service, settings));
  }

  /**
   * Returns the wrapped controller.
   *
   * @return underlying controller
   */
  public Controller controller() {
    return controller;
  }

  /**
   * Adds an application listener to the wrapped controller.
   *
   * @param listener listener to add
   * @return {@code true} when registered
   * @see Controller#addListener(Listener)
   */
  public boolean addListener(Listener listener) {
    return controller.addListener(listener);
  }

  /**
   * Removes an application listener from the wrapped controller.
   *
   * @param listener listener to remove
   * @return {@code true} when it was registered
   * @see Controller#removeListener(Listener)
   */
  public boolean removeListener(Listener listener) {
    return controller.removeListener(listener);
  }

  /** Blocks until {@link #isServiceConnected()} is {@code true}. */
  public void waitUntilServiceConnected() throws InterruptedException {
    awaitLevel(state.serviceConnected, true);
  }

  /** Blocks until {@link #isServiceConnected()} is {@code false}. */
  public void waitUntilServiceDisconnected() throws InterruptedException {
    awaitLevel(state.serviceConnected, false);
  }

  /** Blocks until {@link #isConnected()} is {@code true}. */
  public void waitUntilDeviceConnected() throws InterruptedException {
    awaitLevel(state.deviceConnected, true);
  }

  /** Blocks until {@link #isConnected()} is {@code false}. */
  public void waitUntilDeviceDisconnected() throws InterruptedException {
    awaitLevel(state.deviceConnected, false);
  }

  /** Blocks until {@link #hasFocus()} is {@code true}. */
  public void waitUntilFocusGained() throws InterruptedException {
    awaitLevel(state.focus, true);
  }

  /** Blocks until {@link #hasFocus()} is {@code false}. */
  public void waitUntilFocusLost() throws InterruptedException {
    awaitLevel(state.focus, false);
  }

  /**
   * Blocks until the device configuration changes: a device is plugged in or removed, robust mode toggles, or the
   * image capture rate changes.
   */
  public void waitUntilDeviceChange() throws InterruptedException {
    awaitEdge(state.deviceChanges);
  }

  /** Blocks until new tracking data is available. */
  public void waitUntilFrame() throws InterruptedException {
    awaitEdge(state.frames);
  }

  /** Blocks until a new set of camera images is available. */
  public void waitUntilImages() throws InterruptedException {
    awaitEdge(state.images);
  }

  public boolean waitUntilServiceConnected(Duration timeout) throws InterruptedException {
    return awaitLevel(state.serviceConnected, true, timeout);
  }

  public boolean waitUntilServiceDisconnected(Duration timeout) throws InterruptedException {
    return awaitLevel(state.serviceConnected, false, timeout);
  }

  /**
   * Bounded variant of {@link #waitUntilDeviceConnected()}.
   *
   * @param timeout maximum time to wait
   * @return {@code true} if a device is connected, {@code false} if the timeout elapsed first
   * @throws InterruptedException if interrupted while waiting
   */
  public boolean waitUntilDeviceConnected(Duration timeout) throws InterruptedException {
    return awaitLevel(state.deviceConnected, true, timeout);
  }

  public boolean waitUntilDeviceDisconnected(Duration timeout) throws InterruptedException {
    return awaitLevel(state.deviceConnected, false, timeout);
  }

  public boolean waitUntilFocusGained(Duration timeout) throws InterruptedException {
    return awaitLevel(state.focus, true, timeout);
  }

  public boolean waitUntilFocusLost(Duration timeout) throws InterruptedException {
    return awaitLevel(state.focus, false, timeout);
  }

  public boolean waitUntilDeviceChange(Duration timeout) throws InterruptedException {
    return awaitEdge(state.deviceChanges, timeout);
  }

  /**
   * Bounded variant of {@link #waitUntilFrame()}.
   *
   * @param timeout maximum time to wait
   * @return {@code true} if a new frame arrived, {@code false} if the timeout elapsed first
   * @throws InterruptedException if interrupted while waiting
   */
  public boolean waitUntilFrame(Duration timeout) throws InterruptedException {
    return awaitEdge(state.frames, timeout);
  }

  public boolean waitUntilImages(Duration timeout) throws InterruptedException {
    return awaitEdge(state.images, timeout);
  }

  /**
   * Returns how many frame events this controller has observed.
   *
   * @return monotonic frame count
   */
  public long frameCount() {
    return state.frames.count();
  }

  public long imagesCount() {
    return state.images.count();
  }

  public long deviceChangeCount() {
    return state.deviceChanges.count();
  }

  @Override
  public boolean isServiceConnected() {
    return controller.isServiceConnected();
  }

  @Override
  public boolean isConnected() {
    return controller.isConnected();
  }

  @Override
  public boolean hasFocus() {
    return controller.hasFocus();
  }

  @Override
  public void setPolicy(Policy policy) {
    controller.setPolicy(policy);
  }

  @Override
  public void clearPolicy(Policy policy) {
    controller.clearPolicy(policy);
  }

  @Override
  public boolean isPolicySet(Policy policy) {
    return controller.isPolicySet(policy);
  }

  @Override
  public Timestamp now() {
    return controller.now();
  }

  @Override
  public Frame frame(int history) {
    return controller.frame(history);
  }

  @Override
  public ImageList images() {
    return controller.images();
  }

  @Override
  public void enableGesture(GestureType gesture) {
    controller.enableGesture(gesture);
  }

  @Override
  public void disableGesture(GestureType gesture) {
    controller.disableGesture(gesture);
  }

  @Override
  public boolean isGestureEnabled(GestureType gesture) {
    return controller.isGestureEnabled(gesture);
  }

  /**
   * Closes the wrapped controller. Threads blocked in untimed waits stay blocked; interrupt them or use the timed
   * variants when shutting down.
   */
  @Override
  public void close() {
    controller.close();
  }

  private static void awaitLevel(LevelCondition condition, boolean target) throws InterruptedException {
    log.debug("Waiting for {} == {}", condition.name(), target);
    condition.await(target);
    log.debug("Observed {} == {}", condition.name(), target);
  }

  private static boolean awaitLevel(LevelCondition condition, boolean target, Duration timeout)
      throws InterruptedException {
    requireTimeout(timeout);
    boolean reached = condition.await(target, timeout);
    log.debug("Wait for {} == {} within {} -> {}", condition.name(), target, timeout, reached);
    return reached;
  }

  private static void awaitEdge(EdgeCounter counter) throws InterruptedException {
    log.debug("Waiting for next {}", counter.name());
    counter.awaitNext();
    log.debug("Observed {}", counter.name());
  }

  private static boolean awaitEdge(EdgeCounter counter, Duration timeout) throws InterruptedException {
    requireTimeout(timeout);
    boolean advanced = counter.awaitNext(timeout);
    log.debug("Wait for next {} within {} -> {}", counter.name(), timeout, advanced);
    return advanced;
  }

  private static void requireTimeout(Duration timeout) {
    Objects.requireNonNull(timeout, "timeout");
    if (timeout.isNegative()) {
      throw new IllegalArgumentException("timeout must not be negative: " + timeout);
    }
  }
}
