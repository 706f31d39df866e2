package ca.gc.cra.leap.application;

import ca.gc.cra.leap.application.port.ControllerView;
import ca.gc.cra.leap.application.port.LeapException;
import ca.gc.cra.leap.application.port.LeapService;
import ca.gc.cra.leap.application.port.LeapSession;
import ca.gc.cra.leap.application.port.Listener;
import ca.gc.cra.leap.domain.Frame;
import ca.gc.cra.leap.domain.GestureType;
import ca.gc.cra.leap.domain.LeapEvent;
import ca.gc.cra.leap.domain.Policy;
import ca.gc.cra.leap.domain.Timestamp;
import ca.gc.cra.leap.domain.image.ImageList;
import ca.gc.cra.leap.infrastructure.leap.libleap.JnrLeapService;
import java.util.ArrayList;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> A connection to the tracking service plus the listeners registered on it.
 * <p><strong>Why:</strong> Owns the session so that its lifetime is tied to one object, and keeps the book-keeping
 * that lets listeners be added, removed and told to exit exactly once.</p>
 * <p><strong>Role:</strong> Main entry point of the library. {@code ManagedController} adds blocking waits on
 * top.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Open the session and wire it to a private {@link DispatchBridge}.</li>
 *   <li>Register and remove listeners by identity.</li>
 *   <li>Answer {@link ControllerView} queries until closed.</li>
 *   <li>On close, deliver {@code onExit} to every listener before releasing the session.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Queries are safe from any thread. Listener management and {@link #close()} are
 * serialized on this instance. Hooks must not add or remove listeners on the same controller; they may call the
 * queries and {@link #listenerCount()}.</p>
 *
 * @since 0.1.0
 */
public final class Controller implements ControllerView, AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(Controller.class);

  private final DispatchBridge bridge;
  private final LeapSession session;
  private final Map<Listener, ListenerRegistration> registrations = new IdentityHashMap<>();

  private volatile int listenerCount;
  private boolean closing;
  private volatile boolean closed;

  private Controller(DispatchBridge bridge, LeapService service) throws LeapException {
    this.bridge = bridge;
    this.session = Objects.requireNonNull(service.open(bridge), "session");
  }

  /**
   * Opens a controller against the native tracking service.
   *
   * @return unconnected controller; the connection proceeds in the background
   * @throws LeapException if the native shim cannot be loaded or refuses to create a session
   */
  public static Controller create() throws LeapException {
    return create(new JnrLeapService());
  }

  /**
   * Opens a controller against the supplied service with default dispatch settings.
   *
   * @param service event-source factory
   * @return unconnected controller
   * @throws LeapException if the session cannot be opened
   */
  public static Controller create(LeapService service) throws LeapException {
    return create(service, DispatchSettings.defaults());
  }

  /**
   * Opens a controller against the supplied service.
   *
   * @param service event-source factory
   * @param settings dispatch metrics and failure policy
   * @return unconnected controller
   * @throws LeapException if the session cannot be opened
   */
  public static Controller create(LeapService service, DispatchSettings settings) throws LeapException {
    Objects.requireNonNull(service, "service");
    Controller controller = new Controller(new DispatchBridge(settings), service);
    log.info("Opened tracking session via {}", service.getClass().getSimpleName());
    return controller;
  }

  /**
   * Adds a listener. On success the listener receives {@code onInit} before any other hook.
   *
   * <p>Each listener instance may be registered at most once; a second add of the same instance is rejected.</p>
   *
   * @param listener listener to register
   * @return {@code true} when registered; {@code false} when the service rejected it or it is already registered,
   *     in which case the listener is not retained and receives no calls
   * @throws IllegalStateException if the controller is closing or closed
   */
  public synchronized boolean addListener(Listener listener) {
    Objects.requireNonNull(listener, "listener");
    ensureAcceptingListeners();
    if (registrations.containsKey(listener)) {
      log.warn("Listener {} is already registered; ignoring duplicate add", describe(listener));
      return false;
    }

    ListenerRegistration registration = new ListenerRegistration(bridge.nextToken(), listener, this);
    bridge.register(registration);
    if (!session.attach(registration.token())) {
      bridge.unregister(registration);
      log.warn("Tracking service rejected listener {}", describe(listener));
      return false;
    }
    registrations.put(listener, registration);
    listenerCount = registrations.size();
    log.debug("Registered listener {} with token {}", describe(listener), registration.token());
    return true;
  }

  /**
   * Removes a listener. The listener receives {@code onExit} exactly once and nothing afterwards.
   *
   * @param listener previously added listener
   * @return {@code true} when the listener was registered
   */
  public synchronized boolean removeListener(Listener listener) {
    Objects.requireNonNull(listener, "listener");
    ListenerRegistration registration = registrations.remove(listener);
    if (registration == null) {
      return false;
    }
    listenerCount = registrations.size();
    registration.markClosing();
    detachAndExit(registration);
    return true;
  }

  /**
   * Returns the number of registered listeners, including internal ones. Does not block, so hooks may call it.
   *
   * @return listener count
   */
  public int listenerCount() {
    return listenerCount;
  }

  @Override
  public boolean isServiceConnected() {
    ensureOpen();
    return session.isServiceConnected();
  }

  @Override
  public boolean isConnected() {
    ensureOpen();
    return session.isConnected();
  }

  @Override
  public boolean hasFocus() {
    ensureOpen();
    return session.hasFocus();
  }

  @Override
  public void setPolicy(Policy policy) {
    Objects.requireNonNull(policy, "policy");
    ensureOpen();
    session.setPolicy(policy);
  }

  @Override
  public void clearPolicy(Policy policy) {
    Objects.requireNonNull(policy, "policy");
    ensureOpen();
    session.clearPolicy(policy);
  }

  @Override
  public boolean isPolicySet(Policy policy) {
    Objects.requireNonNull(policy, "policy");
    ensureOpen();
    return session.isPolicySet(policy);
  }

  @Override
  public Timestamp now() {
    ensureOpen();
    return session.now();
  }

  @Override
  public Frame frame(int history) {
    ensureOpen();
    if (history < 0 || history > MAX_FRAME_HISTORY) {
      return Frame.invalid();
    }
    return session.frame(history);
  }

  @Override
  public ImageList images() {
    ensureOpen();
    return session.images();
  }

  @Override
  public void enableGesture(GestureType gesture) {
    Objects.requireNonNull(gesture, "gesture");
    ensureOpen();
    session.enableGesture(gesture);
  }

  @Override
  public void disableGesture(GestureType gesture) {
    Objects.requireNonNull(gesture, "gesture");
    ensureOpen();
    session.disableGesture(gesture);
  }

  @Override
  public boolean isGestureEnabled(GestureType gesture) {
    Objects.requireNonNull(gesture, "gesture");
    ensureOpen();
    return session.isGestureEnabled(gesture);
  }

  /**
   * Returns whether {@link #close()} has completed.
   *
   * @return {@code true} once the session is released
   */
  public boolean isClosed() {
    return closed;
  }

  /**
   * Delivers {@code onExit} to every listener, then releases the session. Idempotent.
   *
   * <p>Once close starts, no listener receives any hook other than its pending {@code onInit} and its
   * {@code onExit}, even if the source keeps raising events while the listeners are detached one by one.</p>
   */
  @Override
  public synchronized void close() {
    if (closing) {
      return;
    }
    closing = true;
    List<ListenerRegistration> remaining = new ArrayList<>(registrations.values());
    registrations.clear();
    listenerCount = 0;
    // listeners detached later in the loop must not see events raised meanwhile
    for (ListenerRegistration registration : remaining) {
      registration.markClosing();
    }
    for (ListenerRegistration registration : remaining) {
      detachAndExit(registration);
    }
    try {
      session.close();
    } finally {
      closed = true;
      log.info("Closed tracking session after notifying {} listener(s)", remaining.size());
    }
  }

  private void detachAndExit(ListenerRegistration registration) {
    session.detach(registration.token());
    if (!registration.isTerminal()) {
      // source did not deliver EXIT during detach
      bridge.dispatch(registration.token(), LeapEvent.EXIT);
    }
    bridge.unregister(registration);
  }

  private void ensureAcceptingListeners() {
    if (closing) {
      throw new IllegalStateException("controller closed");
    }
  }

  private void ensureOpen() {
    if (closed) {
      throw new IllegalStateException("controller closed");
    }
  }

  private static String describe(Listener listener) {
    return listener.getClass().getName() + '@' + Integer.toHexString(System.identityHashCode(listener));
  }
}
