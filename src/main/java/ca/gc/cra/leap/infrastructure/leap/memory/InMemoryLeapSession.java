package ca.gc.cra.leap.infrastructure.leap.memory;

import ca.gc.cra.leap.application.port.ControllerView;
import ca.gc.cra.leap.application.port.EventDispatcher;
import ca.gc.cra.leap.application.port.LeapSession;
import ca.gc.cra.leap.domain.Frame;
import ca.gc.cra.leap.domain.GestureType;
import ca.gc.cra.leap.domain.LeapEvent;
import ca.gc.cra.leap.domain.Policy;
import ca.gc.cra.leap.domain.Timestamp;
import ca.gc.cra.leap.domain.image.ImageList;
import ca.gc.cra.leap.infrastructure.exec.ExecutorFactories;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.EnumSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Simulated tracking session that raises events on its own delivery thread.
 * <p><strong>Why:</strong> Exercises controllers, listeners and waits end-to-end without a device or the native
 * shim, with the same threading shape as the real service.</p>
 * <p><strong>Role:</strong> In-memory adapter for the {@link LeapSession} port.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Deliver every event to all attached tokens, one at a time, on a single thread named
 *       {@code leap-event-source-N}.</li>
 *   <li>Apply the matching state change (connected, focus, latest frame) on that thread right before raising the
 *       event.</li>
 *   <li>Deliver {@code INIT} on attach and {@code EXIT} on detach, in order with the other events.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> All methods may be called from any thread. Simulation methods return a future
 * that completes once every listener has handled the event.</p>
 *
 * @since 0.1.0
 */
public final class InMemoryLeapSession implements LeapSession {
  private static final Logger log = LoggerFactory.getLogger(InMemoryLeapSession.class);
  private static final int HISTORY_CAPACITY = ControllerView.MAX_FRAME_HISTORY + 1;
  private static final long CLOSE_TIMEOUT_SECONDS = 5L;

  private final EventDispatcher dispatcher;
  private final ExecutorService deliveries;
  private final Set<Long> attached = new LinkedHashSet<>();
  private final Deque<Frame> history = new ArrayDeque<>(HISTORY_CAPACITY);
  private final Set<Policy> policies = EnumSet.noneOf(Policy.class);
  private final Set<GestureType> gestures = EnumSet.noneOf(GestureType.class);
  private final AtomicLong clockMicros = new AtomicLong();

  private volatile Thread deliveryThread;
  private volatile boolean acceptListeners;
  private volatile boolean serviceConnected;
  private volatile boolean connected;
  private volatile boolean focus;
  private volatile ImageList images = ImageList.empty();
  private volatile boolean closed;

  InMemoryLeapSession(EventDispatcher dispatcher, boolean acceptListeners) {
    this.dispatcher = Objects.requireNonNull(dispatcher, "dispatcher");
    this.acceptListeners = acceptListeners;
    this.deliveries = ExecutorFactories.newEventSourceExecutor(
        "leap-event-source",
        (thread, ex) -> log.error("Delivery thread {} died", thread.getName(), ex));
  }

  /**
   * Controls whether later {@link #attach(long)} calls succeed.
   *
   * @param accept {@code false} to make the service reject registrations
   */
  public void setAcceptListeners(boolean accept) {
    this.acceptListeners = accept;
  }

  /**
   * Returns the tokens currently attached, in attach order.
   *
   * @return snapshot of attached tokens
   */
  public synchronized List<Long> attachedTokens() {
    return List.copyOf(attached);
  }

  /**
   * Marks the service connection up and raises {@code SERVICE_CONNECT}.
   *
   * @return completion of the delivery
   */
  public CompletableFuture<Void> connectService() {
    return raise(LeapEvent.SERVICE_CONNECT, () -> serviceConnected = true);
  }

  public CompletableFuture<Void> disconnectService() {
    return raise(LeapEvent.SERVICE_DISCONNECT, () -> serviceConnected = false);
  }

  /**
   * Marks a device plugged in and raises {@code CONNECT}.
   *
   * @return completion of the delivery
   */
  public CompletableFuture<Void> connectDevice() {
    return raise(LeapEvent.CONNECT, () -> connected = true);
  }

  public CompletableFuture<Void> disconnectDevice() {
    return raise(LeapEvent.DISCONNECT, () -> connected = false);
  }

  public CompletableFuture<Void> gainFocus() {
    return raise(LeapEvent.FOCUS_GAINED, () -> focus = true);
  }

  public CompletableFuture<Void> loseFocus() {
    return raise(LeapEvent.FOCUS_LOST, () -> focus = false);
  }

  /**
   * Raises {@code DEVICE_CHANGE} without altering connection state.
   *
   * @return completion of the delivery
   */
  public CompletableFuture<Void> changeDevice() {
    return raise(LeapEvent.DEVICE_CHANGE, () -> {});
  }

  /**
   * Makes {@code frame} the most recent frame and raises {@code FRAME}.
   *
   * @param frame frame to publish
   * @return completion of the delivery
   */
  public CompletableFuture<Void> publishFrame(Frame frame) {
    Objects.requireNonNull(frame, "frame");
    return raise(LeapEvent.FRAME, () -> {
      synchronized (history) {
        if (history.size() == HISTORY_CAPACITY) {
          history.removeLast();
        }
        history.addFirst(frame);
      }
      clockMicros.accumulateAndGet(frame.timestamp().micros(), Math::max);
    });
  }

  /**
   * Makes {@code list} the current image set and raises {@code IMAGES}.
   *
   * @param list images to publish
   * @return completion of the delivery
   */
  public CompletableFuture<Void> publishImages(ImageList list) {
    Objects.requireNonNull(list, "list");
    return raise(LeapEvent.IMAGES, () -> images = list);
  }

  /**
   * Raises an arbitrary event to every attached token without touching session state.
   *
   * @param event event to raise
   * @return completion of the delivery
   */
  public CompletableFuture<Void> fire(LeapEvent event) {
    Objects.requireNonNull(event, "event");
    return raise(event, () -> {});
  }

  /**
   * Sets the service clock reading returned by {@link #now()}.
   *
   * @param micros clock value in microseconds
   */
  public void setClock(long micros) {
    clockMicros.set(micros);
  }

  @Override
  public boolean attach(long token) {
    if (closed || !acceptListeners) {
      return false;
    }
    synchronized (this) {
      if (!attached.add(token)) {
        return false;
      }
    }
    submit(() -> dispatcher.dispatch(token, LeapEvent.INIT));
    return true;
  }

  @Override
  public boolean detach(long token) {
    synchronized (this) {
      if (!attached.contains(token)) {
        return false;
      }
    }
    Runnable exit = () -> {
      boolean removed;
      synchronized (this) {
        removed = attached.remove(token);
      }
      if (removed) {
        dispatcher.dispatch(token, LeapEvent.EXIT);
      }
    };
    if (Thread.currentThread() == deliveryThread) {
      exit.run();
      return true;
    }
    Future<?> done = submit(exit);
    if (done != null) {
      awaitQuietly(done);
    }
    return true;
  }

  @Override
  public boolean isServiceConnected() {
    return serviceConnected;
  }

  @Override
  public boolean isConnected() {
    return connected;
  }

  @Override
  public boolean hasFocus() {
    return focus;
  }

  @Override
  public void setPolicy(Policy policy) {
    synchronized (policies) {
      policies.add(policy);
    }
  }

  @Override
  public void clearPolicy(Policy policy) {
    synchronized (policies) {
      policies.remove(policy);
    }
  }

  @Override
  public boolean isPolicySet(Policy policy) {
    synchronized (policies) {
      return policies.contains(policy);
    }
  }

  @Override
  public Timestamp now() {
    return new Timestamp(clockMicros.get());
  }

  @Override
  public Frame frame(int history) {
    if (history < 0) {
      return Frame.invalid();
    }
    synchronized (this.history) {
      if (history >= this.history.size()) {
        return Frame.invalid();
      }
      int index = 0;
      for (Frame frame : this.history) {
        if (index++ == history) {
          return frame;
        }
      }
    }
    return Frame.invalid();
  }

  @Override
  public ImageList images() {
    return images;
  }

  @Override
  public void enableGesture(GestureType gesture) {
    synchronized (gestures) {
      gestures.add(gesture);
    }
  }

  @Override
  public void disableGesture(GestureType gesture) {
    synchronized (gestures) {
      gestures.remove(gesture);
    }
  }

  @Override
  public boolean isGestureEnabled(GestureType gesture) {
    synchronized (gestures) {
      return gestures.contains(gesture);
    }
  }

  /**
   * Returns whether {@link #close()} has been called.
   *
   * @return {@code true} once closed
   */
  public boolean isClosed() {
    return closed;
  }

  @Override
  public void close() {
    if (closed) {
      return;
    }
    closed = true;
    deliveries.shutdown();
    try {
      if (!deliveries.awaitTermination(CLOSE_TIMEOUT_SECONDS, TimeUnit.SECONDS)) {
        log.warn("Delivery thread did not drain within {}s; abandoning pending events", CLOSE_TIMEOUT_SECONDS);
        deliveries.shutdownNow();
      }
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      deliveries.shutdownNow();
    }
  }

  private CompletableFuture<Void> raise(LeapEvent event, Runnable stateChange) {
    CompletableFuture<Void> delivered = new CompletableFuture<>();
    Future<?> submitted = submit(() -> {
      try {
        stateChange.run();
        List<Long> targets;
        synchronized (this) {
          targets = new ArrayList<>(attached);
        }
        for (long token : targets) {
          dispatcher.dispatch(token, event);
        }
        delivered.complete(null);
      } catch (RuntimeException | Error ex) {
        delivered.completeExceptionally(ex);
        throw ex;
      }
    });
    if (submitted == null) {
      delivered.completeExceptionally(new IllegalStateException("session closed"));
    }
    return delivered;
  }

  private Future<?> submit(Runnable task) {
    try {
      return deliveries.submit(() -> {
        deliveryThread = Thread.currentThread();
        task.run();
      });
    } catch (RejectedExecutionException ex) {
      log.debug("Session closed; dropping delivery", ex);
      return null;
    }
  }

  private static void awaitQuietly(Future<?> future) {
    try {
      future.get();
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      log.warn("Interrupted while waiting for detach to complete");
    } catch (ExecutionException ex) {
      throw new IllegalStateException("detach delivery failed", ex.getCause());
    }
  }
}
