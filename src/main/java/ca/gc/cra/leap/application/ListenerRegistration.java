package ca.gc.cra.leap.application;

import ca.gc.cra.leap.application.port.ControllerView;
import ca.gc.cra.leap.application.port.Listener;
import ca.gc.cra.leap.domain.LeapEvent;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Pairs a listener with the correlation token the event source uses to address it.
 *
 * <p>The token is never reused, so a late callback can only ever resolve to the listener it was raised for. The
 * delivery state is lock-free; the event source serializes deliveries for one token, and the only concurrent writer
 * is a controller synthesizing {@code EXIT} during teardown.</p>
 */
final class ListenerRegistration {
  enum State {
    ATTACHED,
    ACTIVE,
    EXITED,
    FAILED
  }

  private final long token;
  private final Listener listener;
  private final ControllerView view;
  private final AtomicReference<State> state = new AtomicReference<>(State.ATTACHED);
  private volatile boolean closing;

  ListenerRegistration(long token, Listener listener, ControllerView view) {
    this.token = token;
    this.listener = Objects.requireNonNull(listener, "listener");
    this.view = Objects.requireNonNull(view, "view");
  }

  long token() {
    return token;
  }

  Listener listener() {
    return listener;
  }

  ControllerView view() {
    return view;
  }

  State state() {
    return state.get();
  }

  boolean isTerminal() {
    State current = state.get();
    return current == State.EXITED || current == State.FAILED;
  }

  /**
   * Claims the right to deliver {@code event}.
   *
   * @return {@code false} when the event must be dropped: a repeated {@code INIT}, anything after exit or failure,
   *     or anything other than {@code INIT} and {@code EXIT} once closing
   */
  boolean begin(LeapEvent event) {
    while (true) {
      State current = state.get();
      if (current == State.EXITED || current == State.FAILED) {
        return false;
      }
      State next;
      if (event == LeapEvent.INIT) {
        if (current != State.ATTACHED) {
          return false;
        }
        next = State.ACTIVE;
      } else if (event == LeapEvent.EXIT) {
        next = State.EXITED;
      } else {
        return !closing;
      }
      if (state.compareAndSet(current, next)) {
        return true;
      }
    }
  }

  /** Stops delivery of everything but the pending {@code INIT} and the final {@code EXIT}. */
  void markClosing() {
    closing = true;
  }

  void markFailed() {
    state.set(State.FAILED);
  }
}
