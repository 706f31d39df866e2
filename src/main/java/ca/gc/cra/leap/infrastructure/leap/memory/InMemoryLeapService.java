package ca.gc.cra.leap.infrastructure.leap.memory;

import ca.gc.cra.leap.application.port.EventDispatcher;
import ca.gc.cra.leap.application.port.LeapService;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * In-memory {@link LeapService} whose sessions are driven by test or demo code instead of a device.
 *
 * <p>Each {@link #open(EventDispatcher)} call creates a fresh {@link InMemoryLeapSession} with its own delivery
 * thread.</p>
 *
 * @since 0.1.0
 */
public final class InMemoryLeapService implements LeapService {
  private final List<InMemoryLeapSession> sessions = new CopyOnWriteArrayList<>();
  private volatile boolean acceptListeners = true;

  @Override
  public InMemoryLeapSession open(EventDispatcher dispatcher) {
    Objects.requireNonNull(dispatcher, "dispatcher");
    InMemoryLeapSession session = new InMemoryLeapSession(dispatcher, acceptListeners);
    sessions.add(session);
    return session;
  }

  /**
   * Makes sessions opened after this call reject (or accept) listener registrations.
   *
   * @param accept {@code false} to reject
   */
  public void setAcceptListeners(boolean accept) {
    this.acceptListeners = accept;
  }

  /**
   * Returns the most recently opened session.
   *
   * @return latest session
   * @throws IllegalStateException if no session was opened yet
   */
  public InMemoryLeapSession lastSession() {
    if (sessions.isEmpty()) {
      throw new IllegalStateException("no session opened");
    }
    return sessions.get(sessions.size() - 1);
  }

  public List<InMemoryLeapSession> sessions() {
    return List.copyOf(sessions);
  }
}
