package ca.gc.cra.leap.testutil;

import ca.gc.cra.leap.application.port.ProcessTerminator;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Terminator double that records requests instead of halting the JVM.
 */
public final class RecordingTerminator implements ProcessTerminator {
  private final List<Integer> statuses = new CopyOnWriteArrayList<>();
  private final List<Throwable> causes = new CopyOnWriteArrayList<>();

  @Override
  public void terminate(int status, Throwable cause) {
    statuses.add(status);
    causes.add(cause);
  }

  public List<Integer> statuses() {
    return List.copyOf(statuses);
  }

  public List<Throwable> causes() {
    return List.copyOf(causes);
  }

  public boolean invoked() {
    return !statuses.isEmpty();
  }
}
