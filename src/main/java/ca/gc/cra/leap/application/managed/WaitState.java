package ca.gc.cra.leap.application.managed;

import ca.gc.cra.leap.application.port.ControllerView;
import java.util.Objects;

/**
 * Wait conditions shared by a {@link ManagedController} and its internal listener.
 *
 * <p>Each condition family has its own lock, so a frame burst never wakes threads waiting for focus.</p>
 */
final class WaitState {
  final LevelCondition serviceConnected;
  final LevelCondition deviceConnected;
  final LevelCondition focus;

  final EdgeCounter frames = new EdgeCounter("frame");
  final EdgeCounter images = new EdgeCounter("images");
  final EdgeCounter deviceChanges = new EdgeCounter("deviceChange");

  WaitState(ControllerView view) {
    Objects.requireNonNull(view, "view");
    this.serviceConnected = new LevelCondition("serviceConnected", view::isServiceConnected);
    this.deviceConnected = new LevelCondition("deviceConnected", view::isConnected);
    this.focus = new LevelCondition("focus", view::hasFocus);
  }
}
