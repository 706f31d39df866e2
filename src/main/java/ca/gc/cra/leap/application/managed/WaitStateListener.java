package ca.gc.cra.leap.application.managed;

import ca.gc.cra.leap.application.port.ControllerView;
import ca.gc.cra.leap.application.port.Listener;
import java.util.Objects;

/**
 * Internal listener feeding {@link WaitState}. Level events only signal; edge events count, then signal.
 * {@code onInit} and {@code onExit} keep the no-op defaults.
 */
final class WaitStateListener implements Listener {
  private final WaitState state;

  WaitStateListener(WaitState state) {
    this.state = Objects.requireNonNull(state, "state");
  }

  @Override
  public void onConnect(ControllerView controller) {
    state.deviceConnected.signal(true);
  }

  @Override
  public void onDisconnect(ControllerView controller) {
    state.deviceConnected.signal(false);
  }

  @Override
  public void onFrame(ControllerView controller) {
    state.frames.increment();
  }

  @Override
  public void onFocusGained(ControllerView controller) {
    state.focus.signal(true);
  }

  @Override
  public void onFocusLost(ControllerView controller) {
    state.focus.signal(false);
  }

  @Override
  public void onServiceConnect(ControllerView controller) {
    state.serviceConnected.signal(true);
  }

  @Override
  public void onServiceDisconnect(ControllerView controller) {
    state.serviceConnected.signal(false);
  }

  @Override
  public void onDeviceChange(ControllerView controller) {
    state.deviceChanges.increment();
  }

  @Override
  public void onImages(ControllerView controller) {
    state.images.increment();
  }
}
