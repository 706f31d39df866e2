package ca.gc.cra.leap.testutil;

import ca.gc.cra.leap.application.port.ControllerView;
import ca.gc.cra.leap.application.port.Listener;
import ca.gc.cra.leap.domain.LeapEvent;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Listener double that records every hook invocation along with the delivering thread.
 */
public class RecordingListener implements Listener {
  private final List<LeapEvent> events = new CopyOnWriteArrayList<>();
  private final List<String> threads = new CopyOnWriteArrayList<>();

  /** Called after each hook is recorded; override to inject behaviour. */
  protected void after(LeapEvent event, ControllerView controller) {}

  private void record(LeapEvent event, ControllerView controller) {
    events.add(event);
    threads.add(Thread.currentThread().getName());
    after(event, controller);
  }

  public List<LeapEvent> events() {
    return new ArrayList<>(events);
  }

  public List<String> threads() {
    return new ArrayList<>(threads);
  }

  public long count(LeapEvent event) {
    return events.stream().filter(e -> e == event).count();
  }

  @Override
  public void onInit(ControllerView controller) {
    record(LeapEvent.INIT, controller);
  }

  @Override
  public void onConnect(ControllerView controller) {
    record(LeapEvent.CONNECT, controller);
  }

  @Override
  public void onDisconnect(ControllerView controller) {
    record(LeapEvent.DISCONNECT, controller);
  }

  @Override
  public void onExit(ControllerView controller) {
    record(LeapEvent.EXIT, controller);
  }

  @Override
  public void onFrame(ControllerView controller) {
    record(LeapEvent.FRAME, controller);
  }

  @Override
  public void onFocusGained(ControllerView controller) {
    record(LeapEvent.FOCUS_GAINED, controller);
  }

  @Override
  public void onFocusLost(ControllerView controller) {
    record(LeapEvent.FOCUS_LOST, controller);
  }

  @Override
  public void onServiceConnect(ControllerView controller) {
    record(LeapEvent.SERVICE_CONNECT, controller);
  }

  @Override
  public void onServiceDisconnect(ControllerView controller) {
    record(LeapEvent.SERVICE_DISCONNECT, controller);
  }

  @Override
  public void onDeviceChange(ControllerView controller) {
    record(LeapEvent.DEVICE_CHANGE, controller);
  }

  @Override
  public void onImages(ControllerView controller) {
    record(LeapEvent.IMAGES, controller);
  }
}
