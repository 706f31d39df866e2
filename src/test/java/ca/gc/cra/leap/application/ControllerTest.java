package ca.gc.cra.leap.application;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTimeoutPreemptively;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.leap.application.port.ControllerView;
import ca.gc.cra.leap.domain.Frame;
import ca.gc.cra.leap.domain.GestureType;
import ca.gc.cra.leap.domain.LeapEvent;
import ca.gc.cra.leap.domain.Policy;
import ca.gc.cra.leap.domain.Timestamp;
import ca.gc.cra.leap.infrastructure.leap.memory.InMemoryLeapService;
import ca.gc.cra.leap.infrastructure.leap.memory.InMemoryLeapSession;
import ca.gc.cra.leap.testutil.LogCapture;
import ca.gc.cra.leap.testutil.RecordingListener;
import ca.gc.cra.leap.testutil.RecordingMetricsPort;
import ca.gc.cra.leap.testutil.RecordingTerminator;
import ch.qos.logback.classic.Level;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class ControllerTest {
  private InMemoryLeapService service;
  private RecordingTerminator terminator;
  private RecordingMetricsPort metrics;
  private Controller controller;

  @BeforeEach
  void setUp() throws Exception {
    service = new InMemoryLeapService();
    terminator = new RecordingTerminator();
    metrics = new RecordingMetricsPort();
    controller = Controller.create(
        service, new DispatchSettings(metrics, terminator, 134, DispatchSettings.DEFAULT_METRIC_PREFIX));
  }

  @AfterEach
  void tearDown() {
    controller.close();
  }

  private InMemoryLeapSession session() {
    return service.lastSession();
  }

  private static void await(CompletableFuture<Void> delivery) throws Exception {
    delivery.get(5, TimeUnit.SECONDS);
  }

  private static Frame frame(long id) {
    return new Frame(id, new Timestamp(id * 1_000L), 110f, true);
  }

  @Test
  void scenarioDeliversHooksInSourceOrderThenExitOnClose() throws Exception {
    RecordingListener listener = new RecordingListener();
    assertTrue(controller.addListener(listener));

    await(session().connectService());
    await(session().connectDevice());
    await(session().gainFocus());
    await(session().publishFrame(frame(1)));
    await(session().publishFrame(frame(2)));
    await(session().publishFrame(frame(3)));
    await(session().loseFocus());
    await(session().disconnectDevice());
    controller.close();

    assertEquals(List.of(
        LeapEvent.INIT,
        LeapEvent.SERVICE_CONNECT,
        LeapEvent.CONNECT,
        LeapEvent.FOCUS_GAINED,
        LeapEvent.FRAME,
        LeapEvent.FRAME,
        LeapEvent.FRAME,
        LeapEvent.FOCUS_LOST,
        LeapEvent.DISCONNECT,
        LeapEvent.EXIT), listener.events());
    assertTrue(listener.threads().stream().allMatch(name -> name.startsWith("leap-event-source-")),
        "hooks run on the event-source thread: " + listener.threads());
    assertEquals(3, metrics.count("leap.dispatch.frame"));
  }

  @Test
  void stateIsUpdatedBeforeTheEventIsRaised() throws Exception {
    List<Boolean> seen = new CopyOnWriteArrayList<>();
    controller.addListener(new RecordingListener() {
      @Override
      protected void after(LeapEvent event, ControllerView view) {
        if (event == LeapEvent.CONNECT || event == LeapEvent.DISCONNECT) {
          seen.add(view.isConnected());
        }
        if (event == LeapEvent.FRAME) {
          seen.add(view.frame().id() == 9L);
        }
      }
    });

    await(session().connectDevice());
    await(session().publishFrame(frame(9)));
    await(session().disconnectDevice());

    assertEquals(List.of(true, true, false), seen);
  }

  @Test
  void closeDeliversExactlyOneExitToEveryListenerAndBlocksLaterQueries() throws Exception {
    RecordingListener first = new RecordingListener();
    RecordingListener second = new RecordingListener();
    controller.addListener(first);
    controller.addListener(second);
    await(session().publishFrame(frame(1)));

    controller.close();
    controller.close();

    assertEquals(List.of(LeapEvent.INIT, LeapEvent.FRAME, LeapEvent.EXIT), first.events());
    assertEquals(List.of(LeapEvent.INIT, LeapEvent.FRAME, LeapEvent.EXIT), second.events());
    assertTrue(controller.isClosed());
    assertTrue(session().isClosed());
    assertEquals(0, controller.listenerCount());
    IllegalStateException ex = assertThrows(IllegalStateException.class, controller::isConnected);
    assertEquals("controller closed", ex.getMessage());
    assertThrows(IllegalStateException.class, () -> controller.frame(0));
    assertThrows(IllegalStateException.class, () -> controller.addListener(new RecordingListener()));
  }

  @Test
  void noHookButExitRunsOnceCloseBegins() throws Exception {
    RecordingListener first = new FramePublishingOnExit();
    RecordingListener second = new FramePublishingOnExit();
    assertTrue(controller.addListener(first));
    assertTrue(controller.addListener(second));
    await(session().connectDevice());

    controller.close();

    assertEquals(List.of(LeapEvent.INIT, LeapEvent.CONNECT, LeapEvent.EXIT), first.events());
    assertEquals(List.of(LeapEvent.INIT, LeapEvent.CONNECT, LeapEvent.EXIT), second.events());
    assertEquals(0, metrics.count(DispatchSettings.DEFAULT_METRIC_PREFIX + ".frame"));
  }

  @Test
  void hooksMayReadListenerCountWhileClosing() throws Exception {
    AtomicInteger seenOnExit = new AtomicInteger(-1);
    RecordingListener listener = new RecordingListener() {
      @Override
      protected void after(LeapEvent event, ControllerView view) {
        if (event == LeapEvent.EXIT) {
          seenOnExit.set(controller.listenerCount());
        }
      }
    };
    assertTrue(controller.addListener(listener));
    await(session().connectService());
    assertEquals(1, controller.listenerCount());

    assertTimeoutPreemptively(Duration.ofSeconds(10), () -> controller.close());

    assertEquals(0, seenOnExit.get());
    assertEquals(List.of(LeapEvent.INIT, LeapEvent.SERVICE_CONNECT, LeapEvent.EXIT), listener.events());
  }

  /** Makes the source raise a frame from inside its exit hook, i.e. while the controller is still closing. */
  private final class FramePublishingOnExit extends RecordingListener {
    @Override
    protected void after(LeapEvent event, ControllerView view) {
      if (event == LeapEvent.EXIT) {
        session().publishFrame(frame(99));
      }
    }
  }

  @Test
  void exitHookMayStillQueryTheController() throws Exception {
    List<Boolean> seen = new CopyOnWriteArrayList<>();
    controller.addListener(new RecordingListener() {
      @Override
      protected void after(LeapEvent event, ControllerView view) {
        if (event == LeapEvent.EXIT) {
          seen.add(view.isServiceConnected());
        }
      }
    });
    await(session().connectService());

    controller.close();

    assertEquals(List.of(true), seen);
  }

  @Test
  void frameHistoryIsBoundedToFiftyNine() throws Exception {
    for (long id = 1; id <= 61; id++) {
      await(session().publishFrame(frame(id)));
    }

    assertEquals(61L, controller.frame().id());
    assertEquals(61L, controller.frame(0).id());
    assertEquals(2L, controller.frame(59).id());
    assertTrue(controller.frame(59).valid());
    assertFalse(controller.frame(60).valid());
    assertEquals(Frame.invalid(), controller.frame(60));
    assertEquals(Frame.invalid(), controller.frame(-1));
  }

  @Test
  void framesBeyondRecordedHistoryAreInvalid() throws Exception {
    await(session().publishFrame(frame(1)));

    assertTrue(controller.frame(0).valid());
    assertFalse(controller.frame(1).valid());
  }

  @Test
  void rejectedRegistrationNeverSeesInit() throws Exception {
    session().setAcceptListeners(false);
    RecordingListener listener = new RecordingListener();

    try (LogCapture logs = LogCapture.attach(Controller.class)) {
      assertFalse(controller.addListener(listener));
      assertEquals(1, logs.messages(Level.WARN).size());
    }
    await(session().publishFrame(frame(1)));
    controller.close();

    assertTrue(listener.events().isEmpty());
    assertEquals(0, controller.listenerCount());
  }

  @Test
  void addingTheSameListenerTwiceIsRejected() throws Exception {
    RecordingListener listener = new RecordingListener();

    assertTrue(controller.addListener(listener));
    assertFalse(controller.addListener(listener));
    await(session().publishFrame(frame(1)));

    assertEquals(1, controller.listenerCount());
    assertEquals(List.of(LeapEvent.INIT, LeapEvent.FRAME), listener.events());
  }

  @Test
  void removeListenerDeliversExitOnceAndStopsDelivery() throws Exception {
    RecordingListener removed = new RecordingListener();
    RecordingListener kept = new RecordingListener();
    controller.addListener(removed);
    controller.addListener(kept);

    assertTrue(controller.removeListener(removed));
    assertFalse(controller.removeListener(removed));
    await(session().publishFrame(frame(1)));

    assertEquals(List.of(LeapEvent.INIT, LeapEvent.EXIT), removed.events());
    assertEquals(List.of(LeapEvent.INIT, LeapEvent.FRAME), kept.events());
  }

  @Test
  void failingListenerTriggersTerminationAndReceivesNothingFurther() throws Exception {
    RecordingListener failing = new RecordingListener() {
      @Override
      protected void after(LeapEvent event, ControllerView view) {
        if (event == LeapEvent.FRAME) {
          throw new IllegalStateException("listener bug");
        }
      }
    };
    RecordingListener healthy = new RecordingListener();
    controller.addListener(failing);
    controller.addListener(healthy);

    await(session().publishFrame(frame(1)));
    await(session().publishFrame(frame(2)));
    controller.close();

    assertEquals(List.of(134), terminator.statuses());
    assertEquals(List.of(LeapEvent.INIT, LeapEvent.FRAME), failing.events());
    assertEquals(
        List.of(LeapEvent.INIT, LeapEvent.FRAME, LeapEvent.FRAME, LeapEvent.EXIT), healthy.events());
  }

  @Test
  void policiesAndGesturesPassThroughToTheSession() {
    controller.setPolicy(Policy.IMAGES);
    controller.enableGesture(GestureType.CIRCLE);

    assertTrue(controller.isPolicySet(Policy.IMAGES));
    assertFalse(controller.isPolicySet(Policy.BACKGROUND_FRAMES));
    assertTrue(controller.isGestureEnabled(GestureType.CIRCLE));

    controller.clearPolicy(Policy.IMAGES);
    controller.disableGesture(GestureType.CIRCLE);

    assertFalse(controller.isPolicySet(Policy.IMAGES));
    assertFalse(controller.isGestureEnabled(GestureType.CIRCLE));
  }

  @Test
  void nowReportsTheServiceClock() {
    session().setClock(123_456L);

    assertEquals(new Timestamp(123_456L), controller.now());
  }

  @Test
  void nullListenerIsRejected() {
    assertThrows(NullPointerException.class, () -> controller.addListener(null));
  }
}
