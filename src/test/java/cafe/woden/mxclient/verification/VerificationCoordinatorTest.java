package cafe.woden.mxclient.verification;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

import cafe.woden.mxclient.bus.MatrixEvent;
import cafe.woden.mxclient.bus.MatrixEventBus;
import cafe.woden.mxclient.config.MatrixProperties;
import cafe.woden.mxclient.model.TransientException;
import cafe.woden.mxclient.model.ValidationException;
import cafe.woden.mxclient.model.VerificationEmoji;
import cafe.woden.mxclient.model.VerificationFlow;
import cafe.woden.mxclient.model.VerificationState;
import io.reactivex.rxjava3.schedulers.Schedulers;
import io.reactivex.rxjava3.schedulers.TestScheduler;
import io.reactivex.rxjava3.subscribers.TestSubscriber;
import java.util.List;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.Test;

class VerificationCoordinatorTest {

  private final MatrixEventBus bus = new MatrixEventBus(Schedulers.trampoline());
  private final VerificationHandshake handshake = mock(VerificationHandshake.class);
  private final TestScheduler scheduler = new TestScheduler();
  private final VerificationCoordinator coordinator =
      new VerificationCoordinator(bus, handshake, MatrixProperties.defaults(), scheduler);

  private static final List<VerificationEmoji> EMOJIS =
      List.of(new VerificationEmoji("🐶", "Dog"), new VerificationEmoji("🔑", "Key"));

  private void request(String flowId) {
    coordinator.onSignal(
        new VerificationSignal.Requested(flowId, "@bob:example.org", "BOBDEV", false));
  }

  private VerificationState state() {
    return coordinator.activeFlow().orElseThrow().state();
  }

  @Test
  void happyPathReachesDoneOnlyAfterBothSidesConfirm() {
    request("f1");
    assertEquals(VerificationState.REQUESTED, state());

    coordinator.accept("f1");
    assertEquals(VerificationState.WAITING, state());
    verify(handshake).accept(any(VerificationFlow.class));

    coordinator.onSignal(new VerificationSignal.EmojisAvailable("f1", EMOJIS));
    assertEquals(VerificationState.EMOJI_COMPARISON, state());
    assertEquals(EMOJIS, coordinator.activeFlow().orElseThrow().emojis());

    coordinator.confirm("f1");
    assertEquals(VerificationState.EMOJI_COMPARISON, state());
    assertTrue(coordinator.activeFlow().orElseThrow().localConfirmed());

    coordinator.onSignal(new VerificationSignal.Done("f1"));
    assertEquals(VerificationState.DONE, state());
  }

  @Test
  void remoteConfirmationMayArriveFirst() {
    request("f1");
    coordinator.accept("f1");
    coordinator.onSignal(new VerificationSignal.EmojisAvailable("f1", EMOJIS));
    coordinator.onSignal(new VerificationSignal.Done("f1"));
    assertEquals(VerificationState.EMOJI_COMPARISON, state());

    coordinator.confirm("f1");
    assertEquals(VerificationState.DONE, state());
  }

  @Test
  void cancelFromEmojiComparisonNeverYieldsDone() {
    request("f1");
    coordinator.accept("f1");
    coordinator.onSignal(new VerificationSignal.EmojisAvailable("f1", EMOJIS));

    coordinator.mismatch("f1");
    assertEquals(VerificationState.CANCELLED, state());
    verify(handshake).cancel(any(VerificationFlow.class), eq("m.mismatched_sas"), any());

    coordinator.onSignal(new VerificationSignal.Done("f1"));
    assertEquals(VerificationState.CANCELLED, state());
    assertThrows(ValidationException.class, () -> coordinator.confirm("f1"));
  }

  @Test
  void invalidLocalTransitionsAreRejected() {
    request("f1");
    assertThrows(ValidationException.class, () -> coordinator.confirm("f1"));
    assertThrows(ValidationException.class, () -> coordinator.accept("nope"));

    coordinator.accept("f1");
    assertThrows(ValidationException.class, () -> coordinator.accept("f1"));
    verify(handshake, never()).confirm(any());
  }

  @Test
  void emojisBeforeAcceptAreIgnored() {
    request("f1");
    coordinator.onSignal(new VerificationSignal.EmojisAvailable("f1", EMOJIS));
    assertEquals(VerificationState.REQUESTED, state());
  }

  @Test
  void failedRemoteAcceptLeavesTheFlowRequested() {
    doThrow(new TransientException("timeout")).when(handshake).accept(any());
    request("f1");

    assertThrows(TransientException.class, () -> coordinator.accept("f1"));
    assertEquals(VerificationState.REQUESTED, state());
  }

  @Test
  void cancelIsAppliedLocallyEvenWhenTheRemoteCallFails() {
    doThrow(new TransientException("timeout")).when(handshake).cancel(any(), any(), any());
    request("f1");

    assertThrows(TransientException.class, () -> coordinator.cancel("f1"));
    assertEquals(VerificationState.CANCELLED, state());
  }

  @Test
  void queuedRequestIsPromotedAfterTheDisplayDelay() {
    TestSubscriber<MatrixEvent> events = bus.events().test();
    request("f1");
    request("f2");
    request("f2");

    assertEquals("f1", coordinator.activeFlow().orElseThrow().flowId());
    assertEquals(1, coordinator.queuedFlows().size());

    coordinator.onSignal(new VerificationSignal.Cancelled("f1", "m.timeout", ""));
    assertEquals(VerificationState.CANCELLED, state());
    assertEquals("m.timeout", coordinator.activeFlow().orElseThrow().cancelReason());

    scheduler.advanceTimeBy(2_999, TimeUnit.MILLISECONDS);
    assertEquals("f1", coordinator.activeFlow().orElseThrow().flowId());

    scheduler.advanceTimeBy(1, TimeUnit.MILLISECONDS);
    VerificationFlow promoted = coordinator.activeFlow().orElseThrow();
    assertEquals("f2", promoted.flowId());
    assertEquals(VerificationState.REQUESTED, promoted.state());
    assertTrue(coordinator.queuedFlows().isEmpty());

    MatrixEvent.VerificationUpdated last =
        (MatrixEvent.VerificationUpdated) events.values().get(events.values().size() - 1);
    assertEquals("f2", last.flow().flowId());
    assertTrue(last.active());
  }

  @Test
  void terminalFlowLeavesTheSlotWhenNothingIsQueued() {
    request("f1");
    coordinator.cancel("f1");

    scheduler.advanceTimeBy(3, TimeUnit.SECONDS);
    assertFalse(coordinator.activeFlow().isPresent());
  }

  @Test
  void queuedFlowCanBeCancelledBeforeItIsShown() {
    request("f1");
    request("f2");

    coordinator.cancel("f2");

    assertTrue(coordinator.queuedFlows().isEmpty());
    assertEquals("f1", coordinator.activeFlow().orElseThrow().flowId());
    verify(handshake).cancel(any(VerificationFlow.class), eq("m.user"), any());
  }
}
