package cafe.woden.mxclient.verification;

import cafe.woden.mxclient.bus.MatrixEvent;
import cafe.woden.mxclient.bus.MatrixEventBus;
import cafe.woden.mxclient.config.ExecutorConfig;
import cafe.woden.mxclient.config.MatrixProperties;
import cafe.woden.mxclient.model.MatrixException;
import cafe.woden.mxclient.model.ValidationException;
import cafe.woden.mxclient.model.VerificationEmoji;
import cafe.woden.mxclient.model.VerificationFlow;
import cafe.woden.mxclient.model.VerificationState;
import io.reactivex.rxjava3.core.Scheduler;
import io.reactivex.rxjava3.disposables.Disposable;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.TimeUnit;
import org.jmolecules.architecture.layered.ApplicationLayer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

/**
 * Drives SAS verification flows: {@code REQUESTED -> WAITING -> EMOJI_COMPARISON -> DONE}, with
 * {@code CANCELLED} reachable from every non-terminal state.
 *
 * <p>One flow occupies the active slot at a time. Requests arriving meanwhile wait in FIFO order
 * and are promoted once the active flow has ended and its final state was shown for the
 * configured display delay.
 */
@Component
@ApplicationLayer
public class VerificationCoordinator {
  private static final Logger log = LoggerFactory.getLogger(VerificationCoordinator.class);

  static final String CODE_USER = "m.user";
  static final String CODE_MISMATCH = "m.mismatched_sas";
  static final String CODE_UNEXPECTED = "m.unexpected_message";

  private static final class FlowEntry {
    final String flowId;
    final String userId;
    final String fromDeviceId;
    final boolean self;
    VerificationState state = VerificationState.REQUESTED;
    List<VerificationEmoji> emojis = List.of();
    boolean localConfirmed;
    boolean remoteConfirmed;
    String cancelReason;

    FlowEntry(VerificationSignal.Requested r) {
      this.flowId = r.flowId();
      this.userId = r.userId();
      this.fromDeviceId = r.fromDeviceId();
      this.self = r.selfVerification();
    }

    VerificationFlow snapshot() {
      return new VerificationFlow(
          flowId, userId, fromDeviceId, self, state, emojis, localConfirmed, remoteConfirmed, cancelReason);
    }
  }

  private final MatrixEventBus bus;
  private final VerificationHandshake handshake;
  private final Scheduler scheduler;
  private final long displayDelayMs;

  private FlowEntry active;
  private final Deque<FlowEntry> queue = new ArrayDeque<>();
  private Disposable expiry;

  public VerificationCoordinator(
      MatrixEventBus bus,
      VerificationHandshake handshake,
      MatrixProperties props,
      @Qualifier(ExecutorConfig.VERIFICATION_SCHEDULER) Scheduler scheduler) {
    this.bus = Objects.requireNonNull(bus, "bus");
    this.handshake = Objects.requireNonNull(handshake, "handshake");
    this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
    this.displayDelayMs = props.verification().displayDelayMs();
  }

  public void onSignal(VerificationSignal signal) {
    if (signal instanceof VerificationSignal.Started st) {
      remoteStarted(st);
    } else if (signal instanceof VerificationSignal.KeyShared k) {
      remoteKey(k);
    } else {
      applySignal(signal);
    }
  }

  private synchronized void applySignal(VerificationSignal signal) {
    if (signal instanceof VerificationSignal.Requested r) {
      requested(r);
    } else if (signal instanceof VerificationSignal.EmojisAvailable e) {
      emojis(e);
    } else if (signal instanceof VerificationSignal.Done d) {
      remoteDone(d.flowId());
    } else if (signal instanceof VerificationSignal.Cancelled c) {
      remoteCancelled(c);
    } else {
      log.debug(
          "[mxcafe] verification {}: {} (no state change)",
          signal.flowId(),
          signal.getClass().getSimpleName());
    }
  }

  private void remoteStarted(VerificationSignal.Started started) {
    VerificationFlow flow = waitingFlow(started.flowId(), "start");
    if (flow == null) return;
    try {
      handshake.start(flow, started);
    } catch (MatrixException e) {
      abort(flow.flowId(), e);
    }
  }

  /** The peer's key completes the agreement; its emojis move the flow to comparison. */
  private void remoteKey(VerificationSignal.KeyShared key) {
    VerificationFlow flow = waitingFlow(key.flowId(), "key");
    if (flow == null) return;
    List<VerificationEmoji> emojis;
    try {
      emojis = handshake.exchangeKeys(flow, key.key());
    } catch (MatrixException e) {
      abort(flow.flowId(), e);
      return;
    }
    applySignal(new VerificationSignal.EmojisAvailable(key.flowId(), emojis));
  }

  private synchronized VerificationFlow waitingFlow(String flowId, String what) {
    FlowEntry f = activeMatching(flowId);
    if (f == null || f.state != VerificationState.WAITING) {
      log.debug("[mxcafe] ignoring {} for verification {}", what, flowId);
      return null;
    }
    return f.snapshot();
  }

  private void abort(String flowId, MatrixException cause) {
    log.warn("[mxcafe] verification {} handshake failed: {}", flowId, cause.getMessage());
    String code = cause.errcode();
    if (code == null || !code.startsWith("m.")) code = CODE_UNEXPECTED;
    try {
      cancelLocally(flowId, code, "Verification handshake failed");
    } catch (MatrixException e) {
      log.warn("[mxcafe] could not cancel verification {}: {}", flowId, e.getMessage());
    }
  }

  /** Local "accept": sends the remote ready message, then moves the flow to waiting. */
  public void accept(String flowId) {
    VerificationFlow flow;
    synchronized (this) {
      flow = requireActive(flowId, VerificationState.REQUESTED, "accept").snapshot();
    }
    handshake.accept(flow);
    synchronized (this) {
      FlowEntry f = activeMatching(flowId);
      if (f == null || f.state != VerificationState.REQUESTED) return;
      transition(f, VerificationState.WAITING);
    }
  }

  /** Local "they match". Completes once the remote side has confirmed as well. */
  public void confirm(String flowId) {
    VerificationFlow flow;
    synchronized (this) {
      FlowEntry f = requireActive(flowId, VerificationState.EMOJI_COMPARISON, "confirm");
      if (f.localConfirmed) return;
      flow = f.snapshot();
    }
    handshake.confirm(flow);
    synchronized (this) {
      FlowEntry f = activeMatching(flowId);
      if (f == null || f.state != VerificationState.EMOJI_COMPARISON) return;
      f.localConfirmed = true;
      if (f.remoteConfirmed) {
        transition(f, VerificationState.DONE);
      } else {
        publish(f, true);
      }
    }
  }

  /** Local "they don't match". */
  public void mismatch(String flowId) {
    cancelLocally(flowId, CODE_MISMATCH, "Emojis did not match");
  }

  public void cancel(String flowId) {
    cancelLocally(flowId, CODE_USER, "Cancelled by user");
  }

  /** The local side is cancelled before the remote call, which may still fail afterwards. */
  private void cancelLocally(String flowId, String code, String reason) {
    VerificationFlow flow;
    synchronized (this) {
      FlowEntry f = activeMatching(flowId);
      if (f != null) {
        if (f.state.isTerminal()) {
          throw new ValidationException("Verification " + flowId + " already " + f.state);
        }
        f.cancelReason = reason;
        transition(f, VerificationState.CANCELLED);
        flow = f.snapshot();
      } else {
        FlowEntry q = removeQueued(flowId);
        if (q == null) throw new ValidationException("No verification " + flowId);
        q.cancelReason = reason;
        q.state = VerificationState.CANCELLED;
        publish(q, false);
        flow = q.snapshot();
      }
    }
    handshake.cancel(flow, code, reason);
  }

  public synchronized Optional<VerificationFlow> activeFlow() {
    return active == null ? Optional.empty() : Optional.of(active.snapshot());
  }

  public synchronized List<VerificationFlow> queuedFlows() {
    List<VerificationFlow> out = new ArrayList<>(queue.size());
    for (FlowEntry f : queue) out.add(f.snapshot());
    return List.copyOf(out);
  }

  /** Forgets every flow, used on logout. */
  public synchronized void reset() {
    if (active != null) handshake.release(active.flowId);
    if (expiry != null) expiry.dispose();
    expiry = null;
    active = null;
    queue.clear();
  }

  private void requested(VerificationSignal.Requested r) {
    if (isKnown(r.flowId())) {
      log.debug("[mxcafe] duplicate verification request {}", r.flowId());
      return;
    }
    FlowEntry f = new FlowEntry(r);
    if (active == null) {
      active = f;
      publish(f, true);
    } else {
      queue.addLast(f);
      log.info(
          "[mxcafe] verification request {} from {} queued behind {}",
          r.flowId(),
          r.userId(),
          active.flowId);
      publish(f, false);
    }
  }

  private void emojis(VerificationSignal.EmojisAvailable e) {
    FlowEntry f = activeMatching(e.flowId());
    if (f == null || f.state != VerificationState.WAITING) {
      log.debug("[mxcafe] ignoring emojis for verification {}", e.flowId());
      return;
    }
    f.emojis = e.emojis();
    transition(f, VerificationState.EMOJI_COMPARISON);
  }

  private void remoteDone(String flowId) {
    FlowEntry f = activeMatching(flowId);
    if (f == null || f.state.isTerminal()) return;
    f.remoteConfirmed = true;
    if (f.state == VerificationState.EMOJI_COMPARISON && f.localConfirmed) {
      transition(f, VerificationState.DONE);
    } else {
      publish(f, true);
    }
  }

  private void remoteCancelled(VerificationSignal.Cancelled c) {
    String reason = c.reason() == null || c.reason().isBlank() ? c.code() : c.reason();
    FlowEntry f = activeMatching(c.flowId());
    if (f != null) {
      if (f.state.isTerminal()) return;
      f.cancelReason = reason;
      transition(f, VerificationState.CANCELLED);
      return;
    }
    FlowEntry q = removeQueued(c.flowId());
    if (q != null) {
      q.cancelReason = reason;
      q.state = VerificationState.CANCELLED;
      publish(q, false);
    }
  }

  private void transition(FlowEntry f, VerificationState next) {
    log.debug("[mxcafe] verification {}: {} -> {}", f.flowId, f.state, next);
    f.state = next;
    publish(f, true);
    if (next.isTerminal()) {
      handshake.release(f.flowId);
      scheduleExpiry(f.flowId);
    }
  }

  private void scheduleExpiry(String flowId) {
    if (expiry != null) expiry.dispose();
    expiry = scheduler.scheduleDirect(() -> expire(flowId), displayDelayMs, TimeUnit.MILLISECONDS);
  }

  private synchronized void expire(String flowId) {
    FlowEntry f = activeMatching(flowId);
    if (f == null || !f.state.isTerminal()) return;
    publish(f, false);
    active = null;
    expiry = null;
    FlowEntry next = queue.pollFirst();
    if (next != null) {
      active = next;
      publish(next, true);
    }
  }

  private FlowEntry requireActive(String flowId, VerificationState expected, String action) {
    FlowEntry f = activeMatching(flowId);
    if (f == null) throw new ValidationException("No active verification " + flowId);
    if (f.state != expected) {
      throw new ValidationException("Cannot " + action + " verification in state " + f.state);
    }
    return f;
  }

  private FlowEntry activeMatching(String flowId) {
    return active != null && active.flowId.equals(flowId) ? active : null;
  }

  private boolean isKnown(String flowId) {
    if (activeMatching(flowId) != null) return true;
    for (FlowEntry f : queue) {
      if (f.flowId.equals(flowId)) return true;
    }
    return false;
  }

  private FlowEntry removeQueued(String flowId) {
    Iterator<FlowEntry> it = queue.iterator();
    while (it.hasNext()) {
      FlowEntry f = it.next();
      if (f.flowId.equals(flowId)) {
        it.remove();
        return f;
      }
    }
    return null;
  }

  private void publish(FlowEntry f, boolean isActive) {
    bus.emit(new MatrixEvent.VerificationUpdated(f.snapshot(), isActive));
  }
}
