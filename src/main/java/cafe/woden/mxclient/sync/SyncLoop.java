package cafe.woden.mxclient.sync;

import cafe.woden.mxclient.bus.MatrixEvent;
import cafe.woden.mxclient.bus.MatrixEventBus;
import cafe.woden.mxclient.config.ExecutorConfig;
import cafe.woden.mxclient.config.MatrixProperties;
import cafe.woden.mxclient.matrix.HomeserverApi;
import cafe.woden.mxclient.matrix.HomeserverConnection;
import cafe.woden.mxclient.model.ConnectionException;
import cafe.woden.mxclient.model.MatrixException;
import cafe.woden.mxclient.model.NotFoundException;
import cafe.woden.mxclient.model.SyncStatus;
import cafe.woden.mxclient.state.RoomStateStore;
import cafe.woden.mxclient.state.SyncUpdate;
import cafe.woden.mxclient.util.Backoff;
import cafe.woden.mxclient.util.FutureDisposables;
import cafe.woden.mxclient.verification.VerificationCoordinator;
import cafe.woden.mxclient.verification.VerificationSignal;
import com.fasterxml.jackson.databind.JsonNode;
import io.reactivex.rxjava3.disposables.Disposable;
import java.util.HashSet;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;
import org.jmolecules.architecture.layered.ApplicationLayer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

/**
 * The one long-poll {@code /sync} loop.
 *
 * <p>Iterations run one at a time on a dedicated single-thread executor: request, translate,
 * apply, advance the cursor, schedule the next request. Failed requests are retried with jittered
 * exponential backoff until {@link #stop()}; a rejected access token stops the loop for good and
 * is reported through the callback given to {@link #start(Runnable)}.
 *
 * <p>Every store write of an iteration happens under one apply lock and only while the
 * iteration's generation is current. {@link #stop()} bumps the generation and then takes that
 * lock, so once it returns no update of the stopped iteration reaches the store.
 */
@Component
@ApplicationLayer
public class SyncLoop {
  private static final Logger log = LoggerFactory.getLogger(SyncLoop.class);

  private final HomeserverConnection connection;
  private final SyncResponseTranslator translator;
  private final RoomStateStore store;
  private final VerificationCoordinator verification;
  private final MatrixEventBus bus;
  private final MatrixProperties.Sync policy;
  private final ScheduledExecutorService exec;

  private final Object lifecycle = new Object();
  private final Object applying = new Object();
  private final AtomicBoolean running = new AtomicBoolean(false);
  private final AtomicLong generation = new AtomicLong();
  private final AtomicInteger failures = new AtomicInteger();
  private final AtomicReference<Disposable> scheduled = new AtomicReference<>();
  private volatile String cursor;
  private volatile boolean synced;
  private volatile Runnable onCredentialsRejected = () -> {};

  public SyncLoop(
      HomeserverConnection connection,
      SyncResponseTranslator translator,
      RoomStateStore store,
      VerificationCoordinator verification,
      MatrixEventBus bus,
      MatrixProperties props,
      @Qualifier(ExecutorConfig.SYNC_LOOP_EXECUTOR) ScheduledExecutorService exec) {
    this.connection = Objects.requireNonNull(connection, "connection");
    this.translator = Objects.requireNonNull(translator, "translator");
    this.store = Objects.requireNonNull(store, "store");
    this.verification = Objects.requireNonNull(verification, "verification");
    this.bus = Objects.requireNonNull(bus, "bus");
    this.policy = props.sync();
    this.exec = Objects.requireNonNull(exec, "exec");
  }

  /** Starts the loop; a no-op while it is already running. */
  public void start(Runnable onCredentialsRejected) {
    synchronized (lifecycle) {
      if (running.get()) return;
      this.onCredentialsRejected = onCredentialsRejected == null ? () -> {} : onCredentialsRejected;
      running.set(true);
      failures.set(0);
      synced = false;
      long gen = generation.incrementAndGet();
      bus.emit(new MatrixEvent.SyncStatusChanged(SyncStatus.of(SyncStatus.Phase.SYNCING)));
      schedule(gen, 0);
    }
  }

  /** Cancels the in-flight request (interrupting it) and prevents further iterations. */
  public void stop() {
    synchronized (lifecycle) {
      if (!running.getAndSet(false)) return;
      generation.incrementAndGet();
      Disposable prev = scheduled.getAndSet(null);
      if (prev != null && !prev.isDisposed()) prev.dispose();
      bus.emit(new MatrixEvent.SyncStatusChanged(SyncStatus.of(SyncStatus.Phase.STOPPED)));
    }
    // Wait out a batch being applied right now; it sees the new generation at its next update.
    synchronized (applying) {
      log.debug("[mxcafe] Sync stopped");
    }
  }

  public boolean isRunning() {
    return running.get();
  }

  /** The {@code next_batch} token of the last applied response, {@code null} before the first. */
  public String cursor() {
    return cursor;
  }

  /** Forgets the cursor so the next iteration performs a full initial sync. */
  public void resetCursor() {
    cursor = null;
  }

  /** Runs one iteration on the calling thread. */
  boolean pollOnce() {
    return runOnce(generation.get());
  }

  private void schedule(long gen, long delayMs) {
    try {
      ScheduledFuture<?> future = exec.schedule(() -> iterate(gen), delayMs, TimeUnit.MILLISECONDS);
      // The previous future is the iteration calling us (or already done); never cancel it here.
      scheduled.set(FutureDisposables.of(future));
    } catch (RejectedExecutionException rejected) {
      log.debug("[mxcafe] Sync scheduling rejected (likely shutdown)");
    }
  }

  private void iterate(long gen) {
    if (gen != generation.get() || !running.get()) return;
    boolean ok = runOnce(gen);
    if (gen != generation.get() || !running.get()) return;

    if (ok) {
      failures.set(0);
      schedule(gen, 0);
      return;
    }
    int attempt = failures.incrementAndGet();
    long delayMs =
        Backoff.delayMs(
            policy.initialRetryDelayMs(),
            policy.maxRetryDelayMs(),
            policy.retryMultiplier(),
            policy.retryJitterPct(),
            attempt);
    bus.emit(new MatrixEvent.SyncStatusChanged(SyncStatus.retrying(attempt, delayMs)));
    schedule(gen, delayMs);
  }

  private boolean runOnce(long gen) {
    HomeserverApi api = connection.current().orElse(null);
    if (api == null) {
      log.warn("[mxcafe] Sync skipped: not connected");
      return false;
    }
    try {
      String since = cursor;
      boolean initial = since == null;
      JsonNode response = api.sync(since, initial ? 0 : policy.timeoutMs(), initial);
      if (gen != generation.get()) return true;

      SyncBatch batch = translator.translate(response, store.selfUserId());
      // A full-state response replays backlog; it is history, not unread news.
      if (!applyBatch(batch, api, gen, !initial)) return true;
      synchronized (applying) {
        if (gen != generation.get()) return true;
        if (batch.nextBatch() != null) cursor = batch.nextBatch();
      }
      if (!synced) {
        synced = true;
        bus.emit(new MatrixEvent.SyncStatusChanged(SyncStatus.of(SyncStatus.Phase.SYNCED)));
      }
      return true;
    } catch (ConnectionException e) {
      if (e.reason() != ConnectionException.Reason.CREDENTIALS_REJECTED) {
        log.warn("[mxcafe] Sync failed: {}", e.getMessage());
        return false;
      }
      if (gen != generation.get()) return true;
      log.warn("[mxcafe] Sync stopped, access token rejected ({})", e.errcode());
      // Running on the scheduled task itself: drop it so stop() does not interrupt this thread.
      scheduled.set(null);
      stop();
      onCredentialsRejected.run();
      return true;
    } catch (MatrixException e) {
      if (gen == generation.get()) log.warn("[mxcafe] Sync failed: {}", e.getMessage());
      return false;
    } catch (RuntimeException e) {
      log.error("[mxcafe] Sync iteration crashed", e);
      return false;
    }
  }

  /**
   * Applies a batch in order. An update for a room the store has not seen yet first creates the
   * room, looking its name up on the homeserver unless the batch itself names it.
   *
   * @return {@code false} if the loop was stopped part way and the rest of the batch was dropped
   */
  boolean applyBatch(SyncBatch batch, HomeserverApi api, long gen, boolean countUnread) {
    Set<String> namedInBatch = new HashSet<>();
    for (SyncUpdate u : batch.updates()) {
      if (u instanceof SyncUpdate.RoomNamed n && n.name() != null && !n.name().isBlank()) {
        namedInBatch.add(n.roomId());
      }
    }

    for (SyncUpdate u : batch.updates()) {
      try {
        boolean discover = u.requiresKnownRoom() && !store.isKnownRoom(u.roomId());
        String fallback =
            discover && !namedInBatch.contains(u.roomId()) ? lookupRoomName(api, u.roomId()) : null;
        synchronized (applying) {
          if (gen != generation.get()) {
            log.debug("[mxcafe] Sync stopped mid-batch, dropping the rest");
            return false;
          }
          if (discover) store.apply(new SyncUpdate.RoomDiscovered(u.roomId(), fallback));
          store.apply(u, countUnread);
        }
      } catch (RuntimeException e) {
        log.warn("[mxcafe] Skipping {} for {}: {}", u.getClass().getSimpleName(), u.roomId(), e.toString());
      }
    }

    for (VerificationSignal s : batch.signals()) {
      if (gen != generation.get()) return false;
      try {
        verification.onSignal(s);
      } catch (RuntimeException e) {
        log.warn("[mxcafe] Verification signal {} failed: {}", s, e.toString());
      }
    }
    return true;
  }

  private String lookupRoomName(HomeserverApi api, String roomId) {
    String name = stateField(api, roomId, "m.room.name", "name");
    if (name != null) return name;
    return stateField(api, roomId, "m.room.canonical_alias", "alias");
  }

  private static String stateField(HomeserverApi api, String roomId, String type, String field) {
    try {
      String v = api.roomState(roomId, type, "").path(field).asText("");
      return v.isBlank() ? null : v;
    } catch (NotFoundException e) {
      log.debug("[mxcafe] {} has no {}", roomId, type);
      return null;
    } catch (MatrixException e) {
      log.warn("[mxcafe] Could not look up {} of {}: {}", type, roomId, e.getMessage());
      return null;
    }
  }
}
