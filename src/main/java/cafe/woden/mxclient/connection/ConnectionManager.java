package cafe.woden.mxclient.connection;

import cafe.woden.mxclient.bus.MatrixEvent;
import cafe.woden.mxclient.bus.MatrixEventBus;
import cafe.woden.mxclient.config.ExecutorConfig;
import cafe.woden.mxclient.config.MatrixProperties;
import cafe.woden.mxclient.matrix.HomeserverApi;
import cafe.woden.mxclient.matrix.HomeserverApiFactory;
import cafe.woden.mxclient.matrix.HomeserverConnection;
import cafe.woden.mxclient.matrix.LoginResult;
import cafe.woden.mxclient.matrix.RegistrationStep;
import cafe.woden.mxclient.model.ConnectionException;
import cafe.woden.mxclient.model.ConnectionState;
import cafe.woden.mxclient.model.MatrixException;
import cafe.woden.mxclient.model.PermissionException;
import cafe.woden.mxclient.model.TransientException;
import cafe.woden.mxclient.model.ValidationException;
import cafe.woden.mxclient.session.PersistedSession;
import cafe.woden.mxclient.session.SessionStore;
import cafe.woden.mxclient.state.RoomStateStore;
import cafe.woden.mxclient.sync.SyncLoop;
import cafe.woden.mxclient.util.Backoff;
import cafe.woden.mxclient.util.FutureDisposables;
import cafe.woden.mxclient.verification.VerificationCoordinator;
import io.reactivex.rxjava3.disposables.Disposable;
import jakarta.annotation.PreDestroy;
import java.net.URI;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;
import org.jmolecules.architecture.layered.ApplicationLayer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

/**
 * Owns the session lifecycle: login, registration, silent restore, reconnect, disconnect and
 * logout.
 *
 * <p>It is the only component that creates or drops the live {@link HomeserverApi} handle. All
 * operations are serialized and blocking; the command surface wraps them in Rx types.
 */
@Component
@ApplicationLayer
public class ConnectionManager {
  private static final Logger log = LoggerFactory.getLogger(ConnectionManager.class);

  static final String DUMMY_AUTH = "m.login.dummy";

  private final SessionStore sessions;
  private final HomeserverApiFactory apiFactory;
  private final HomeserverConnection connection;
  private final SyncLoop syncLoop;
  private final RoomStateStore store;
  private final VerificationCoordinator verification;
  private final MatrixEventBus bus;
  private final MatrixProperties.Client client;
  private final ScheduledExecutorService reconnectExec;

  private final Object lock = new Object();
  private final AtomicReference<ConnectionState> state =
      new AtomicReference<>(ConnectionState.ABSENT);
  private final AtomicReference<PersistedSession> session = new AtomicReference<>();
  private final AtomicBoolean manualDisconnect = new AtomicBoolean(false);
  private final AtomicLong reconnectAttempts = new AtomicLong();
  private final AtomicReference<Disposable> reconnectTask = new AtomicReference<>();

  public ConnectionManager(
      SessionStore sessions,
      HomeserverApiFactory apiFactory,
      HomeserverConnection connection,
      SyncLoop syncLoop,
      RoomStateStore store,
      VerificationCoordinator verification,
      MatrixEventBus bus,
      MatrixProperties props,
      @Qualifier(ExecutorConfig.RECONNECT_SCHEDULER) ScheduledExecutorService reconnectExec) {
    this.sessions = Objects.requireNonNull(sessions, "sessions");
    this.apiFactory = Objects.requireNonNull(apiFactory, "apiFactory");
    this.connection = Objects.requireNonNull(connection, "connection");
    this.syncLoop = Objects.requireNonNull(syncLoop, "syncLoop");
    this.store = Objects.requireNonNull(store, "store");
    this.verification = Objects.requireNonNull(verification, "verification");
    this.bus = Objects.requireNonNull(bus, "bus");
    this.client = props.client();
    this.reconnectExec = Objects.requireNonNull(reconnectExec, "reconnectExec");
  }

  /** Password login on a fresh device. Returns the account id. */
  public String login(String homeserver, String username, String password) {
    requireCredentials(username, password);
    synchronized (lock) {
      URI hs = apiFactory.resolve(homeserver);
      prepareFreshDevice();
      try {
        LoginResult r =
            apiFactory.create(hs, null).login(username.trim(), password, client.deviceDisplayName());
        return establish(hs, r);
      } catch (MatrixException e) {
        throw failed("Login", e);
      }
    }
  }

  /**
   * Creates an account. Servers that demand user-interactive auth are satisfied with the dummy
   * stage when they offer it; anything else (captcha, email) has to happen in a browser.
   */
  public String register(String homeserver, String username, String password) {
    requireCredentials(username, password);
    synchronized (lock) {
      URI hs = apiFactory.resolve(homeserver);
      prepareFreshDevice();
      try {
        HomeserverApi anonymous = apiFactory.create(hs, null);
        String user = username.trim();
        RegistrationStep step =
            anonymous.register(user, password, client.deviceDisplayName(), null, null);
        if (!step.isCompleted()) {
          log.info("[mxcafe] Registration needs interactive auth, flows: {}", step.flows());
          if (!step.offersSingleStage(DUMMY_AUTH)) throw browserRegistrationRequired(hs);
          step = anonymous.register(user, password, client.deviceDisplayName(), DUMMY_AUTH, step.session());
          if (!step.isCompleted()) throw browserRegistrationRequired(hs);
        }
        return establish(hs, step.result());
      } catch (MatrixException e) {
        throw failed("Registration", e);
      }
    }
  }

  /**
   * Resumes the persisted session after verifying its token is still accepted. Idempotent while
   * live.
   *
   * @throws ConnectionException {@code NO_SESSION} when nothing was saved, {@code
   *     CREDENTIALS_REJECTED} when the stored token was revoked
   */
  public String restoreSession() {
    synchronized (lock) {
      if (state.get() == ConnectionState.LIVE) return currentUserIdOrThrow();
      PersistedSession s =
          sessions
              .load()
              .orElseThrow(
                  () -> new ConnectionException(ConnectionException.Reason.NO_SESSION, "No saved session"));
      return resume(s);
    }
  }

  /** Re-establishes the connection from the current session. A no-op success while live. */
  public String reconnect() {
    synchronized (lock) {
      if (state.get() == ConnectionState.LIVE) return currentUserIdOrThrow();
      PersistedSession s = session.get();
      if (s == null) {
        s = sessions
            .load()
            .orElseThrow(
                () -> new ConnectionException(ConnectionException.Reason.NO_SESSION, "No saved session"));
      }
      manualDisconnect.set(false);
      try {
        return resume(s);
      } catch (ConnectionException e) {
        if (e.reason() == ConnectionException.Reason.NETWORK) scheduleReconnect(e.getMessage());
        throw e;
      }
    }
  }

  /** Drops the live connection but keeps the session; state snapshots stay readable. */
  public void disconnect() {
    synchronized (lock) {
      manualDisconnect.set(true);
      cancelReconnect();
      syncLoop.stop();
      connection.detach();
      store.clearTyping();
      if (session.get() != null || state.get() != ConnectionState.ABSENT) {
        setState(ConnectionState.DISCONNECTED, "Disconnected");
      }
      log.info("[mxcafe] Disconnected");
    }
  }

  /** Remote logout (best-effort) followed by erasing every trace of the session locally. */
  public void logout() {
    synchronized (lock) {
      manualDisconnect.set(true);
      cancelReconnect();
      syncLoop.stop();
      HomeserverApi api = connection.detach();
      if (api != null) {
        try {
          api.logout();
        } catch (MatrixException e) {
          log.warn("[mxcafe] Remote logout failed, continuing locally: {}", e.getMessage());
        }
      }
      sessions.erase();
      session.set(null);
      syncLoop.resetCursor();
      store.clear();
      verification.reset();
      setState(ConnectionState.ABSENT, "Logged out");
      log.info("[mxcafe] Logged out");
    }
  }

  @PreDestroy
  void shutdown() {
    manualDisconnect.set(true);
    cancelReconnect();
    syncLoop.stop();
  }

  public ConnectionState state() {
    return state.get();
  }

  public Optional<String> currentUserId() {
    PersistedSession s = session.get();
    return s == null ? Optional.empty() : Optional.of(s.userId());
  }

  public Optional<PersistedSession> session() {
    return Optional.ofNullable(session.get());
  }

  private void prepareFreshDevice() {
    cancelReconnect();
    manualDisconnect.set(false);
    syncLoop.stop();
    connection.detach();
    setState(ConnectionState.CONNECTING, null);
    sessions.resetStoreDirectory();
  }

  private String establish(URI hs, LoginResult r) {
    PersistedSession s =
        new PersistedSession(hs.toString(), r.userId(), r.deviceId(), r.accessToken(), r.refreshToken());
    sessions.save(s);
    store.reset(s.userId());
    syncLoop.resetCursor();
    goLive(s, apiFactory.create(hs, s.accessToken()));
    return s.userId();
  }

  private String resume(PersistedSession s) {
    session.set(s);
    setState(ConnectionState.CONNECTING, null);
    try {
      HomeserverApi api = apiFactory.create(URI.create(s.homeserverUrl()), s.accessToken());
      LoginResult who = api.whoami();
      if (!who.userId().isBlank() && !who.userId().equals(s.userId())) {
        log.warn("[mxcafe] Stored session for {} resolves to {}", s.userId(), who.userId());
      }
      if (!s.userId().equals(store.selfUserId())) {
        store.reset(s.userId());
        syncLoop.resetCursor();
      }
      goLive(s, api);
      return s.userId();
    } catch (MatrixException e) {
      throw failed("Session restore", e);
    }
  }

  private void goLive(PersistedSession s, HomeserverApi api) {
    cancelReconnect();
    reconnectAttempts.set(0);
    session.set(s);
    connection.attach(api, s.userId(), s.deviceId());
    setState(ConnectionState.LIVE, null);
    syncLoop.start(this::onCredentialsRejected);
    log.info("[mxcafe] Connected as {} on {}", s.userId(), s.homeserverUrl());
  }

  private void onCredentialsRejected() {
    synchronized (lock) {
      connection.detach();
      store.clearTyping();
      setState(ConnectionState.DISCONNECTED, "Access token rejected by the homeserver");
    }
  }

  private ConnectionException failed(String what, MatrixException e) {
    ConnectionException ce;
    if (e instanceof ConnectionException c) {
      ce = c;
    } else if (e instanceof TransientException) {
      ce = new ConnectionException(ConnectionException.Reason.NETWORK, e.errcode(), e.getMessage(), e);
    } else if (e instanceof PermissionException) {
      ce = new ConnectionException(ConnectionException.Reason.CREDENTIALS_REJECTED, e.errcode(), e.getMessage(), e);
    } else {
      ce = new ConnectionException(ConnectionException.Reason.REMOTE, e.errcode(), e.getMessage(), e);
    }
    log.warn("[mxcafe] {} failed ({}): {}", what, ce.reason(), ce.getMessage());
    connection.detach();
    setState(session.get() == null ? ConnectionState.ABSENT : ConnectionState.DISCONNECTED, ce.getMessage());
    return ce;
  }

  private static ConnectionException browserRegistrationRequired(URI hs) {
    return new ConnectionException(
        ConnectionException.Reason.REGISTRATION_UNSUPPORTED,
        "This server requires additional verification steps (e.g. email or captcha). "
            + "Please register at " + hs + " in your browser.");
  }

  private static void requireCredentials(String username, String password) {
    if (username == null || username.isBlank()) throw new ValidationException("Username is required");
    if (password == null || password.isEmpty()) throw new ValidationException("Password is required");
  }

  private String currentUserIdOrThrow() {
    return currentUserId()
        .orElseThrow(() -> new ConnectionException(ConnectionException.Reason.NO_SESSION, "No session"));
  }

  private void setState(ConnectionState next, String reason) {
    state.set(next);
    String userId = currentUserId().orElse(null);
    bus.emit(new MatrixEvent.ConnectionStateChanged(next, userId, reason));
  }

  private void scheduleReconnect(String reason) {
    MatrixProperties.Reconnect p = client.reconnect();
    if (!p.enabled() || manualDisconnect.get()) return;

    long attempt = reconnectAttempts.incrementAndGet();
    if (p.maxAttempts() > 0 && attempt > p.maxAttempts()) {
      log.warn("[mxcafe] Reconnect aborted after {} attempts", p.maxAttempts());
      return;
    }
    long delayMs =
        Backoff.delayMs(p.initialDelayMs(), p.maxDelayMs(), p.multiplier(), p.jitterPct(), attempt);
    log.info("[mxcafe] Reconnecting in {}ms (attempt {}): {}", delayMs, attempt, reason);

    try {
      ScheduledFuture<?> future =
          reconnectExec.schedule(this::runScheduledReconnect, delayMs, TimeUnit.MILLISECONDS);
      Disposable prev = reconnectTask.getAndSet(FutureDisposables.of(future));
      if (prev != null && !prev.isDisposed()) prev.dispose();
    } catch (RejectedExecutionException rejected) {
      log.debug("[mxcafe] Reconnect scheduling rejected (likely shutdown)");
    }
  }

  private void runScheduledReconnect() {
    // This task is the scheduled one; forget it so a new schedule does not cancel us.
    reconnectTask.set(null);
    if (manualDisconnect.get()) return;
    try {
      reconnect();
    } catch (MatrixException e) {
      log.warn("[mxcafe] Reconnect attempt failed: {}", e.getMessage());
    }
  }

  private void cancelReconnect() {
    Disposable prev = reconnectTask.getAndSet(null);
    if (prev != null && !prev.isDisposed()) prev.dispose();
  }
}
