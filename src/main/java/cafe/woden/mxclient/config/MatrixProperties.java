package cafe.woden.mxclient.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Matrix client configuration.
 *
 * <p>Example YAML:
 * <pre>
 * matrix:
 *   client:
 *     device-display-name: "MXcafe"
 *     request-timeout-ms: 30000
 *   sync:
 *     timeout-ms: 30000
 * </pre>
 */
@ConfigurationProperties(prefix = "matrix")
public record MatrixProperties(
    Client client, Sync sync, State state, Verification verification, Session session) {

  public MatrixProperties {
    if (client == null) client = new Client(null, 0, 0, null);
    if (sync == null) sync = new Sync(0, 0, 0, 0, 0);
    if (state == null) state = new State(0, 0);
    if (verification == null) verification = new Verification(0);
    if (session == null) session = new Session(null);
  }

  /** Defaults for every section, used by tests and by code constructed outside Spring. */
  public static MatrixProperties defaults() {
    return new MatrixProperties(null, null, null, null, null);
  }

  /** Settings for every HTTP call made to the homeserver. */
  public record Client(
      String deviceDisplayName, long requestTimeoutMs, long connectTimeoutMs, Reconnect reconnect) {
    public Client {
      if (deviceDisplayName == null || deviceDisplayName.isBlank()) deviceDisplayName = "MXcafe";
      if (requestTimeoutMs <= 0) requestTimeoutMs = 30_000;
      if (connectTimeoutMs <= 0) connectTimeoutMs = 10_000;
      if (reconnect == null) reconnect = new Reconnect(true, 0, 0, 0, 0.20, 0);
    }
  }

  public record Reconnect(
      boolean enabled,
      long initialDelayMs,
      long maxDelayMs,
      double multiplier,
      double jitterPct,
      int maxAttempts
  ) {
    public Reconnect {
      if (initialDelayMs <= 0) initialDelayMs = 1_000;
      if (maxDelayMs <= 0) maxDelayMs = 120_000;
      if (maxDelayMs < initialDelayMs) maxDelayMs = initialDelayMs;
      if (multiplier < 1.1) multiplier = 2.0;
      if (jitterPct < 0) jitterPct = 0;
      if (jitterPct > 0.75) jitterPct = 0.75;
      // maxAttempts == 0 means "until disconnect".
      if (maxAttempts < 0) maxAttempts = 0;
    }
  }

  /** Long-poll sync settings. Retries after a failed sync never give up on their own. */
  public record Sync(
      long timeoutMs,
      long initialRetryDelayMs,
      long maxRetryDelayMs,
      double retryMultiplier,
      double retryJitterPct
  ) {
    public Sync {
      if (timeoutMs <= 0) timeoutMs = 30_000;
      if (initialRetryDelayMs <= 0) initialRetryDelayMs = 1_000;
      if (maxRetryDelayMs <= 0) maxRetryDelayMs = 60_000;
      if (maxRetryDelayMs < initialRetryDelayMs) maxRetryDelayMs = initialRetryDelayMs;
      if (retryMultiplier < 1.1) retryMultiplier = 2.0;
      if (retryJitterPct < 0) retryJitterPct = 0;
      if (retryJitterPct > 0.75) retryJitterPct = 0.75;
    }
  }

  public record State(int maxTimelineMessages, int replyPreviewMaxChars) {
    public State {
      if (maxTimelineMessages <= 0) maxTimelineMessages = 500;
      if (replyPreviewMaxChars <= 0) replyPreviewMaxChars = 80;
    }
  }

  public record Verification(long displayDelayMs) {
    public Verification {
      if (displayDelayMs <= 0) displayDelayMs = 3_000;
    }
  }

  public record Session(String dir) {
    public Session {
      if (dir == null || dir.isBlank()) {
        dir = System.getProperty("user.home") + "/.local/share/mxcafe";
      }
    }
  }
}
