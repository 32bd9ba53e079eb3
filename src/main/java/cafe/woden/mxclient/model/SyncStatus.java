package cafe.woden.mxclient.model;

import org.jmolecules.ddd.annotation.ValueObject;

/** Progress of the sync loop as shown in the status bar. */
@ValueObject
public record SyncStatus(Phase phase, int attempt, long retryDelayMs) {

  public enum Phase {
    SYNCING,
    SYNCED,
    RETRYING,
    STOPPED
  }

  public SyncStatus {
    if (phase == null) phase = Phase.STOPPED;
    if (attempt < 0) attempt = 0;
    if (retryDelayMs < 0) retryDelayMs = 0;
  }

  public static SyncStatus of(Phase phase) {
    return new SyncStatus(phase, 0, 0);
  }

  public static SyncStatus retrying(int attempt, long retryDelayMs) {
    return new SyncStatus(Phase.RETRYING, attempt, retryDelayMs);
  }
}
