package cafe.woden.mxclient.sync;

import cafe.woden.mxclient.state.SyncUpdate;
import cafe.woden.mxclient.verification.VerificationSignal;
import java.util.List;

/** Everything one sync response carried, in application order. */
public record SyncBatch(String nextBatch, List<SyncUpdate> updates, List<VerificationSignal> signals) {
  public SyncBatch {
    updates = updates == null ? List.of() : List.copyOf(updates);
    signals = signals == null ? List.of() : List.copyOf(signals);
  }
}
