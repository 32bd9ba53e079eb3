package cafe.woden.mxclient.model;

import java.util.List;
import java.util.Objects;
import org.jmolecules.ddd.annotation.ValueObject;

/** Immutable snapshot of one SAS verification handshake. */
@ValueObject
public record VerificationFlow(
    String flowId,
    String userId,
    String fromDeviceId,
    boolean selfVerification,
    VerificationState state,
    List<VerificationEmoji> emojis,
    boolean localConfirmed,
    boolean remoteConfirmed,
    String cancelReason) {

  public VerificationFlow {
    Objects.requireNonNull(flowId, "flowId");
    if (userId == null) userId = "";
    if (state == null) state = VerificationState.REQUESTED;
    emojis = emojis == null ? List.of() : List.copyOf(emojis);
  }
}
