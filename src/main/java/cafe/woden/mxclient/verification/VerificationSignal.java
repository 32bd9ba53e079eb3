package cafe.woden.mxclient.verification;

import cafe.woden.mxclient.model.VerificationEmoji;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.util.List;

/** Remote side of a SAS verification, as reported through to-device messages. */
public sealed interface VerificationSignal permits
    VerificationSignal.Requested,
    VerificationSignal.Ready,
    VerificationSignal.Started,
    VerificationSignal.KeyShared,
    VerificationSignal.EmojisAvailable,
    VerificationSignal.Done,
    VerificationSignal.Cancelled
 {

  String flowId();

  record Requested(String flowId, String userId, String fromDeviceId, boolean selfVerification)
      implements VerificationSignal {}

  record Ready(String flowId) implements VerificationSignal {}

  /** {@code content} is the complete start message; the SAS commitment is computed over it. */
  record Started(String flowId, String method, String fromDeviceId, ObjectNode content)
      implements VerificationSignal {}

  /** The peer's ephemeral public key, unpadded base64. */
  record KeyShared(String flowId, String key) implements VerificationSignal {}

  /** Short authentication string computed by the cryptographic collaborator. */
  record EmojisAvailable(String flowId, List<VerificationEmoji> emojis) implements VerificationSignal {
    public EmojisAvailable {
      emojis = List.copyOf(emojis);
    }
  }

  record Done(String flowId) implements VerificationSignal {}

  record Cancelled(String flowId, String code, String reason) implements VerificationSignal {}
}
