package cafe.woden.mxclient.verification;

import cafe.woden.mxclient.model.VerificationEmoji;
import cafe.woden.mxclient.model.VerificationFlow;
import java.util.List;
import org.jmolecules.architecture.layered.ApplicationLayer;

/**
 * Remote half of the verification handshake. Implementations block until the homeserver accepted
 * the message and throw a {@link cafe.woden.mxclient.model.MatrixException} otherwise.
 */
@ApplicationLayer
public interface VerificationHandshake {

  void accept(VerificationFlow flow);

  /** Answers the peer's start message with our commitment. */
  void start(VerificationFlow flow, VerificationSignal.Started started);

  /** Sends our key in reply to the peer's and returns the emojis both sides should now show. */
  List<VerificationEmoji> exchangeKeys(VerificationFlow flow, String theirKey);

  void confirm(VerificationFlow flow);

  void cancel(VerificationFlow flow, String code, String reason);

  /** Drops whatever the handshake kept for a flow that has ended. */
  default void release(String flowId) {}
}
