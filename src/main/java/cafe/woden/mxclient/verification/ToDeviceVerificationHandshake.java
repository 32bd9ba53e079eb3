package cafe.woden.mxclient.verification;

import cafe.woden.mxclient.matrix.HomeserverApi;
import cafe.woden.mxclient.matrix.HomeserverConnection;
import cafe.woden.mxclient.matrix.TransactionIds;
import cafe.woden.mxclient.model.ValidationException;
import cafe.woden.mxclient.model.VerificationEmoji;
import cafe.woden.mxclient.model.VerificationFlow;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import org.jmolecules.architecture.layered.InfrastructureLayer;
import org.springframework.stereotype.Component;

/**
 * Sends the handshake's {@code m.key.verification.*} messages as to-device events and runs the
 * accepting side of the SAS key agreement for flows the peer started.
 */
@Component
@InfrastructureLayer
public class ToDeviceVerificationHandshake implements VerificationHandshake {

  static final String SAS_METHOD = "m.sas.v1";

  private static final ObjectMapper CANONICAL_JSON =
      JsonMapper.builder().enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS).build();

  private record SasSession(SasKeyAgreement agreement, String peerDeviceId) {}

  private final HomeserverConnection connection;
  private final Map<String, SasSession> sessions = new ConcurrentHashMap<>();

  public ToDeviceVerificationHandshake(HomeserverConnection connection) {
    this.connection = connection;
  }

  @Override
  public void accept(VerificationFlow flow) {
    ObjectNode content = content(flow);
    content.put("from_device", connection.requireDeviceId());
    content.putArray("methods").add(SAS_METHOD);
    send("m.key.verification.ready", flow, content);
  }

  @Override
  public void start(VerificationFlow flow, VerificationSignal.Started started) {
    ObjectNode start = started.content();
    if (!SAS_METHOD.equals(started.method())
        || !offers(start, "key_agreement_protocols", SasKeyAgreement.KEY_AGREEMENT_PROTOCOL)
        || !offers(start, "hashes", SasKeyAgreement.HASH)
        || !offers(start, "message_authentication_codes", SasKeyAgreement.MAC)
        || !offers(start, "short_authentication_string", SasKeyAgreement.SAS_EMOJI)) {
      throw new ValidationException("m.unknown_method", "Unsupported verification method " + started.method());
    }
    String peerDevice = started.fromDeviceId().isBlank() ? flow.fromDeviceId() : started.fromDeviceId();
    SasKeyAgreement agreement = new SasKeyAgreement();

    ObjectNode content = content(flow);
    content.put("method", SAS_METHOD);
    content.put("key_agreement_protocol", SasKeyAgreement.KEY_AGREEMENT_PROTOCOL);
    content.put("hash", SasKeyAgreement.HASH);
    content.put("message_authentication_code", SasKeyAgreement.MAC);
    content.putArray("short_authentication_string").add(SasKeyAgreement.SAS_EMOJI);
    content.put("commitment", SasKeyAgreement.sha256(agreement.publicKey() + canonicalJson(start)));
    send("m.key.verification.accept", flow, content);
    sessions.put(flow.flowId(), new SasSession(agreement, peerDevice));
  }

  @Override
  public List<VerificationEmoji> exchangeKeys(VerificationFlow flow, String theirKey) {
    SasSession session = sessions.get(flow.flowId());
    if (session == null) {
      throw new ValidationException("m.unexpected_message", "Key for unstarted verification " + flow.flowId());
    }
    SasKeyAgreement agreement = session.agreement();
    List<VerificationEmoji> emojis =
        agreement.emojis(
            theirKey,
            new SasKeyAgreement.Party(flow.userId(), session.peerDeviceId(), theirKey),
            new SasKeyAgreement.Party(
                connection.requireUserId(), connection.requireDeviceId(), agreement.publicKey()),
            flow.flowId());

    ObjectNode content = content(flow);
    content.put("key", agreement.publicKey());
    send("m.key.verification.key", flow, content);
    return emojis;
  }

  @Override
  public void confirm(VerificationFlow flow) {
    send("m.key.verification.done", flow, content(flow));
    sessions.remove(flow.flowId());
  }

  @Override
  public void cancel(VerificationFlow flow, String code, String reason) {
    sessions.remove(flow.flowId());
    ObjectNode content = content(flow);
    content.put("code", code);
    content.put("reason", reason);
    send("m.key.verification.cancel", flow, content);
  }

  @Override
  public void release(String flowId) {
    sessions.remove(flowId);
  }

  private static boolean offers(ObjectNode start, String field, String value) {
    for (JsonNode n : start.path(field)) {
      if (value.equals(n.asText())) return true;
    }
    return false;
  }

  /** Sorted keys, no insignificant whitespace. */
  static String canonicalJson(ObjectNode node) {
    try {
      return CANONICAL_JSON.writeValueAsString(CANONICAL_JSON.convertValue(node, Object.class));
    } catch (JsonProcessingException e) {
      throw new ValidationException("m.invalid_message", "Unserializable start message");
    }
  }

  private void send(String type, VerificationFlow flow, ObjectNode content) {
    HomeserverApi api = connection.require();
    String device = flow.fromDeviceId() == null || flow.fromDeviceId().isBlank() ? "*" : flow.fromDeviceId();
    api.sendToDevice(type, flow.userId(), device, TransactionIds.next(), content);
  }

  private static ObjectNode content(VerificationFlow flow) {
    ObjectNode content = JsonNodeFactory.instance.objectNode();
    content.put("transaction_id", flow.flowId());
    return content;
  }
}
