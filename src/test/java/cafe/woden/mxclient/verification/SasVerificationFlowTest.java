package cafe.woden.mxclient.verification;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

import cafe.woden.mxclient.bus.MatrixEventBus;
import cafe.woden.mxclient.config.MatrixProperties;
import cafe.woden.mxclient.matrix.HomeserverApi;
import cafe.woden.mxclient.matrix.HomeserverConnection;
import cafe.woden.mxclient.model.VerificationEmoji;
import cafe.woden.mxclient.model.VerificationFlow;
import cafe.woden.mxclient.model.VerificationState;
import cafe.woden.mxclient.sync.SyncResponseTranslator;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.reactivex.rxjava3.schedulers.Schedulers;
import io.reactivex.rxjava3.schedulers.TestScheduler;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

/** Drives a peer-started SAS flow from raw to-device sync JSON through the real handshake. */
class SasVerificationFlowTest {

  private static final String SELF = "@me:example.org";
  private static final String BOB = "@bob:example.org";

  private final ObjectMapper mapper = new ObjectMapper();
  private final SyncResponseTranslator translator = new SyncResponseTranslator();
  private final HomeserverConnection connection = new HomeserverConnection();
  private final HomeserverApi api = mock(HomeserverApi.class);
  private final VerificationCoordinator coordinator =
      new VerificationCoordinator(
          new MatrixEventBus(Schedulers.trampoline()),
          new ToDeviceVerificationHandshake(connection),
          MatrixProperties.defaults(),
          new TestScheduler());

  @BeforeEach
  void setUp() {
    connection.attach(api, SELF, "MYDEV");
  }

  private void receive(String type, String content) throws Exception {
    String sync =
        "{\"next_batch\": \"s1\", \"to_device\": {\"events\": [{\"type\": \""
            + type
            + "\", \"sender\": \""
            + BOB
            + "\", \"content\": "
            + content
            + "}]}}";
    translator.translate(mapper.readTree(sync), SELF).signals().forEach(coordinator::onSignal);
  }

  private VerificationFlow flow() {
    return coordinator.activeFlow().orElseThrow();
  }

  private void requestAcceptAndStart() throws Exception {
    receive(
        "m.key.verification.request",
        "{\"transaction_id\": \"t1\", \"from_device\": \"BOBDEV\", \"methods\": [\"m.sas.v1\"]}");
    coordinator.accept("t1");
    receive(
        "m.key.verification.start",
        """
        {"transaction_id": "t1", "from_device": "BOBDEV", "method": "m.sas.v1",
         "key_agreement_protocols": ["curve25519-hkdf-sha256"], "hashes": ["sha256"],
         "message_authentication_codes": ["hkdf-hmac-sha256.v2"],
         "short_authentication_string": ["decimal", "emoji"]}
        """);
  }

  @Test
  void peerKeyLeadsToEmojiComparisonAndThenDone() throws Exception {
    requestAcceptAndStart();
    assertEquals(VerificationState.WAITING, flow().state());
    verify(api).sendToDevice(eq("m.key.verification.accept"), eq(BOB), eq("BOBDEV"), anyString(), any());

    SasKeyAgreement bob = new SasKeyAgreement();
    receive("m.key.verification.key", "{\"transaction_id\": \"t1\", \"key\": \"" + bob.publicKey() + "\"}");

    ArgumentCaptor<ObjectNode> key = ArgumentCaptor.forClass(ObjectNode.class);
    verify(api).sendToDevice(eq("m.key.verification.key"), eq(BOB), eq("BOBDEV"), anyString(), key.capture());
    String ourKey = key.getValue().path("key").asText();
    List<VerificationEmoji> seenByBob =
        bob.emojis(
            ourKey,
            new SasKeyAgreement.Party(BOB, "BOBDEV", bob.publicKey()),
            new SasKeyAgreement.Party(SELF, "MYDEV", ourKey),
            "t1");

    assertEquals(VerificationState.EMOJI_COMPARISON, flow().state());
    assertEquals(seenByBob, flow().emojis());

    coordinator.confirm("t1");
    receive("m.key.verification.done", "{\"transaction_id\": \"t1\"}");
    assertEquals(VerificationState.DONE, flow().state());
  }

  @Test
  void unusableKeyCancelsTheFlow() throws Exception {
    requestAcceptAndStart();

    receive("m.key.verification.key", "{\"transaction_id\": \"t1\", \"key\": \"AAAA\"}");

    assertEquals(VerificationState.CANCELLED, flow().state());
    assertTrue(flow().emojis().isEmpty());
    ArgumentCaptor<ObjectNode> cancel = ArgumentCaptor.forClass(ObjectNode.class);
    verify(api).sendToDevice(eq("m.key.verification.cancel"), eq(BOB), eq("BOBDEV"), anyString(), cancel.capture());
    assertEquals("m.invalid_message", cancel.getValue().path("code").asText());
    verify(api, never()).sendToDevice(eq("m.key.verification.key"), anyString(), anyString(), anyString(), any());
  }

  @Test
  void startBeforeAcceptIsIgnored() throws Exception {
    receive(
        "m.key.verification.request",
        "{\"transaction_id\": \"t1\", \"from_device\": \"BOBDEV\", \"methods\": [\"m.sas.v1\"]}");
    receive(
        "m.key.verification.start",
        "{\"transaction_id\": \"t1\", \"from_device\": \"BOBDEV\", \"method\": \"m.sas.v1\"}");

    assertEquals(VerificationState.REQUESTED, flow().state());
    verify(api, never()).sendToDevice(eq("m.key.verification.accept"), anyString(), anyString(), anyString(), any());
  }
}
