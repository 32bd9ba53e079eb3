package cafe.woden.mxclient.verification;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import cafe.woden.mxclient.model.ValidationException;
import cafe.woden.mxclient.model.VerificationEmoji;
import java.util.Arrays;
import java.util.Collections;
import java.util.HexFormat;
import java.util.List;
import org.junit.jupiter.api.Test;

class SasKeyAgreementTest {

  @Test
  void bothSidesDeriveTheSameEmojis() {
    SasKeyAgreement alice = new SasKeyAgreement();
    SasKeyAgreement bob = new SasKeyAgreement();
    var starter = new SasKeyAgreement.Party("@alice:example.org", "ALICEDEV", alice.publicKey());
    var accepter = new SasKeyAgreement.Party("@bob:example.org", "BOBDEV", bob.publicKey());

    List<VerificationEmoji> seenByAlice = alice.emojis(bob.publicKey(), starter, accepter, "t1");
    List<VerificationEmoji> seenByBob = bob.emojis(alice.publicKey(), starter, accepter, "t1");

    assertEquals(7, seenByAlice.size());
    assertEquals(seenByAlice, seenByBob);
    assertEquals(43, alice.publicKey().length());
  }

  @Test
  void sharedSecretMatchesOnBothSides() {
    SasKeyAgreement a = new SasKeyAgreement();
    SasKeyAgreement b = new SasKeyAgreement();

    byte[] fromA = a.sharedSecret(b.publicKey());
    assertEquals(HexFormat.of().formatHex(fromA), HexFormat.of().formatHex(b.sharedSecret(a.publicKey())));
    assertNotEquals(a.publicKey(), b.publicKey());
  }

  @Test
  void emojisTakeSixBitsEach() {
    assertEquals(Collections.nCopies(7, new VerificationEmoji("🐶", "Dog")), SasKeyAgreement.emojisFor(new byte[6]));

    byte[] ones = new byte[6];
    Arrays.fill(ones, (byte) 0xFF);
    assertEquals(Collections.nCopies(7, new VerificationEmoji("📌", "Pin")), SasKeyAgreement.emojisFor(ones));

    byte[] cats = HexFormat.of().parseHex("041041041040");
    assertEquals(Collections.nCopies(7, new VerificationEmoji("🐱", "Cat")), SasKeyAgreement.emojisFor(cats));
    assertEquals(64, SasKeyAgreement.EMOJI_TABLE.size());
  }

  @Test
  void hkdfMatchesTheRfcVectorWithoutSaltOrInfo() {
    byte[] ikm = new byte[22];
    Arrays.fill(ikm, (byte) 0x0b);

    byte[] okm = SasKeyAgreement.hkdfSha256(ikm, new byte[0], 42);

    assertEquals(
        "8da4e775a563c18f715f802a063c5a31b8a11f5c5ee1879ec3454e5f3c738d2d9d201395faa4b61a96c8",
        HexFormat.of().formatHex(okm));
  }

  @Test
  void malformedPeerKeysAreRejected() {
    SasKeyAgreement a = new SasKeyAgreement();

    ValidationException e = assertThrows(ValidationException.class, () -> a.sharedSecret("AAAA"));
    assertEquals("m.invalid_message", e.errcode());
    assertThrows(ValidationException.class, () -> a.sharedSecret("not base64 !"));
  }
}
