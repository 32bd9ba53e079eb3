package cafe.woden.mxclient.verification;

import cafe.woden.mxclient.model.ValidationException;
import cafe.woden.mxclient.model.VerificationEmoji;
import java.math.BigInteger;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.KeyFactory;
import java.security.KeyPair;
import java.security.KeyPairGenerator;
import java.security.MessageDigest;
import java.security.PublicKey;
import java.security.interfaces.XECPublicKey;
import java.security.spec.NamedParameterSpec;
import java.security.spec.XECPublicKeySpec;
import java.util.ArrayList;
import java.util.Base64;
import java.util.List;
import javax.crypto.KeyAgreement;
import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;

/**
 * One side of an {@code m.sas.v1} exchange using {@code curve25519-hkdf-sha256}: an ephemeral
 * X25519 key pair, the shared secret with the peer's key, and the emoji rendering of the derived
 * short authentication string.
 */
final class SasKeyAgreement {

  static final String KEY_AGREEMENT_PROTOCOL = "curve25519-hkdf-sha256";
  static final String HASH = "sha256";
  static final String MAC = "hkdf-hmac-sha256.v2";
  static final String SAS_EMOJI = "emoji";

  static final int SAS_BYTES = 6;
  private static final int KEY_BYTES = 32;
  private static final String SAS_INFO_PREFIX = "MATRIX_KEY_VERIFICATION_SAS|";

  static final List<VerificationEmoji> EMOJI_TABLE =
      List.of(
          new VerificationEmoji("🐶", "Dog"),
          new VerificationEmoji("🐱", "Cat"),
          new VerificationEmoji("🦁", "Lion"),
          new VerificationEmoji("🐎", "Horse"),
          new VerificationEmoji("🦄", "Unicorn"),
          new VerificationEmoji("🐷", "Pig"),
          new VerificationEmoji("🐘", "Elephant"),
          new VerificationEmoji("🐰", "Rabbit"),
          new VerificationEmoji("🐼", "Panda"),
          new VerificationEmoji("🐓", "Rooster"),
          new VerificationEmoji("🐧", "Penguin"),
          new VerificationEmoji("🐢", "Turtle"),
          new VerificationEmoji("🐟", "Fish"),
          new VerificationEmoji("🐙", "Octopus"),
          new VerificationEmoji("🦋", "Butterfly"),
          new VerificationEmoji("🌷", "Flower"),
          new VerificationEmoji("🌳", "Tree"),
          new VerificationEmoji("🌵", "Cactus"),
          new VerificationEmoji("🍄", "Mushroom"),
          new VerificationEmoji("🌏", "Globe"),
          new VerificationEmoji("🌙", "Moon"),
          new VerificationEmoji("☁️", "Cloud"),
          new VerificationEmoji("🔥", "Fire"),
          new VerificationEmoji("🍌", "Banana"),
          new VerificationEmoji("🍎", "Apple"),
          new VerificationEmoji("🍓", "Strawberry"),
          new VerificationEmoji("🌽", "Corn"),
          new VerificationEmoji("🍕", "Pizza"),
          new VerificationEmoji("🎂", "Cake"),
          new VerificationEmoji("❤️", "Heart"),
          new VerificationEmoji("😀", "Smiley"),
          new VerificationEmoji("🤖", "Robot"),
          new VerificationEmoji("🎩", "Hat"),
          new VerificationEmoji("👓", "Glasses"),
          new VerificationEmoji("🔧", "Spanner"),
          new VerificationEmoji("🎅", "Santa"),
          new VerificationEmoji("👍", "Thumbs Up"),
          new VerificationEmoji("☂️", "Umbrella"),
          new VerificationEmoji("⌛", "Hourglass"),
          new VerificationEmoji("⏰", "Clock"),
          new VerificationEmoji("🎁", "Gift"),
          new VerificationEmoji("💡", "Light Bulb"),
          new VerificationEmoji("📕", "Book"),
          new VerificationEmoji("✏️", "Pencil"),
          new VerificationEmoji("📎", "Paperclip"),
          new VerificationEmoji("✂️", "Scissors"),
          new VerificationEmoji("🔒", "Lock"),
          new VerificationEmoji("🔑", "Key"),
          new VerificationEmoji("🔨", "Hammer"),
          new VerificationEmoji("☎️", "Telephone"),
          new VerificationEmoji("🏁", "Flag"),
          new VerificationEmoji("🚂", "Train"),
          new VerificationEmoji("🚲", "Bicycle"),
          new VerificationEmoji("✈️", "Aeroplane"),
          new VerificationEmoji("🚀", "Rocket"),
          new VerificationEmoji("🏆", "Trophy"),
          new VerificationEmoji("⚽", "Ball"),
          new VerificationEmoji("🎸", "Guitar"),
          new VerificationEmoji("🎺", "Trumpet"),
          new VerificationEmoji("🔔", "Bell"),
          new VerificationEmoji("⚓", "Anchor"),
          new VerificationEmoji("🎧", "Headphones"),
          new VerificationEmoji("📁", "Folder"),
          new VerificationEmoji("📌", "Pin"));

  private final KeyPair keyPair;

  SasKeyAgreement() {
    try {
      this.keyPair = KeyPairGenerator.getInstance("X25519").generateKeyPair();
    } catch (GeneralSecurityException e) {
      throw new IllegalStateException("X25519 is not available", e);
    }
  }

  /** Our ephemeral public key, unpadded base64 as the wire format wants it. */
  String publicKey() {
    BigInteger u = ((XECPublicKey) keyPair.getPublic()).getU();
    byte[] raw = new byte[KEY_BYTES];
    for (int i = 0; i < KEY_BYTES; i++) raw[i] = u.shiftRight(8 * i).byteValue();
    return encode(raw);
  }

  byte[] sharedSecret(String theirPublicKey) {
    try {
      KeyAgreement agreement = KeyAgreement.getInstance("X25519");
      agreement.init(keyPair.getPrivate());
      agreement.doPhase(decodePublicKey(theirPublicKey), true);
      return agreement.generateSecret();
    } catch (GeneralSecurityException e) {
      throw new ValidationException("m.invalid_message", "Unusable verification key: " + e.getMessage());
    }
  }

  /** Emojis both sides must see, for a flow started by {@code starter} and accepted by {@code accepter}. */
  List<VerificationEmoji> emojis(String theirPublicKey, Party starter, Party accepter, String flowId) {
    String info =
        SAS_INFO_PREFIX
            + starter.userId() + "|" + starter.deviceId() + "|" + starter.publicKey() + "|"
            + accepter.userId() + "|" + accepter.deviceId() + "|" + accepter.publicKey() + "|"
            + flowId;
    byte[] sas =
        hkdfSha256(sharedSecret(theirPublicKey), info.getBytes(StandardCharsets.UTF_8), SAS_BYTES);
    return emojisFor(sas);
  }

  record Party(String userId, String deviceId, String publicKey) {}

  /** Seven emojis from the first 42 bits, six bits each. */
  static List<VerificationEmoji> emojisFor(byte[] sas) {
    if (sas.length < SAS_BYTES) throw new IllegalArgumentException("need " + SAS_BYTES + " bytes");
    long bits = 0;
    for (int i = 0; i < SAS_BYTES; i++) bits = (bits << 8) | (sas[i] & 0xFF);
    List<VerificationEmoji> out = new ArrayList<>(7);
    for (int i = 0; i < 7; i++) {
      out.add(EMOJI_TABLE.get((int) ((bits >>> (42 - 6 * i)) & 0x3F)));
    }
    return List.copyOf(out);
  }

  /** RFC 5869 with an all-zero salt. */
  static byte[] hkdfSha256(byte[] ikm, byte[] info, int length) {
    try {
      Mac mac = Mac.getInstance("HmacSHA256");
      mac.init(new SecretKeySpec(new byte[KEY_BYTES], "HmacSHA256"));
      byte[] prk = mac.doFinal(ikm);
      mac.init(new SecretKeySpec(prk, "HmacSHA256"));
      byte[] out = new byte[length];
      byte[] block = new byte[0];
      int pos = 0;
      for (int counter = 1; pos < length; counter++) {
        mac.update(block);
        mac.update(info);
        mac.update((byte) counter);
        block = mac.doFinal();
        int n = Math.min(block.length, length - pos);
        System.arraycopy(block, 0, out, pos, n);
        pos += n;
      }
      return out;
    } catch (GeneralSecurityException e) {
      throw new IllegalStateException("HmacSHA256 is not available", e);
    }
  }

  static String sha256(String text) {
    try {
      return encode(MessageDigest.getInstance("SHA-256").digest(text.getBytes(StandardCharsets.UTF_8)));
    } catch (GeneralSecurityException e) {
      throw new IllegalStateException("SHA-256 is not available", e);
    }
  }

  private static PublicKey decodePublicKey(String encoded) throws GeneralSecurityException {
    byte[] raw;
    try {
      raw = Base64.getDecoder().decode(encoded == null ? "" : encoded.trim());
    } catch (IllegalArgumentException e) {
      throw new ValidationException("m.invalid_message", "Verification key is not base64");
    }
    if (raw.length != KEY_BYTES) {
      throw new ValidationException("m.invalid_message", "Verification key has " + raw.length + " bytes");
    }
    // Little-endian on the wire; the top bit is ignored for X25519.
    raw[KEY_BYTES - 1] &= 0x7F;
    byte[] bigEndian = new byte[KEY_BYTES];
    for (int i = 0; i < KEY_BYTES; i++) bigEndian[i] = raw[KEY_BYTES - 1 - i];
    return KeyFactory.getInstance("XDH")
        .generatePublic(new XECPublicKeySpec(NamedParameterSpec.X25519, new BigInteger(1, bigEndian)));
  }

  private static String encode(byte[] data) {
    return Base64.getEncoder().withoutPadding().encodeToString(data);
  }
}
