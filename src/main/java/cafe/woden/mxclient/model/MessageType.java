package cafe.woden.mxclient.model;

import java.util.Locale;

public enum MessageType {
  TEXT,
  IMAGE,
  FILE,
  AUDIO,
  VIDEO;

  /** Maps a Matrix {@code msgtype}; text-like types (notice, emote) render as {@link #TEXT}. */
  public static MessageType fromMsgtype(String msgtype) {
    if (msgtype == null) return TEXT;
    return switch (msgtype.toLowerCase(Locale.ROOT)) {
      case "m.image" -> IMAGE;
      case "m.file" -> FILE;
      case "m.audio" -> AUDIO;
      case "m.video" -> VIDEO;
      default -> TEXT;
    };
  }
}
