package cafe.woden.mxclient.model;

import java.util.Locale;

/**
 * ICQ-style presence.
 *
 * <p>Matrix only knows {@code online}, {@code unavailable} and {@code offline}; the finer ICQ
 * states travel as well-known status messages that this client both writes and recognises.
 */
public enum Presence {
  ONLINE("online"),
  AWAY("away"),
  EXTENDED_AWAY("na"),
  OCCUPIED("occupied"),
  DO_NOT_DISTURB("dnd"),
  FREE_FOR_CHAT("free_for_chat"),
  INVISIBLE("invisible"),
  OFFLINE("offline"),
  UNKNOWN("unknown");

  static final String STATUS_DND = "Do Not Disturb";
  static final String STATUS_OCCUPIED = "Occupied";
  static final String STATUS_NA = "Not Available";
  static final String STATUS_FREE_FOR_CHAT = "Free for Chat";

  private final String localName;

  Presence(String localName) {
    this.localName = localName;
  }

  /** Short name used by the UI layer ({@code "dnd"}, {@code "na"} ...). */
  public String localName() {
    return localName;
  }

  public static Presence fromLocalName(String raw) {
    if (raw == null) return UNKNOWN;
    String s = raw.trim().toLowerCase(Locale.ROOT);
    for (Presence p : values()) {
      if (p.localName.equals(s) || p.name().equalsIgnoreCase(s)) return p;
    }
    return UNKNOWN;
  }

  /** The Matrix {@code presence} value this state is published as. */
  public String matrixState() {
    return switch (this) {
      case ONLINE, FREE_FOR_CHAT, UNKNOWN -> "online";
      case AWAY, EXTENDED_AWAY, OCCUPIED, DO_NOT_DISTURB -> "unavailable";
      case INVISIBLE, OFFLINE -> "offline";
    };
  }

  /** The status message published alongside {@link #matrixState()}, or {@code null}. */
  public String statusMessage() {
    return switch (this) {
      case DO_NOT_DISTURB -> STATUS_DND;
      case OCCUPIED -> STATUS_OCCUPIED;
      case EXTENDED_AWAY -> STATUS_NA;
      case FREE_FOR_CHAT -> STATUS_FREE_FOR_CHAT;
      default -> null;
    };
  }

  /**
   * Maps a Matrix presence report back to an ICQ state.
   *
   * @return {@code null} when {@code matrixState} is absent, meaning "no change"
   */
  public static Presence fromMatrix(String matrixState, String statusMsg) {
    if (matrixState == null || matrixState.isBlank()) return null;
    String msg = statusMsg == null ? "" : statusMsg.trim();
    return switch (matrixState.trim().toLowerCase(Locale.ROOT)) {
      case "online" -> STATUS_FREE_FOR_CHAT.equalsIgnoreCase(msg) ? FREE_FOR_CHAT : ONLINE;
      case "unavailable" -> {
        if (STATUS_DND.equalsIgnoreCase(msg)) yield DO_NOT_DISTURB;
        if (STATUS_OCCUPIED.equalsIgnoreCase(msg)) yield OCCUPIED;
        if (STATUS_NA.equalsIgnoreCase(msg)) yield EXTENDED_AWAY;
        yield AWAY;
      }
      case "offline" -> OFFLINE;
      default -> UNKNOWN;
    };
  }

  public boolean isOnline() {
    return this != OFFLINE && this != INVISIBLE && this != UNKNOWN;
  }
}
