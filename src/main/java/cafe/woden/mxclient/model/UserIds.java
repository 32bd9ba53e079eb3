package cafe.woden.mxclient.model;

/** Helpers for Matrix user ids ({@code @localpart:server}). */
public final class UserIds {

  private UserIds() {}

  public static String localpart(String userId) {
    if (userId == null) return "";
    String s = userId.startsWith("@") ? userId.substring(1) : userId;
    int colon = s.indexOf(':');
    return colon > 0 ? s.substring(0, colon) : s;
  }

  public static String serverName(String userId) {
    if (userId == null) return "";
    int colon = userId.indexOf(':');
    return colon >= 0 ? userId.substring(colon + 1) : "";
  }

  public static boolean looksLikeUserId(String s) {
    return s != null && s.startsWith("@") && s.indexOf(':') > 1;
  }
}
