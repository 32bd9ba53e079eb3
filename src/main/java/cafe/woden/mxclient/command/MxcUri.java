package cafe.woden.mxclient.command;

import cafe.woden.mxclient.model.ValidationException;

/** A parsed {@code mxc://server/mediaId} reference. */
record MxcUri(String serverName, String mediaId) {

  static final String SCHEME = "mxc://";

  static MxcUri parse(String raw) {
    String s = raw == null ? "" : raw.trim();
    if (!s.startsWith(SCHEME)) throw new ValidationException("Not a media reference: " + raw);
    String rest = s.substring(SCHEME.length());
    int slash = rest.indexOf('/');
    if (slash <= 0 || slash == rest.length() - 1) {
      throw new ValidationException("Malformed media reference: " + raw);
    }
    String mediaId = rest.substring(slash + 1);
    if (mediaId.contains("/")) throw new ValidationException("Malformed media reference: " + raw);
    return new MxcUri(rest.substring(0, slash), mediaId);
  }
}
