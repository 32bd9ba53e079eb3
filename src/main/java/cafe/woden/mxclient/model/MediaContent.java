package cafe.woden.mxclient.model;

import java.util.Locale;

/** Downloaded media bytes plus their content type. */
public record MediaContent(byte[] data, String contentType) {

  public MediaContent {
    if (data == null) data = new byte[0];
    if (contentType == null || contentType.isBlank()) contentType = sniffContentType(data);
    contentType = contentType.toLowerCase(Locale.ROOT);
  }

  /** Recognises the image formats avatars and inline images use. */
  public static String sniffContentType(byte[] data) {
    if (data == null) return "application/octet-stream";
    if (startsWith(data, 0x89, 'P', 'N', 'G')) return "image/png";
    if (startsWith(data, 0xFF, 0xD8)) return "image/jpeg";
    if (startsWith(data, 'G', 'I', 'F')) return "image/gif";
    if (data.length >= 12 && startsWith(data, 'R', 'I', 'F', 'F')
        && data[8] == 'W' && data[9] == 'E' && data[10] == 'B' && data[11] == 'P') {
      return "image/webp";
    }
    return "application/octet-stream";
  }

  private static boolean startsWith(byte[] data, int... prefix) {
    if (data.length < prefix.length) return false;
    for (int i = 0; i < prefix.length; i++) {
      if ((data[i] & 0xFF) != prefix[i]) return false;
    }
    return true;
  }
}
