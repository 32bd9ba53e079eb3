package cafe.woden.mxclient.model;

import org.jmolecules.ddd.annotation.ValueObject;

/** Quoted sender and (truncated) body of the message a reply points at. */
@ValueObject
public record ReplyPreview(String senderName, String body) {
  public ReplyPreview {
    if (senderName == null) senderName = "";
    if (body == null) body = "";
  }

  public static ReplyPreview truncated(String senderName, String body, int maxChars) {
    String b = body == null ? "" : body.strip();
    if (maxChars > 0 && b.codePointCount(0, b.length()) > maxChars) {
      int end = b.offsetByCodePoints(0, maxChars);
      b = b.substring(0, end) + "…";
    }
    return new ReplyPreview(senderName, b);
  }
}
