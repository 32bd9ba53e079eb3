package cafe.woden.mxclient.model;

import java.time.Instant;
import java.util.Objects;
import org.jmolecules.ddd.annotation.ValueObject;

/** One rendered timeline entry. Optional fields are {@code null} when absent. */
@ValueObject
public record Message(
    String roomId,
    String eventId,
    String senderId,
    String senderName,
    String body,
    Instant timestamp,
    MessageType type,
    String mediaUrl,
    String fileName,
    String replyToEventId,
    ReplyPreview replyPreview,
    boolean edited) {

  public Message {
    Objects.requireNonNull(roomId, "roomId");
    Objects.requireNonNull(eventId, "eventId");
    if (senderId == null) senderId = "";
    if (senderName == null || senderName.isBlank()) senderName = senderId;
    if (body == null) body = "";
    if (timestamp == null) timestamp = Instant.EPOCH;
    if (type == null) type = MessageType.TEXT;
  }

  public Message withEditedBody(String newBody) {
    return new Message(
        roomId,
        eventId,
        senderId,
        senderName,
        newBody,
        timestamp,
        type,
        mediaUrl,
        fileName,
        replyToEventId,
        replyPreview,
        true);
  }
}
