package cafe.woden.mxclient.sync;

import cafe.woden.mxclient.model.Message;
import cafe.woden.mxclient.model.MessageType;
import cafe.woden.mxclient.model.MessagesPage;
import cafe.woden.mxclient.model.ReplyPreview;
import cafe.woden.mxclient.state.SyncUpdate;
import cafe.woden.mxclient.verification.VerificationSignal;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Turns {@code /sync} (and {@code /messages}) JSON into ordered {@link SyncUpdate}s and {@link
 * VerificationSignal}s.
 *
 * <p>Order within a response: account data, then each joined room (summary, state, timeline,
 * ephemeral, room account data), then invites, leaves, presence and to-device messages. A
 * malformed event is logged and skipped; it never loses the rest of the response.
 */
@Component
public class SyncResponseTranslator {
  private static final Logger log = LoggerFactory.getLogger(SyncResponseTranslator.class);

  private static final String VERIFICATION_PREFIX = "m.key.verification.";

  public SyncBatch translate(JsonNode sync, String selfUserId) {
    List<SyncUpdate> updates = new ArrayList<>();
    List<VerificationSignal> signals = new ArrayList<>();

    for (JsonNode ev : sync.path("account_data").path("events")) {
      guarded(null, ev, () -> accountData(ev).ifPresent(updates::add));
    }

    JsonNode rooms = sync.path("rooms");
    forEachField(rooms.path("join"), (roomId, room) -> joinedRoom(roomId, room, updates));
    forEachField(
        rooms.path("invite"),
        (roomId, room) -> guarded(roomId, room, () -> updates.add(invite(roomId, room, selfUserId))));
    forEachField(rooms.path("leave"), (roomId, room) -> updates.add(new SyncUpdate.RoomLeft(roomId)));

    for (JsonNode ev : sync.path("presence").path("events")) {
      guarded(null, ev, () -> presence(ev).ifPresent(updates::add));
    }
    for (JsonNode ev : sync.path("to_device").path("events")) {
      guarded(null, ev, () -> verificationSignal(ev, selfUserId).ifPresent(signals::add));
    }

    return new SyncBatch(sync.path("next_batch").asText(null), updates, signals);
  }

  private void joinedRoom(String roomId, JsonNode room, List<SyncUpdate> out) {
    JsonNode count = room.path("summary").path("m.joined_member_count");
    if (count.isNumber()) out.add(new SyncUpdate.RoomSummary(roomId, count.asInt()));

    for (JsonNode ev : room.path("state").path("events")) {
      guarded(roomId, ev, () -> stateEvent(roomId, ev).ifPresent(out::add));
    }
    for (JsonNode ev : room.path("timeline").path("events")) {
      guarded(roomId, ev, () -> roomEvent(roomId, ev).ifPresent(out::add));
    }
    for (JsonNode ev : room.path("ephemeral").path("events")) {
      if (!"m.typing".equals(ev.path("type").asText())) continue;
      List<String> ids = new ArrayList<>();
      for (JsonNode id : ev.path("content").path("user_ids")) ids.add(id.asText());
      out.add(new SyncUpdate.TypingChanged(roomId, ids));
    }
    for (JsonNode ev : room.path("account_data").path("events")) {
      if (!"m.tag".equals(ev.path("type").asText())) continue;
      Set<String> tags = new LinkedHashSet<>();
      ev.path("content").path("tags").fieldNames().forEachRemaining(tags::add);
      out.add(new SyncUpdate.RoomTagsChanged(roomId, tags));
    }
  }

  /** One timeline event; state events in the timeline are handled like the state block. */
  public Optional<SyncUpdate> roomEvent(String roomId, JsonNode ev) {
    if (ev.has("state_key")) return stateEvent(roomId, ev);
    String type = ev.path("type").asText("");
    JsonNode content = ev.path("content");
    switch (type) {
      case "m.room.message":
      case "m.sticker":
        return message(roomId, ev, type);
      case "m.room.redaction": {
        String target = content.path("redacts").asText(ev.path("redacts").asText(""));
        if (target.isEmpty()) return Optional.empty();
        return Optional.of(new SyncUpdate.MessageRedacted(roomId, requireText(ev, "event_id"), target));
      }
      case "m.reaction": {
        JsonNode rel = content.path("m.relates_to");
        if (!"m.annotation".equals(rel.path("rel_type").asText())) return Optional.empty();
        return Optional.of(
            new SyncUpdate.ReactionAdded(
                roomId,
                requireText(ev, "event_id"),
                requireText(rel, "event_id"),
                requireText(ev, "sender"),
                rel.path("key").asText("")));
      }
      default:
        return Optional.empty();
    }
  }

  private Optional<SyncUpdate> message(String roomId, JsonNode ev, String type) {
    JsonNode content = ev.path("content");
    // Redacted events keep their envelope but lose all content.
    if (content.isEmpty()) return Optional.empty();

    String eventId = requireText(ev, "event_id");
    String sender = requireText(ev, "sender");
    JsonNode rel = content.path("m.relates_to");

    if ("m.replace".equals(rel.path("rel_type").asText())) {
      JsonNode newContent = content.path("m.new_content");
      JsonNode source = newContent.isObject() ? newContent : content;
      String body = render(source.path("msgtype").asText("m.text"), source.path("body").asText(""));
      return Optional.of(
          new SyncUpdate.MessageEdited(roomId, eventId, requireText(rel, "event_id"), sender, body));
    }

    String msgtype = "m.sticker".equals(type) ? "m.image" : content.path("msgtype").asText("m.text");
    String replyTo = rel.path("m.in_reply_to").path("event_id").asText(null);
    ReplyFallback.Parsed parsed = ReplyFallback.parse(content.path("body").asText(""));
    MessageType messageType = MessageType.fromMsgtype(msgtype);
    String fileName = content.path("filename").asText(null);
    if (fileName == null && messageType != MessageType.TEXT) fileName = parsed.body();

    return Optional.of(
        new SyncUpdate.MessageAdded(
            roomId,
            eventId,
            sender,
            Instant.ofEpochMilli(ev.path("origin_server_ts").asLong(0)),
            messageType,
            render(msgtype, parsed.body()),
            content.path("url").asText(null),
            fileName,
            replyTo,
            parsed.sender(),
            parsed.quote()));
  }

  private static String render(String msgtype, String body) {
    return "m.emote".equals(msgtype) ? "* " + body : body;
  }

  public Optional<SyncUpdate> stateEvent(String roomId, JsonNode ev) {
    String type = ev.path("type").asText("");
    JsonNode content = ev.path("content");
    String stateKey = ev.path("state_key").asText("");
    switch (type) {
      case "m.room.name":
        return Optional.of(new SyncUpdate.RoomNamed(roomId, content.path("name").asText(null)));
      case "m.room.topic":
        return Optional.of(new SyncUpdate.RoomTopicChanged(roomId, content.path("topic").asText("")));
      case "m.room.canonical_alias":
        return Optional.of(new SyncUpdate.RoomAliasChanged(roomId, content.path("alias").asText(null)));
      case "m.room.create":
        return Optional.of(
            new SyncUpdate.RoomCreated(roomId, "m.space".equals(content.path("type").asText())));
      case "m.space.child":
        if (stateKey.isEmpty()) return Optional.empty();
        boolean present = content.path("via").isArray() && !content.path("via").isEmpty();
        return Optional.of(new SyncUpdate.SpaceChildChanged(roomId, stateKey, present));
      case "m.room.member":
        if (stateKey.isEmpty()) return Optional.empty();
        return Optional.of(
            new SyncUpdate.MemberChanged(
                roomId,
                stateKey,
                content.path("displayname").asText(null),
                content.path("avatar_url").asText(null),
                content.path("membership").asText("leave")));
      default:
        return Optional.empty();
    }
  }

  private SyncUpdate invite(String roomId, JsonNode room, String selfUserId) {
    String name = null;
    String inviter = null;
    Map<String, String> names = new LinkedHashMap<>();
    for (JsonNode ev : room.path("invite_state").path("events")) {
      String type = ev.path("type").asText("");
      JsonNode content = ev.path("content");
      if ("m.room.name".equals(type)) {
        name = content.path("name").asText(null);
      } else if ("m.room.member".equals(type)) {
        String stateKey = ev.path("state_key").asText("");
        String displayName = content.path("displayname").asText(null);
        if (displayName != null) names.put(stateKey, displayName);
        if (stateKey.equals(selfUserId) && "invite".equals(content.path("membership").asText())) {
          inviter = ev.path("sender").asText(null);
        }
      }
    }
    return new SyncUpdate.InviteReceived(roomId, name, inviter, inviter == null ? null : names.get(inviter));
  }

  private Optional<SyncUpdate> accountData(JsonNode ev) {
    if (!"m.direct".equals(ev.path("type").asText())) return Optional.empty();
    Map<String, List<String>> byUser = new LinkedHashMap<>();
    forEachField(
        ev.path("content"),
        (userId, roomIds) -> {
          List<String> ids = new ArrayList<>();
          for (JsonNode id : roomIds) ids.add(id.asText());
          byUser.put(userId, List.copyOf(ids));
        });
    return Optional.of(new SyncUpdate.DirectRoomsChanged(byUser));
  }

  private Optional<SyncUpdate> presence(JsonNode ev) {
    if (!"m.presence".equals(ev.path("type").asText())) return Optional.empty();
    JsonNode content = ev.path("content");
    JsonNode lastActive = content.path("last_active_ago");
    JsonNode active = content.path("currently_active");
    return Optional.of(
        new SyncUpdate.PresenceChanged(
            requireText(ev, "sender"),
            content.path("presence").asText(null),
            content.path("status_msg").asText(null),
            lastActive.isNumber() ? lastActive.asLong() : null,
            active.isBoolean() ? active.asBoolean() : null));
  }

  private Optional<VerificationSignal> verificationSignal(JsonNode ev, String selfUserId) {
    String type = ev.path("type").asText("");
    if (!type.startsWith(VERIFICATION_PREFIX)) return Optional.empty();
    JsonNode content = ev.path("content");
    String flowId = content.path("transaction_id").asText("");
    if (flowId.isEmpty()) return Optional.empty();
    String sender = ev.path("sender").asText("");
    switch (type.substring(VERIFICATION_PREFIX.length())) {
      case "request":
        return Optional.of(
            new VerificationSignal.Requested(
                flowId, sender, content.path("from_device").asText(""), sender.equals(selfUserId)));
      case "ready":
        return Optional.of(new VerificationSignal.Ready(flowId));
      case "start":
        return Optional.of(
            new VerificationSignal.Started(
                flowId,
                content.path("method").asText(""),
                content.path("from_device").asText(""),
                ((ObjectNode) content).deepCopy()));
      case "key":
        return Optional.of(new VerificationSignal.KeyShared(flowId, content.path("key").asText("")));
      case "done":
        return Optional.of(new VerificationSignal.Done(flowId));
      case "cancel":
        return Optional.of(
            new VerificationSignal.Cancelled(
                flowId, content.path("code").asText(""), content.path("reason").asText("")));
      default:
        return Optional.empty();
    }
  }

  /**
   * Folds one {@code /messages?dir=b} response into chronological messages: edits replace the
   * body of the message they target, redactions remove it.
   */
  public MessagesPage historyPage(
      String roomId, JsonNode response, Function<String, String> senderNames, int previewMaxChars) {
    List<JsonNode> chunk = new ArrayList<>();
    response.path("chunk").forEach(chunk::add);

    Map<String, Message> byId = new LinkedHashMap<>();
    for (int i = chunk.size() - 1; i >= 0; i--) {
      JsonNode ev = chunk.get(i);
      Optional<SyncUpdate> update = Optional.empty();
      try {
        update = roomEvent(roomId, ev);
      } catch (RuntimeException e) {
        log.warn("[mxcafe] skipping malformed history event in {}: {}", roomId, e.toString());
      }
      update.ifPresent(u -> foldHistory(u, byId, senderNames, previewMaxChars));
    }
    String end = response.path("end").asText(null);
    return new MessagesPage(new ArrayList<>(byId.values()), end);
  }

  private static void foldHistory(
      SyncUpdate u, Map<String, Message> byId, Function<String, String> senderNames, int previewMaxChars) {
    if (u instanceof SyncUpdate.MessageAdded m) {
      ReplyPreview preview = null;
      Message target = m.replyToEventId() == null ? null : byId.get(m.replyToEventId());
      if (target != null) {
        preview = ReplyPreview.truncated(target.senderName(), target.body(), previewMaxChars);
      } else if (m.fallbackReplyBody() != null) {
        preview =
            ReplyPreview.truncated(
                senderNames.apply(m.fallbackReplySender()), m.fallbackReplyBody(), previewMaxChars);
      }
      byId.putIfAbsent(
          m.eventId(),
          new Message(
              m.roomId(),
              m.eventId(),
              m.senderId(),
              senderNames.apply(m.senderId()),
              m.body(),
              m.timestamp(),
              m.type(),
              m.mediaUrl(),
              m.fileName(),
              m.replyToEventId(),
              preview,
              false));
    } else if (u instanceof SyncUpdate.MessageEdited e) {
      Message target = byId.get(e.targetEventId());
      if (target != null && target.senderId().equals(e.senderId())) {
        byId.put(target.eventId(), target.withEditedBody(e.newBody()));
      }
    } else if (u instanceof SyncUpdate.MessageRedacted r) {
      byId.remove(r.targetEventId());
    }
  }

  private static String requireText(JsonNode node, String field) {
    String v = node.path(field).asText("");
    if (v.isEmpty()) throw new IllegalArgumentException("missing " + field);
    return v;
  }

  private static void guarded(String roomId, JsonNode ev, Runnable action) {
    try {
      action.run();
    } catch (RuntimeException e) {
      log.warn(
          "[mxcafe] skipping malformed {} event{}: {}",
          ev.path("type").asText("?"),
          roomId == null ? "" : " in " + roomId,
          e.toString());
    }
  }

  private interface FieldVisitor {
    void visit(String name, JsonNode value);
  }

  private static void forEachField(JsonNode node, FieldVisitor visitor) {
    Iterator<Map.Entry<String, JsonNode>> it = node.fields();
    while (it.hasNext()) {
      Map.Entry<String, JsonNode> e = it.next();
      visitor.visit(e.getKey(), e.getValue());
    }
  }
}
