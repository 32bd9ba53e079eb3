package cafe.woden.mxclient.state;

import cafe.woden.mxclient.model.MessageType;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * One domain-level change extracted from a sync response, applied in order by {@link
 * RoomStateStore#apply(SyncUpdate)}.
 */
public sealed interface SyncUpdate permits
    SyncUpdate.RoomDiscovered,
    SyncUpdate.RoomCreated,
    SyncUpdate.RoomNamed,
    SyncUpdate.RoomTopicChanged,
    SyncUpdate.RoomAliasChanged,
    SyncUpdate.RoomSummary,
    SyncUpdate.SpaceChildChanged,
    SyncUpdate.MemberChanged,
    SyncUpdate.MessageAdded,
    SyncUpdate.MessageEdited,
    SyncUpdate.MessageRedacted,
    SyncUpdate.ReactionAdded,
    SyncUpdate.TypingChanged,
    SyncUpdate.PresenceChanged,
    SyncUpdate.InviteReceived,
    SyncUpdate.RoomLeft,
    SyncUpdate.DirectRoomsChanged,
    SyncUpdate.RoomTagsChanged
 {

  /** Room this update belongs to, {@code null} for account-wide updates. */
  String roomId();

  /**
   * Whether the room must already be known before this update is applied. Updates that describe
   * a room themselves (discovery, invites, leaves) return {@code false}.
   */
  default boolean requiresKnownRoom() {
    return roomId() != null;
  }

  /** A joined room seen for the first time; {@code fallbackName} is whatever a lookup found. */
  record RoomDiscovered(String roomId, String fallbackName) implements SyncUpdate {
    @Override
    public boolean requiresKnownRoom() {
      return false;
    }
  }

  record RoomCreated(String roomId, boolean space) implements SyncUpdate {}

  record RoomNamed(String roomId, String name) implements SyncUpdate {}

  record RoomTopicChanged(String roomId, String topic) implements SyncUpdate {}

  record RoomAliasChanged(String roomId, String alias) implements SyncUpdate {}

  record RoomSummary(String roomId, Integer joinedMemberCount) implements SyncUpdate {}

  record SpaceChildChanged(String roomId, String childRoomId, boolean present)
      implements SyncUpdate {}

  /** {@code membership} is the raw Matrix value: join, invite, leave, ban, knock. */
  record MemberChanged(
      String roomId, String userId, String displayName, String avatarUrl, String membership)
      implements SyncUpdate {}

  /**
   * A new timeline message. {@code fallbackReplySender}/{@code fallbackReplyBody} come from a
   * quoted reply fallback in the body, used only when the reply target is unknown.
   */
  record MessageAdded(
      String roomId,
      String eventId,
      String senderId,
      Instant timestamp,
      MessageType type,
      String body,
      String mediaUrl,
      String fileName,
      String replyToEventId,
      String fallbackReplySender,
      String fallbackReplyBody)
      implements SyncUpdate {}

  record MessageEdited(
      String roomId, String editEventId, String targetEventId, String senderId, String newBody)
      implements SyncUpdate {}

  record MessageRedacted(String roomId, String redactionEventId, String targetEventId)
      implements SyncUpdate {}

  record ReactionAdded(
      String roomId, String reactionEventId, String targetEventId, String senderId, String key)
      implements SyncUpdate {}

  record TypingChanged(String roomId, List<String> userIds) implements SyncUpdate {
    public TypingChanged {
      userIds = userIds == null ? List.of() : List.copyOf(userIds);
    }
  }

  /** {@code presence} is the raw Matrix value; {@code null} means "unchanged". */
  record PresenceChanged(
      String userId, String presence, String statusMsg, Long lastActiveAgoMs, Boolean currentlyActive)
      implements SyncUpdate {
    @Override
    public String roomId() {
      return null;
    }
  }

  record InviteReceived(String roomId, String roomName, String inviterId, String inviterName)
      implements SyncUpdate {
    @Override
    public boolean requiresKnownRoom() {
      return false;
    }
  }

  record RoomLeft(String roomId) implements SyncUpdate {
    @Override
    public boolean requiresKnownRoom() {
      return false;
    }
  }

  /** Full content of the {@code m.direct} account data: user id to direct room ids. */
  record DirectRoomsChanged(Map<String, List<String>> roomsByUser) implements SyncUpdate {
    public DirectRoomsChanged {
      roomsByUser = roomsByUser == null ? Map.of() : Map.copyOf(roomsByUser);
    }

    @Override
    public String roomId() {
      return null;
    }
  }

  record RoomTagsChanged(String roomId, Set<String> tags) implements SyncUpdate {
    public RoomTagsChanged {
      tags = tags == null ? Set.of() : Set.copyOf(tags);
    }
  }
}
