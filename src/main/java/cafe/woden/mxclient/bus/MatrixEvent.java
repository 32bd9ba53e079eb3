package cafe.woden.mxclient.bus;

import cafe.woden.mxclient.model.Buddy;
import cafe.woden.mxclient.model.ConnectionState;
import cafe.woden.mxclient.model.Invite;
import cafe.woden.mxclient.model.Message;
import cafe.woden.mxclient.model.SyncStatus;
import cafe.woden.mxclient.model.VerificationFlow;
import java.util.List;
import java.util.Set;

/**
 * Change notifications published on the {@link MatrixEventBus}.
 *
 * <p>{@link #roomId()} is {@code null} for events that do not belong to a single room.
 */
public sealed interface MatrixEvent permits
    MatrixEvent.MessageReceived,
    MatrixEvent.MessageEdited,
    MatrixEvent.MessageDeleted,
    MatrixEvent.ReactionUpdated,
    MatrixEvent.TypingChanged,
    MatrixEvent.RoomListChanged,
    MatrixEvent.InviteReceived,
    MatrixEvent.InviteRemoved,
    MatrixEvent.SyncStatusChanged,
    MatrixEvent.UnreadChanged,
    MatrixEvent.UnreadCleared,
    MatrixEvent.PresenceChanged,
    MatrixEvent.ConnectionStateChanged,
    MatrixEvent.VerificationUpdated
 {

  String roomId();

  record MessageReceived(Message message) implements MatrixEvent {
    @Override
    public String roomId() {
      return message.roomId();
    }
  }

  record MessageEdited(String roomId, String eventId, String newBody) implements MatrixEvent {}

  record MessageDeleted(String roomId, String eventId) implements MatrixEvent {}

  /** The full set of sender names now carrying {@code key} on {@code eventId}. */
  record ReactionUpdated(String roomId, String eventId, String key, Set<String> senderNames)
      implements MatrixEvent {
    public ReactionUpdated {
      senderNames = Set.copyOf(senderNames);
    }
  }

  /** Display names of everyone typing in the room, local account excluded. */
  record TypingChanged(String roomId, List<String> userNames) implements MatrixEvent {
    public TypingChanged {
      userNames = List.copyOf(userNames);
    }
  }

  /** Room list or buddy list needs a refresh; {@code roomId} is set when one room changed. */
  record RoomListChanged(String roomId) implements MatrixEvent {}

  record InviteReceived(Invite invite) implements MatrixEvent {
    @Override
    public String roomId() {
      return invite.roomId();
    }
  }

  record InviteRemoved(String roomId) implements MatrixEvent {}

  record SyncStatusChanged(SyncStatus status) implements MatrixEvent {
    @Override
    public String roomId() {
      return null;
    }
  }

  record UnreadChanged(String roomId, int unreadCount) implements MatrixEvent {}

  record UnreadCleared(String roomId) implements MatrixEvent {}

  record PresenceChanged(Buddy buddy) implements MatrixEvent {
    @Override
    public String roomId() {
      return null;
    }
  }

  record ConnectionStateChanged(ConnectionState state, String userId, String reason)
      implements MatrixEvent {
    @Override
    public String roomId() {
      return null;
    }
  }

  /** {@code active} is false for a queued flow and for a flow leaving the active slot. */
  record VerificationUpdated(VerificationFlow flow, boolean active) implements MatrixEvent {
    @Override
    public String roomId() {
      return null;
    }
  }
}
