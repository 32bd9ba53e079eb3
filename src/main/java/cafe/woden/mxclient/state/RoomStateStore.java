package cafe.woden.mxclient.state;

import cafe.woden.mxclient.bus.MatrixEvent;
import cafe.woden.mxclient.bus.MatrixEventBus;
import cafe.woden.mxclient.config.MatrixProperties;
import cafe.woden.mxclient.model.Buddy;
import cafe.woden.mxclient.model.Invite;
import cafe.woden.mxclient.model.Message;
import cafe.woden.mxclient.model.Presence;
import cafe.woden.mxclient.model.ReplyPreview;
import cafe.woden.mxclient.model.Room;
import cafe.woden.mxclient.model.RoomProfile;
import cafe.woden.mxclient.model.SharedRoom;
import cafe.woden.mxclient.model.Space;
import cafe.woden.mxclient.model.UserIds;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Supplier;
import org.jmolecules.architecture.layered.ApplicationLayer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Authoritative in-memory view of the account: rooms, spaces, buddies, timelines, reactions,
 * invites, typing and unread counters.
 *
 * <p>Single writer (the sync loop, plus the local-only unread and visibility operations), many
 * readers. Every mutation emits its bus events while still holding the write lock, so subscribers
 * see events for a room in exactly the order the updates were applied. Queries return immutable
 * snapshots.
 */
@Component
@ApplicationLayer
public class RoomStateStore {
  private static final Logger log = LoggerFactory.getLogger(RoomStateStore.class);

  private static final class UserEntry {
    String displayName;
    String avatarUrl;
    Presence presence = Presence.UNKNOWN;
    String statusMsg;
    Long lastActiveAgoMs;
  }

  private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();
  private final MatrixEventBus bus;
  private final int maxTimelineMessages;
  private final int replyPreviewMaxChars;

  private String selfUserId = "";
  private final Map<String, RoomEntry> rooms = new LinkedHashMap<>();
  private final Map<String, Invite> invites = new LinkedHashMap<>();
  private final Map<String, UserEntry> users = new HashMap<>();
  private Map<String, List<String>> directRoomsByUser = Map.of();
  private Set<String> directRoomIds = Set.of();
  private final Map<String, Integer> visibleWindows = new HashMap<>();

  public RoomStateStore(MatrixEventBus bus, MatrixProperties props) {
    this.bus = Objects.requireNonNull(bus, "bus");
    this.maxTimelineMessages = props.state().maxTimelineMessages();
    this.replyPreviewMaxChars = props.state().replyPreviewMaxChars();
  }

  /** Drops all state and starts over for {@code selfUserId}. */
  public void reset(String selfUserId) {
    write(
        () -> {
          this.selfUserId = Objects.toString(selfUserId, "");
          rooms.clear();
          invites.clear();
          users.clear();
          directRoomsByUser = Map.of();
          directRoomIds = Set.of();
          visibleWindows.clear();
          bus.emit(new MatrixEvent.RoomListChanged(null));
        });
  }

  public void clear() {
    reset("");
  }

  public String selfUserId() {
    return read(() -> selfUserId);
  }

  public boolean isKnownRoom(String roomId) {
    return read(() -> rooms.containsKey(roomId));
  }

  public void applyAll(List<? extends SyncUpdate> updates) {
    for (SyncUpdate u : updates) apply(u);
  }

  public void apply(SyncUpdate update) {
    apply(update, true);
  }

  /**
   * Applies one update. With {@code countUnread} off, new messages land in the timeline without
   * raising the room's unread counter; used for backlog delivered by a full-state sync.
   */
  public void apply(SyncUpdate update, boolean countUnread) {
    if (update == null) return;
    write(() -> applyLocked(update, countUnread));
  }

  private void applyLocked(SyncUpdate u, boolean countUnread) {
    if (u instanceof SyncUpdate.RoomDiscovered d) {
      discover(d.roomId(), d.fallbackName());
    } else if (u instanceof SyncUpdate.InviteReceived i) {
      invite(i);
    } else if (u instanceof SyncUpdate.RoomLeft l) {
      leave(l.roomId());
    } else if (u instanceof SyncUpdate.PresenceChanged p) {
      presence(p);
    } else if (u instanceof SyncUpdate.DirectRoomsChanged d) {
      directRooms(d.roomsByUser());
    } else {
      RoomEntry room = ensureRoom(u.roomId());
      if (u instanceof SyncUpdate.MessageAdded m) {
        addMessage(room, m, countUnread);
      } else if (u instanceof SyncUpdate.MessageEdited e) {
        editMessage(room, e);
      } else if (u instanceof SyncUpdate.MessageRedacted r) {
        redact(room, r.targetEventId());
      } else if (u instanceof SyncUpdate.ReactionAdded r) {
        react(room, r);
      } else if (u instanceof SyncUpdate.TypingChanged t) {
        typing(room, t.userIds());
      } else if (u instanceof SyncUpdate.MemberChanged m) {
        member(room, m);
      } else if (u instanceof SyncUpdate.RoomCreated c) {
        if (room.space != c.space()) {
          room.space = c.space();
          roomListChanged(room.roomId);
        }
      } else if (u instanceof SyncUpdate.RoomNamed n) {
        if (!Objects.equals(room.explicitName, n.name())) {
          room.explicitName = n.name();
          roomListChanged(room.roomId);
        }
      } else if (u instanceof SyncUpdate.RoomTopicChanged t) {
        String topic = Objects.toString(t.topic(), "");
        if (!room.topic.equals(topic)) {
          room.topic = topic;
          roomListChanged(room.roomId);
        }
      } else if (u instanceof SyncUpdate.RoomAliasChanged a) {
        if (!Objects.equals(room.canonicalAlias, a.alias())) {
          room.canonicalAlias = a.alias();
          roomListChanged(room.roomId);
        }
      } else if (u instanceof SyncUpdate.RoomSummary s) {
        if (s.joinedMemberCount() != null
            && !Objects.equals(room.summaryJoinedCount, s.joinedMemberCount())) {
          room.summaryJoinedCount = s.joinedMemberCount();
          roomListChanged(room.roomId);
        }
      } else if (u instanceof SyncUpdate.SpaceChildChanged c) {
        boolean changed =
            c.present() ? room.spaceChildren.add(c.childRoomId()) : room.spaceChildren.remove(c.childRoomId());
        if (changed) roomListChanged(room.roomId);
      } else if (u instanceof SyncUpdate.RoomTagsChanged t) {
        if (!room.tags.equals(t.tags())) {
          room.tags = t.tags();
          roomListChanged(room.roomId);
        }
      }
    }
  }

  private RoomEntry ensureRoom(String roomId) {
    RoomEntry room = rooms.get(roomId);
    if (room != null) return room;
    log.debug("[mxcafe] implicitly creating room {}", roomId);
    return discover(roomId, null);
  }

  private RoomEntry discover(String roomId, String fallbackName) {
    RoomEntry room = rooms.get(roomId);
    boolean created = room == null;
    if (created) {
      room = new RoomEntry(roomId);
      rooms.put(roomId, room);
    }
    boolean renamed = fallbackName != null && !fallbackName.equals(room.fallbackName);
    if (renamed) room.fallbackName = fallbackName;
    if (invites.remove(roomId) != null) {
      bus.emit(new MatrixEvent.InviteRemoved(roomId));
    }
    if (created || renamed) roomListChanged(roomId);
    return room;
  }

  private void addMessage(RoomEntry room, SyncUpdate.MessageAdded m, boolean countUnread) {
    if (room.timeline.containsKey(m.eventId()) || room.tombstones.contains(m.eventId())) return;

    Message message =
        new Message(
            room.roomId,
            m.eventId(),
            m.senderId(),
            senderName(room, m.senderId()),
            m.body(),
            m.timestamp(),
            m.type(),
            m.mediaUrl(),
            m.fileName(),
            m.replyToEventId(),
            replyPreview(room, m),
            false);
    room.timeline.put(message.eventId(), message);
    trimTimeline(room);
    bus.emit(new MatrixEvent.MessageReceived(message));

    boolean own = !selfUserId.isEmpty() && selfUserId.equals(m.senderId());
    if (countUnread && !own && visibleWindows.getOrDefault(room.roomId, 0) == 0) {
      room.unread++;
      bus.emit(new MatrixEvent.UnreadChanged(room.roomId, room.unread));
    }
  }

  private ReplyPreview replyPreview(RoomEntry room, SyncUpdate.MessageAdded m) {
    if (m.replyToEventId() != null) {
      Message target = room.timeline.get(m.replyToEventId());
      if (target != null) {
        return ReplyPreview.truncated(target.senderName(), target.body(), replyPreviewMaxChars);
      }
    }
    if (m.fallbackReplyBody() != null) {
      String sender = m.fallbackReplySender();
      String name = UserIds.looksLikeUserId(sender) ? senderName(room, sender) : sender;
      return ReplyPreview.truncated(name, m.fallbackReplyBody(), replyPreviewMaxChars);
    }
    return null;
  }

  private void trimTimeline(RoomEntry room) {
    Iterator<String> it = room.timeline.keySet().iterator();
    while (room.timeline.size() > maxTimelineMessages && it.hasNext()) {
      String evicted = it.next();
      it.remove();
      room.reactions.remove(evicted);
    }
  }

  private void editMessage(RoomEntry room, SyncUpdate.MessageEdited e) {
    Message target = room.timeline.get(e.targetEventId());
    if (target == null) {
      log.debug("[mxcafe] edit {} targets unknown message {}", e.editEventId(), e.targetEventId());
      return;
    }
    if (!target.senderId().equals(e.senderId())) {
      log.debug(
          "[mxcafe] ignoring edit of {} by {}, message belongs to {}",
          e.targetEventId(),
          e.senderId(),
          target.senderId());
      return;
    }
    String body = Objects.toString(e.newBody(), "");
    if (target.edited() && target.body().equals(body)) return;
    room.timeline.put(target.eventId(), target.withEditedBody(body));
    bus.emit(new MatrixEvent.MessageEdited(room.roomId, target.eventId(), body));
  }

  private void redact(RoomEntry room, String targetEventId) {
    if (targetEventId == null || !room.tombstones.add(targetEventId)) return;
    Message removed = room.timeline.remove(targetEventId);
    room.reactions.remove(targetEventId);
    if (removed != null) {
      bus.emit(new MatrixEvent.MessageDeleted(room.roomId, targetEventId));
    }
  }

  private void react(RoomEntry room, SyncUpdate.ReactionAdded r) {
    if (r.key() == null || r.key().isEmpty()) return;
    if (room.tombstones.contains(r.targetEventId())) return;
    LinkedHashMap<String, String> senders =
        room.reactions
            .computeIfAbsent(r.targetEventId(), k -> new LinkedHashMap<>())
            .computeIfAbsent(r.key(), k -> new LinkedHashMap<>());
    if (senders.containsKey(r.senderId())) return;
    senders.put(r.senderId(), senderName(room, r.senderId()));
    bus.emit(
        new MatrixEvent.ReactionUpdated(
            room.roomId, r.targetEventId(), r.key(), new LinkedHashSet<>(senders.values())));
  }

  private void typing(RoomEntry room, List<String> userIds) {
    List<String> others = new ArrayList<>();
    for (String id : userIds) {
      if (!id.equals(selfUserId) && !others.contains(id)) others.add(id);
    }
    if (others.equals(room.typingUserIds)) return;
    room.typingUserIds = List.copyOf(others);
    bus.emit(new MatrixEvent.TypingChanged(room.roomId, typingNames(room)));
  }

  private List<String> typingNames(RoomEntry room) {
    List<String> names = new ArrayList<>(room.typingUserIds.size());
    for (String id : room.typingUserIds) names.add(senderName(room, id));
    return names;
  }

  private void member(RoomEntry room, SyncUpdate.MemberChanged m) {
    String membership = Objects.toString(m.membership(), "");
    boolean present = membership.equals("join") || membership.equals("invite");
    boolean changed;
    if (present) {
      RoomEntry.Member next =
          new RoomEntry.Member(m.userId(), m.displayName(), m.avatarUrl(), membership);
      changed = !next.equals(room.members.put(m.userId(), next));
      if (membership.equals("join")) {
        UserEntry user = users.computeIfAbsent(m.userId(), k -> new UserEntry());
        if (m.displayName() != null && !m.displayName().isBlank()) user.displayName = m.displayName();
        if (m.avatarUrl() != null) user.avatarUrl = m.avatarUrl();
      }
    } else {
      changed = room.members.remove(m.userId()) != null;
    }
    if (changed && directRoomIds.contains(room.roomId)) roomListChanged(room.roomId);
  }

  private void invite(SyncUpdate.InviteReceived i) {
    if (rooms.containsKey(i.roomId())) return;
    Invite next = new Invite(i.roomId(), i.roomName(), i.inviterId(), i.inviterName());
    if (next.equals(invites.get(i.roomId()))) return;
    invites.put(i.roomId(), next);
    bus.emit(new MatrixEvent.InviteReceived(next));
  }

  private void leave(String roomId) {
    RoomEntry removed = rooms.remove(roomId);
    visibleWindows.remove(roomId);
    if (invites.remove(roomId) != null) {
      bus.emit(new MatrixEvent.InviteRemoved(roomId));
    }
    if (removed != null) roomListChanged(roomId);
  }

  private void presence(SyncUpdate.PresenceChanged p) {
    Presence next = Presence.fromMatrix(p.presence(), p.statusMsg());
    if (next == null) return;
    UserEntry user = users.computeIfAbsent(p.userId(), k -> new UserEntry());
    user.lastActiveAgoMs = p.lastActiveAgoMs();
    if (user.presence == next && Objects.equals(user.statusMsg, p.statusMsg())) return;
    user.presence = next;
    user.statusMsg = p.statusMsg();
    bus.emit(new MatrixEvent.PresenceChanged(buddyLocked(p.userId())));
  }

  private void directRooms(Map<String, List<String>> byUser) {
    if (byUser.equals(directRoomsByUser)) return;
    directRoomsByUser = byUser;
    Set<String> ids = new LinkedHashSet<>();
    byUser.values().forEach(ids::addAll);
    directRoomIds = Set.copyOf(ids);
    roomListChanged(null);
  }

  private void roomListChanged(String roomId) {
    bus.emit(new MatrixEvent.RoomListChanged(roomId));
  }

  /** Clears every typing indicator, used when the connection drops. */
  public void clearTyping() {
    write(
        () -> {
          for (RoomEntry room : rooms.values()) {
            if (room.typingUserIds.isEmpty()) continue;
            room.typingUserIds = List.of();
            bus.emit(new MatrixEvent.TypingChanged(room.roomId, List.of()));
          }
        });
  }

  /**
   * Reference-counts windows showing a room. Messages arriving while at least one window shows the
   * room do not count as unread.
   */
  public void setRoomVisible(String roomId, boolean visible) {
    write(
        () -> {
          int n = visibleWindows.getOrDefault(roomId, 0) + (visible ? 1 : -1);
          if (n <= 0) visibleWindows.remove(roomId);
          else visibleWindows.put(roomId, n);
        });
  }

  /** Zeroes the room's unread counter. Local only; the read receipt is the caller's business. */
  public void markRead(String roomId) {
    write(
        () -> {
          RoomEntry room = rooms.get(roomId);
          if (room == null) return;
          room.unread = 0;
          bus.emit(new MatrixEvent.UnreadCleared(roomId));
        });
  }

  public List<Room> rooms() {
    return read(
        () -> {
          List<Room> out = new ArrayList<>();
          for (RoomEntry r : rooms.values()) {
            if (!r.space) out.add(snapshot(r));
          }
          return List.copyOf(out);
        });
  }

  public Optional<Room> room(String roomId) {
    return read(
        () -> {
          RoomEntry r = rooms.get(roomId);
          return r == null ? Optional.<Room>empty() : Optional.of(snapshot(r));
        });
  }

  public List<Space> spaces() {
    return read(
        () -> {
          List<Space> out = new ArrayList<>();
          for (RoomEntry r : rooms.values()) {
            if (r.space) out.add(new Space(r.roomId, displayName(r), r.topic, List.copyOf(r.spaceChildren)));
          }
          return List.copyOf(out);
        });
  }

  public Optional<RoomProfile> roomProfile(String roomId) {
    return read(
        () -> {
          RoomEntry r = rooms.get(roomId);
          if (r == null) return Optional.<RoomProfile>empty();
          return Optional.of(
              new RoomProfile(
                  r.roomId,
                  displayName(r),
                  r.topic,
                  r.canonicalAlias,
                  r.memberCount(),
                  directRoomIds.contains(r.roomId),
                  r.space));
        });
  }

  /** Other members of direct rooms, one entry per user. */
  public List<Buddy> buddies() {
    return read(
        () -> {
          List<Buddy> out = new ArrayList<>();
          for (Map.Entry<String, List<String>> e : directRoomsByUser.entrySet()) {
            String userId = e.getKey();
            if (userId.equals(selfUserId)) continue;
            if (e.getValue().stream().noneMatch(rooms::containsKey)) continue;
            out.add(buddyLocked(userId));
          }
          return List.copyOf(out);
        });
  }

  public Buddy buddy(String userId) {
    return read(() -> buddyLocked(userId));
  }

  private Buddy buddyLocked(String userId) {
    UserEntry user = users.get(userId);
    String name = null;
    for (String roomId : directRoomsByUser.getOrDefault(userId, List.of())) {
      RoomEntry room = rooms.get(roomId);
      RoomEntry.Member m = room == null ? null : room.members.get(userId);
      if (m != null && m.displayName() != null && !m.displayName().isBlank()) {
        name = m.displayName();
        break;
      }
    }
    if (name == null && user != null) name = user.displayName;
    return new Buddy(
        userId,
        name,
        user == null ? null : user.avatarUrl,
        user == null ? Presence.UNKNOWN : user.presence);
  }

  public Presence presenceOf(String userId) {
    return read(
        () -> {
          UserEntry user = users.get(userId);
          return user == null ? Presence.UNKNOWN : user.presence;
        });
  }

  public List<Message> timeline(String roomId) {
    return read(
        () -> {
          RoomEntry r = rooms.get(roomId);
          return r == null ? List.<Message>of() : List.copyOf(r.timeline.values());
        });
  }

  public Optional<Message> findMessage(String roomId, String eventId) {
    return read(
        () -> {
          RoomEntry r = rooms.get(roomId);
          return r == null ? Optional.<Message>empty() : Optional.ofNullable(r.timeline.get(eventId));
        });
  }

  /** Reaction key to sender display names, for one message. */
  public Map<String, Set<String>> reactions(String roomId, String eventId) {
    return read(
        () -> {
          RoomEntry r = rooms.get(roomId);
          Map<String, LinkedHashMap<String, String>> byKey = r == null ? null : r.reactions.get(eventId);
          if (byKey == null) return Map.<String, Set<String>>of();
          Map<String, Set<String>> out = new LinkedHashMap<>();
          byKey.forEach(
              (key, senders) ->
                  out.put(key, Collections.unmodifiableSet(new LinkedHashSet<>(senders.values()))));
          return Collections.unmodifiableMap(out);
        });
  }

  public List<Invite> pendingInvites() {
    return read(() -> List.copyOf(invites.values()));
  }

  public Optional<Invite> invite(String roomId) {
    return read(() -> Optional.ofNullable(invites.get(roomId)));
  }

  public Map<String, Integer> unreadCounts() {
    return read(
        () -> {
          Map<String, Integer> out = new LinkedHashMap<>();
          for (RoomEntry r : rooms.values()) out.put(r.roomId, r.unread);
          return Collections.unmodifiableMap(out);
        });
  }

  public List<String> typing(String roomId) {
    return read(
        () -> {
          RoomEntry r = rooms.get(roomId);
          return r == null ? List.<String>of() : List.copyOf(typingNames(r));
        });
  }

  public String senderName(String roomId, String userId) {
    return read(() -> senderName(rooms.get(roomId), userId));
  }

  private String senderName(RoomEntry room, String userId) {
    RoomEntry.Member m = room == null ? null : room.members.get(userId);
    if (m != null && m.displayName() != null && !m.displayName().isBlank()) return m.displayName();
    UserEntry user = users.get(userId);
    if (user != null && user.displayName != null && !user.displayName.isBlank()) {
      return user.displayName;
    }
    return UserIds.localpart(userId);
  }

  public Map<String, List<String>> directRoomsByUser() {
    return read(() -> directRoomsByUser);
  }

  /** Known direct rooms shared with {@code userId}. */
  public List<String> directRoomsWith(String userId) {
    return read(
        () -> {
          List<String> out = new ArrayList<>();
          for (String roomId : directRoomsByUser.getOrDefault(userId, List.of())) {
            if (rooms.containsKey(roomId)) out.add(roomId);
          }
          return List.copyOf(out);
        });
  }

  /** Joined rooms where {@code userId} is a member. */
  public List<SharedRoom> sharedRooms(String userId) {
    return read(
        () -> {
          List<SharedRoom> out = new ArrayList<>();
          for (RoomEntry r : rooms.values()) {
            if (r.members.containsKey(userId)) out.add(new SharedRoom(r.roomId, displayName(r)));
          }
          return List.copyOf(out);
        });
  }

  public boolean isJoined(String roomId) {
    return isKnownRoom(roomId);
  }

  private Room snapshot(RoomEntry r) {
    List<String> parents = new ArrayList<>();
    for (RoomEntry candidate : rooms.values()) {
      if (candidate.space && candidate.spaceChildren.contains(r.roomId)) parents.add(candidate.roomId);
    }
    return new Room(
        r.roomId,
        displayName(r),
        directRoomIds.contains(r.roomId),
        r.topic,
        r.memberCount(),
        r.lastMessageBody(),
        r.unread,
        r.tags,
        parents);
  }

  private String displayName(RoomEntry r) {
    if (notBlank(r.explicitName)) return r.explicitName;
    if (notBlank(r.canonicalAlias)) return r.canonicalAlias;
    if (notBlank(r.fallbackName)) return r.fallbackName;
    if (directRoomIds.contains(r.roomId)) {
      for (RoomEntry.Member m : r.members.values()) {
        if (!m.userId().equals(selfUserId)) return senderName(r, m.userId());
      }
    }
    return r.roomId;
  }

  private static boolean notBlank(String s) {
    return s != null && !s.isBlank();
  }

  private void write(Runnable action) {
    lock.writeLock().lock();
    try {
      action.run();
    } finally {
      lock.writeLock().unlock();
    }
  }

  private <T> T read(Supplier<T> query) {
    lock.readLock().lock();
    try {
      return query.get();
    } finally {
      lock.readLock().unlock();
    }
  }
}
