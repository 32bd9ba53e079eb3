package cafe.woden.mxclient.state;

import cafe.woden.mxclient.model.Message;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/** Mutable per-room state. Only touched under the store's lock. */
final class RoomEntry {

  record Member(String userId, String displayName, String avatarUrl, String membership) {
    boolean joined() {
      return "join".equals(membership);
    }
  }

  final String roomId;
  String explicitName;
  String canonicalAlias;
  String fallbackName;
  String topic = "";
  boolean space;
  Integer summaryJoinedCount;
  Set<String> tags = Set.of();
  int unread;
  List<String> typingUserIds = List.of();

  final Map<String, Member> members = new LinkedHashMap<>();
  final Set<String> spaceChildren = new LinkedHashSet<>();

  /** Visible timeline keyed by event id, in application order. */
  final LinkedHashMap<String, Message> timeline = new LinkedHashMap<>();

  final Set<String> tombstones = new HashSet<>();

  /** target event id -> reaction key -> sender id -> sender display name */
  final Map<String, Map<String, LinkedHashMap<String, String>>> reactions = new LinkedHashMap<>();

  RoomEntry(String roomId) {
    this.roomId = roomId;
  }

  int memberCount() {
    if (summaryJoinedCount != null) return summaryJoinedCount;
    int n = 0;
    for (Member m : members.values()) {
      if (m.joined()) n++;
    }
    return n;
  }

  String lastMessageBody() {
    String last = "";
    for (Message m : timeline.values()) last = m.body();
    return last;
  }
}
