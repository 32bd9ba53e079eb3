package cafe.woden.mxclient.model;

import java.util.List;
import java.util.Set;
import org.jmolecules.ddd.annotation.ValueObject;

/** Snapshot of a joined room as listed in the contact/room window. */
@ValueObject
public record Room(
    String roomId,
    String name,
    boolean direct,
    String topic,
    int memberCount,
    String lastMessage,
    int unreadCount,
    Set<String> tags,
    List<String> spaceIds) {

  public Room {
    if (name == null || name.isBlank()) name = roomId;
    if (topic == null) topic = "";
    if (lastMessage == null) lastMessage = "";
    tags = tags == null ? Set.of() : Set.copyOf(tags);
    spaceIds = spaceIds == null ? List.of() : List.copyOf(spaceIds);
  }
}
