package cafe.woden.mxclient.model;

import org.jmolecules.ddd.annotation.ValueObject;

/** Another member of a direct room, as shown in the buddy list. */
@ValueObject
public record Buddy(String userId, String displayName, String avatarUrl, Presence presence) {
  public Buddy {
    if (displayName == null || displayName.isBlank()) displayName = UserIds.localpart(userId);
    if (presence == null) presence = Presence.UNKNOWN;
  }
}
