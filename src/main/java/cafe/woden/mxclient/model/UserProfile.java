package cafe.woden.mxclient.model;

import java.util.List;
import org.jmolecules.ddd.annotation.ValueObject;

/**
 * Profile card data for one user.
 *
 * <p>{@code presenceSupported} is false when the homeserver has presence disabled and only returns
 * a stale offline stub.
 */
@ValueObject
public record UserProfile(
    String userId,
    String displayName,
    String avatarUrl,
    Presence presence,
    String statusMessage,
    Long lastActiveAgoMs,
    boolean presenceSupported,
    List<SharedRoom> sharedRooms) {

  public UserProfile {
    if (displayName == null || displayName.isBlank()) displayName = UserIds.localpart(userId);
    if (presence == null) presence = Presence.UNKNOWN;
    sharedRooms = sharedRooms == null ? List.of() : List.copyOf(sharedRooms);
  }
}
