package cafe.woden.mxclient.model;

import org.jmolecules.ddd.annotation.ValueObject;

/** Room information card. */
@ValueObject
public record RoomProfile(
    String roomId,
    String name,
    String topic,
    String canonicalAlias,
    int memberCount,
    boolean direct,
    boolean space) {}
