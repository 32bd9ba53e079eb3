package cafe.woden.mxclient.model;

import org.jmolecules.ddd.annotation.ValueObject;

/** One entry of a space hierarchy, with whether the local account already joined it. */
@ValueObject
public record SpaceChild(
    String roomId, String name, String topic, int memberCount, boolean space, boolean joined) {}
