package cafe.woden.mxclient.model;

import org.jmolecules.ddd.annotation.ValueObject;

/** A pending room invitation. Name and inviter fields are {@code null} when the server omits them. */
@ValueObject
public record Invite(String roomId, String roomName, String inviterId, String inviterName) {}
