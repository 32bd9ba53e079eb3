package cafe.woden.mxclient.model;

import org.jmolecules.ddd.annotation.ValueObject;

/** A space listed in a public room directory. */
@ValueObject
public record PublicSpace(
    String roomId, String name, String topic, String canonicalAlias, int memberCount, String avatarUrl) {}
