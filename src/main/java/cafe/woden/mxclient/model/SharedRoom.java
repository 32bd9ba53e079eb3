package cafe.woden.mxclient.model;

import org.jmolecules.ddd.annotation.ValueObject;

@ValueObject
public record SharedRoom(String roomId, String name) {}
