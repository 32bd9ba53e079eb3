package cafe.woden.mxclient.model;

import org.jmolecules.ddd.annotation.ValueObject;

@ValueObject
public record VerificationEmoji(String symbol, String description) {}
