package cafe.woden.mxclient.matrix;

import org.jmolecules.ddd.annotation.ValueObject;

/** Credentials issued by a successful login or registration. */
@ValueObject
public record LoginResult(String userId, String deviceId, String accessToken, String refreshToken) {}
