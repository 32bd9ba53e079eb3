package cafe.woden.mxclient.session;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.Objects;
import org.jmolecules.ddd.annotation.ValueObject;

/** What {@code session.json} holds: enough to resume without asking for the password again. */
@ValueObject
@JsonIgnoreProperties(ignoreUnknown = true)
public record PersistedSession(
    @JsonProperty("homeserver_url") String homeserverUrl,
    @JsonProperty("user_id") String userId,
    @JsonProperty("device_id") String deviceId,
    @JsonProperty("access_token") String accessToken,
    @JsonProperty("refresh_token") String refreshToken) {

  public PersistedSession {
    Objects.requireNonNull(homeserverUrl, "homeserverUrl");
    Objects.requireNonNull(userId, "userId");
    Objects.requireNonNull(accessToken, "accessToken");
    if (deviceId == null) deviceId = "";
  }

  @Override
  public String toString() {
    return "PersistedSession[homeserverUrl=" + homeserverUrl + ", userId=" + userId
        + ", deviceId=" + deviceId + "]";
  }
}
