package cafe.woden.mxclient.matrix;

import cafe.woden.mxclient.model.MediaContent;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.jmolecules.architecture.layered.ApplicationLayer;

/**
 * Blocking client-server API calls against one homeserver.
 *
 * <p>Every call is bounded by the configured request timeout and fails with a {@link
 * cafe.woden.mxclient.model.MatrixException} subclass. Query results that the rest of the client
 * translates itself are returned as raw JSON.
 */
@ApplicationLayer
public interface HomeserverApi {

  String homeserverUrl();

  /** Access token this handle authenticates with, {@code null} for an anonymous handle. */
  String accessToken();

  LoginResult login(String username, String password, String deviceDisplayName);

  /**
   * One registration request. With {@code authType == null} the plain request is sent; otherwise
   * an {@code auth} object with that type and {@code authSession} is attached.
   */
  RegistrationStep register(
      String username,
      String password,
      String deviceDisplayName,
      String authType,
      String authSession);

  /** Account id and device id the access token belongs to. */
  LoginResult whoami();

  void logout();

  JsonNode sync(String since, long timeoutMs, boolean fullState);

  /**
   * Sends a room event and returns its event id. Repeating a call with the same {@code txnId}
   * (see {@link TransactionIds}) does not send the event twice.
   */
  String sendEvent(String roomId, String eventType, String txnId, ObjectNode content);

  String redact(String roomId, String eventId, String reason, String txnId);

  /** Joins by id or alias and returns the room id. */
  String joinRoom(String roomIdOrAlias);

  void leaveRoom(String roomId);

  /** Creates a room from a {@code /createRoom} request body and returns its id. */
  String createRoom(ObjectNode request);

  JsonNode searchUserDirectory(String term, int limit);

  JsonNode publicRooms(String server, ObjectNode filterRequest);

  JsonNode spaceHierarchy(String spaceId, int limit);

  JsonNode profile(String userId);

  JsonNode presence(String userId);

  void setPresence(String userId, String presence, String statusMsg);

  void setTyping(String roomId, String userId, boolean typing, long timeoutMs);

  void sendReadReceipt(String roomId, String eventId);

  void putRoomTag(String userId, String roomId, String tag);

  void deleteRoomTag(String userId, String roomId, String tag);

  void putAccountData(String userId, String type, ObjectNode content);

  /** Content of one state event; {@code NotFoundException} when the room has none. */
  JsonNode roomState(String roomId, String eventType, String stateKey);

  JsonNode joinedMembers(String roomId);

  /** Backwards pagination from {@code from} (or the end of the room when {@code null}). */
  JsonNode messages(String roomId, String from, int limit);

  MediaContent downloadMedia(String serverName, String mediaId);

  /** Uploads bytes and returns their {@code mxc://} URI. */
  String uploadMedia(byte[] data, String contentType, String fileName);

  void sendToDevice(String eventType, String userId, String deviceId, String txnId, ObjectNode content);
}
