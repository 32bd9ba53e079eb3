package cafe.woden.mxclient.matrix;

import cafe.woden.mxclient.model.ConnectionException;
import cafe.woden.mxclient.model.MatrixException;
import cafe.woden.mxclient.model.MediaContent;
import cafe.woden.mxclient.model.NotFoundException;
import cafe.woden.mxclient.model.TransientException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.jmolecules.architecture.layered.InfrastructureLayer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** {@link HomeserverApi} over the Matrix client-server HTTP API. */
@InfrastructureLayer
final class HttpHomeserverApi implements HomeserverApi {
  private static final Logger log = LoggerFactory.getLogger(HttpHomeserverApi.class);

  private static final String CLIENT_V3 = "/_matrix/client/v3";
  private static final String CLIENT_V1 = "/_matrix/client/v1";
  private static final String MEDIA_V3 = "/_matrix/media/v3";
  private static final String FULL_STATE_FILTER =
      "{\"room\":{\"timeline\":{\"limit\":50},\"state\":{\"lazy_load_members\":false}}}";


  private final HttpClient http;
  private final ObjectMapper json;
  private final URI base;
  private final String accessToken;
  private final Duration requestTimeout;

  HttpHomeserverApi(
      HttpClient http, ObjectMapper json, URI base, String accessToken, Duration requestTimeout) {
    this.http = Objects.requireNonNull(http, "http");
    this.json = Objects.requireNonNull(json, "json");
    this.base = Objects.requireNonNull(base, "base");
    this.accessToken = accessToken;
    this.requestTimeout = Objects.requireNonNull(requestTimeout, "requestTimeout");
  }

  @Override
  public String homeserverUrl() {
    return base.toString();
  }

  @Override
  public String accessToken() {
    return accessToken;
  }

  @Override
  public LoginResult login(String username, String password, String deviceDisplayName) {
    ObjectNode body = json.createObjectNode();
    body.put("type", "m.login.password");
    ObjectNode identifier = body.putObject("identifier");
    identifier.put("type", "m.id.user");
    identifier.put("user", username);
    body.put("password", password);
    body.put("initial_device_display_name", deviceDisplayName);
    JsonNode resp = call("POST", CLIENT_V3 + "/login", body, "Login", false);
    return loginResult(resp);
  }

  @Override
  public RegistrationStep register(
      String username,
      String password,
      String deviceDisplayName,
      String authType,
      String authSession) {
    ObjectNode body = json.createObjectNode();
    body.put("username", username);
    body.put("password", password);
    body.put("initial_device_display_name", deviceDisplayName);
    if (authType != null) {
      ObjectNode auth = body.putObject("auth");
      auth.put("type", authType);
      if (authSession != null) auth.put("session", authSession);
    }
    Response resp = exchange("POST", CLIENT_V3 + "/register?kind=user", body, requestTimeout, false);
    if (resp.status() / 100 == 2) {
      return RegistrationStep.completed(loginResult(resp.body()));
    }
    if (resp.status() == 401 && resp.body().has("flows")) {
      List<List<String>> flows = new ArrayList<>();
      for (JsonNode flow : resp.body().path("flows")) {
        List<String> stages = new ArrayList<>();
        for (JsonNode stage : flow.path("stages")) stages.add(stage.asText());
        flows.add(stages);
      }
      String session = resp.body().path("session").asText(null);
      return RegistrationStep.authRequired(session, flows);
    }
    throw MatrixErrors.fromResponse(resp.status(), resp.body(), "Registration");
  }

  @Override
  public LoginResult whoami() {
    JsonNode resp = call("GET", CLIENT_V3 + "/account/whoami", null, "Session check", true);
    return new LoginResult(
        resp.path("user_id").asText(""), resp.path("device_id").asText(""), accessToken, null);
  }

  @Override
  public void logout() {
    call("POST", CLIENT_V3 + "/logout", json.createObjectNode(), "Logout", true);
  }

  @Override
  public JsonNode sync(String since, long timeoutMs, boolean fullState) {
    StringBuilder path = new StringBuilder(CLIENT_V3).append("/sync?timeout=").append(timeoutMs);
    if (since != null && !since.isBlank()) path.append("&since=").append(enc(since));
    if (fullState) path.append("&full_state=true&filter=").append(enc(FULL_STATE_FILTER));
    Duration timeout = requestTimeout.plusMillis(Math.max(0, timeoutMs));
    Response resp = exchange("GET", path.toString(), null, timeout, true);
    return expectOk(resp, "Sync");
  }

  @Override
  public String sendEvent(String roomId, String eventType, String txnId, ObjectNode content) {
    String path =
        CLIENT_V3 + "/rooms/" + enc(roomId) + "/send/" + enc(eventType) + "/" + enc(txnId);
    return call("PUT", path, content, "Send " + eventType, true).path("event_id").asText("");
  }

  @Override
  public String redact(String roomId, String eventId, String reason, String txnId) {
    ObjectNode body = json.createObjectNode();
    if (reason != null && !reason.isBlank()) body.put("reason", reason);
    String path =
        CLIENT_V3 + "/rooms/" + enc(roomId) + "/redact/" + enc(eventId) + "/" + enc(txnId);
    return call("PUT", path, body, "Redact", true).path("event_id").asText("");
  }

  @Override
  public String joinRoom(String roomIdOrAlias) {
    JsonNode resp =
        call("POST", CLIENT_V3 + "/join/" + enc(roomIdOrAlias), json.createObjectNode(), "Join", true);
    return resp.path("room_id").asText(roomIdOrAlias);
  }

  @Override
  public void leaveRoom(String roomId) {
    call("POST", CLIENT_V3 + "/rooms/" + enc(roomId) + "/leave", json.createObjectNode(), "Leave", true);
  }

  @Override
  public String createRoom(ObjectNode request) {
    return call("POST", CLIENT_V3 + "/createRoom", request, "Create room", true)
        .path("room_id")
        .asText("");
  }

  @Override
  public JsonNode searchUserDirectory(String term, int limit) {
    ObjectNode body = json.createObjectNode();
    body.put("search_term", term);
    body.put("limit", limit);
    return call("POST", CLIENT_V3 + "/user_directory/search", body, "User search", true);
  }

  @Override
  public JsonNode publicRooms(String server, ObjectNode filterRequest) {
    String path = CLIENT_V3 + "/publicRooms";
    if (server != null && !server.isBlank()) path += "?server=" + enc(server);
    return call("POST", path, filterRequest, "Room directory", true);
  }

  @Override
  public JsonNode spaceHierarchy(String spaceId, int limit) {
    String path =
        CLIENT_V1 + "/rooms/" + enc(spaceId) + "/hierarchy?max_depth=1&limit=" + Math.max(1, limit);
    return call("GET", path, null, "Space hierarchy", true);
  }

  @Override
  public JsonNode profile(String userId) {
    return call("GET", CLIENT_V3 + "/profile/" + enc(userId), null, "Profile", true);
  }

  @Override
  public JsonNode presence(String userId) {
    return call("GET", CLIENT_V3 + "/presence/" + enc(userId) + "/status", null, "Presence", true);
  }

  @Override
  public void setPresence(String userId, String presence, String statusMsg) {
    ObjectNode body = json.createObjectNode();
    body.put("presence", presence);
    if (statusMsg != null) body.put("status_msg", statusMsg);
    call("PUT", CLIENT_V3 + "/presence/" + enc(userId) + "/status", body, "Set presence", true);
  }

  @Override
  public void setTyping(String roomId, String userId, boolean typing, long timeoutMs) {
    ObjectNode body = json.createObjectNode();
    body.put("typing", typing);
    if (typing) body.put("timeout", timeoutMs);
    String path = CLIENT_V3 + "/rooms/" + enc(roomId) + "/typing/" + enc(userId);
    call("PUT", path, body, "Typing", true);
  }

  @Override
  public void sendReadReceipt(String roomId, String eventId) {
    String path = CLIENT_V3 + "/rooms/" + enc(roomId) + "/receipt/m.read/" + enc(eventId);
    call("POST", path, json.createObjectNode(), "Read receipt", true);
  }

  @Override
  public void putRoomTag(String userId, String roomId, String tag) {
    call("PUT", tagPath(userId, roomId, tag), json.createObjectNode(), "Set tag", true);
  }

  @Override
  public void deleteRoomTag(String userId, String roomId, String tag) {
    call("DELETE", tagPath(userId, roomId, tag), null, "Remove tag", true);
  }

  @Override
  public void putAccountData(String userId, String type, ObjectNode content) {
    String path = CLIENT_V3 + "/user/" + enc(userId) + "/account_data/" + enc(type);
    call("PUT", path, content, "Account data", true);
  }

  @Override
  public JsonNode roomState(String roomId, String eventType, String stateKey) {
    String path = CLIENT_V3 + "/rooms/" + enc(roomId) + "/state/" + enc(eventType);
    if (stateKey != null && !stateKey.isEmpty()) path += "/" + enc(stateKey);
    return call("GET", path, null, "Room state", true);
  }

  @Override
  public JsonNode joinedMembers(String roomId) {
    return call("GET", CLIENT_V3 + "/rooms/" + enc(roomId) + "/joined_members", null, "Members", true);
  }

  @Override
  public JsonNode messages(String roomId, String from, int limit) {
    StringBuilder path =
        new StringBuilder(CLIENT_V3)
            .append("/rooms/")
            .append(enc(roomId))
            .append("/messages?dir=b&limit=")
            .append(Math.max(1, limit));
    if (from != null && !from.isBlank()) path.append("&from=").append(enc(from));
    return call("GET", path.toString(), null, "History", true);
  }

  @Override
  public MediaContent downloadMedia(String serverName, String mediaId) {
    String suffix = "/download/" + enc(serverName) + "/" + enc(mediaId);
    try {
      return download(CLIENT_V1 + "/media" + suffix);
    } catch (NotFoundException | ConnectionException e) {
      // Servers without authenticated media answer 404 (or 401 for unknown endpoints).
      log.debug("[mxcafe] Authenticated media download failed, trying legacy endpoint: {}", e.getMessage());
      return download(MEDIA_V3 + suffix);
    }
  }

  @Override
  public String uploadMedia(byte[] data, String contentType, String fileName) {
    String path = MEDIA_V3 + "/upload";
    if (fileName != null && !fileName.isBlank()) path += "?filename=" + enc(fileName);
    HttpRequest request =
        authorized(HttpRequest.newBuilder(base.resolve(path)))
            .timeout(requestTimeout)
            .header("Content-Type", contentType)
            .POST(HttpRequest.BodyPublishers.ofByteArray(data))
            .build();
    HttpResponse<String> resp = send(request, HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
    JsonNode body = parse(resp.body());
    if (resp.statusCode() / 100 != 2) throw MatrixErrors.fromResponse(resp.statusCode(), body, "Upload");
    return body.path("content_uri").asText("");
  }

  @Override
  public void sendToDevice(
      String eventType, String userId, String deviceId, String txnId, ObjectNode content) {
    ObjectNode body = json.createObjectNode();
    body.putObject("messages").putObject(userId).set(deviceId, content);
    String path = CLIENT_V3 + "/sendToDevice/" + enc(eventType) + "/" + enc(txnId);
    call("PUT", path, body, "To-device " + eventType, true);
  }

  private MediaContent download(String path) {
    HttpRequest request =
        authorized(HttpRequest.newBuilder(base.resolve(path))).timeout(requestTimeout).GET().build();
    HttpResponse<byte[]> resp = send(request, HttpResponse.BodyHandlers.ofByteArray());
    if (resp.statusCode() / 100 != 2) {
      JsonNode body = parse(new String(resp.body(), StandardCharsets.UTF_8));
      throw MatrixErrors.fromResponse(resp.statusCode(), body, "Media download");
    }
    String contentType = resp.headers().firstValue("Content-Type").orElse(null);
    if (contentType != null) {
      int semi = contentType.indexOf(';');
      if (semi >= 0) contentType = contentType.substring(0, semi).trim();
      if (contentType.equals("application/octet-stream")) contentType = null;
    }
    return new MediaContent(resp.body(), contentType);
  }

  private String tagPath(String userId, String roomId, String tag) {
    return CLIENT_V3 + "/user/" + enc(userId) + "/rooms/" + enc(roomId) + "/tags/" + enc(tag);
  }

  private LoginResult loginResult(JsonNode resp) {
    return new LoginResult(
        resp.path("user_id").asText(""),
        resp.path("device_id").asText(""),
        resp.path("access_token").asText(""),
        resp.path("refresh_token").asText(null));
  }

  private JsonNode call(String method, String path, JsonNode body, String what, boolean auth) {
    return expectOk(exchange(method, path, body, requestTimeout, auth), what);
  }

  private static JsonNode expectOk(Response resp, String what) {
    if (resp.status() / 100 == 2) return resp.body();
    throw MatrixErrors.fromResponse(resp.status(), resp.body(), what);
  }

  private Response exchange(
      String method, String path, JsonNode body, Duration timeout, boolean auth) {
    HttpRequest.Builder b =
        HttpRequest.newBuilder(base.resolve(path)).timeout(timeout).header("Accept", "application/json");
    if (auth) authorized(b);
    if (body != null) {
      b.header("Content-Type", "application/json");
      b.method(method, HttpRequest.BodyPublishers.ofString(write(body), StandardCharsets.UTF_8));
    } else {
      b.method(method, HttpRequest.BodyPublishers.noBody());
    }
    HttpResponse<String> resp = send(b.build(), HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
    return new Response(resp.statusCode(), parse(resp.body()));
  }

  private HttpRequest.Builder authorized(HttpRequest.Builder b) {
    if (accessToken == null || accessToken.isBlank()) {
      throw new ConnectionException(ConnectionException.Reason.NOT_CONNECTED, "No access token");
    }
    return b.header("Authorization", "Bearer " + accessToken);
  }

  private <T> HttpResponse<T> send(HttpRequest request, HttpResponse.BodyHandler<T> handler) {
    try {
      return http.send(request, handler);
    } catch (HttpTimeoutException e) {
      throw new TransientException("Request timed out: " + request.uri().getPath(), e);
    } catch (IOException e) {
      throw new TransientException("Homeserver unreachable: " + e.getMessage(), e);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new TransientException("Request interrupted", e);
    }
  }

  private String write(JsonNode body) {
    try {
      return json.writeValueAsString(body);
    } catch (JsonProcessingException e) {
      throw new MatrixException("", "Could not encode request: " + e.getOriginalMessage(), e);
    }
  }

  private JsonNode parse(String raw) {
    if (raw == null || raw.isBlank()) return json.createObjectNode();
    try {
      JsonNode node = json.readTree(raw);
      return node == null || node instanceof ArrayNode ? json.createObjectNode() : node;
    } catch (JsonProcessingException e) {
      log.debug("[mxcafe] Non-JSON response body: {}", e.getOriginalMessage());
      return json.createObjectNode();
    }
  }

  static String enc(String s) {
    return URLEncoder.encode(s == null ? "" : s, StandardCharsets.UTF_8).replace("+", "%20");
  }

  private record Response(int status, JsonNode body) {}
}
