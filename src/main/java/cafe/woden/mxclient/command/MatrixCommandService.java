package cafe.woden.mxclient.command;

import cafe.woden.mxclient.config.ExecutorConfig;
import cafe.woden.mxclient.config.MatrixProperties;
import cafe.woden.mxclient.connection.ConnectionManager;
import cafe.woden.mxclient.logging.LogEntry;
import cafe.woden.mxclient.logging.ServerLog;
import cafe.woden.mxclient.matrix.HomeserverApi;
import cafe.woden.mxclient.matrix.HomeserverConnection;
import cafe.woden.mxclient.matrix.TransactionIds;
import cafe.woden.mxclient.model.Buddy;
import cafe.woden.mxclient.model.ConnectionException;
import cafe.woden.mxclient.model.ConnectionState;
import cafe.woden.mxclient.model.Invite;
import cafe.woden.mxclient.model.MatrixException;
import cafe.woden.mxclient.model.MediaContent;
import cafe.woden.mxclient.model.Message;
import cafe.woden.mxclient.model.MessagesPage;
import cafe.woden.mxclient.model.NotFoundException;
import cafe.woden.mxclient.model.PermissionException;
import cafe.woden.mxclient.model.Presence;
import cafe.woden.mxclient.model.PublicSpace;
import cafe.woden.mxclient.model.Room;
import cafe.woden.mxclient.model.RoomProfile;
import cafe.woden.mxclient.model.Space;
import cafe.woden.mxclient.model.SpaceChild;
import cafe.woden.mxclient.model.TransientException;
import cafe.woden.mxclient.model.UserIds;
import cafe.woden.mxclient.model.UserProfile;
import cafe.woden.mxclient.model.ValidationException;
import cafe.woden.mxclient.model.VerificationFlow;
import cafe.woden.mxclient.state.RoomStateStore;
import cafe.woden.mxclient.sync.SyncResponseTranslator;
import cafe.woden.mxclient.verification.VerificationCoordinator;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.reactivex.rxjava3.core.Completable;
import io.reactivex.rxjava3.core.Scheduler;
import io.reactivex.rxjava3.core.Single;
import io.reactivex.rxjava3.functions.Action;
import io.reactivex.rxjava3.functions.Consumer;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Iterator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.Callable;
import org.jmolecules.architecture.layered.InterfaceLayer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

/**
 * The command surface every window talks to.
 *
 * <p>Snapshot queries answer synchronously from the {@link RoomStateStore}. Everything that needs
 * the homeserver is returned as a cold {@link Completable}/{@link Single} running on the command
 * scheduler; input is validated before any remote call, and mutating calls are retried once on a
 * {@link TransientException}. Remote writes never touch local state: the next sync batch reports
 * their effect.
 */
@Component
@InterfaceLayer
public class MatrixCommandService {
  private static final Logger log = LoggerFactory.getLogger(MatrixCommandService.class);

  static final long TYPING_TIMEOUT_MS = 30_000;
  static final int USER_SEARCH_LIMIT = 50;
  static final int SPACE_HIERARCHY_LIMIT = 50;
  static final int MAX_HISTORY_PAGE = 100;

  private final ConnectionManager connections;
  private final HomeserverConnection connection;
  private final RoomStateStore store;
  private final SyncResponseTranslator translator;
  private final VerificationCoordinator verification;
  private final ServerLog serverLog;
  private final Scheduler scheduler;
  private final int previewMaxChars;

  public MatrixCommandService(
      ConnectionManager connections,
      HomeserverConnection connection,
      RoomStateStore store,
      SyncResponseTranslator translator,
      VerificationCoordinator verification,
      ServerLog serverLog,
      MatrixProperties props,
      @Qualifier(ExecutorConfig.COMMAND_SCHEDULER) Scheduler scheduler) {
    this.connections = Objects.requireNonNull(connections, "connections");
    this.connection = Objects.requireNonNull(connection, "connection");
    this.store = Objects.requireNonNull(store, "store");
    this.translator = Objects.requireNonNull(translator, "translator");
    this.verification = Objects.requireNonNull(verification, "verification");
    this.serverLog = Objects.requireNonNull(serverLog, "serverLog");
    this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
    this.previewMaxChars = props.state().replyPreviewMaxChars();
  }

  // ---------------------------------------------------------------------------------------------
  // Session

  public Single<String> login(String homeserver, String username, String password) {
    return Single.fromCallable(() -> connections.login(homeserver, username, password))
        .subscribeOn(scheduler);
  }

  public Single<String> register(String homeserver, String username, String password) {
    return Single.fromCallable(() -> connections.register(homeserver, username, password))
        .subscribeOn(scheduler);
  }

  public Single<String> restoreSession() {
    return Single.fromCallable(connections::restoreSession).subscribeOn(scheduler);
  }

  public Single<String> reconnect() {
    return Single.fromCallable(connections::reconnect).subscribeOn(scheduler);
  }

  public Completable disconnect() {
    return Completable.fromAction(connections::disconnect).subscribeOn(scheduler);
  }

  public Completable logout() {
    return Completable.fromAction(connections::logout).subscribeOn(scheduler);
  }

  public ConnectionState connectionState() {
    return connections.state();
  }

  public Optional<String> currentUserId() {
    return connections.currentUserId();
  }

  // ---------------------------------------------------------------------------------------------
  // Messages

  /** Sends a text message, optionally as a reply to {@code replyToEventId}. */
  public Completable sendMessage(String roomId, String body, String replyToEventId) {
    return remoteSend(
        "sendMessage",
        txnId -> {
          String room = requireRoomId(roomId);
          requireText(body, "Message");
          ObjectNode content = textContent(body);
          if (replyToEventId != null && !replyToEventId.isBlank()) {
            content
                .putObject("m.relates_to")
                .putObject("m.in_reply_to")
                .put("event_id", replyToEventId.trim());
          }
          connection.require().sendEvent(room, "m.room.message", txnId, content);
        });
  }

  public Completable sendMessage(String roomId, String body) {
    return sendMessage(roomId, body, null);
  }

  public Completable editMessage(String roomId, String eventId, String newBody) {
    return remoteSend(
        "editMessage",
        txnId -> {
          String room = requireRoomId(roomId);
          requireText(newBody, "Message");
          Message original = requireOwnMessage(room, eventId);

          ObjectNode content = textContent("* " + newBody);
          content.set("m.new_content", textContent(newBody));
          content
              .putObject("m.relates_to")
              .put("rel_type", "m.replace")
              .put("event_id", original.eventId());
          connection.require().sendEvent(room, "m.room.message", txnId, content);
        });
  }

  public Completable deleteMessage(String roomId, String eventId) {
    return remoteSend(
        "deleteMessage",
        txnId -> {
          String room = requireRoomId(roomId);
          Message original = requireOwnMessage(room, eventId);
          connection.require().redact(room, original.eventId(), null, txnId);
        });
  }

  public Completable sendReaction(String roomId, String eventId, String key) {
    return remoteSend(
        "sendReaction",
        txnId -> {
          String room = requireRoomId(roomId);
          String target = requireText(eventId, "Event id");
          String k = requireText(key, "Reaction");
          ObjectNode content = JsonNodeFactory.instance.objectNode();
          content
              .putObject("m.relates_to")
              .put("rel_type", "m.annotation")
              .put("event_id", target)
              .put("key", k);
          connection.require().sendEvent(room, "m.reaction", txnId, content);
        });
  }

  /**
   * Uploads a local file and posts it as an {@code m.file} message. The content type is guessed
   * from the file name and contents.
   */
  public Completable uploadFile(String roomId, Path file) {
    return remoteSend(
        "uploadFile",
        txnId -> {
          String room = requireRoomId(roomId);
          if (file == null || !Files.isRegularFile(file)) {
            throw new ValidationException("Not a file: " + file);
          }
          byte[] data;
          String contentType;
          try {
            data = Files.readAllBytes(file);
            contentType = Files.probeContentType(file);
          } catch (IOException e) {
            throw new ValidationException("Cannot read " + file + ": " + e.getMessage());
          }
          if (contentType == null || contentType.isBlank()) {
            contentType = MediaContent.sniffContentType(data);
          }
          String name = file.getFileName().toString();

          HomeserverApi api = connection.require();
          String mxc = api.uploadMedia(data, contentType, name);
          ObjectNode content = JsonNodeFactory.instance.objectNode();
          content.put("msgtype", "m.file");
          content.put("body", name);
          content.put("filename", name);
          content.put("url", mxc);
          content.putObject("info").put("mimetype", contentType).put("size", data.length);
          api.sendEvent(room, "m.room.message", txnId, content);
          log.info("[mxcafe] Uploaded {} ({} bytes) to {}", name, data.length, room);
        });
  }

  /** One page of history before {@code from}, or before the end of the room when absent. */
  public Single<MessagesPage> getRoomMessages(String roomId, int limit, String from) {
    return query(
        () -> {
          String room = requireRoomId(roomId);
          if (limit <= 0) throw new ValidationException("limit must be > 0");
          JsonNode response =
              connection.require().messages(room, blankToNull(from), Math.min(limit, MAX_HISTORY_PAGE));
          return translator.historyPage(
              room, response, userId -> store.senderName(room, userId), previewMaxChars);
        });
  }

  public Single<MediaContent> fetchMedia(String mxcUri) {
    return query(
        () -> {
          MxcUri mxc = MxcUri.parse(mxcUri);
          return connection.require().downloadMedia(mxc.serverName(), mxc.mediaId());
        });
  }

  // ---------------------------------------------------------------------------------------------
  // Rooms

  /** Joins by room id or alias; resolves to the joined room's id. */
  public Single<String> joinRoom(String roomIdOrAlias) {
    return remoteWriteSingle(
        "joinRoom",
        () -> {
          String target = requireText(roomIdOrAlias, "Room id or alias");
          if (!target.startsWith("!") && !target.startsWith("#")) {
            throw new ValidationException("Not a room id or alias: " + target);
          }
          String roomId = connection.require().joinRoom(target);
          log.info("[mxcafe] Joined {} ({})", target, roomId);
          return roomId;
        });
  }

  /** Creates a public room whose alias and name are the local part of {@code alias}. */
  public Single<String> createRoom(String alias) {
    return remoteWriteSingle(
        "createRoom",
        () -> {
          String local = localAlias(alias);
          ObjectNode request = JsonNodeFactory.instance.objectNode();
          request.put("room_alias_name", local);
          request.put("name", local);
          request.put("preset", "public_chat");
          String roomId = connection.require().createRoom(request);
          log.info("[mxcafe] Created room #{} ({})", local, roomId);
          return roomId;
        });
  }

  /**
   * Opens a direct chat with {@code userId}: a trusted private room with {@code is_direct}, then
   * recorded in the account's {@code m.direct} map.
   */
  public Single<String> createDirectRoom(String userId) {
    return remoteWriteSingle(
        "createDirectRoom",
        () -> {
          String peer = requireUserId(userId);
          HomeserverApi api = connection.require();
          String self = connection.requireUserId();

          ObjectNode request = JsonNodeFactory.instance.objectNode();
          request.putArray("invite").add(peer);
          request.put("is_direct", true);
          request.put("preset", "trusted_private_chat");
          String roomId = api.createRoom(request);

          ObjectNode direct = JsonNodeFactory.instance.objectNode();
          for (Map.Entry<String, List<String>> e : store.directRoomsByUser().entrySet()) {
            ArrayNode ids = direct.putArray(e.getKey());
            e.getValue().forEach(ids::add);
          }
          ArrayNode peerRooms =
              direct.has(peer) ? (ArrayNode) direct.get(peer) : direct.putArray(peer);
          peerRooms.add(roomId);
          try {
            api.putAccountData(self, "m.direct", direct);
          } catch (MatrixException e) {
            // The room exists already; retrying the whole command would create a second one.
            log.warn("[mxcafe] Could not record {} as direct chat: {}", roomId, e.getMessage());
          }
          log.info("[mxcafe] Direct chat with {} created ({})", peer, roomId);
          return roomId;
        });
  }

  public Completable leaveRoom(String roomId) {
    return remoteWrite("leaveRoom", () -> connection.require().leaveRoom(requireRoomId(roomId)));
  }

  public Completable acceptInvite(String roomId) {
    return remoteWrite(
        "acceptInvite",
        () -> {
          String room = requireRoomId(roomId);
          connection.require().joinRoom(room);
        });
  }

  public Completable rejectInvite(String roomId) {
    return remoteWrite("rejectInvite", () -> connection.require().leaveRoom(requireRoomId(roomId)));
  }

  /**
   * Leaves every direct room shared with {@code userId}. Rooms that fail to leave are logged and
   * skipped; resolves to the number of rooms left.
   */
  public Single<Integer> removeBuddy(String userId) {
    return Single.fromCallable(
            () -> {
              String peer = requireUserId(userId);
              HomeserverApi api = connection.require();
              int left = 0;
              for (String roomId : store.directRoomsWith(peer)) {
                try {
                  api.leaveRoom(roomId);
                  left++;
                } catch (MatrixException e) {
                  log.warn("[mxcafe] Could not leave direct room {}: {}", roomId, e.getMessage());
                }
              }
              log.info("[mxcafe] Removed buddy {}: left {} direct room(s)", peer, left);
              return left;
            })
        .subscribeOn(scheduler);
  }

  /** Clears the local unread counter right away, then sends the read receipt. */
  public Completable markAsRead(String roomId, String eventId) {
    return remoteWrite(
        "markAsRead",
        () -> {
          String room = requireRoomId(roomId);
          store.markRead(room);
          String target = blankToNull(eventId);
          if (target == null) {
            List<Message> timeline = store.timeline(room);
            if (timeline.isEmpty()) return;
            target = timeline.get(timeline.size() - 1).eventId();
          }
          connection.require().sendReadReceipt(room, target);
        });
  }

  public Completable setRoomTag(String roomId, String tag) {
    return remoteWrite(
        "setRoomTag",
        () ->
            connection
                .require()
                .putRoomTag(connection.requireUserId(), requireRoomId(roomId), requireText(tag, "Tag")));
  }

  public Completable removeRoomTag(String roomId, String tag) {
    return remoteWrite(
        "removeRoomTag",
        () ->
            connection
                .require()
                .deleteRoomTag(
                    connection.requireUserId(), requireRoomId(roomId), requireText(tag, "Tag")));
  }

  public Completable sendTyping(String roomId, boolean typing) {
    return remoteWrite(
        "sendTyping",
        () ->
            connection
                .require()
                .setTyping(requireRoomId(roomId), connection.requireUserId(), typing, TYPING_TIMEOUT_MS));
  }

  public Single<RoomProfile> getRoomInfo(String roomId) {
    return query(
        () -> {
          String room = requireRoomId(roomId);
          return store
              .roomProfile(room)
              .orElseThrow(() -> new NotFoundException("Unknown room " + room));
        });
  }

  /** Joined members as reported by the homeserver, sorted by display name. */
  public Single<List<Buddy>> getRoomMembers(String roomId) {
    return query(
        () -> {
          String room = requireRoomId(roomId);
          JsonNode joined = connection.require().joinedMembers(room).path("joined");
          List<Buddy> out = new ArrayList<>();
          Iterator<Map.Entry<String, JsonNode>> it = joined.fields();
          while (it.hasNext()) {
            Map.Entry<String, JsonNode> e = it.next();
            JsonNode m = e.getValue();
            out.add(
                new Buddy(
                    e.getKey(),
                    blankToNull(m.path("display_name").asText(null)),
                    blankToNull(m.path("avatar_url").asText(null)),
                    store.presenceOf(e.getKey())));
          }
          out.sort(Comparator.comparing(b -> b.displayName().toLowerCase(Locale.ROOT)));
          return List.copyOf(out);
        });
  }

  // ---------------------------------------------------------------------------------------------
  // Directory

  /** User directory search; a blank query or no match resolves to an empty list. */
  public Single<List<Buddy>> searchUsers(String query) {
    return query(
        () -> {
          String term = query == null ? "" : query.trim();
          if (term.isEmpty()) return List.of();
          JsonNode response = connection.require().searchUserDirectory(term, USER_SEARCH_LIMIT);
          List<Buddy> out = new ArrayList<>();
          for (JsonNode u : response.path("results")) {
            String userId = u.path("user_id").asText("");
            if (userId.isEmpty()) continue;
            out.add(
                new Buddy(
                    userId,
                    blankToNull(u.path("display_name").asText(null)),
                    blankToNull(u.path("avatar_url").asText(null)),
                    store.presenceOf(userId)));
          }
          return List.copyOf(out);
        });
  }

  /**
   * Searches a public room directory for spaces.
   *
   * @param server directory to search, {@code null} for the local homeserver's
   */
  public Single<List<PublicSpace>> searchSpaces(String query, int limit, String server) {
    return query(
        () -> {
          if (limit <= 0) throw new ValidationException("limit must be > 0");
          ObjectNode request = JsonNodeFactory.instance.objectNode();
          request.put("limit", limit);
          ObjectNode filter = request.putObject("filter");
          String term = query == null ? "" : query.trim();
          if (!term.isEmpty()) filter.put("generic_search_term", term);
          filter.putArray("room_types").add("m.space");

          JsonNode response = connection.require().publicRooms(blankToNull(server), request);
          List<PublicSpace> out = new ArrayList<>();
          for (JsonNode r : response.path("chunk")) {
            String roomId = r.path("room_id").asText("");
            if (roomId.isEmpty()) continue;
            // Older servers ignore room_types.
            String type = r.path("room_type").asText(null);
            if (type != null && !"m.space".equals(type)) continue;
            out.add(
                new PublicSpace(
                    roomId,
                    blankToNull(r.path("name").asText(null)),
                    blankToNull(r.path("topic").asText(null)),
                    blankToNull(r.path("canonical_alias").asText(null)),
                    r.path("num_joined_members").asInt(0),
                    blankToNull(r.path("avatar_url").asText(null))));
          }
          return List.copyOf(out);
        });
  }

  /** Direct children of a space, each flagged with whether the account already joined it. */
  public Single<List<SpaceChild>> getSpaceChildren(String spaceId) {
    return query(
        () -> {
          String space = requireRoomId(spaceId);
          JsonNode response = connection.require().spaceHierarchy(space, SPACE_HIERARCHY_LIMIT);
          List<SpaceChild> out = new ArrayList<>();
          for (JsonNode r : response.path("rooms")) {
            String roomId = r.path("room_id").asText("");
            if (roomId.isEmpty() || roomId.equals(space)) continue;
            out.add(
                new SpaceChild(
                    roomId,
                    blankToNull(r.path("name").asText(null)),
                    blankToNull(r.path("topic").asText(null)),
                    r.path("num_joined_members").asInt(0),
                    "m.space".equals(r.path("room_type").asText(null)),
                    store.isJoined(roomId)));
          }
          return List.copyOf(out);
        });
  }

  /**
   * Profile card: display name and avatar, live presence when the homeserver supports it, and the
   * joined rooms shared with the user.
   */
  public Single<UserProfile> getUserProfile(String userId) {
    return query(
        () -> {
          String user = requireUserId(userId);
          HomeserverApi api = connection.require();

          String displayName = null;
          String avatarUrl = null;
          try {
            JsonNode profile = api.profile(user);
            displayName = blankToNull(profile.path("displayname").asText(null));
            avatarUrl = blankToNull(profile.path("avatar_url").asText(null));
          } catch (ConnectionException e) {
            throw e;
          } catch (MatrixException e) {
            log.warn("[mxcafe] Profile fetch for {} failed: {}", user, e.getMessage());
          }

          Presence presence = Presence.UNKNOWN;
          String statusMessage = null;
          Long lastActiveAgo = null;
          boolean supported = false;
          try {
            JsonNode p = api.presence(user);
            String state = p.path("presence").asText("");
            boolean stale =
                p.path("currently_active").isMissingNode()
                    && p.path("last_active_ago").isMissingNode()
                    && "offline".equals(state);
            if (!stale) {
              supported = true;
              statusMessage = blankToNull(p.path("status_msg").asText(null));
              Presence mapped = Presence.fromMatrix(state, statusMessage);
              presence = mapped == null ? Presence.UNKNOWN : mapped;
              if (p.hasNonNull("last_active_ago")) lastActiveAgo = p.get("last_active_ago").asLong();
            }
          } catch (ConnectionException e) {
            throw e;
          } catch (MatrixException e) {
            log.debug("[mxcafe] Presence unavailable for {}: {}", user, e.getMessage());
          }

          return new UserProfile(
              user,
              displayName,
              avatarUrl,
              presence,
              statusMessage,
              lastActiveAgo,
              supported,
              store.sharedRooms(user));
        });
  }

  // ---------------------------------------------------------------------------------------------
  // Presence

  public Completable setPresence(Presence presence) {
    return remoteWrite(
        "setPresence",
        () -> {
          if (presence == null || presence == Presence.UNKNOWN) {
            throw new ValidationException("Cannot publish presence " + presence);
          }
          connection
              .require()
              .setPresence(connection.requireUserId(), presence.matrixState(), presence.statusMessage());
        });
  }

  // ---------------------------------------------------------------------------------------------
  // Snapshots

  public List<Room> rooms() {
    return store.rooms();
  }

  public List<Space> spaces() {
    return store.spaces();
  }

  public List<Buddy> buddies() {
    return store.buddies();
  }

  public List<Message> timeline(String roomId) {
    return store.timeline(roomId);
  }

  public Map<String, Set<String>> reactions(String roomId, String eventId) {
    return store.reactions(roomId, eventId);
  }

  public List<Invite> pendingInvites() {
    return store.pendingInvites();
  }

  public Map<String, Integer> unreadCounts() {
    return store.unreadCounts();
  }

  public List<String> typing(String roomId) {
    return store.typing(roomId);
  }

  /** Windows call this with {@code true} when they open a room and {@code false} on close. */
  public void setRoomVisible(String roomId, boolean visible) {
    store.setRoomVisible(requireRoomId(roomId), visible);
  }

  public List<LogEntry> serverLog() {
    return serverLog.snapshot();
  }

  // ---------------------------------------------------------------------------------------------
  // Verification

  public Completable acceptVerification(String flowId) {
    return Completable.fromAction(() -> verification.accept(requireText(flowId, "Flow id")))
        .subscribeOn(scheduler);
  }

  /** "They match". */
  public Completable confirmVerification(String flowId) {
    return Completable.fromAction(() -> verification.confirm(requireText(flowId, "Flow id")))
        .subscribeOn(scheduler);
  }

  /** "They don't match". */
  public Completable mismatchVerification(String flowId) {
    return Completable.fromAction(() -> verification.mismatch(requireText(flowId, "Flow id")))
        .subscribeOn(scheduler);
  }

  public Completable cancelVerification(String flowId) {
    return Completable.fromAction(() -> verification.cancel(requireText(flowId, "Flow id")))
        .subscribeOn(scheduler);
  }

  public Optional<VerificationFlow> activeVerification() {
    return verification.activeFlow();
  }

  public List<VerificationFlow> queuedVerifications() {
    return verification.queuedFlows();
  }

  // ---------------------------------------------------------------------------------------------

  private Completable remoteWrite(String what, Action action) {
    return Completable.fromAction(action)
        .retry(1, MatrixCommandService::isTransient)
        .doOnError(e -> logFailure(what, e))
        .subscribeOn(scheduler);
  }

  /**
   * Like {@link #remoteWrite}, for calls that create an event. The transaction id is drawn once per
   * subscription so the retry repeats the same request instead of sending a second event.
   */
  private Completable remoteSend(String what, Consumer<String> send) {
    return Completable.defer(
            () -> {
              String txnId = TransactionIds.next();
              return Completable.fromAction(() -> send.accept(txnId))
                  .retry(1, MatrixCommandService::isTransient);
            })
        .doOnError(e -> logFailure(what, e))
        .subscribeOn(scheduler);
  }

  private <T> Single<T> remoteWriteSingle(String what, Callable<T> call) {
    return Single.fromCallable(call)
        .retry(1, MatrixCommandService::isTransient)
        .doOnError(e -> logFailure(what, e))
        .subscribeOn(scheduler);
  }

  private <T> Single<T> query(Callable<T> call) {
    return Single.fromCallable(call).subscribeOn(scheduler);
  }

  private static boolean isTransient(Throwable e) {
    return e instanceof TransientException;
  }

  private static void logFailure(String what, Throwable e) {
    if (e instanceof ValidationException) {
      log.debug("[mxcafe] {} rejected: {}", what, e.getMessage());
    } else {
      log.warn("[mxcafe] {} failed: {}", what, e.toString());
    }
  }

  private Message requireOwnMessage(String roomId, String eventId) {
    String id = requireText(eventId, "Event id");
    Message m =
        store
            .findMessage(roomId, id)
            .orElseThrow(() -> new NotFoundException("Unknown message " + id + " in " + roomId));
    if (!m.senderId().equals(store.selfUserId())) {
      throw new PermissionException("Only your own messages can be changed");
    }
    return m;
  }

  private static ObjectNode textContent(String body) {
    ObjectNode content = JsonNodeFactory.instance.objectNode();
    content.put("msgtype", "m.text");
    content.put("body", body);
    return content;
  }

  static String localAlias(String alias) {
    String s = alias == null ? "" : alias.trim();
    if (s.startsWith("#")) s = s.substring(1);
    int colon = s.indexOf(':');
    if (colon >= 0) s = s.substring(0, colon);
    if (s.isBlank()) throw new ValidationException("Room alias is required");
    return s;
  }

  private static String requireRoomId(String roomId) {
    return requireText(roomId, "Room id");
  }

  private static String requireUserId(String userId) {
    String s = requireText(userId, "User id");
    if (!UserIds.looksLikeUserId(s)) throw new ValidationException("Not a user id: " + s);
    return s;
  }

  private static String requireText(String s, String what) {
    if (s == null || s.isBlank()) throw new ValidationException(what + " must not be blank");
    return s.trim();
  }

  private static String blankToNull(String s) {
    return s == null || s.isBlank() ? null : s;
  }
}
