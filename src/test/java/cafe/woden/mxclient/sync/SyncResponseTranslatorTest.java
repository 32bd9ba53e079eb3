package cafe.woden.mxclient.sync;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import cafe.woden.mxclient.model.Message;
import cafe.woden.mxclient.model.MessageType;
import cafe.woden.mxclient.model.MessagesPage;
import cafe.woden.mxclient.state.SyncUpdate;
import cafe.woden.mxclient.verification.VerificationSignal;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.junit.jupiter.api.Test;

class SyncResponseTranslatorTest {

  private static final String SELF = "@me:example.org";

  private final ObjectMapper mapper = new ObjectMapper();
  private final SyncResponseTranslator translator = new SyncResponseTranslator();

  private JsonNode json(String text) throws Exception {
    return mapper.readTree(text);
  }

  @Test
  void translatesAJoinedRoomInStateTimelineEphemeralOrder() throws Exception {
    JsonNode sync =
        json(
            """
            {
              "next_batch": "s2",
              "account_data": {"events": [
                {"type": "m.direct", "content": {"@bob:example.org": ["!dm:example.org"]}}
              ]},
              "rooms": {"join": {"!dm:example.org": {
                "summary": {"m.joined_member_count": 2},
                "state": {"events": [
                  {"type": "m.room.member", "state_key": "@bob:example.org",
                   "content": {"membership": "join", "displayname": "Bob"}}
                ]},
                "timeline": {"events": [
                  {"type": "m.room.message", "event_id": "$1", "sender": "@bob:example.org",
                   "origin_server_ts": 1700000000000, "content": {"msgtype": "m.text", "body": "hi"}},
                  {"type": "m.room.message", "event_id": "$2", "sender": "@bob:example.org",
                   "content": {"msgtype": "m.emote", "body": "waves"}},
                  {"type": "m.reaction", "event_id": "$3", "sender": "@me:example.org",
                   "content": {"m.relates_to": {"rel_type": "m.annotation", "event_id": "$1", "key": "👍"}}}
                ]},
                "ephemeral": {"events": [
                  {"type": "m.typing", "content": {"user_ids": ["@bob:example.org"]}}
                ]},
                "account_data": {"events": [
                  {"type": "m.tag", "content": {"tags": {"m.favourite": {}}}}
                ]}
              }}}
            }
            """);

    SyncBatch batch = translator.translate(sync, SELF);

    assertEquals("s2", batch.nextBatch());
    List<SyncUpdate> u = batch.updates();
    assertEquals(8, u.size());
    assertEquals(
        new SyncUpdate.DirectRoomsChanged(Map.of("@bob:example.org", List.of("!dm:example.org"))),
        u.get(0));
    assertEquals(new SyncUpdate.RoomSummary("!dm:example.org", 2), u.get(1));
    assertInstanceOf(SyncUpdate.MemberChanged.class, u.get(2));
    SyncUpdate.MessageAdded hi = assertInstanceOf(SyncUpdate.MessageAdded.class, u.get(3));
    assertEquals("hi", hi.body());
    assertEquals(1700000000000L, hi.timestamp().toEpochMilli());
    assertEquals("* waves", assertInstanceOf(SyncUpdate.MessageAdded.class, u.get(4)).body());
    assertEquals(
        new SyncUpdate.ReactionAdded("!dm:example.org", "$3", "$1", SELF, "👍"), u.get(5));
    assertEquals(new SyncUpdate.TypingChanged("!dm:example.org", List.of("@bob:example.org")), u.get(6));
    assertEquals(new SyncUpdate.RoomTagsChanged("!dm:example.org", Set.of("m.favourite")), u.get(7));
  }

  @Test
  void editsUseNewContentAndRedactionsNameTheirTarget() throws Exception {
    JsonNode edit =
        json(
            """
            {"type": "m.room.message", "event_id": "$e", "sender": "@bob:example.org",
             "content": {"msgtype": "m.text", "body": "* fixed",
               "m.new_content": {"msgtype": "m.text", "body": "fixed"},
               "m.relates_to": {"rel_type": "m.replace", "event_id": "$1"}}}
            """);
    JsonNode redaction =
        json(
            """
            {"type": "m.room.redaction", "event_id": "$r", "sender": "@bob:example.org",
             "redacts": "$1", "content": {}}
            """);

    assertEquals(
        new SyncUpdate.MessageEdited("!r:x", "$e", "$1", "@bob:example.org", "fixed"),
        translator.roomEvent("!r:x", edit).orElseThrow());
    assertEquals(
        new SyncUpdate.MessageRedacted("!r:x", "$r", "$1"),
        translator.roomEvent("!r:x", redaction).orElseThrow());
  }

  @Test
  void replyFallbackIsStrippedAndKeptForThePreview() throws Exception {
    JsonNode reply =
        json(
            """
            {"type": "m.room.message", "event_id": "$2", "sender": "@me:example.org",
             "content": {"msgtype": "m.text",
               "body": "> <@bob:example.org> lunch?\\n\\nsure",
               "m.relates_to": {"m.in_reply_to": {"event_id": "$1"}}}}
            """);

    SyncUpdate.MessageAdded m =
        assertInstanceOf(SyncUpdate.MessageAdded.class, translator.roomEvent("!r:x", reply).orElseThrow());
    assertEquals("sure", m.body());
    assertEquals("$1", m.replyToEventId());
    assertEquals("@bob:example.org", m.fallbackReplySender());
    assertEquals("lunch?", m.fallbackReplyBody());
  }

  @Test
  void mediaMessagesCarryTypeUrlAndFileName() throws Exception {
    JsonNode image =
        json(
            """
            {"type": "m.room.message", "event_id": "$i", "sender": "@bob:example.org",
             "content": {"msgtype": "m.image", "body": "cat.png", "url": "mxc://example.org/abc"}}
            """);

    SyncUpdate.MessageAdded m =
        assertInstanceOf(SyncUpdate.MessageAdded.class, translator.roomEvent("!r:x", image).orElseThrow());
    assertEquals(MessageType.IMAGE, m.type());
    assertEquals("mxc://example.org/abc", m.mediaUrl());
    assertEquals("cat.png", m.fileName());
  }

  @Test
  void malformedEventIsSkippedWithoutLosingTheRest() throws Exception {
    JsonNode sync =
        json(
            """
            {"next_batch": "s9", "rooms": {"join": {"!r:x": {"timeline": {"events": [
              {"type": "m.room.message", "content": {"msgtype": "m.text", "body": "no ids"}},
              {"type": "m.room.message", "event_id": "$ok", "sender": "@bob:example.org",
               "content": {"msgtype": "m.text", "body": "fine"}}
            ]}}}}}
            """);

    SyncBatch batch = translator.translate(sync, SELF);

    assertEquals(1, batch.updates().size());
    assertEquals("fine", assertInstanceOf(SyncUpdate.MessageAdded.class, batch.updates().get(0)).body());
  }

  @Test
  void invitesLeavesPresenceAndVerificationAreTranslated() throws Exception {
    JsonNode sync =
        json(
            """
            {"next_batch": "s3",
             "rooms": {
               "invite": {"!club:example.org": {"invite_state": {"events": [
                 {"type": "m.room.name", "state_key": "", "content": {"name": "Club"}},
                 {"type": "m.room.member", "state_key": "@bob:example.org", "sender": "@bob:example.org",
                  "content": {"membership": "join", "displayname": "Bob"}},
                 {"type": "m.room.member", "state_key": "@me:example.org", "sender": "@bob:example.org",
                  "content": {"membership": "invite"}}
               ]}}},
               "leave": {"!old:example.org": {}}
             },
             "presence": {"events": [
               {"type": "m.presence", "sender": "@bob:example.org",
                "content": {"presence": "unavailable", "status_msg": "Occupied", "last_active_ago": 5}}
             ]},
             "to_device": {"events": [
               {"type": "m.key.verification.request", "sender": "@bob:example.org",
                "content": {"transaction_id": "t1", "from_device": "BOBDEV", "methods": ["m.sas.v1"]}},
               {"type": "m.key.verification.cancel", "sender": "@bob:example.org",
                "content": {"transaction_id": "t0", "code": "m.user", "reason": "nope"}}
             ]}}
            """);

    SyncBatch batch = translator.translate(sync, SELF);

    assertEquals(
        List.of(
            new SyncUpdate.InviteReceived("!club:example.org", "Club", "@bob:example.org", "Bob"),
            new SyncUpdate.RoomLeft("!old:example.org"),
            new SyncUpdate.PresenceChanged("@bob:example.org", "unavailable", "Occupied", 5L, null)),
        batch.updates());
    assertEquals(
        List.of(
            new VerificationSignal.Requested("t1", "@bob:example.org", "BOBDEV", false),
            new VerificationSignal.Cancelled("t0", "m.user", "nope")),
        batch.signals());
  }

  @Test
  void historyPageIsChronologicalWithEditsFolded() throws Exception {
    JsonNode response =
        json(
            """
            {"end": "t_older", "chunk": [
              {"type": "m.room.message", "event_id": "$e", "sender": "@bob:example.org",
               "content": {"msgtype": "m.text", "body": "* second!",
                 "m.new_content": {"msgtype": "m.text", "body": "second!"},
                 "m.relates_to": {"rel_type": "m.replace", "event_id": "$2"}}},
              {"type": "m.room.message", "event_id": "$2", "sender": "@bob:example.org",
               "content": {"msgtype": "m.text", "body": "second"}},
              {"type": "m.room.redaction", "event_id": "$x", "sender": "@bob:example.org",
               "redacts": "$gone", "content": {}},
              {"type": "m.room.message", "event_id": "$gone", "sender": "@bob:example.org",
               "content": {"msgtype": "m.text", "body": "deleted later"}},
              {"type": "m.room.message", "event_id": "$1", "sender": "@me:example.org",
               "content": {"msgtype": "m.text", "body": "first"}}
            ]}
            """);

    MessagesPage page = translator.historyPage("!r:x", response, id -> id.equals(SELF) ? "Me" : "Bob", 80);

    assertEquals("t_older", page.nextToken());
    List<Message> messages = page.messages();
    assertEquals(2, messages.size());
    assertEquals("first", messages.get(0).body());
    assertEquals("Me", messages.get(0).senderName());
    assertEquals("second!", messages.get(1).body());
    assertTrue(messages.get(1).edited());
    assertFalse(messages.get(0).edited());
    assertNull(messages.get(0).replyPreview());
  }
}
