package cafe.woden.mxclient.model;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

class PresenceTest {

  @Test
  void icqStatesTravelAsMatrixPresencePlusStatusMessage() {
    assertEquals("unavailable", Presence.DO_NOT_DISTURB.matrixState());
    assertEquals("Do Not Disturb", Presence.DO_NOT_DISTURB.statusMessage());
    assertEquals("online", Presence.FREE_FOR_CHAT.matrixState());
    assertEquals("offline", Presence.INVISIBLE.matrixState());
    assertNull(Presence.AWAY.statusMessage());
  }

  @Test
  void everyPublishableStateReadsBackAsItself() {
    for (Presence p : Presence.values()) {
      if (p == Presence.UNKNOWN || p == Presence.INVISIBLE) continue;
      assertEquals(p, Presence.fromMatrix(p.matrixState(), p.statusMessage()), p.name());
    }
  }

  @Test
  void absentPresenceMeansNoChange() {
    assertNull(Presence.fromMatrix(null, "Occupied"));
    assertNull(Presence.fromMatrix(" ", null));
    assertEquals(Presence.UNKNOWN, Presence.fromMatrix("busy", null));
    assertEquals(Presence.OCCUPIED, Presence.fromMatrix("unavailable", " occupied "));
  }

  @Test
  void localNamesAreCaseInsensitive() {
    assertEquals(Presence.EXTENDED_AWAY, Presence.fromLocalName("NA"));
    assertEquals(Presence.DO_NOT_DISTURB, Presence.fromLocalName("do_not_disturb"));
    assertEquals(Presence.UNKNOWN, Presence.fromLocalName(null));
    assertTrue(Presence.FREE_FOR_CHAT.isOnline());
    assertFalse(Presence.INVISIBLE.isOnline());
  }
}
