package cafe.woden.mxclient.command;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import cafe.woden.mxclient.model.ValidationException;
import org.junit.jupiter.api.Test;

class MxcUriTest {

  @Test
  void splitsServerAndMediaId() {
    MxcUri uri = MxcUri.parse(" mxc://example.org/AbC123 ");
    assertEquals("example.org", uri.serverName());
    assertEquals("AbC123", uri.mediaId());
  }

  @Test
  void rejectsOtherSchemes() {
    ValidationException e =
        assertThrows(ValidationException.class, () -> MxcUri.parse("https://example.org/a"));
    assertEquals("Not a media reference: https://example.org/a", e.getMessage());
    assertThrows(ValidationException.class, () -> MxcUri.parse(null));
  }

  @Test
  void rejectsMissingParts() {
    assertThrows(ValidationException.class, () -> MxcUri.parse("mxc://example.org"));
    assertThrows(ValidationException.class, () -> MxcUri.parse("mxc:///abc"));
    assertThrows(ValidationException.class, () -> MxcUri.parse("mxc://example.org/"));
    assertThrows(ValidationException.class, () -> MxcUri.parse("mxc://example.org/a/b"));
  }
}
