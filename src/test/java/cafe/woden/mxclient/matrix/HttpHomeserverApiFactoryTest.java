package cafe.woden.mxclient.matrix;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import cafe.woden.mxclient.config.MatrixProperties;
import cafe.woden.mxclient.model.ValidationException;
import java.net.URI;
import org.junit.jupiter.api.Test;

class HttpHomeserverApiFactoryTest {

  private final HttpHomeserverApiFactory factory =
      new HttpHomeserverApiFactory(MatrixProperties.defaults());

  @Test
  void explicitUrlsAreUsedAsGivenWithoutTrailingSlash() {
    assertEquals(URI.create("https://example.org"), factory.resolve(" https://example.org/ "));
    assertEquals(URI.create("http://localhost:8008"), factory.resolve("http://localhost:8008"));
  }

  @Test
  void blankOrHostlessInputIsRejected() {
    assertThrows(ValidationException.class, () -> factory.resolve("  "));
    assertThrows(ValidationException.class, () -> factory.resolve(null));
    assertThrows(ValidationException.class, () -> HttpHomeserverApiFactory.normalize("https://"));
  }

  @Test
  void createdHandlesCarryTheirHomeserverAndToken() {
    HomeserverApi api = factory.create(URI.create("https://example.org"), "tok");
    assertEquals("tok", api.accessToken());
  }
}
