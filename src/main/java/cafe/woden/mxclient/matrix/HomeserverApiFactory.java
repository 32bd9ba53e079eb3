package cafe.woden.mxclient.matrix;

import java.net.URI;

/** Creates {@link HomeserverApi} handles; the only way new handles come into existence. */
public interface HomeserverApiFactory {

  /**
   * Turns user input ({@code https://host}, {@code http://host} or a bare server name) into the
   * client-server API base URL.
   */
  URI resolve(String homeserverInput);

  HomeserverApi create(URI homeserver, String accessToken);
}
