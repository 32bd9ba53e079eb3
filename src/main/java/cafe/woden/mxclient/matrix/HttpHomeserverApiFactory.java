package cafe.woden.mxclient.matrix;

import cafe.woden.mxclient.config.MatrixProperties;
import cafe.woden.mxclient.model.ValidationException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.net.URI;
import java.net.URISyntaxException;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Locale;
import org.jmolecules.architecture.layered.InfrastructureLayer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/** Creates HTTP-backed API handles sharing one {@link HttpClient}. */
@Component
@InfrastructureLayer
public class HttpHomeserverApiFactory implements HomeserverApiFactory {
  private static final Logger log = LoggerFactory.getLogger(HttpHomeserverApiFactory.class);

  private final HttpClient http;
  private final ObjectMapper json = new ObjectMapper();
  private final Duration requestTimeout;

  public HttpHomeserverApiFactory(MatrixProperties props) {
    MatrixProperties.Client client = props.client();
    this.requestTimeout = Duration.ofMillis(client.requestTimeoutMs());
    this.http =
        HttpClient.newBuilder()
            .connectTimeout(Duration.ofMillis(client.connectTimeoutMs()))
            .followRedirects(HttpClient.Redirect.NORMAL)
            .build();
  }

  @Override
  public URI resolve(String homeserverInput) {
    String raw = homeserverInput == null ? "" : homeserverInput.trim();
    if (raw.isEmpty()) throw new ValidationException("Homeserver is required");
    String lower = raw.toLowerCase(Locale.ROOT);
    if (lower.startsWith("https://") || lower.startsWith("http://")) {
      return normalize(raw);
    }
    URI fallback = normalize("https://" + raw);
    URI wellKnown = lookupWellKnown(fallback);
    return wellKnown != null ? wellKnown : fallback;
  }

  @Override
  public HomeserverApi create(URI homeserver, String accessToken) {
    return new HttpHomeserverApi(http, json, homeserver, accessToken, requestTimeout);
  }

  private URI lookupWellKnown(URI server) {
    try {
      HttpRequest request =
          HttpRequest.newBuilder(server.resolve("/.well-known/matrix/client"))
              .timeout(requestTimeout)
              .GET()
              .build();
      HttpResponse<String> resp =
          http.send(request, HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
      if (resp.statusCode() / 100 != 2) return null;
      JsonNode node = json.readTree(resp.body());
      String baseUrl = node.path("m.homeserver").path("base_url").asText("");
      if (baseUrl.isBlank()) return null;
      log.info("[mxcafe] {} delegates to homeserver {}", server.getHost(), baseUrl);
      return normalize(baseUrl);
    } catch (IOException | RuntimeException e) {
      log.debug("[mxcafe] No usable .well-known for {}: {}", server, e.toString());
      return null;
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      return null;
    }
  }

  static URI normalize(String raw) {
    String s = raw.trim();
    while (s.endsWith("/")) s = s.substring(0, s.length() - 1);
    try {
      URI uri = new URI(s);
      if (uri.getHost() == null) throw new ValidationException("Not a homeserver URL: " + raw);
      return uri;
    } catch (URISyntaxException e) {
      throw new ValidationException("Not a homeserver URL: " + raw);
    }
  }
}
