package cafe.woden.mxclient.session;

import cafe.woden.mxclient.config.MatrixProperties;
import cafe.woden.mxclient.model.ConnectionException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.nio.file.attribute.PosixFilePermissions;
import java.util.Comparator;
import java.util.Optional;
import java.util.stream.Stream;
import org.jmolecules.architecture.layered.InfrastructureLayer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Owns {@code session.json} and the local store directory next to it.
 *
 * <p>Layout under the configured directory:
 * <pre>
 * session.json
 * store/
 * </pre>
 */
@Component
@InfrastructureLayer
public class SessionStore {
  private static final Logger log = LoggerFactory.getLogger(SessionStore.class);

  static final String SESSION_FILE = "session.json";
  static final String STORE_DIR = "store";

  private final Path baseDir;
  private final ObjectMapper mapper =
      new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);

  @Autowired
  public SessionStore(MatrixProperties props) {
    this(Paths.get(props.session().dir()));
  }

  public SessionStore(Path baseDir) {
    this.baseDir = baseDir.toAbsolutePath().normalize();
  }

  public Path sessionFile() {
    return baseDir.resolve(SESSION_FILE);
  }

  public Path storeDirectory() {
    return baseDir.resolve(STORE_DIR);
  }

  /**
   * @return the persisted session, or empty when none was saved
   * @throws ConnectionException with {@code SESSION_UNREADABLE} if the file exists but is corrupt
   */
  public synchronized Optional<PersistedSession> load() {
    Path file = sessionFile();
    if (!Files.isRegularFile(file)) return Optional.empty();
    try {
      return Optional.of(mapper.readValue(file.toFile(), PersistedSession.class));
    } catch (IOException | RuntimeException e) {
      log.warn("[mxcafe] Could not read session file {}: {}", file, e.toString());
      throw new ConnectionException(
          ConnectionException.Reason.SESSION_UNREADABLE,
          "Stored session is unreadable: " + e.getMessage());
    }
  }

  public synchronized void save(PersistedSession session) {
    Path file = sessionFile();
    try {
      Files.createDirectories(baseDir);
      Path tmp = baseDir.resolve(SESSION_FILE + ".tmp");
      mapper.writeValue(tmp.toFile(), session);
      restrictToOwner(tmp);
      try {
        Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
      } catch (AtomicMoveNotSupportedException e) {
        Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING);
      }
      log.info("[mxcafe] Session saved for {}", session.userId());
    } catch (IOException e) {
      throw new UncheckedIOException("Could not write " + file, e);
    }
  }

  public synchronized void erase() {
    try {
      Files.deleteIfExists(sessionFile());
      deleteRecursively(storeDirectory());
      log.info("[mxcafe] Session erased");
    } catch (IOException e) {
      throw new UncheckedIOException("Could not erase session under " + baseDir, e);
    }
  }

  /** Deletes and recreates the store directory so a fresh device never reuses stale state. */
  public synchronized Path resetStoreDirectory() {
    Path dir = storeDirectory();
    try {
      deleteRecursively(dir);
      Files.createDirectories(dir);
      return dir;
    } catch (IOException e) {
      throw new UncheckedIOException("Could not reset store directory " + dir, e);
    }
  }

  private static void deleteRecursively(Path dir) throws IOException {
    if (!Files.exists(dir)) return;
    try (Stream<Path> walk = Files.walk(dir)) {
      for (Path p : (Iterable<Path>) walk.sorted(Comparator.reverseOrder())::iterator) {
        Files.deleteIfExists(p);
      }
    }
  }

  private static void restrictToOwner(Path file) {
    try {
      Files.setPosixFilePermissions(file, PosixFilePermissions.fromString("rw-------"));
    } catch (UnsupportedOperationException | IOException e) {
      log.debug("[mxcafe] Could not restrict permissions on {}: {}", file, e.toString());
    }
  }
}
