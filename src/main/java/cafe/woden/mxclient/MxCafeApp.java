package cafe.woden.mxclient;

import cafe.woden.mxclient.config.MatrixProperties;
import cafe.woden.mxclient.connection.ConnectionManager;
import cafe.woden.mxclient.model.ConnectionException;
import cafe.woden.mxclient.model.MatrixException;
import cafe.woden.mxclient.session.SessionStore;
import java.nio.file.Files;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.builder.SpringApplicationBuilder;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.modulith.Modulithic;

@SpringBootApplication
@Modulithic(
    systemName = "MXcafe",
    sharedModules = {"config", "model", "util"})
@EnableConfigurationProperties(MatrixProperties.class)
public class MxCafeApp {
  private static final Logger log = LoggerFactory.getLogger(MxCafeApp.class);

  public static void main(String[] args) {
    new SpringApplicationBuilder(MxCafeApp.class).headless(true).run(args);
  }

  /** Silently resumes the saved session, if any, so windows open straight into the buddy list. */
  @Bean
  public ApplicationRunner restoreSavedSession(SessionStore sessions, ConnectionManager connections) {
    return args -> {
      if (!Files.exists(sessions.sessionFile())) {
        log.info("[mxcafe] No saved session; waiting for login");
        return;
      }
      try {
        String userId = connections.restoreSession();
        log.info("[mxcafe] Restored session for {}", userId);
      } catch (ConnectionException e) {
        log.warn("[mxcafe] Could not restore session ({}): {}", e.reason(), e.getMessage());
      } catch (MatrixException e) {
        log.warn("[mxcafe] Could not restore session: {}", e.getMessage());
      }
    };
  }
}
