package cafe.woden.mxclient.architecture;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;

import cafe.woden.mxclient.MxCafeApp;
import cafe.woden.mxclient.bus.MatrixEventBus;
import cafe.woden.mxclient.command.MatrixCommandService;
import cafe.woden.mxclient.connection.ConnectionManager;
import cafe.woden.mxclient.logging.ServerLog;
import cafe.woden.mxclient.matrix.HomeserverApi;
import cafe.woden.mxclient.session.SessionStore;
import cafe.woden.mxclient.state.RoomStateStore;
import cafe.woden.mxclient.sync.SyncLoop;
import cafe.woden.mxclient.verification.VerificationCoordinator;
import org.junit.jupiter.api.Test;
import org.springframework.modulith.core.ApplicationModule;
import org.springframework.modulith.core.ApplicationModules;

class SpringModulithBoundariesTest {

  @Test
  void applicationModulesCanBeDiscovered() {
    assertThatCode(() -> ApplicationModules.of(MxCafeApp.class)).doesNotThrowAnyException();
  }

  @Test
  void coreTypesResolveToTheirOwnModules() {
    ApplicationModules modules = ApplicationModules.of(MxCafeApp.class);

    assertModule(modules, SessionStore.class, "session");
    assertModule(modules, ConnectionManager.class, "connection");
    assertModule(modules, SyncLoop.class, "sync");
    assertModule(modules, RoomStateStore.class, "state");
    assertModule(modules, VerificationCoordinator.class, "verification");
    assertModule(modules, MatrixEventBus.class, "bus");
    assertModule(modules, MatrixCommandService.class, "command");
    assertModule(modules, HomeserverApi.class, "matrix");
    assertModule(modules, ServerLog.class, "logging");

    assertThat(moduleFor(modules, SyncLoop.class))
        .isNotEqualTo(moduleFor(modules, ConnectionManager.class));
  }

  @Test
  void moduleVerificationPassesWithCurrentBoundaries() {
    ApplicationModules.of(MxCafeApp.class).verify();
  }

  private static void assertModule(ApplicationModules modules, Class<?> type, String name) {
    assertThat(moduleFor(modules, type).getBasePackage().getName())
        .isEqualTo("cafe.woden.mxclient." + name);
  }

  private static ApplicationModule moduleFor(ApplicationModules modules, Class<?> type) {
    return modules
        .getModuleByType(type)
        .orElseThrow(() -> new AssertionError("No module discovered for type " + type.getName()));
  }
}
