package cafe.woden.mxclient.matrix;

import cafe.woden.mxclient.model.ConnectionException;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;
import org.springframework.stereotype.Component;

/**
 * Holder of the zero-or-one live {@link HomeserverApi} handle and the identity it acts as.
 *
 * <p>Only the connection manager attaches and detaches handles; everything else borrows the
 * current one per call through {@link #require()} and never keeps it.
 */
@Component
public class HomeserverConnection {

  private record Live(HomeserverApi api, String userId, String deviceId) {}

  private final AtomicReference<Live> current = new AtomicReference<>();

  public HomeserverApi require() {
    return live().api();
  }

  /** Account id of the live connection. */
  public String requireUserId() {
    return live().userId();
  }

  public String requireDeviceId() {
    return live().deviceId();
  }

  public Optional<HomeserverApi> current() {
    Live live = current.get();
    return live == null ? Optional.empty() : Optional.of(live.api());
  }

  public boolean isAttached() {
    return current.get() != null;
  }

  public void attach(HomeserverApi api, String userId, String deviceId) {
    Objects.requireNonNull(api, "api");
    current.set(new Live(api, Objects.toString(userId, ""), Objects.toString(deviceId, "")));
  }

  /** @return the handle that was attached, or {@code null} */
  public HomeserverApi detach() {
    Live prev = current.getAndSet(null);
    return prev == null ? null : prev.api();
  }

  private Live live() {
    Live live = current.get();
    if (live == null) {
      throw new ConnectionException(ConnectionException.Reason.NOT_CONNECTED, "Not connected");
    }
    return live;
  }
}
