package cafe.woden.mxclient.bus;

import cafe.woden.mxclient.config.ExecutorConfig;
import io.reactivex.rxjava3.core.Flowable;
import io.reactivex.rxjava3.core.Scheduler;
import io.reactivex.rxjava3.disposables.Disposable;
import io.reactivex.rxjava3.processors.FlowableProcessor;
import io.reactivex.rxjava3.processors.PublishProcessor;
import java.util.Objects;
import java.util.function.Consumer;
import org.jmolecules.architecture.layered.ApplicationLayer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

/**
 * Fan-out of {@link MatrixEvent}s to every open window.
 *
 * <p>Emission never blocks: each subscriber has an unbounded buffer and its own delivery worker,
 * so a slow window only delays itself. Subscribers only see events emitted after they subscribed.
 */
@Component
@ApplicationLayer
public class MatrixEventBus {
  private static final Logger log = LoggerFactory.getLogger(MatrixEventBus.class);

  private final FlowableProcessor<MatrixEvent> bus =
      PublishProcessor.<MatrixEvent>create().toSerialized();
  private final Scheduler deliveryScheduler;

  public MatrixEventBus(
      @Qualifier(ExecutorConfig.EVENT_DELIVERY_SCHEDULER) Scheduler deliveryScheduler) {
    this.deliveryScheduler = Objects.requireNonNull(deliveryScheduler, "deliveryScheduler");
  }

  public void emit(MatrixEvent event) {
    if (event == null) return;
    bus.onNext(event);
  }

  /** Raw stream on the emitting thread; prefer {@link #subscribe(Consumer)} for UI listeners. */
  public Flowable<MatrixEvent> events() {
    return bus.onBackpressureBuffer();
  }

  public Flowable<MatrixEvent> events(String roomId) {
    return events().filter(e -> Objects.equals(roomId, e.roomId()));
  }

  /**
   * Attaches a listener on its own delivery worker. Exceptions thrown by the listener are logged
   * and do not end the subscription; dispose the result to detach.
   */
  public Disposable subscribe(Consumer<? super MatrixEvent> listener) {
    Objects.requireNonNull(listener, "listener");
    return events()
        .observeOn(deliveryScheduler)
        .subscribe(
            e -> deliver(listener, e),
            err -> log.error("[mxcafe] event bus subscription failed", err));
  }

  public boolean hasSubscribers() {
    return bus.hasSubscribers();
  }

  private static void deliver(Consumer<? super MatrixEvent> listener, MatrixEvent e) {
    try {
      listener.accept(e);
    } catch (RuntimeException ex) {
      log.warn("[mxcafe] event listener failed on {}", e.getClass().getSimpleName(), ex);
    }
  }
}
