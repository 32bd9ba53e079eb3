package cafe.woden.mxclient.bus;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.reactivex.rxjava3.disposables.Disposable;
import io.reactivex.rxjava3.schedulers.Schedulers;
import io.reactivex.rxjava3.subscribers.TestSubscriber;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.Test;

class MatrixEventBusTest {

  private final MatrixEventBus bus = new MatrixEventBus(Schedulers.trampoline());

  @Test
  void listenersSeeEventsInEmissionOrder() {
    List<MatrixEvent> seen = new ArrayList<>();
    bus.subscribe(seen::add);

    bus.emit(new MatrixEvent.UnreadChanged("!a:x", 1));
    bus.emit(new MatrixEvent.UnreadChanged("!a:x", 2));
    bus.emit(new MatrixEvent.UnreadCleared("!a:x"));

    assertEquals(
        List.of(
            new MatrixEvent.UnreadChanged("!a:x", 1),
            new MatrixEvent.UnreadChanged("!a:x", 2),
            new MatrixEvent.UnreadCleared("!a:x")),
        seen);
  }

  @Test
  void failingListenerKeepsItsSubscriptionAndDoesNotAffectOthers() {
    List<MatrixEvent> healthy = new ArrayList<>();
    List<MatrixEvent> flaky = new ArrayList<>();
    bus.subscribe(
        e -> {
          flaky.add(e);
          throw new IllegalStateException("boom");
        });
    bus.subscribe(healthy::add);

    bus.emit(new MatrixEvent.RoomListChanged(null));
    bus.emit(new MatrixEvent.RoomListChanged("!a:x"));

    assertEquals(2, healthy.size());
    assertEquals(2, flaky.size());
  }

  @Test
  void blockedListenerStallsNeitherEmitterNorOtherListeners() throws Exception {
    MatrixEventBus live = new MatrixEventBus(Schedulers.io());
    int events = 300;
    CountDownLatch release = new CountDownLatch(1);
    CountDownLatch stuck = new CountDownLatch(1);
    CountDownLatch healthy = new CountDownLatch(events);
    CountDownLatch slow = new CountDownLatch(events);
    Disposable blocked =
        live.subscribe(
            e -> {
              stuck.countDown();
              try {
                release.await();
              } catch (InterruptedException ex) {
                Thread.currentThread().interrupt();
              }
              slow.countDown();
            });
    Disposable other = live.subscribe(e -> healthy.countDown());
    try {
      for (int i = 0; i < events; i++) live.emit(new MatrixEvent.UnreadChanged("!a:x", i));

      assertTrue(stuck.await(5, TimeUnit.SECONDS));
      assertTrue(healthy.await(5, TimeUnit.SECONDS));
      assertEquals(events, slow.getCount());

      release.countDown();
      assertTrue(slow.await(5, TimeUnit.SECONDS));
    } finally {
      release.countDown();
      blocked.dispose();
      other.dispose();
    }
  }

  @Test
  void disposedListenerStopsReceiving() {
    List<MatrixEvent> seen = new ArrayList<>();
    Disposable d = bus.subscribe(seen::add);

    bus.emit(new MatrixEvent.InviteRemoved("!a:x"));
    d.dispose();
    bus.emit(new MatrixEvent.InviteRemoved("!b:x"));

    assertEquals(List.of(new MatrixEvent.InviteRemoved("!a:x")), seen);
    assertFalse(bus.hasSubscribers());
  }

  @Test
  void roomStreamOnlyCarriesThatRoom() {
    TestSubscriber<MatrixEvent> room = bus.events("!a:x").test();

    bus.emit(new MatrixEvent.UnreadCleared("!a:x"));
    bus.emit(new MatrixEvent.UnreadCleared("!b:x"));
    bus.emit(new MatrixEvent.RoomListChanged(null));

    room.assertValues(new MatrixEvent.UnreadCleared("!a:x"));
    assertTrue(bus.hasSubscribers());
  }

  @Test
  void nullEventsAreDropped() {
    TestSubscriber<MatrixEvent> all = bus.events().test();
    bus.emit(null);
    all.assertNoValues();
  }
}
