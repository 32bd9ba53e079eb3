package cafe.woden.mxclient.util;

import io.reactivex.rxjava3.disposables.Disposable;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

/** Wraps a {@link Future} into a {@link Disposable} whose dispose cancels with interrupt. */
public final class FutureDisposables {

  private FutureDisposables() {}

  public static Disposable of(Future<?> f) {
    AtomicReference<Future<?>> ref = new AtomicReference<>(f);
    return new Disposable() {
      private final AtomicBoolean disposed = new AtomicBoolean(false);

      @Override
      public void dispose() {
        if (disposed.compareAndSet(false, true)) {
          Future<?> fx = ref.getAndSet(null);
          if (fx != null) fx.cancel(true);
        }
      }

      @Override
      public boolean isDisposed() {
        if (disposed.get()) return true;
        Future<?> fx = ref.get();
        return fx == null || fx.isDone();
      }
    };
  }
}
