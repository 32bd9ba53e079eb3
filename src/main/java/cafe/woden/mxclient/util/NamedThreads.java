package cafe.woden.mxclient.util;

import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/** Shared helpers for creating app-owned daemon threads with readable names. */
public final class NamedThreads {

  private NamedThreads() {}

  public static ThreadFactory namedFactory(String baseName) {
    String base = normalize(baseName);
    AtomicInteger seq = new AtomicInteger(1);
    return r -> {
      Thread t = new Thread(r, base + "-" + seq.getAndIncrement());
      t.setDaemon(true);
      return t;
    };
  }

  public static ScheduledExecutorService newSingleThreadScheduledExecutor(String baseName) {
    return Executors.newSingleThreadScheduledExecutor(namedFactory(baseName));
  }

  private static String normalize(String baseName) {
    String base = baseName == null ? "" : baseName.trim();
    return base.isEmpty() ? "mxcafe" : base;
  }
}
