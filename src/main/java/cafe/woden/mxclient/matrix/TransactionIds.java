package cafe.woden.mxclient.matrix;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Client transaction ids. The homeserver treats a repeated id from the same device as the same
 * request, so a retry must reuse the id of the attempt it repeats.
 */
public final class TransactionIds {

  private static final AtomicLong SEQ = new AtomicLong();

  private TransactionIds() {}

  public static String next() {
    return "mx" + System.currentTimeMillis() + "." + SEQ.incrementAndGet();
  }
}
