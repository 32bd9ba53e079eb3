package cafe.woden.mxclient.logging;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import org.springframework.stereotype.Component;

/** Bounded in-memory ring of the most recent client log lines, oldest first. */
@Component
public class ServerLog {

  public static final int DEFAULT_CAPACITY = 500;

  private final int capacity;
  private final Deque<LogEntry> entries = new ArrayDeque<>();

  public ServerLog() {
    this(DEFAULT_CAPACITY);
  }

  ServerLog(int capacity) {
    if (capacity <= 0) throw new IllegalArgumentException("capacity must be > 0");
    this.capacity = capacity;
  }

  public synchronized void append(LogEntry entry) {
    if (entry == null) return;
    entries.addLast(entry);
    while (entries.size() > capacity) entries.pollFirst();
  }

  public synchronized List<LogEntry> snapshot() {
    return List.copyOf(entries);
  }

  public synchronized void clear() {
    entries.clear();
  }
}
