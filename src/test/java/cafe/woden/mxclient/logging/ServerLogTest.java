package cafe.woden.mxclient.logging;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Instant;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

class ServerLogTest {

  private static LogEntry entry(String message) {
    return new LogEntry(Instant.EPOCH, "INFO", "test", message);
  }

  @Test
  void oldestEntriesAreEvictedAtCapacity() {
    ServerLog serverLog = new ServerLog(3);
    for (int i = 1; i <= 5; i++) serverLog.append(entry("line " + i));

    List<LogEntry> snapshot = serverLog.snapshot();
    assertEquals(3, snapshot.size());
    assertEquals("line 3", snapshot.get(0).message());
    assertEquals("line 5", snapshot.get(2).message());
  }

  @Test
  void snapshotIsDetachedFromLaterAppends() {
    ServerLog serverLog = new ServerLog();
    serverLog.append(entry("a"));
    List<LogEntry> before = serverLog.snapshot();
    serverLog.append(entry("b"));

    assertEquals(1, before.size());
    serverLog.clear();
    assertTrue(serverLog.snapshot().isEmpty());
  }

  @Test
  void capacityMustBePositive() {
    assertThrows(IllegalArgumentException.class, () -> new ServerLog(0));
  }

  @Test
  void appenderMirrorsClientLoggers() {
    ServerLog serverLog = new ServerLog();
    ServerLogAppender appender = new ServerLogAppender(serverLog);
    appender.attach();
    try {
      Logger log = LoggerFactory.getLogger("cafe.woden.mxclient.sync.SyncLoop");
      log.warn("[mxcafe] Sync failed: {}", "timeout");
      LoggerFactory.getLogger("org.example.Other").warn("not ours");
    } finally {
      appender.detach();
    }

    List<LogEntry> entries = serverLog.snapshot();
    assertEquals(1, entries.size());
    assertEquals("WARN", entries.get(0).level());
    assertEquals("cafe.woden.mxclient.sync.SyncLoop", entries.get(0).logger());
    assertEquals("[mxcafe] Sync failed: timeout", entries.get(0).message());
  }
}
