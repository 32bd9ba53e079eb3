package cafe.woden.mxclient.logging;

import java.time.Instant;
import org.jmolecules.ddd.annotation.ValueObject;

/** One line of the server log window. */
@ValueObject
public record LogEntry(Instant timestamp, String level, String logger, String message) {
  public LogEntry {
    if (timestamp == null) timestamp = Instant.now();
    if (level == null) level = "INFO";
    if (logger == null) logger = "";
    if (message == null) message = "";
  }
}
