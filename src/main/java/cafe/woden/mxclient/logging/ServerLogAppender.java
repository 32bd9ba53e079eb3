package cafe.woden.mxclient.logging;

import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.AppenderBase;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import java.time.Instant;
import java.util.Objects;
import org.slf4j.ILoggerFactory;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Mirrors everything logged under {@code cafe.woden.mxclient} into the {@link ServerLog}.
 *
 * <p>Attached to the Logback logger when the context starts and detached on shutdown. When SLF4J
 * is bound to something other than Logback the server log simply stays empty.
 */
@Component
public class ServerLogAppender extends AppenderBase<ILoggingEvent> {
  private static final org.slf4j.Logger log = LoggerFactory.getLogger(ServerLogAppender.class);

  static final String APPENDER_NAME = "mxcafe-server-log";
  static final String ROOT_PACKAGE = "cafe.woden.mxclient";

  private final ServerLog serverLog;
  private Logger attachedTo;

  public ServerLogAppender(ServerLog serverLog) {
    this.serverLog = Objects.requireNonNull(serverLog, "serverLog");
    setName(APPENDER_NAME);
  }

  @PostConstruct
  void attach() {
    ILoggerFactory factory = LoggerFactory.getILoggerFactory();
    if (!(factory instanceof LoggerContext context)) {
      log.debug("[mxcafe] SLF4J is not bound to Logback; server log disabled");
      return;
    }
    setContext(context);
    start();
    attachedTo = context.getLogger(ROOT_PACKAGE);
    attachedTo.addAppender(this);
  }

  @PreDestroy
  void detach() {
    if (attachedTo != null) {
      attachedTo.detachAppender(this);
      attachedTo = null;
    }
    stop();
  }

  @Override
  protected void append(ILoggingEvent event) {
    serverLog.append(
        new LogEntry(
            Instant.ofEpochMilli(event.getTimeStamp()),
            event.getLevel().toString(),
            event.getLoggerName(),
            event.getFormattedMessage()));
  }
}
