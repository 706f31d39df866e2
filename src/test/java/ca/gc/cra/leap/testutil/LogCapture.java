package ca.gc.cra.leap.testutil;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import java.util.List;
import java.util.stream.Collectors;
import org.slf4j.LoggerFactory;

/**
 * Attaches a Logback {@link ListAppender} to one logger for the duration of a test.
 */
public final class LogCapture implements AutoCloseable {
  private final Logger logger;
  private final ListAppender<ILoggingEvent> appender = new ListAppender<>();
  private final boolean originalAdditive;
  private final Level originalLevel;

  private LogCapture(Class<?> type, Level level) {
    this.logger = (Logger) LoggerFactory.getLogger(type);
    this.originalAdditive = logger.isAdditive();
    this.originalLevel = logger.getLevel();
    logger.setAdditive(false);
    logger.setLevel(level);
    appender.start();
    logger.addAppender(appender);
  }

  public static LogCapture attach(Class<?> type) {
    return new LogCapture(type, Level.DEBUG);
  }

  public List<ILoggingEvent> events() {
    synchronized (appender) {
      return List.copyOf(appender.list);
    }
  }

  public List<String> messages(Level level) {
    return events().stream()
        .filter(event -> event.getLevel().equals(level))
        .map(ILoggingEvent::getFormattedMessage)
        .collect(Collectors.toList());
  }

  @Override
  public void close() {
    logger.detachAppender(appender);
    logger.setAdditive(originalAdditive);
    logger.setLevel(originalLevel);
    appender.stop();
  }
}
