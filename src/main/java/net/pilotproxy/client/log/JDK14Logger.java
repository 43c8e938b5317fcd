package net.pilotproxy.client.log;

import java.util.Arrays;
import java.util.HashSet;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;
import org.slf4j.helpers.MessageFormatter;

/**
 * Use java.util.logging to implements PilotLogger.
 *
 * <p>Log Level mapping from PilotLogger to java.util.logging: ERROR -- SEVERE WARN -- WARNING INFO
 * -- INFO DEBUG -- FINE TRACE -- FINEST
 */
public class JDK14Logger implements PilotLogger {
  private final Logger jdkLogger;

  // strong reference, java.util.logging drops levels of collected loggers
  private static final Logger prefixLogger =
      Logger.getLogger(PilotLoggerFactory.LOGGER_NAME_PREFIX);

  private static final Set<String> logMethods =
      new HashSet<>(Arrays.asList("debug", "error", "info", "trace", "warn", "logInternal"));

  public JDK14Logger(String name) {
    this.jdkLogger = Logger.getLogger(name);
  }

  public boolean isDebugEnabled() {
    return this.jdkLogger.isLoggable(Level.FINE);
  }

  public boolean isErrorEnabled() {
    return this.jdkLogger.isLoggable(Level.SEVERE);
  }

  public boolean isInfoEnabled() {
    return this.jdkLogger.isLoggable(Level.INFO);
  }

  public boolean isTraceEnabled() {
    return this.jdkLogger.isLoggable(Level.FINEST);
  }

  public boolean isWarnEnabled() {
    return this.jdkLogger.isLoggable(Level.WARNING);
  }

  public void debug(String msg, Object... arguments) {
    logInternal(Level.FINE, msg, arguments);
  }

  public void debug(String msg, Throwable t) {
    logInternal(Level.FINE, msg, t);
  }

  public void error(String msg, Object... arguments) {
    logInternal(Level.SEVERE, msg, arguments);
  }

  public void error(String msg, Throwable t) {
    logInternal(Level.SEVERE, msg, t);
  }

  public void info(String msg, Object... arguments) {
    logInternal(Level.INFO, msg, arguments);
  }

  public void info(String msg, Throwable t) {
    logInternal(Level.INFO, msg, t);
  }

  public void trace(String msg, Object... arguments) {
    logInternal(Level.FINEST, msg, arguments);
  }

  public void trace(String msg, Throwable t) {
    logInternal(Level.FINEST, msg, t);
  }

  public void warn(String msg, Object... arguments) {
    logInternal(Level.WARNING, msg, arguments);
  }

  public void warn(String msg, Throwable t) {
    logInternal(Level.WARNING, msg, t);
  }

  public static void setLevel(Level level) {
    prefixLogger.setLevel(level);
  }

  public static Level getLevel() {
    return prefixLogger.getLevel();
  }

  private void logInternal(Level level, String msg, Object... arguments) {
    if (jdkLogger.isLoggable(level)) {
      String[] source = findSourceInStack();
      // slf4j placeholders, so messages read the same under both backends
      String message =
          MessageFormatter.arrayFormat(msg, SLF4JLogger.evaluateLambdaArgs(arguments))
              .getMessage();
      jdkLogger.logp(level, source[0], source[1], message);
    }
  }

  private void logInternal(Level level, String msg, Throwable t) {
    if (jdkLogger.isLoggable(level)) {
      String[] source = findSourceInStack();
      jdkLogger.logp(level, source[0], source[1], msg, t);
    }
  }

  /**
   * Used to find the index of the source class/method in current stack This method will locate the
   * source as the first method after logMethods
   *
   * @return an array of size two, first element is className and second is methodName
   */
  private String[] findSourceInStack() {
    StackTraceElement[] stackTraces = Thread.currentThread().getStackTrace();
    String[] results = new String[2];
    for (int i = 0; i < stackTraces.length; i++) {
      if (logMethods.contains(stackTraces[i].getMethodName())) {
        for (int j = i; j < stackTraces.length; j++) {
          if (!logMethods.contains(stackTraces[j].getMethodName())) {
            results[0] = stackTraces[j].getClassName();
            results[1] = stackTraces[j].getMethodName();
            return results;
          }
        }
      }
    }
    return results;
  }
}
