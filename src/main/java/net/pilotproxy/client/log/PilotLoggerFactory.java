package net.pilotproxy.client.log;

import static net.pilotproxy.client.core.PilotProxyUtil.systemGetProperty;

/** Used to create PilotLogger instance */
public class PilotLoggerFactory {
  static final String LOGGER_NAME_PREFIX = "net.pilotproxy";

  public static final String LOGGER_IMPL_PROPERTY = "net.pilotproxy.loggerImpl";

  private static volatile LoggerImpl loggerImplementation;

  enum LoggerImpl {
    SLF4JLOGGER("net.pilotproxy.client.log.SLF4JLogger"),
    JDK14LOGGER("net.pilotproxy.client.log.JDK14Logger");

    private final String loggerImplClassName;

    LoggerImpl(String loggerClass) {
      this.loggerImplClassName = loggerClass;
    }

    public String getLoggerImplClassName() {
      return this.loggerImplClassName;
    }

    public static LoggerImpl fromString(String loggerImplClassName) {
      if (loggerImplClassName != null) {
        for (LoggerImpl imp : LoggerImpl.values()) {
          if (loggerImplClassName.equalsIgnoreCase(imp.getLoggerImplClassName())) {
            return imp;
          }
        }
      }
      return null;
    }
  }

  private PilotLoggerFactory() {}

  /**
   * @param clazz Class type that the logger is instantiated
   * @return An PilotLogger instance given the name of the class
   */
  public static PilotLogger getLogger(Class<?> clazz) {
    return getLogger(clazz.getName());
  }

  /**
   * @param name name to indicate the class that the logger is instantiated
   * @return An PilotLogger instance given the name
   */
  public static PilotLogger getLogger(String name) {
    if (loggerImplementation == null) {
      LoggerImpl impl = LoggerImpl.fromString(systemGetProperty(LOGGER_IMPL_PROPERTY));
      // default to use java util logging
      loggerImplementation = impl != null ? impl : LoggerImpl.JDK14LOGGER;
    }

    switch (loggerImplementation) {
      case SLF4JLOGGER:
        return new SLF4JLogger(name);
      case JDK14LOGGER:
      default:
        return new JDK14Logger(name);
    }
  }

  static void resetLoggerImplementation() {
    loggerImplementation = null;
  }
}
