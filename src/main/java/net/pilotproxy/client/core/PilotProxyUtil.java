package net.pilotproxy.client.core;

import net.pilotproxy.client.log.PilotLogger;
import net.pilotproxy.client.log.PilotLoggerFactory;

public class PilotProxyUtil {
  private static final PilotLogger logger = PilotLoggerFactory.getLogger(PilotProxyUtil.class);

  private PilotProxyUtil() {}

  /**
   * System.getProperty wrapper. If System.getProperty raises an SecurityException, it is ignored
   * and returns null.
   *
   * @param property the property name
   * @return the property value if set, otherwise null.
   */
  public static String systemGetProperty(String property) {
    try {
      return System.getProperty(property);
    } catch (SecurityException ex) {
      logger.debug("Security exception raised: {}", ex.getMessage());
      return null;
    }
  }

  /**
   * System.getenv wrapper. If System.getenv raises an SecurityException, it is ignored and returns
   * null.
   *
   * @param env the environment variable name.
   * @return the environment variable value if set, otherwise null.
   */
  public static String systemGetEnv(String env) {
    try {
      return System.getenv(env);
    } catch (SecurityException ex) {
      logger.debug(
          "Failed to get environment variable {}. Security exception raised: {}",
          env,
          ex.getMessage());
    }
    return null;
  }

  public static boolean isNullOrEmpty(String str) {
    return str == null || str.isEmpty();
  }

  public static boolean isWindows() {
    String osName = systemGetProperty("os.name");
    return osName != null && osName.toLowerCase().startsWith("windows");
  }
}
