package net.pilotproxy.client.core.proxy;

import java.util.List;
import net.pilotproxy.client.log.PilotLogger;
import net.pilotproxy.client.log.PilotLoggerFactory;

/** Matches FQANs such as {@code /vo/Role=pilot/Capability=NULL} against a shell pattern. */
public class FqanMatcher {
  private static final PilotLogger logger = PilotLoggerFactory.getLogger(FqanMatcher.class);

  private FqanMatcher() {}

  /**
   * @param fqans attribute tags, in order
   * @param pattern fnmatch pattern
   * @return true at the first tag matching the pattern; false for a null or empty list
   * @throws IllegalArgumentException if the pattern is null
   */
  public static boolean matchesAny(List<String> fqans, String pattern) {
    return matchesAny(fqans, GlobPattern.compile(pattern));
  }

  public static boolean matchesAny(List<String> fqans, GlobPattern pattern) {
    if (fqans == null || fqans.isEmpty()) {
      logger.debug("No FQANs to match against {}", pattern);
      return false;
    }
    for (String fqan : fqans) {
      if (pattern.matches(fqan)) {
        logger.debug("FQAN {} matches {}", fqan, pattern);
        return true;
      }
    }
    logger.debug("None of {} FQANs matches {}", fqans.size(), pattern);
    return false;
  }
}
