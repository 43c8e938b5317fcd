package net.pilotproxy.client.core.plugin;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import net.pilotproxy.client.log.PilotLogger;
import net.pilotproxy.client.log.PilotLoggerFactory;

/** Reads the FQANs of the request. Missing FQANs are not an error. */
public class FqanRetriever {
  private static final PilotLogger logger = PilotLoggerFactory.getLogger(FqanRetriever.class);

  public List<String> retrieve(PluginArguments args) {
    Integer count = args.getArgValue(PluginArguments.NFQAN, Integer.class);
    if (count == null || count <= 0) {
      logger.debug("No FQANs found");
      return Collections.emptyList();
    }
    String[] values = args.getArgValue(PluginArguments.FQAN_LIST, String[].class);
    if (values == null) {
      logger.debug(
          "{} is {} but {} is not set", PluginArguments.NFQAN, count, PluginArguments.FQAN_LIST);
      return Collections.emptyList();
    }

    int available = Math.min(count, values.length);
    List<String> fqans = new ArrayList<>(available);
    for (int i = 0; i < available; i++) {
      if (values[i] != null) {
        fqans.add(values[i]);
      }
    }
    logger.debug("Found {} FQAN(s)", fqans.size());
    return Collections.unmodifiableList(fqans);
  }
}
