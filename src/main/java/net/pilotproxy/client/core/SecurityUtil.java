package net.pilotproxy.client.core;

import java.security.Provider;
import java.security.Security;
import net.pilotproxy.client.log.PilotLogger;
import net.pilotproxy.client.log.PilotLoggerFactory;
import org.bouncycastle.jce.provider.BouncyCastleProvider;

public class SecurityUtil {

  private static final PilotLogger LOGGER = PilotLoggerFactory.getLogger(SecurityUtil.class);

  /** provider name for FIPS */
  public static final String BOUNCY_CASTLE_FIPS_PROVIDER = "BCFIPS";

  public static final String BOUNCY_CASTLE_PROVIDER = "BC";

  private SecurityUtil() {}

  /**
   * Adds Bouncy Castle to the list of security providers unless a FIPS provider is already
   * installed. Calling this more than once is harmless.
   *
   * @return the name of the provider to use for certificate conversion
   */
  public static synchronized String addBouncyCastleProvider() {
    if (Security.getProvider(BOUNCY_CASTLE_FIPS_PROVIDER) != null) {
      return BOUNCY_CASTLE_FIPS_PROVIDER;
    }
    if (Security.getProvider(BOUNCY_CASTLE_PROVIDER) == null) {
      Provider provider = new BouncyCastleProvider();
      Security.addProvider(provider);
      LOGGER.debug("Registered security provider {}", provider.getName());
    }
    return BOUNCY_CASTLE_PROVIDER;
  }
}
