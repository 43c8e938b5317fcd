package net.pilotproxy.client.core.plugin;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.function.Function;
import net.pilotproxy.client.core.ErrorCode;
import net.pilotproxy.client.core.PilotProxyException;
import net.pilotproxy.client.core.PilotProxyUtil;
import net.pilotproxy.client.core.file.LockType;
import net.pilotproxy.client.core.file.LockedFileReader;
import net.pilotproxy.client.core.proxy.PemChainDecoder;
import net.pilotproxy.client.log.PilotLogger;
import net.pilotproxy.client.log.PilotLoggerFactory;

/** Loads the pilot proxy chain from the file named by {@code X509_USER_PROXY}. */
public class PilotProxyRetriever {
  private static final PilotLogger logger = PilotLoggerFactory.getLogger(PilotProxyRetriever.class);

  public static final String X509_USER_PROXY_ENV = "X509_USER_PROXY";

  private final LockedFileReader reader;
  private final PemChainDecoder decoder;
  private final Function<String, String> envLookup;

  public PilotProxyRetriever(LockedFileReader reader, PemChainDecoder decoder) {
    this(reader, decoder, PilotProxyUtil::systemGetEnv);
  }

  PilotProxyRetriever(
      LockedFileReader reader, PemChainDecoder decoder, Function<String, String> envLookup) {
    this.reader = reader;
    this.decoder = decoder;
    this.envLookup = envLookup;
  }

  /**
   * @param lockType lock taken while reading the proxy file
   * @return the pilot chain, always owned by the caller
   * @throws PilotProxyException MISSING_PILOT_PROXY_ENV when the variable is unset, or any error of
   *     the file reader and PEM decoder
   */
  public RetrievedChain retrieve(LockType lockType) throws PilotProxyException {
    String proxyFile = envLookup.apply(X509_USER_PROXY_ENV);
    if (PilotProxyUtil.isNullOrEmpty(proxyFile)) {
      logger.error("Environment variable {} is not set", X509_USER_PROXY_ENV);
      throw new PilotProxyException(ErrorCode.MISSING_PILOT_PROXY_ENV, X509_USER_PROXY_ENV);
    }

    Path path = Paths.get(proxyFile);
    logger.debug("Reading pilot proxy from {} with lock type {}", path, lockType.getName());
    byte[] contents = reader.read(path, lockType);
    return new RetrievedChain(decoder.decode(contents), true);
  }
}
