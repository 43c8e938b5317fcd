package net.pilotproxy.client.core.plugin;

import java.security.cert.X509Certificate;
import java.util.Arrays;
import net.pilotproxy.client.core.ErrorCode;
import net.pilotproxy.client.core.PilotProxyException;
import net.pilotproxy.client.core.proxy.CertificateChain;
import net.pilotproxy.client.core.proxy.PemChainDecoder;
import net.pilotproxy.client.log.PilotLogger;
import net.pilotproxy.client.log.PilotLoggerFactory;

/**
 * Obtains the payload chain from the request, preferring the certificate array over the PEM
 * string.
 */
public class PayloadProxyRetriever {
  private static final PilotLogger logger =
      PilotLoggerFactory.getLogger(PayloadProxyRetriever.class);

  private final PemChainDecoder decoder;

  public PayloadProxyRetriever(PemChainDecoder decoder) {
    this.decoder = decoder;
  }

  /**
   * @param args request arguments
   * @return the host's chain, not owned, or a chain decoded from {@code pem_string}, owned
   * @throws PilotProxyException MISSING_PAYLOAD if neither argument is usable, or a decoder error
   */
  public RetrievedChain retrieve(PluginArguments args) throws PilotProxyException {
    X509Certificate[] chain =
        args.getArgValue(PluginArguments.PX509_CHAIN, X509Certificate[].class);
    if (chain != null && chain.length > 0) {
      try {
        logger.debug("Using payload chain of length {} from arguments", chain.length);
        return new RetrievedChain(CertificateChain.of(Arrays.asList(chain)), false);
      } catch (IllegalArgumentException ex) {
        logger.warn("Ignoring unusable payload chain argument: {}", ex.getMessage());
      }
    }

    String pem = args.getArgValue(PluginArguments.PEM_STRING, String.class);
    if (pem != null) {
      logger.debug("Decoding payload chain from PEM string");
      return new RetrievedChain(decoder.decode(pem), true);
    }

    logger.warn(
        "Neither {} nor {} is set", PluginArguments.PX509_CHAIN, PluginArguments.PEM_STRING);
    throw new PilotProxyException(ErrorCode.MISSING_PAYLOAD);
  }
}
