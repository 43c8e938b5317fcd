package net.pilotproxy.client.core.plugin;

import java.security.cert.X509Certificate;
import java.util.List;
import net.pilotproxy.client.config.PilotProxyConfig;
import net.pilotproxy.client.core.PilotProxyException;
import net.pilotproxy.client.core.file.LibCPosixIdentity;
import net.pilotproxy.client.core.file.LockType;
import net.pilotproxy.client.core.file.LockedFileReader;
import net.pilotproxy.client.core.proxy.ChainSignatureVerifier;
import net.pilotproxy.client.core.proxy.CredentialStore;
import net.pilotproxy.client.core.proxy.FqanMatcher;
import net.pilotproxy.client.core.proxy.GlobPattern;
import net.pilotproxy.client.core.proxy.PemChainDecoder;
import net.pilotproxy.client.core.proxy.ProxyPolicyInspector;
import net.pilotproxy.client.core.proxy.TrustAssertionEmitter;
import net.pilotproxy.client.log.PilotLogger;
import net.pilotproxy.client.log.PilotLoggerFactory;

/**
 * Decides whether a payload proxy may run under the identity it claims, based on the pilot proxy
 * of the current job.
 *
 * <p>The payload leaf must be signed by the pilot leaf. Depending on the configuration both leaves
 * must also be RFC 3820 proxies, both must be limited, and one of the payload FQANs must match the
 * configured pattern. A trusted payload has its DN and FQANs stored. Failures never escape: they
 * yield a negative decision.
 */
public class PilotSubProxyAuthorizer {
  private static final PilotLogger logger =
      PilotLoggerFactory.getLogger(PilotSubProxyAuthorizer.class);

  private final LockType lockType;
  private final boolean requireRfcProxy;
  private final boolean requireLimitedProxy;
  private final GlobPattern fqanPattern;

  private final PilotProxyRetriever pilotRetriever;
  private final PayloadProxyRetriever payloadRetriever;
  private final FqanRetriever fqanRetriever;
  private final ChainSignatureVerifier verifier;
  private final ProxyPolicyInspector inspector;
  private final TrustAssertionEmitter emitter;

  public PilotSubProxyAuthorizer(
      PilotProxyConfig config,
      PilotProxyRetriever pilotRetriever,
      PayloadProxyRetriever payloadRetriever,
      FqanRetriever fqanRetriever,
      ChainSignatureVerifier verifier,
      ProxyPolicyInspector inspector,
      TrustAssertionEmitter emitter)
      throws PilotProxyException {
    this.lockType = config.resolveLockType();
    this.requireRfcProxy = config.isRequireRfcProxy();
    this.requireLimitedProxy = config.isRequireLimitedProxy();
    this.fqanPattern = config.resolveFqanPattern();
    this.pilotRetriever = pilotRetriever;
    this.payloadRetriever = payloadRetriever;
    this.fqanRetriever = fqanRetriever;
    this.verifier = verifier;
    this.inspector = inspector;
    this.emitter = emitter;
  }

  /**
   * Wires an authorizer for the current process.
   *
   * @param config loaded configuration
   * @param store sink for the credentials of trusted payloads
   * @return authorizer
   * @throws PilotProxyException CONFIGURATION_ERROR for invalid configuration values
   */
  public static PilotSubProxyAuthorizer create(PilotProxyConfig config, CredentialStore store)
      throws PilotProxyException {
    PemChainDecoder decoder = new PemChainDecoder();
    LockedFileReader reader =
        new LockedFileReader(LibCPosixIdentity.getInstance(), config.resolveRetryPolicy());
    return new PilotSubProxyAuthorizer(
        config,
        new PilotProxyRetriever(reader, decoder),
        new PayloadProxyRetriever(decoder),
        new FqanRetriever(),
        new ChainSignatureVerifier(),
        new ProxyPolicyInspector(),
        new TrustAssertionEmitter(store));
  }

  public TrustDecision authorize(PluginArguments args) {
    RetrievedChain pilot = null;
    RetrievedChain payload = null;
    try {
      pilot = pilotRetriever.retrieve(lockType);
      payload = payloadRetriever.retrieve(args);
      List<String> fqans = fqanRetriever.retrieve(args);

      X509Certificate pilotLeaf = pilot.getChain().getLeaf();
      X509Certificate payloadLeaf = payload.getChain().getLeaf();

      TrustDecision decision =
          new TrustDecision(
              verifier.verify(payloadLeaf, pilotLeaf),
              checkRfc(pilotLeaf, payloadLeaf),
              checkLimited(pilotLeaf, payloadLeaf),
              checkFqans(fqans));
      if (!decision.isTrusted()) {
        logger.warn("Payload proxy is not trusted: {}", decision);
        return decision;
      }

      emitter.storeSubjectDn(payloadLeaf);
      emitter.storeFqans(fqans);
      logger.info("Payload proxy {} is trusted", payloadLeaf.getSubjectX500Principal());
      return decision;
    } catch (PilotProxyException ex) {
      logger.error("Authorization failed: {}", ex.getMessage());
      return TrustDecision.failed(ex.getErrorCode());
    } finally {
      if (payload != null) {
        payload.releaseIfOwned();
      }
      if (pilot != null) {
        pilot.releaseIfOwned();
      }
    }
  }

  private boolean checkRfc(X509Certificate pilotLeaf, X509Certificate payloadLeaf) {
    if (!requireRfcProxy) {
      return true;
    }
    boolean pilotRfc = inspector.isRfcProxy(pilotLeaf);
    boolean payloadRfc = inspector.isRfcProxy(payloadLeaf);
    if (!pilotRfc || !payloadRfc) {
      logger.warn("RFC proxy required, pilot: {}, payload: {}", pilotRfc, payloadRfc);
    }
    return pilotRfc && payloadRfc;
  }

  private boolean checkLimited(X509Certificate pilotLeaf, X509Certificate payloadLeaf) {
    if (!requireLimitedProxy) {
      return true;
    }
    boolean pilotLimited = inspector.isLimitedProxy(pilotLeaf);
    boolean payloadLimited = inspector.isLimitedProxy(payloadLeaf);
    if (!pilotLimited || !payloadLimited) {
      logger.warn("Limited proxy required, pilot: {}, payload: {}", pilotLimited, payloadLimited);
    }
    return pilotLimited && payloadLimited;
  }

  private boolean checkFqans(List<String> fqans) {
    if (fqanPattern == null) {
      return true;
    }
    return FqanMatcher.matchesAny(fqans, fqanPattern);
  }
}
