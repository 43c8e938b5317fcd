package net.pilotproxy.client.core.proxy;

import java.security.cert.X509Certificate;
import java.util.List;
import net.pilotproxy.client.core.ErrorCode;
import net.pilotproxy.client.core.PilotProxyException;
import net.pilotproxy.client.log.PilotLogger;
import net.pilotproxy.client.log.PilotLoggerFactory;

/** Publishes the identity of a trusted payload to a {@link CredentialStore}. */
public class TrustAssertionEmitter {
  private static final PilotLogger logger =
      PilotLoggerFactory.getLogger(TrustAssertionEmitter.class);

  private final CredentialStore store;

  public TrustAssertionEmitter(CredentialStore store) {
    this.store = store;
  }

  /**
   * Stores the subject DN of the given certificate in one-line form.
   *
   * @param cert payload leaf certificate
   * @return the stored DN
   * @throws PilotProxyException CREDENTIAL_STORE_ERROR if the DN cannot be obtained or stored
   */
  public String storeSubjectDn(X509Certificate cert) throws PilotProxyException {
    if (cert == null) {
      throw new PilotProxyException(ErrorCode.CREDENTIAL_STORE_ERROR, "no certificate for DN");
    }
    String dn;
    try {
      dn = OneLineNameFormatter.format(cert.getSubjectX500Principal());
    } catch (RuntimeException ex) {
      throw new PilotProxyException(
          ex, ErrorCode.CREDENTIAL_STORE_ERROR, "cannot obtain subject DN: " + ex.getMessage());
    }
    store.addCredentialData(CredentialType.DN, dn);
    logger.info("Stored DN {}", dn);
    return dn;
  }

  /**
   * Stores every FQAN as a VO credential string. A failed store does not stop the remaining ones
   * and nothing already stored is rolled back.
   *
   * @param fqans attribute tags, in order
   * @return number of tags stored
   * @throws PilotProxyException CREDENTIAL_STORE_ERROR after all tags were attempted, if any
   *     failed
   */
  public int storeFqans(List<String> fqans) throws PilotProxyException {
    if (fqans == null || fqans.isEmpty()) {
      return 0;
    }
    int stored = 0;
    PilotProxyException firstFailure = null;
    for (String fqan : fqans) {
      try {
        store.addCredentialData(CredentialType.VO_CRED_STRING, fqan);
        logger.debug("Stored FQAN {}", fqan);
        stored++;
      } catch (PilotProxyException ex) {
        logger.warn("Failed to store FQAN {}: {}", fqan, ex.getMessage());
        if (firstFailure == null) {
          firstFailure = ex;
        }
      }
    }
    if (firstFailure != null) {
      throw new PilotProxyException(
          firstFailure,
          ErrorCode.CREDENTIAL_STORE_ERROR,
          String.format("%d of %d FQANs not stored", fqans.size() - stored, fqans.size()));
    }
    logger.info("Stored {} FQAN(s)", stored);
    return stored;
  }
}
