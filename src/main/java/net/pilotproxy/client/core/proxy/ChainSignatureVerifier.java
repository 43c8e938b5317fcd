package net.pilotproxy.client.core.proxy;

import java.security.InvalidKeyException;
import java.security.NoSuchAlgorithmException;
import java.security.NoSuchProviderException;
import java.security.PublicKey;
import java.security.SignatureException;
import java.security.cert.CertificateException;
import java.security.cert.X509Certificate;
import net.pilotproxy.client.log.PilotLogger;
import net.pilotproxy.client.log.PilotLoggerFactory;

/** Checks that a payload certificate was signed with the key of a pilot certificate. */
public class ChainSignatureVerifier {
  private static final PilotLogger logger =
      PilotLoggerFactory.getLogger(ChainSignatureVerifier.class);

  /**
   * @param payload certificate whose signature is checked
   * @param pilot certificate holding the expected signing key
   * @return true only when the signature verifies; every failure or error yields false
   */
  public boolean verify(X509Certificate payload, X509Certificate pilot) {
    if (payload == null || pilot == null) {
      logger.warn("Pilot or payload proxy is unset");
      return false;
    }

    PublicKey pilotKey;
    try {
      pilotKey = pilot.getPublicKey();
    } catch (RuntimeException ex) {
      logger.warn("Cannot get public key from pilot certificate: {}", ex.getMessage());
      return false;
    }
    if (pilotKey == null) {
      logger.warn("Cannot get public key from pilot certificate");
      return false;
    }

    try {
      payload.verify(pilotKey);
    } catch (CertificateException
        | NoSuchAlgorithmException
        | InvalidKeyException
        | NoSuchProviderException
        | SignatureException ex) {
      logger.warn(
          "Payload certificate {} is not signed by pilot certificate {}: {}",
          payload.getSubjectX500Principal(),
          pilot.getSubjectX500Principal(),
          ex.getMessage());
      return false;
    } catch (RuntimeException ex) {
      logger.warn("Signature verification of payload certificate failed: {}", ex.getMessage());
      return false;
    }
    logger.debug("Payload certificate {} is signed by pilot", payload.getSubjectX500Principal());
    return true;
  }
}
