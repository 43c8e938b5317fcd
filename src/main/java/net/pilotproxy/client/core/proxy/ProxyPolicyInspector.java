package net.pilotproxy.client.core.proxy;

import java.math.BigInteger;
import java.security.cert.X509Certificate;
import java.util.Set;
import net.pilotproxy.client.log.PilotLogger;
import net.pilotproxy.client.log.PilotLoggerFactory;
import org.bouncycastle.asn1.ASN1Encodable;
import org.bouncycastle.asn1.ASN1Integer;
import org.bouncycastle.asn1.ASN1ObjectIdentifier;
import org.bouncycastle.asn1.ASN1OctetString;
import org.bouncycastle.asn1.ASN1Sequence;

/**
 * Classifies proxy certificates by their RFC 3820 ProxyCertInfo extension.
 *
 * <pre>
 * ProxyCertInfo ::= SEQUENCE {
 *     pCPathLenConstraint   INTEGER (0..MAX) OPTIONAL,
 *     proxyPolicy           ProxyPolicy }
 *
 * ProxyPolicy ::= SEQUENCE {
 *     policyLanguage        OBJECT IDENTIFIER,
 *     policy                OCTET STRING OPTIONAL }
 * </pre>
 */
public class ProxyPolicyInspector {
  private static final PilotLogger logger =
      PilotLoggerFactory.getLogger(ProxyPolicyInspector.class);

  /** id-pe-proxyCertInfo */
  public static final String RFC_PROXY_OID = "1.3.6.1.5.5.7.1.14";

  /** Globus limited proxy policy language */
  public static final String LIMITED_PROXY_OID = "1.3.6.1.4.1.3536.1.1.1.9";

  /**
   * @param cert certificate to classify
   * @return true if any extension carries the RFC 3820 proxy OID
   */
  public boolean isRfcProxy(X509Certificate cert) {
    if (cert == null) {
      return false;
    }
    return containsOid(cert.getCriticalExtensionOIDs())
        || containsOid(cert.getNonCriticalExtensionOIDs());
  }

  /**
   * @param cert certificate to classify
   * @return true only if the ProxyCertInfo policy language is the limited proxy OID
   */
  public boolean isLimitedProxy(X509Certificate cert) {
    ProxyCertInfoLookup lookup = lookupProxyCertInfo(cert);
    switch (lookup.getStatus()) {
      case PRESENT:
        logger.debug("Found policy language {}", lookup.getPolicyLanguage());
        return LIMITED_PROXY_OID.equals(lookup.getPolicyLanguage());
      case MALFORMED:
        logger.warn("Cannot decode ProxyCertInfo extension: {}", lookup.getError());
        return false;
      case ABSENT:
      default:
        return false;
    }
  }

  public ProxyCertInfoLookup lookupProxyCertInfo(X509Certificate cert) {
    if (cert == null) {
      return ProxyCertInfoLookup.absent();
    }
    byte[] extensionBytes = cert.getExtensionValue(RFC_PROXY_OID);
    if (extensionBytes == null) {
      return ProxyCertInfoLookup.absent();
    }

    try {
      ASN1OctetString octetString = ASN1OctetString.getInstance(extensionBytes);
      ASN1Sequence proxyCertInfo = ASN1Sequence.getInstance(octetString.getOctets());

      int index = 0;
      BigInteger pathLength = null;
      if (proxyCertInfo.size() > index && proxyCertInfo.getObjectAt(index) instanceof ASN1Integer) {
        pathLength = ((ASN1Integer) proxyCertInfo.getObjectAt(index)).getValue();
        index++;
      }
      if (proxyCertInfo.size() <= index) {
        return ProxyCertInfoLookup.malformed("proxyPolicy is missing");
      }

      ASN1Sequence proxyPolicy = ASN1Sequence.getInstance(proxyCertInfo.getObjectAt(index));
      if (proxyPolicy.size() == 0) {
        return ProxyCertInfoLookup.present(null, pathLength);
      }
      ASN1Encodable language = proxyPolicy.getObjectAt(0);
      return ProxyCertInfoLookup.present(
          ASN1ObjectIdentifier.getInstance(language).getId(), pathLength);
    } catch (IllegalArgumentException | ClassCastException ex) {
      return ProxyCertInfoLookup.malformed(ex.getMessage());
    }
  }

  private static boolean containsOid(Set<String> oids) {
    if (oids == null) {
      return false;
    }
    for (String oid : oids) {
      if (RFC_PROXY_OID.equals(oid)) {
        return true;
      }
    }
    return false;
  }
}
