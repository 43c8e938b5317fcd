package net.pilotproxy.client.core.proxy;

import java.io.IOException;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import java.security.cert.CertificateException;
import java.security.cert.X509Certificate;
import java.util.ArrayList;
import java.util.List;
import net.pilotproxy.client.core.ErrorCode;
import net.pilotproxy.client.core.PilotProxyException;
import net.pilotproxy.client.core.SecurityUtil;
import net.pilotproxy.client.log.PilotLogger;
import net.pilotproxy.client.log.PilotLoggerFactory;
import org.bouncycastle.cert.X509CertificateHolder;
import org.bouncycastle.cert.jcajce.JcaX509CertificateConverter;
import org.bouncycastle.util.io.pem.PemObject;
import org.bouncycastle.util.io.pem.PemReader;

/**
 * Turns PEM text into a {@link CertificateChain}, keeping the input order. PEM objects that are not
 * certificates, such as the private key stored in a proxy file, are skipped.
 */
public class PemChainDecoder {
  private static final PilotLogger logger = PilotLoggerFactory.getLogger(PemChainDecoder.class);

  private static final String CERTIFICATE_TYPE = "CERTIFICATE";
  private static final String X509_CERTIFICATE_TYPE = "X509 CERTIFICATE";

  private final JcaX509CertificateConverter converter;

  public PemChainDecoder() {
    this.converter =
        new JcaX509CertificateConverter().setProvider(SecurityUtil.addBouncyCastleProvider());
  }

  public CertificateChain decode(byte[] pem) throws PilotProxyException {
    if (pem == null) {
      throw new PilotProxyException(ErrorCode.PEM_PARSE_ERROR, "no PEM data given");
    }
    return decode(new String(pem, StandardCharsets.UTF_8));
  }

  /**
   * @param pem PEM text with one or more certificates
   * @return chain in input order
   * @throws PilotProxyException PEM_PARSE_ERROR for malformed input, NO_CERTIFICATES_FOUND when
   *     the text holds no certificate
   */
  public CertificateChain decode(String pem) throws PilotProxyException {
    if (pem == null) {
      throw new PilotProxyException(ErrorCode.PEM_PARSE_ERROR, "no PEM data given");
    }

    List<X509Certificate> certificates = new ArrayList<>();
    try (PemReader reader = new PemReader(new StringReader(pem))) {
      PemObject pemObject;
      while ((pemObject = reader.readPemObject()) != null) {
        String type = pemObject.getType();
        if (!CERTIFICATE_TYPE.equals(type) && !X509_CERTIFICATE_TYPE.equals(type)) {
          logger.trace("Skipping PEM object of type {}", type);
          continue;
        }
        X509CertificateHolder holder = new X509CertificateHolder(pemObject.getContent());
        certificates.add(converter.getCertificate(holder));
      }
    } catch (IOException | CertificateException | RuntimeException ex) {
      logger.debug("Cannot convert PEM string to certificate chain: {}", ex.getMessage());
      throw new PilotProxyException(ex, ErrorCode.PEM_PARSE_ERROR, String.valueOf(ex));
    }

    if (certificates.isEmpty()) {
      throw new PilotProxyException(ErrorCode.NO_CERTIFICATES_FOUND);
    }
    logger.debug("Decoded certificate chain of length {}", certificates.size());
    return CertificateChain.of(certificates);
  }
}
