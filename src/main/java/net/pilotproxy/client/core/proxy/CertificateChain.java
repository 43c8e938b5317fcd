package net.pilotproxy.client.core.proxy;

import java.security.cert.X509Certificate;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Non-empty ordered list of certificates with the leaf at index 0.
 *
 * <p>A chain is released exactly once by its owner. Any access after release, including a second
 * release, fails with {@link IllegalStateException}.
 */
public final class CertificateChain {
  private List<X509Certificate> certificates;

  private CertificateChain(List<X509Certificate> certificates) {
    this.certificates = certificates;
  }

  /**
   * @param certificates certificates, leaf first
   * @return new chain holding a copy of the list
   * @throws IllegalArgumentException if the list is null, empty or contains null
   */
  public static CertificateChain of(List<X509Certificate> certificates) {
    if (certificates == null || certificates.isEmpty()) {
      throw new IllegalArgumentException("A certificate chain cannot be empty");
    }
    List<X509Certificate> copy = new ArrayList<>(certificates.size());
    for (X509Certificate certificate : certificates) {
      if (certificate == null) {
        throw new IllegalArgumentException("A certificate chain cannot contain null");
      }
      copy.add(certificate);
    }
    return new CertificateChain(Collections.unmodifiableList(copy));
  }

  public X509Certificate getLeaf() {
    return get(0);
  }

  public X509Certificate get(int index) {
    return certificates().get(index);
  }

  public int size() {
    return certificates().size();
  }

  public List<X509Certificate> getCertificates() {
    return certificates();
  }

  public boolean isReleased() {
    return certificates == null;
  }

  public void release() {
    certificates();
    certificates = null;
  }

  private List<X509Certificate> certificates() {
    if (certificates == null) {
      throw new IllegalStateException("Certificate chain has already been released");
    }
    return certificates;
  }
}
