package net.pilotproxy.client.core.proxy;

import java.math.BigInteger;

/**
 * Result of looking up the RFC 3820 ProxyCertInfo extension of one certificate. An absent
 * extension and an undecodable one are different outcomes.
 */
public final class ProxyCertInfoLookup {
  public enum Status {
    ABSENT,
    PRESENT,
    MALFORMED
  }

  private static final ProxyCertInfoLookup ABSENT =
      new ProxyCertInfoLookup(Status.ABSENT, null, null, null);

  private final Status status;
  private final String policyLanguage;
  private final BigInteger pathLengthConstraint;
  private final String error;

  private ProxyCertInfoLookup(
      Status status, String policyLanguage, BigInteger pathLengthConstraint, String error) {
    this.status = status;
    this.policyLanguage = policyLanguage;
    this.pathLengthConstraint = pathLengthConstraint;
    this.error = error;
  }

  static ProxyCertInfoLookup absent() {
    return ABSENT;
  }

  static ProxyCertInfoLookup present(String policyLanguage, BigInteger pathLengthConstraint) {
    return new ProxyCertInfoLookup(Status.PRESENT, policyLanguage, pathLengthConstraint, null);
  }

  static ProxyCertInfoLookup malformed(String error) {
    return new ProxyCertInfoLookup(Status.MALFORMED, null, null, error);
  }

  public Status getStatus() {
    return status;
  }

  /** @return dotted policy language OID, or null when absent */
  public String getPolicyLanguage() {
    return policyLanguage;
  }

  /** @return pCPathLenConstraint, or null when unlimited */
  public BigInteger getPathLengthConstraint() {
    return pathLengthConstraint;
  }

  public String getError() {
    return error;
  }

  @Override
  public String toString() {
    return "ProxyCertInfoLookup{status="
        + status
        + (policyLanguage != null ? ", policyLanguage=" + policyLanguage : "")
        + (pathLengthConstraint != null ? ", pathLen=" + pathLengthConstraint : "")
        + (error != null ? ", error=" + error : "")
        + '}';
  }
}
