package net.pilotproxy.client.core.plugin;

import net.pilotproxy.client.core.ErrorCode;

/**
 * Outcome of one authorization. Each fact is true when its check passed or was not required. A
 * decision that failed with an error carries its error code and is never trusted.
 */
public final class TrustDecision {
  private final boolean signatureValid;
  private final boolean rfcSatisfied;
  private final boolean limitedSatisfied;
  private final boolean attributesSatisfied;
  private final ErrorCode failure;

  public TrustDecision(
      boolean signatureValid,
      boolean rfcSatisfied,
      boolean limitedSatisfied,
      boolean attributesSatisfied) {
    this(signatureValid, rfcSatisfied, limitedSatisfied, attributesSatisfied, null);
  }

  private TrustDecision(
      boolean signatureValid,
      boolean rfcSatisfied,
      boolean limitedSatisfied,
      boolean attributesSatisfied,
      ErrorCode failure) {
    this.signatureValid = signatureValid;
    this.rfcSatisfied = rfcSatisfied;
    this.limitedSatisfied = limitedSatisfied;
    this.attributesSatisfied = attributesSatisfied;
    this.failure = failure;
  }

  public static TrustDecision failed(ErrorCode failure) {
    return new TrustDecision(false, false, false, false, failure);
  }

  public boolean isSignatureValid() {
    return signatureValid;
  }

  public boolean isRfcSatisfied() {
    return rfcSatisfied;
  }

  public boolean isLimitedSatisfied() {
    return limitedSatisfied;
  }

  public boolean isAttributesSatisfied() {
    return attributesSatisfied;
  }

  /** @return error code of a failed authorization, or null */
  public ErrorCode getFailure() {
    return failure;
  }

  public boolean isTrusted() {
    return failure == null
        && signatureValid
        && rfcSatisfied
        && limitedSatisfied
        && attributesSatisfied;
  }

  @Override
  public String toString() {
    return "TrustDecision{signatureValid="
        + signatureValid
        + ", rfcSatisfied="
        + rfcSatisfied
        + ", limitedSatisfied="
        + limitedSatisfied
        + ", attributesSatisfied="
        + attributesSatisfied
        + (failure != null ? ", failure=" + failure : "")
        + '}';
  }
}
