package net.pilotproxy.client.core.plugin;

import net.pilotproxy.client.core.proxy.CertificateChain;

/**
 * Certificate chain together with the knowledge of who releases it. Chains decoded here are owned
 * by the caller; chains passed in by the host are not.
 */
public final class RetrievedChain {
  private final CertificateChain chain;
  private final boolean callerOwnsRelease;

  public RetrievedChain(CertificateChain chain, boolean callerOwnsRelease) {
    if (chain == null) {
      throw new IllegalArgumentException("chain cannot be null");
    }
    this.chain = chain;
    this.callerOwnsRelease = callerOwnsRelease;
  }

  public CertificateChain getChain() {
    return chain;
  }

  public boolean isCallerOwnsRelease() {
    return callerOwnsRelease;
  }

  /** Releases the chain if it is owned and not released yet. */
  public void releaseIfOwned() {
    if (callerOwnsRelease && !chain.isReleased()) {
      chain.release();
    }
  }
}
