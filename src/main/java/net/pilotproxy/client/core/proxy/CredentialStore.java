package net.pilotproxy.client.core.proxy;

import net.pilotproxy.client.core.PilotProxyException;

/** Sink that receives the credential data of a trusted payload. */
public interface CredentialStore {
  /**
   * @param type kind of credential
   * @param value credential value
   * @throws PilotProxyException if the value cannot be stored
   */
  void addCredentialData(CredentialType type, String value) throws PilotProxyException;
}
