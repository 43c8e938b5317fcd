package net.pilotproxy.client.core.proxy;

/** Kinds of credential data published for a trusted payload. */
public enum CredentialType {
  /** subject distinguished name of the payload proxy */
  DN,
  /** one VO attribute (FQAN) string */
  VO_CRED_STRING
}
