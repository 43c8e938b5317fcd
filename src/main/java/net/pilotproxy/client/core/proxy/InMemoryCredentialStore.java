package net.pilotproxy.client.core.proxy;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import net.pilotproxy.client.core.ErrorCode;
import net.pilotproxy.client.core.PilotProxyException;

/** Credential store keeping values per type in insertion order. */
public class InMemoryCredentialStore implements CredentialStore {
  private final Map<CredentialType, List<String>> data = new EnumMap<>(CredentialType.class);

  @Override
  public synchronized void addCredentialData(CredentialType type, String value)
      throws PilotProxyException {
    if (type == null || value == null) {
      throw new PilotProxyException(
          ErrorCode.CREDENTIAL_STORE_ERROR, "null credential of type " + type);
    }
    data.computeIfAbsent(type, k -> new ArrayList<>()).add(value);
  }

  public synchronized List<String> getCredentialData(CredentialType type) {
    List<String> values = data.get(type);
    return values == null
        ? Collections.emptyList()
        : Collections.unmodifiableList(new ArrayList<>(values));
  }

  public synchronized boolean isEmpty() {
    return data.isEmpty();
  }

  public synchronized void clear() {
    data.clear();
  }
}
