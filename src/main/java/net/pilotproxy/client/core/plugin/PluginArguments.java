package net.pilotproxy.client.core.plugin;

import java.security.cert.X509Certificate;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Ordered arguments of one authorization request. Lookups match on both name and type and return
 * the first hit.
 */
public final class PluginArguments {
  /** payload chain as certificates, leaf first */
  public static final String PX509_CHAIN = "px509_chain";
  /** payload chain as PEM text */
  public static final String PEM_STRING = "pem_string";
  /** number of entries in {@link #FQAN_LIST} */
  public static final String NFQAN = "nfqan";
  /** FQAN values */
  public static final String FQAN_LIST = "fqan_list";

  private final List<PluginArgument> arguments;

  private PluginArguments(List<PluginArgument> arguments) {
    this.arguments = Collections.unmodifiableList(arguments);
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * @param name argument name
   * @param type declared argument type
   * @return value of the first argument with this name and type, or null when there is none
   */
  public <T> T getArgValue(String name, Class<T> type) {
    for (PluginArgument argument : arguments) {
      if (argument.getName().equals(name) && argument.getType().equals(type)) {
        return type.cast(argument.getValue());
      }
    }
    return null;
  }

  public List<PluginArgument> getArguments() {
    return arguments;
  }

  public static final class Builder {
    private final List<PluginArgument> arguments = new ArrayList<>();

    private Builder() {}

    public Builder add(String name, Class<?> type, Object value) {
      arguments.add(new PluginArgument(name, type, value));
      return this;
    }

    public Builder payloadChain(X509Certificate... chain) {
      return add(PX509_CHAIN, X509Certificate[].class, chain);
    }

    public Builder pemString(String pem) {
      return add(PEM_STRING, String.class, pem);
    }

    public Builder fqans(String... fqans) {
      add(NFQAN, Integer.class, fqans == null ? 0 : fqans.length);
      return add(FQAN_LIST, String[].class, fqans);
    }

    public PluginArguments build() {
      return new PluginArguments(new ArrayList<>(arguments));
    }
  }
}
