package net.pilotproxy.client.core.plugin;

/** One named and typed value handed over by the host. */
public final class PluginArgument {
  private final String name;
  private final Class<?> type;
  private final Object value;

  public PluginArgument(String name, Class<?> type, Object value) {
    if (name == null || type == null) {
      throw new IllegalArgumentException("Argument name and type are required");
    }
    if (value != null && !type.isInstance(value)) {
      throw new IllegalArgumentException(
          "Argument " + name + " is not of type " + type.getSimpleName());
    }
    this.name = name;
    this.type = type;
    this.value = value;
  }

  public String getName() {
    return name;
  }

  public Class<?> getType() {
    return type;
  }

  public Object getValue() {
    return value;
  }

  @Override
  public String toString() {
    return "PluginArgument{name=" + name + ", type=" + type.getSimpleName() + '}';
  }
}
