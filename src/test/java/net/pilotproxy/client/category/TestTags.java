package net.pilotproxy.client.category;

public class TestTags {
  private TestTags() {}

  public static final String CONFIG = "config";
  public static final String CORE = "core";
  public static final String FILE = "file";
  public static final String LOGGING = "logging";
  public static final String PLUGIN = "plugin";
  public static final String PROXY = "proxy";
}
