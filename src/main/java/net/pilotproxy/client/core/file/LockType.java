package net.pilotproxy.client.core.file;

import java.util.Locale;
import net.pilotproxy.client.core.ErrorCode;
import net.pilotproxy.client.core.PilotProxyException;

/** Advisory locking policy used while reading a file. Policies are never combined. */
public enum LockType {
  /** No locking at all. */
  NONE("none", "nolock"),
  /** Whole-file POSIX range lock. */
  RANGE("range", "fcntl"),
  /** Whole-file BSD flag lock. */
  FLAG("flag", "flock");

  private final String configName;
  private final String alias;

  LockType(String name, String alias) {
    this.configName = name;
    this.alias = alias;
  }

  public String getName() {
    return configName;
  }

  FileLocker newLocker() {
    switch (this) {
      case RANGE:
        return new RangeFileLocker();
      case FLAG:
        return new FlagFileLocker(PosixLibC.INSTANCE);
      case NONE:
      default:
        return new NoFileLocker();
    }
  }

  /**
   * @param value lock type name, case-insensitive: none/nolock, range/fcntl or flag/flock
   * @return matching lock type
   * @throws PilotProxyException CONFIGURATION_ERROR for an unknown or missing name
   */
  public static LockType fromString(String value) throws PilotProxyException {
    if (value != null) {
      String lower = value.trim().toLowerCase(Locale.ROOT);
      for (LockType type : values()) {
        if (type.configName.equals(lower) || type.alias.equals(lower)) {
          return type;
        }
      }
    }
    throw new PilotProxyException(ErrorCode.CONFIGURATION_ERROR, "unknown lock type " + value);
  }
}
