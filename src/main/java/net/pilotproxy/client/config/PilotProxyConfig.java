package net.pilotproxy.client.config;

import com.fasterxml.jackson.annotation.JsonAnySetter;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import net.pilotproxy.client.core.ErrorCode;
import net.pilotproxy.client.core.PilotProxyException;
import net.pilotproxy.client.core.file.LockType;
import net.pilotproxy.client.core.file.ReadRetryPolicy;
import net.pilotproxy.client.core.proxy.GlobPattern;

/** POJO class for the pilot sub-proxy config. */
public class PilotProxyConfig {
  @JsonProperty("lock_type")
  private String lockType = LockType.NONE.getName();

  @JsonProperty("fqan_pattern")
  private String fqanPattern;

  @JsonProperty("require_rfc_proxy")
  private boolean requireRfcProxy = true;

  @JsonProperty("require_limited_proxy")
  private boolean requireLimitedProxy = false;

  @JsonProperty("max_read_attempts")
  private int maxReadAttempts = ReadRetryPolicy.DEFAULT_MAX_ATTEMPTS;

  @JsonProperty("retry_pause_micros")
  private long retryPauseMicros = ReadRetryPolicy.DEFAULT_PAUSE_MICROS;

  @JsonAnySetter private Map<String, Object> unknownKeys = new LinkedHashMap<>();

  @JsonIgnore private String configFilePath;

  public PilotProxyConfig() {}

  public String getLockType() {
    return lockType;
  }

  public void setLockType(String lockType) {
    this.lockType = lockType;
  }

  public String getFqanPattern() {
    return fqanPattern;
  }

  public void setFqanPattern(String fqanPattern) {
    this.fqanPattern = fqanPattern;
  }

  public boolean isRequireRfcProxy() {
    return requireRfcProxy;
  }

  public void setRequireRfcProxy(boolean requireRfcProxy) {
    this.requireRfcProxy = requireRfcProxy;
  }

  public boolean isRequireLimitedProxy() {
    return requireLimitedProxy;
  }

  public void setRequireLimitedProxy(boolean requireLimitedProxy) {
    this.requireLimitedProxy = requireLimitedProxy;
  }

  public int getMaxReadAttempts() {
    return maxReadAttempts;
  }

  public void setMaxReadAttempts(int maxReadAttempts) {
    this.maxReadAttempts = maxReadAttempts;
  }

  public long getRetryPauseMicros() {
    return retryPauseMicros;
  }

  public void setRetryPauseMicros(long retryPauseMicros) {
    this.retryPauseMicros = retryPauseMicros;
  }

  public String getConfigFilePath() {
    return configFilePath;
  }

  public void setConfigFilePath(String configFilePath) {
    this.configFilePath = configFilePath;
  }

  @JsonIgnore
  Set<String> getUnknownParamKeys() {
    return unknownKeys.keySet();
  }

  /**
   * @return the configured lock type
   * @throws PilotProxyException CONFIGURATION_ERROR for an unknown name
   */
  @JsonIgnore
  public LockType resolveLockType() throws PilotProxyException {
    return LockType.fromString(lockType);
  }

  /**
   * @return read retry policy built from the configured bound and pause
   * @throws PilotProxyException CONFIGURATION_ERROR for a non-positive bound or a negative pause
   */
  @JsonIgnore
  public ReadRetryPolicy resolveRetryPolicy() throws PilotProxyException {
    try {
      return new ReadRetryPolicy(maxReadAttempts, retryPauseMicros);
    } catch (IllegalArgumentException ex) {
      throw new PilotProxyException(ex, ErrorCode.CONFIGURATION_ERROR, ex.getMessage());
    }
  }

  /**
   * @return compiled FQAN pattern, or null when none is configured
   * @throws PilotProxyException CONFIGURATION_ERROR for a pattern naming an unknown character
   *     class
   */
  @JsonIgnore
  public GlobPattern resolveFqanPattern() throws PilotProxyException {
    if (fqanPattern == null) {
      return null;
    }
    try {
      return GlobPattern.compile(fqanPattern);
    } catch (IllegalArgumentException ex) {
      throw new PilotProxyException(ex, ErrorCode.CONFIGURATION_ERROR, ex.getMessage());
    }
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (o == null || getClass() != o.getClass()) {
      return false;
    }
    PilotProxyConfig that = (PilotProxyConfig) o;
    return requireRfcProxy == that.requireRfcProxy
        && requireLimitedProxy == that.requireLimitedProxy
        && maxReadAttempts == that.maxReadAttempts
        && retryPauseMicros == that.retryPauseMicros
        && Objects.equals(lockType, that.lockType)
        && Objects.equals(fqanPattern, that.fqanPattern);
  }

  @Override
  public int hashCode() {
    return Objects.hash(
        lockType,
        fqanPattern,
        requireRfcProxy,
        requireLimitedProxy,
        maxReadAttempts,
        retryPauseMicros);
  }
}
