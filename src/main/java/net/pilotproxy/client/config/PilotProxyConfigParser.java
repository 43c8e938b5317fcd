package net.pilotproxy.client.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.attribute.PosixFilePermission;
import java.util.Set;
import java.util.function.Function;
import net.pilotproxy.client.core.ErrorCode;
import net.pilotproxy.client.core.PilotProxyException;
import net.pilotproxy.client.core.PilotProxyUtil;
import net.pilotproxy.client.log.PilotLogger;
import net.pilotproxy.client.log.PilotLoggerFactory;

public class PilotProxyConfigParser {
  private static final PilotLogger logger =
      PilotLoggerFactory.getLogger(PilotProxyConfigParser.class);
  public static final String CONFIG_FILE_NAME = "pilot_sub_proxy_config.json";
  public static final String CONFIG_ENV_NAME = "PILOT_SUB_PROXY_CONFIG_FILE";

  private PilotProxyConfigParser() {}

  /**
   * Construct PilotProxyConfig from the config file. This method searches the config file in
   * following order: 1. configFilePath param. 2. Environment variable PILOT_SUB_PROXY_CONFIG_FILE
   * containing full path to the config file. 3. Default config file name
   * (pilot_sub_proxy_config.json) under user home directory. Defaults are used when no file is
   * found.
   *
   * @param configFilePath explicit config file path, may be null
   * @return PilotProxyConfig
   * @throws PilotProxyException CONFIGURATION_ERROR if the config file cannot be read or holds
   *     invalid values
   */
  public static PilotProxyConfig loadConfig(String configFilePath) throws PilotProxyException {
    return loadConfig(
        configFilePath,
        PilotProxyUtil::systemGetEnv,
        PilotProxyUtil.systemGetProperty("user.home"));
  }

  static PilotProxyConfig loadConfig(
      String configFilePath, Function<String, String> envLookup, String homeDirectory)
      throws PilotProxyException {
    String derivedConfigFilePath = null;
    if (!PilotProxyUtil.isNullOrEmpty(configFilePath)) {
      logger.info("Using config file specified by caller: {}", configFilePath);
      derivedConfigFilePath = configFilePath;
    } else if (!PilotProxyUtil.isNullOrEmpty(envLookup.apply(CONFIG_ENV_NAME))) {
      derivedConfigFilePath = envLookup.apply(CONFIG_ENV_NAME);
      logger.info(
          "Using config file specified from environment variable: {}", derivedConfigFilePath);
    } else if (homeDirectory != null) {
      Path userHomeFilePath = Paths.get(homeDirectory, CONFIG_FILE_NAME);
      if (Files.exists(userHomeFilePath)) {
        logger.info("Using config file specified from home directory: {}", userHomeFilePath);
        derivedConfigFilePath = userHomeFilePath.toString();
      }
    }

    if (derivedConfigFilePath == null) {
      logger.debug("No config file found, using defaults");
      return validate(new PilotProxyConfig());
    }

    try {
      checkConfigFilePermissions(derivedConfigFilePath);

      ObjectMapper objectMapper = new ObjectMapper();
      PilotProxyConfig config =
          objectMapper.readValue(Paths.get(derivedConfigFilePath).toFile(), PilotProxyConfig.class);
      logger.debug(
          "Reading values lockType {} and fqanPattern {} from config",
          config.getLockType(),
          config.getFqanPattern());

      for (String unknownParam : config.getUnknownParamKeys()) {
        logger.warn("Unknown field from config: {}", unknownParam);
      }
      config.setConfigFilePath(derivedConfigFilePath);
      return validate(config);
    } catch (IOException e) {
      throw new PilotProxyException(
          e,
          ErrorCode.CONFIGURATION_ERROR,
          "error while reading config file at location: " + derivedConfigFilePath);
    }
  }

  private static PilotProxyConfig validate(PilotProxyConfig config) throws PilotProxyException {
    config.resolveLockType();
    config.resolveRetryPolicy();
    config.resolveFqanPattern();
    return config;
  }

  private static void checkConfigFilePermissions(String derivedConfigFilePath)
      throws IOException {
    if (!PilotProxyUtil.isWindows() && checkGroupOthersWritePermissions(derivedConfigFilePath)) {
      logger.warn(
          "Other users have permission to modify the config file: {}", derivedConfigFilePath);
    }
  }

  static boolean checkGroupOthersWritePermissions(String configFilePath) throws IOException {
    Set<PosixFilePermission> filePermissions =
        Files.getPosixFilePermissions(Paths.get(configFilePath));
    return filePermissions.contains(PosixFilePermission.GROUP_WRITE)
        || filePermissions.contains(PosixFilePermission.OTHERS_WRITE);
  }
}
