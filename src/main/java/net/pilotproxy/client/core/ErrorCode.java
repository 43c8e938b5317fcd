package net.pilotproxy.client.core;

import java.util.HashMap;
import java.util.Map;

/**
 * Internal error codes of the pilot sub-proxy library.
 *
 * <p>Codes are partitioned by the kind of failure so callers can log precisely:
 *
 * <p>1NN: configuration, 2NN: file access, 3NN: certificate parsing, 4NN: trust and emission.
 */
public enum ErrorCode {
  CONFIGURATION_ERROR(100, Kind.CONFIGURATION),
  MISSING_PILOT_PROXY_ENV(101, Kind.CONFIGURATION),

  IO_ERROR(200, Kind.IO),
  PRIVILEGE_ERROR(201, Kind.PRIVILEGE),
  PERMISSION_ERROR(202, Kind.PERMISSION),
  OUT_OF_MEMORY(203, Kind.OUT_OF_MEMORY),
  TOO_MANY_RETRIES(204, Kind.RETRY),
  LOCK_ERROR(205, Kind.LOCKING),

  PEM_PARSE_ERROR(300, Kind.PARSE),
  NO_CERTIFICATES_FOUND(301, Kind.PARSE),

  MISSING_PAYLOAD(400, Kind.TRUST),
  CREDENTIAL_STORE_ERROR(401, Kind.EMISSION);

  public static final String errorMessageResource =
      "net.pilotproxy.client.core.pilotproxy_error_messages";

  /** Failure classes distinguished by callers when reporting. */
  public enum Kind {
    CONFIGURATION,
    IO,
    PRIVILEGE,
    PERMISSION,
    OUT_OF_MEMORY,
    RETRY,
    LOCKING,
    PARSE,
    TRUST,
    EMISSION
  }

  private final int messageCode;

  private final Kind kind;

  ErrorCode(int messageCode, Kind kind) {
    this.messageCode = messageCode;
    this.kind = kind;
  }

  public int getMessageCode() {
    return messageCode;
  }

  public Kind getKind() {
    return kind;
  }

  @Override
  public String toString() {
    return "ErrorCode{" + "messageCode=" + messageCode + ", kind=" + kind + '}';
  }

  private static final Map<Integer, ErrorCode> errorCodeMap = new HashMap<>();

  static {
    for (ErrorCode errorCode : ErrorCode.values()) {
      errorCodeMap.put(errorCode.getMessageCode(), errorCode);
    }
  }

  public static ErrorCode getByMessageCode(int messageCode) {
    return errorCodeMap.get(messageCode);
  }
}
