package net.pilotproxy.client.core;

import java.text.MessageFormat;
import java.util.MissingResourceException;
import java.util.ResourceBundle;

/**
 * Checked failure raised by the file, parsing and retrieval layers. The message is resolved from
 * the error message bundle using the error code and the supplied parameters.
 */
public class PilotProxyException extends Exception {
  private static final long serialVersionUID = 1L;

  private static final ResourceBundle errorMessages =
      ResourceBundle.getBundle(ErrorCode.errorMessageResource);

  private final ErrorCode errorCode;
  private final Object[] params;

  public PilotProxyException(ErrorCode errorCode, Object... params) {
    this(null, errorCode, params);
  }

  /**
   * @param cause throwable
   * @param errorCode error code
   * @param params additional params
   */
  public PilotProxyException(Throwable cause, ErrorCode errorCode, Object... params) {
    super(getLocalizedMessage(errorCode, params), cause);
    this.errorCode = errorCode;
    this.params = params;
  }

  public ErrorCode getErrorCode() {
    return errorCode;
  }

  public int getVendorCode() {
    return errorCode.getMessageCode();
  }

  public Object[] getParams() {
    return params;
  }

  static String getLocalizedMessage(ErrorCode errorCode, Object... params) {
    String key = String.valueOf(errorCode.getMessageCode());
    try {
      return MessageFormat.format(errorMessages.getString(key), params);
    } catch (MissingResourceException ex) {
      return "!!" + key + "!!";
    }
  }

  @Override
  public String toString() {
    return super.toString() + ", error code = " + errorCode.getMessageCode();
  }
}
