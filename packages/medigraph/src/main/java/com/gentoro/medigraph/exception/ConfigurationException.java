package com.gentoro.medigraph.exception;

/** Required connection parameters are absent or unusable. Raised before any connection attempt. */
public class ConfigurationException extends MedigraphException {
  public ConfigurationException(String message) {
    super(MedigraphErrorCode.CONFIGURATION_ERROR, message);
  }

  public ConfigurationException(String message, Throwable cause) {
    super(MedigraphErrorCode.CONFIGURATION_ERROR, message, cause);
  }
}
