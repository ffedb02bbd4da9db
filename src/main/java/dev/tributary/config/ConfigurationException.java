package dev.tributary.config;

/**
 * Raised when configuration is missing or malformed (credentials, paths, URL shape, stage
 * wiring). Always thrown before any I/O and aborts the whole run.
 */
public class ConfigurationException extends RuntimeException {

  public ConfigurationException(String message) {
    super(message);
  }

  public ConfigurationException(String message, Throwable cause) {
    super(message, cause);
  }
}
