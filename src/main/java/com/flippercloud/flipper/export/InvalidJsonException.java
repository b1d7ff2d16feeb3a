package com.flippercloud.flipper.export;

/**
 * Thrown when export contents cannot be parsed as JSON.
 */
public final class InvalidJsonException extends ExportException {
  private static final long serialVersionUID = 1L;

  public InvalidJsonException(String message, Throwable cause) {
    super(message, cause);
  }
}
