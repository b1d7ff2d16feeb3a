package com.flippercloud.flipper.export;

/**
 * Base class for errors reading the contents of an {@link Export}.
 */
public class ExportException extends RuntimeException {
  private static final long serialVersionUID = 1L;

  public ExportException(String message) {
    super(message);
  }

  public ExportException(String message, Throwable cause) {
    super(message, cause);
  }
}
