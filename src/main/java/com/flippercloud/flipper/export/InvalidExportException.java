package com.flippercloud.flipper.export;

/**
 * Thrown when export contents are valid JSON but do not have the expected structure.
 */
public final class InvalidExportException extends ExportException {
  private static final long serialVersionUID = 1L;

  public InvalidExportException(String message) {
    super(message);
  }
}
