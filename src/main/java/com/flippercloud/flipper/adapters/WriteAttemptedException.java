package com.flippercloud.flipper.adapters;

/**
 * Thrown by {@link ReadOnly} when a write is attempted.
 */
public final class WriteAttemptedException extends RuntimeException {
  private static final long serialVersionUID = 1L;

  public WriteAttemptedException() {
    super("write attempted while in read only mode");
  }
}
