package com.flippercloud.flipper.adapters;

import com.google.common.collect.ImmutableList;

import java.util.List;

/**
 * The exception classes a resilience decorator intercepts. Anything else propagates.
 */
final class ErrorMatcher {
  static final ErrorMatcher ALL_RUNTIME = new ErrorMatcher(ImmutableList.of(RuntimeException.class));

  private final List<Class<? extends RuntimeException>> errors;

  ErrorMatcher(List<Class<? extends RuntimeException>> errors) {
    this.errors = ImmutableList.copyOf(errors);
  }

  static ErrorMatcher of(List<Class<? extends RuntimeException>> errors) {
    return errors == null || errors.isEmpty() ? ALL_RUNTIME : new ErrorMatcher(errors);
  }

  boolean matches(RuntimeException e) {
    for (Class<? extends RuntimeException> c: errors) {
      if (c.isInstance(e)) {
        return true;
      }
    }
    return false;
  }
}
