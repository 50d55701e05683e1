package org.labrad.awg.errors;

/**
 * Base class of all errors raised while compiling a sequence.
 */
public abstract class CompilationException extends RuntimeException {
  private static final long serialVersionUID = 1L;

  protected CompilationException(String message) {
    super(message);
  }

  protected CompilationException(String message, Throwable cause) {
    super(message, cause);
  }
}
