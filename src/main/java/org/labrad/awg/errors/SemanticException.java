package org.labrad.awg.errors;

/**
 * A scan point that cannot be resolved into a valid timeline.
 */
public abstract class SemanticException extends CompilationException {
  private static final long serialVersionUID = 1L;

  protected SemanticException(String message) {
    super(message);
  }

  protected SemanticException(String message, Throwable cause) {
    super(message, cause);
  }
}
