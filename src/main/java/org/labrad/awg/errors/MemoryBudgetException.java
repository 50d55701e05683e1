package org.labrad.awg.errors;

/**
 * The compiled output does not fit the instrument memory or sequencer.
 */
public class MemoryBudgetException extends CompilationException {
  private static final long serialVersionUID = 1L;

  public MemoryBudgetException(String message) {
    super(message);
  }
}
