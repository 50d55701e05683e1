package org.labrad.awg.errors;

public class CompilationAbortedException extends CompilationException {
  private static final long serialVersionUID = 1L;

  public CompilationAbortedException(int completed) {
    super("Compilation aborted after " + completed + " scan points");
  }
}
