package org.labrad.awg.errors;

public class UnknownUnitException extends SequenceSyntaxException {
  private static final long serialVersionUID = 1L;

  public UnknownUnitException(int line, String token) {
    super(line, token, "unknown unit");
  }
}
