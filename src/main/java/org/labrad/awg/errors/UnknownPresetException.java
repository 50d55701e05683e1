package org.labrad.awg.errors;

public class UnknownPresetException extends SequenceSyntaxException {
  private static final long serialVersionUID = 1L;

  public UnknownPresetException(int line, String name) {
    super(line, name, "unknown preset");
  }
}
