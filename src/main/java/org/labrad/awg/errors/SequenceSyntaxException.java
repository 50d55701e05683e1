package org.labrad.awg.errors;

/**
 * Malformed sequence text. Carries the 1-based line number and the offending token.
 */
public class SequenceSyntaxException extends CompilationException {
  private static final long serialVersionUID = 1L;

  private final int line;
  private final String token;

  public SequenceSyntaxException(int line, String token, String message) {
    super(String.format("line %d: %s (at '%s')", line, message, token));
    this.line = line;
    this.token = token;
  }

  public int getLine() {
    return line;
  }

  public String getToken() {
    return token;
  }
}
