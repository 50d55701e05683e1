package org.labrad.awg.errors;

public class UnresolvedVariableException extends SemanticException {
  private static final long serialVersionUID = 1L;

  private final String variable;

  public UnresolvedVariableException(String variable, String context) {
    super(String.format("Undeclared variable '%s' referenced by %s", variable, context));
    this.variable = variable;
  }

  public String getVariable() {
    return variable;
  }
}
