package org.labrad.awg.errors;

/**
 * A resolved pulse starts before zero, overlaps the previous pulse on its
 * channel, or ends after the sequence. Never clamped.
 */
public class TimingOrderException extends SemanticException {
  private static final long serialVersionUID = 1L;

  public TimingOrderException(String message) {
    super(message);
  }
}
