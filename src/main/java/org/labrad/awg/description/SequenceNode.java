package org.labrad.awg.description;

/**
 * An element of a sequence body: a pulse, a loop or a conditional.
 */
public interface SequenceNode {
  /**
   * Source line the node was declared on, or 0 when built programmatically.
   */
  int getLine();
}
