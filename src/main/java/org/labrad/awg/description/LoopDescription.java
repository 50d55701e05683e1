package org.labrad.awg.description;

import java.util.List;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;

/**
 * A loop over a nested body. The iteration source is either a literal
 * count or a variable, in which case the body runs once per generated value
 * with the variable bound to that value.
 */
public final class LoopDescription implements SequenceNode {
  private final ParameterValue iterations;
  private final ParameterValue start;
  private final ImmutableList<SequenceNode> body;
  private final int line;

  public LoopDescription(ParameterValue iterations, ParameterValue start, List<SequenceNode> body, int line) {
    this.iterations = Preconditions.checkNotNull(iterations);
    this.start = start;
    this.body = ImmutableList.copyOf(body);
    this.line = line;
  }

  public ParameterValue getIterations() {
    return iterations;
  }

  /**
   * Loop variable, or null for a counted loop.
   */
  public String getIterator() {
    return iterations.isVariable() ? iterations.getVariable() : null;
  }

  /**
   * Start time, or null to start at the end of the preceding content.
   */
  public ParameterValue getStart() {
    return start;
  }

  public List<SequenceNode> getBody() {
    return body;
  }

  @Override
  public int getLine() {
    return line;
  }

  @Override
  public String toString() {
    return "loop " + iterations + (start != null ? " at " + start : "") + " " + body;
  }
}
