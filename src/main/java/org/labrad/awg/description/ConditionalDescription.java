package org.labrad.awg.description;

import java.util.List;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;

/**
 * An if/else block. The predicate is evaluated once per scan point.
 */
public final class ConditionalDescription implements SequenceNode {
  private final Predicate predicate;
  private final ImmutableList<SequenceNode> thenBranch;
  private final ImmutableList<SequenceNode> elseBranch;
  private final int line;

  public ConditionalDescription(Predicate predicate, List<SequenceNode> thenBranch,
      List<SequenceNode> elseBranch, int line) {
    this.predicate = Preconditions.checkNotNull(predicate);
    this.thenBranch = ImmutableList.copyOf(thenBranch);
    this.elseBranch = ImmutableList.copyOf(elseBranch);
    this.line = line;
  }

  public Predicate getPredicate() {
    return predicate;
  }

  public List<SequenceNode> getThenBranch() {
    return thenBranch;
  }

  /**
   * Else branch, empty when none was written.
   */
  public List<SequenceNode> getElseBranch() {
    return elseBranch;
  }

  @Override
  public int getLine() {
    return line;
  }

  @Override
  public String toString() {
    return "if " + predicate + " " + thenBranch + " else " + elseBranch;
  }
}
