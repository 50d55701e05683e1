package org.labrad.awg.description;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;
import java.util.Set;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Lists;
import com.google.common.collect.Sets;

/**
 * Hardware-agnostic description of a pulse sequence, as parsed from text.
 */
public final class SequenceDescription {
  private final String name;
  private final String type;
  private final Quantity duration;
  private final BigDecimal sampleRate;
  private final long repeatCount;
  private final ImmutableList<VariableDescription> variables;
  private final ImmutableList<SequenceNode> nodes;
  private final ImmutableMap<String, String> metadata;

  public SequenceDescription(String name, String type, Quantity duration, BigDecimal sampleRate,
      long repeatCount, List<VariableDescription> variables, List<SequenceNode> nodes,
      Map<String, String> metadata) {
    Preconditions.checkNotNull(name);
    Preconditions.checkNotNull(type);
    Preconditions.checkArgument(sampleRate.signum() > 0, "Sample rate must be positive");
    Preconditions.checkArgument(repeatCount >= 1, "Repeat count must be at least 1");
    this.name = name;
    this.type = type;
    this.duration = duration;
    this.sampleRate = sampleRate;
    this.repeatCount = repeatCount;
    this.variables = ImmutableList.copyOf(variables);
    this.nodes = ImmutableList.copyOf(nodes);
    this.metadata = ImmutableMap.copyOf(metadata);
  }

  public String getName() {
    return name;
  }

  public String getType() {
    return type;
  }

  /**
   * Total nominal duration, or null when the header did not give one.
   */
  public Quantity getDuration() {
    return duration;
  }

  /**
   * Sample rate in Hz.
   */
  public BigDecimal getSampleRate() {
    return sampleRate;
  }

  /**
   * Number of times the experiment is repeated for statistics.
   */
  public long getRepeatCount() {
    return repeatCount;
  }

  public List<VariableDescription> getVariables() {
    return variables;
  }

  public VariableDescription getVariable(String name) {
    for (VariableDescription v : variables) {
      if (v.getName().equals(name)) {
        return v;
      }
    }
    return null;
  }

  public List<SequenceNode> getNodes() {
    return nodes;
  }

  public Map<String, String> getMetadata() {
    return metadata;
  }

  /**
   * Names of variables used as loop iterators anywhere in the body.
   */
  public Set<String> getLoopIterators() {
    Set<String> iterators = Sets.newLinkedHashSet();
    collectIterators(nodes, iterators);
    return iterators;
  }

  private static void collectIterators(List<SequenceNode> nodes, Set<String> iterators) {
    for (SequenceNode node : nodes) {
      if (node instanceof LoopDescription) {
        LoopDescription loop = (LoopDescription) node;
        if (loop.getIterator() != null) {
          iterators.add(loop.getIterator());
        }
        collectIterators(loop.getBody(), iterators);
      } else if (node instanceof ConditionalDescription) {
        ConditionalDescription cond = (ConditionalDescription) node;
        collectIterators(cond.getThenBranch(), iterators);
        collectIterators(cond.getElseBranch(), iterators);
      }
    }
  }

  /**
   * Variables that span the scan space, in declaration order.
   */
  public List<VariableDescription> getScanVariables() {
    Set<String> iterators = getLoopIterators();
    List<VariableDescription> scan = Lists.newArrayList();
    for (VariableDescription v : variables) {
      if (!iterators.contains(v.getName())) {
        scan.add(v);
      }
    }
    return scan;
  }

  /**
   * All pulses of the body in source order, branches and loop bodies included.
   */
  public List<PulseDescription> getAllPulses() {
    List<PulseDescription> pulses = Lists.newArrayList();
    collectPulses(nodes, pulses);
    return pulses;
  }

  private static void collectPulses(List<SequenceNode> nodes, List<PulseDescription> pulses) {
    for (SequenceNode node : nodes) {
      if (node instanceof PulseDescription) {
        pulses.add((PulseDescription) node);
      } else if (node instanceof LoopDescription) {
        collectPulses(((LoopDescription) node).getBody(), pulses);
      } else if (node instanceof ConditionalDescription) {
        ConditionalDescription cond = (ConditionalDescription) node;
        collectPulses(cond.getThenBranch(), pulses);
        collectPulses(cond.getElseBranch(), pulses);
      }
    }
  }

  @Override
  public String toString() {
    return String.format("Sequence %s (%s): %d variables, %d nodes", name, type, variables.size(), nodes.size());
  }
}
