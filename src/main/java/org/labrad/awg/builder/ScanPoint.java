package org.labrad.awg.builder;

import java.util.List;
import java.util.Map;

import org.labrad.awg.description.Quantity;
import org.labrad.awg.description.SequenceDescription;
import org.labrad.awg.description.VariableDescription;

import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Lists;
import com.google.common.collect.Maps;

/**
 * One combination of scan variable values.
 */
public final class ScanPoint {
  private final int index;
  private final ImmutableMap<String, Quantity> values;

  public ScanPoint(int index, Map<String, Quantity> values) {
    this.index = index;
    this.values = ImmutableMap.copyOf(values);
  }

  public int getIndex() {
    return index;
  }

  public Map<String, Quantity> getValues() {
    return values;
  }

  /**
   * The cartesian product of the scan variables, first-declared variable outermost.
   * A sequence without scan variables has a single point.
   */
  public static List<ScanPoint> enumerate(SequenceDescription desc) {
    List<VariableDescription> vars = desc.getScanVariables();
    List<List<Quantity>> axes = Lists.newArrayList();
    for (VariableDescription v : vars) {
      axes.add(v.getValues());
    }
    List<ScanPoint> points = Lists.newArrayList();
    int index = 0;
    for (List<Quantity> combo : Lists.cartesianProduct(axes)) {
      Map<String, Quantity> values = Maps.newLinkedHashMap();
      for (int i = 0; i < vars.size(); i++) {
        values.put(vars.get(i).getName(), combo.get(i));
      }
      points.add(new ScanPoint(index++, values));
    }
    return points;
  }

  /**
   * Number of scan points without enumerating them.
   */
  public static long count(SequenceDescription desc) {
    long n = 1;
    for (VariableDescription v : desc.getScanVariables()) {
      n *= v.getSteps();
    }
    return n;
  }

  @Override
  public String toString() {
    return "#" + index + values;
  }
}
