package org.labrad.awg.waveform;

import java.util.List;

import com.google.common.base.Objects;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;

/**
 * Descriptor of one waveform file: a padded length, the analog shapes and the
 * marker spans it contains. Two waveforms with equal content are the same
 * waveform, whichever channel plays them.
 */
public final class ChannelWaveform {
  private final long length;
  private final double baseline;
  private final ImmutableList<ShapeDescriptor> shapes;
  private final ImmutableList<MarkerSpan> markers;

  public ChannelWaveform(long length, double baseline, List<ShapeDescriptor> shapes, List<MarkerSpan> markers) {
    Preconditions.checkArgument(length > 0, "Waveform length must be positive");
    for (ShapeDescriptor s : shapes) {
      Preconditions.checkArgument(s.getEnd() <= length, "Shape %s exceeds waveform length %s", s, length);
    }
    for (MarkerSpan m : markers) {
      Preconditions.checkArgument(m.getEnd() <= length, "Marker %s exceeds waveform length %s", m, length);
    }
    this.length = length;
    this.baseline = baseline;
    this.shapes = ImmutableList.copyOf(shapes);
    this.markers = ImmutableList.copyOf(markers);
  }

  /**
   * A waveform holding the output at a constant level.
   */
  public static ChannelWaveform idle(long length, double level) {
    return new ChannelWaveform(length, level, ImmutableList.<ShapeDescriptor>of(),
        ImmutableList.<MarkerSpan>of());
  }

  public long getLength() {
    return length;
  }

  /**
   * Level of samples not covered by any shape.
   */
  public double getBaseline() {
    return baseline;
  }

  public List<ShapeDescriptor> getShapes() {
    return shapes;
  }

  public List<MarkerSpan> getMarkers() {
    return markers;
  }

  public boolean isEmpty() {
    return shapes.isEmpty() && markers.isEmpty();
  }

  @Override
  public boolean equals(Object obj) {
    if (!(obj instanceof ChannelWaveform)) {
      return false;
    }
    ChannelWaveform other = (ChannelWaveform) obj;
    return length == other.length
        && Double.compare(baseline, other.baseline) == 0
        && shapes.equals(other.shapes)
        && markers.equals(other.markers);
  }

  @Override
  public int hashCode() {
    return Objects.hashCode(length, baseline, shapes, markers);
  }

  @Override
  public String toString() {
    return String.format("waveform[%d samples, %s, %s]", length, shapes, markers);
  }
}
