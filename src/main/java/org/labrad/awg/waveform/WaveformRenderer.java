package org.labrad.awg.waveform;

import java.util.Arrays;

import org.labrad.awg.errors.InvalidParameterException;

import com.google.common.base.Preconditions;

/**
 * Materializes waveform descriptors into samples. Overlapping shapes add.
 */
public class WaveformRenderer {
  private final ExternalWaveformSource externalSource;

  public WaveformRenderer() {
    this(null);
  }

  /**
   * @param externalSource source for loadfile shapes, or null if none are expected
   */
  public WaveformRenderer(ExternalWaveformSource externalSource) {
    this.externalSource = externalSource;
  }

  public RenderedWaveform render(ChannelWaveform waveform) {
    Preconditions.checkArgument(waveform.getLength() <= Integer.MAX_VALUE,
        "Waveform of %s samples is too long to render", waveform.getLength());
    int len = (int) waveform.getLength();
    double[] levels = new double[len];
    byte[] markers = new byte[len];
    if (waveform.getBaseline() != 0.0) {
      Arrays.fill(levels, waveform.getBaseline());
    }
    for (ShapeDescriptor shape : waveform.getShapes()) {
      double[] samples = shapeSamples(shape);
      int offset = (int) shape.getOffset();
      for (int i = 0; i < samples.length; i++) {
        levels[offset + i] += samples[i];
      }
    }
    for (MarkerSpan m : waveform.getMarkers()) {
      byte bit = (byte) (1 << m.getBit());
      for (long i = m.getOffset(); i < m.getEnd(); i++) {
        markers[(int) i] |= bit;
      }
    }
    return new RenderedWaveform(levels, markers);
  }

  /**
   * Samples of one shape, scaled by its amplitude.
   */
  public double[] shapeSamples(ShapeDescriptor shape) {
    int len = (int) shape.getLength();
    double a = shape.getAmplitude();
    double c = (len - 1) / 2.0;
    double[] out = new double[len];
    switch (shape.getShape()) {
      case SQUARE:
        for (int t = 0; t < len; t++) {
          out[t] = a;
        }
        break;
      case GAUSSIAN: {
        double sigma = len / 6.0;
        for (int t = 0; t < len; t++) {
          double x = (t - c) / sigma;
          out[t] = a * Math.exp(-0.5 * x * x);
        }
        break;
      }
      case SECH: {
        double width = len / 4.0;
        for (int t = 0; t < len; t++) {
          out[t] = a / Math.cosh((t - c) / width);
        }
        break;
      }
      case LORENTZIAN: {
        double gamma = len / 4.0;
        for (int t = 0; t < len; t++) {
          double x = (t - c) / gamma;
          out[t] = a / (1 + x * x);
        }
        break;
      }
      case SINE: {
        double phase = Math.toRadians(shape.getPhaseDegrees());
        for (int t = 0; t < len; t++) {
          out[t] = a * Math.sin(2 * Math.PI * shape.getCyclesPerSample() * t + phase);
        }
        break;
      }
      case LOADFILE: {
        if (externalSource == null) {
          throw new InvalidParameterException("No external waveform source configured for file " + shape.getFile());
        }
        double[] data = externalSource.load(shape.getFile(), len);
        LengthChecker.checkLengths(data.length, len);
        for (int t = 0; t < len; t++) {
          out[t] = a * data[t];
        }
        break;
      }
      default:
        throw new IllegalStateException("Unhandled shape " + shape.getShape());
    }
    return out;
  }
}
