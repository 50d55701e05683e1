package org.labrad.awg.enums;

import com.google.common.base.Preconditions;

/**
 * Output channels addressable from a sequence. Channels 1 and 2 are the
 * analog outputs; the others are the two marker bits of an analog output.
 */
public enum OutputChannel {
  CH1(1, 1, -1),
  CH2(2, 2, -1),
  CH1_MARKER1(3, 1, 0),
  CH1_MARKER2(4, 1, 1),
  CH2_MARKER1(5, 2, 0),
  CH2_MARKER2(6, 2, 1);

  private final int id;
  private final int analogChannel;
  private final int markerShift;

  OutputChannel(int id, int analogChannel, int markerShift) {
    this.id = id;
    this.analogChannel = analogChannel;
    this.markerShift = markerShift;
  }

  public String toString() {
    return Integer.toString(id);
  }

  public int getId() {
    return id;
  }

  /**
   * The analog output this channel belongs to (1 or 2).
   */
  public int getAnalogChannel() {
    return analogChannel;
  }

  public boolean isMarker() {
    return markerShift >= 0;
  }

  /**
   * Bit position of this marker in the per-sample marker byte.
   */
  public int getMarkerShift() {
    Preconditions.checkState(isMarker(), "Channel %s is not a marker channel", id);
    return markerShift;
  }

  public static boolean isValid(int id) {
    return id >= 1 && id <= values().length;
  }

  public static OutputChannel fromId(int id) {
    Preconditions.checkArgument(isValid(id), "Invalid output channel %s", id);
    return values()[id - 1];
  }

  public static OutputChannel marker(int analogChannel, int markerShift) {
    for (OutputChannel ch : values()) {
      if (ch.analogChannel == analogChannel && ch.markerShift == markerShift) {
        return ch;
      }
    }
    throw new IllegalArgumentException("No marker " + markerShift + " on channel " + analogChannel);
  }
}
