package com.swathtrace.processor.grid;

import java.util.Arrays;

/**
 * Valid cells of a {@link BeamGrid} flattened into parallel arrays.
 *
 * <p>Entry {@code i} came from cell ({@code pingIndex(i)}, {@code beamIndex(i)}) of a grid with
 * the recorded shape; {@link #reform()} puts the values back.
 */
public final class CompactBeams {
  private final int pings;
  private final int beams;
  private final int[] pingIndex;
  private final int[] beamIndex;
  private final double[] values;

  CompactBeams(int pings, int beams, int[] pingIndex, int[] beamIndex, double[] values) {
    this.pings = pings;
    this.beams = beams;
    this.pingIndex = pingIndex;
    this.beamIndex = beamIndex;
    this.values = values;
  }

  public int size() {
    return values.length;
  }

  public int pingIndex(int i) {
    return pingIndex[i];
  }

  public int beamIndex(int i) {
    return beamIndex[i];
  }

  public double value(int i) {
    return values[i];
  }

  public double[] values() {
    return values.clone();
  }

  /**
   * Returns a compact array with the same positions and new values, for example the output of a
   * computation that ran over {@link #values()}.
   */
  public CompactBeams withValues(double[] newValues) {
    if (newValues.length != values.length) {
      throw new IllegalArgumentException(
          "expected " + values.length + " values, got " + newValues.length);
    }
    return new CompactBeams(pings, beams, pingIndex, beamIndex, newValues.clone());
  }

  /** True when both compact arrays were taken from the same cells of the same shape. */
  public boolean hasSamePositions(CompactBeams other) {
    return pings == other.pings
        && beams == other.beams
        && Arrays.equals(pingIndex, other.pingIndex)
        && Arrays.equals(beamIndex, other.beamIndex);
  }

  /** Rebuilds the original grid shape; cells not listed here are invalid. */
  public BeamGrid reform() {
    BeamGrid.Builder builder = new BeamGrid.Builder(pings, beams);
    for (int i = 0; i < values.length; i++) {
      builder.set(pingIndex[i], beamIndex[i], values[i]);
    }
    return builder.build();
  }
}
