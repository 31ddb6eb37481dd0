package com.swathtrace.processor.grid;

import java.util.Arrays;

/**
 * Immutable (ping, beam) array of doubles with an explicit validity mask.
 *
 * <p>Pings carry a variable number of beams. Every cell beyond a ping's beam count, and every
 * beam the sonar did not report, is marked invalid. Invalid cells never hold a meaningful value
 * and are reported as {@link Double#NaN} by {@link #get(int, int)}.
 */
public final class BeamGrid {
  private final int pings;
  private final int beams;
  private final double[] values;
  private final boolean[] valid;

  private BeamGrid(int pings, int beams, double[] values, boolean[] valid) {
    this.pings = pings;
    this.beams = beams;
    this.values = values;
    this.valid = valid;
  }

  /**
   * Creates a grid from row-major values and mask.
   *
   * @param pings number of pings (rows)
   * @param beams maximum number of beams (columns)
   * @param values row-major values, length {@code pings * beams}
   * @param valid row-major validity mask, length {@code pings * beams}
   * @return grid holding copies of the arrays
   */
  public static BeamGrid of(int pings, int beams, double[] values, boolean[] valid) {
    if (pings < 0 || beams < 0) {
      throw new IllegalArgumentException("grid dimensions must be >= 0");
    }
    int size = pings * beams;
    if (values.length != size || valid.length != size) {
      throw new IllegalArgumentException(
          "expected " + size + " cells for a " + pings + "x" + beams + " grid, got values="
              + values.length + " mask=" + valid.length);
    }
    double[] copy = Arrays.copyOf(values, size);
    for (int i = 0; i < size; i++) {
      if (!valid[i]) {
        copy[i] = Double.NaN;
      }
    }
    return new BeamGrid(pings, beams, copy, Arrays.copyOf(valid, size));
  }

  /**
   * Builds a grid from ragged rows. Row {@code i} holds the beams of ping {@code i}; the column
   * count is the longest row. NaN entries inside a row are treated as absent beams.
   *
   * @param rows ragged rows, one per ping
   * @return grid with cells past each row's length marked invalid
   */
  public static BeamGrid fromRows(double[][] rows) {
    int beams = 0;
    for (double[] row : rows) {
      beams = Math.max(beams, row.length);
    }
    Builder builder = new Builder(rows.length, beams);
    for (int p = 0; p < rows.length; p++) {
      for (int b = 0; b < rows[p].length; b++) {
        if (!Double.isNaN(rows[p][b])) {
          builder.set(p, b, rows[p][b]);
        }
      }
    }
    return builder.build();
  }

  /** Grid where every cell is valid and holds {@code value}. */
  public static BeamGrid filled(int pings, int beams, double value) {
    double[] values = new double[pings * beams];
    boolean[] valid = new boolean[pings * beams];
    Arrays.fill(values, value);
    Arrays.fill(valid, true);
    return new BeamGrid(pings, beams, values, valid);
  }

  /** Grid with the mask of {@code template} where every valid cell holds {@code value}. */
  public static BeamGrid filledLike(BeamGrid template, double value) {
    double[] values = new double[template.values.length];
    for (int i = 0; i < values.length; i++) {
      values[i] = template.valid[i] ? value : Double.NaN;
    }
    return new BeamGrid(template.pings, template.beams, values, template.valid.clone());
  }

  public int pings() {
    return pings;
  }

  public int beams() {
    return beams;
  }

  public boolean isValid(int ping, int beam) {
    return valid[index(ping, beam)];
  }

  /**
   * Returns the value at (ping, beam).
   *
   * @return the stored value, or {@link Double#NaN} for an invalid cell
   */
  public double get(int ping, int beam) {
    return values[index(ping, beam)];
  }

  /** Number of valid cells. */
  public int validCount() {
    int count = 0;
    for (boolean v : valid) {
      if (v) {
        count++;
      }
    }
    return count;
  }

  public boolean hasSameShape(BeamGrid other) {
    return pings == other.pings && beams == other.beams;
  }

  /** True when both grids have the same shape and the same valid cells. */
  public boolean hasSameMask(BeamGrid other) {
    return hasSameShape(other) && Arrays.equals(valid, other.valid);
  }

  /** Returns the ping rows {@code [fromPing, toPing)} as a new grid. */
  public BeamGrid slicePings(int fromPing, int toPing) {
    if (fromPing < 0 || toPing > pings || fromPing > toPing) {
      throw new IndexOutOfBoundsException(
          "ping slice [" + fromPing + "," + toPing + ") outside 0.." + pings);
    }
    int from = fromPing * beams;
    int to = toPing * beams;
    return new BeamGrid(
        toPing - fromPing,
        beams,
        Arrays.copyOfRange(values, from, to),
        Arrays.copyOfRange(valid, from, to));
  }

  /** Flattens the valid cells into a {@link CompactBeams}, in row-major order. */
  public CompactBeams compact() {
    int count = validCount();
    int[] pingIndex = new int[count];
    int[] beamIndex = new int[count];
    double[] compactValues = new double[count];
    int n = 0;
    for (int p = 0; p < pings; p++) {
      for (int b = 0; b < beams; b++) {
        int i = p * beams + b;
        if (valid[i]) {
          pingIndex[n] = p;
          beamIndex[n] = b;
          compactValues[n] = values[i];
          n++;
        }
      }
    }
    return new CompactBeams(pings, beams, pingIndex, beamIndex, compactValues);
  }

  private int index(int ping, int beam) {
    if (ping < 0 || ping >= pings || beam < 0 || beam >= beams) {
      throw new IndexOutOfBoundsException(
          "(" + ping + "," + beam + ") outside " + pings + "x" + beams + " grid");
    }
    return ping * beams + beam;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof BeamGrid other)) {
      return false;
    }
    if (!hasSameMask(other)) {
      return false;
    }
    for (int i = 0; i < values.length; i++) {
      if (valid[i] && Double.compare(values[i], other.values[i]) != 0) {
        return false;
      }
    }
    return true;
  }

  @Override
  public int hashCode() {
    int result = 31 * pings + beams;
    result = 31 * result + Arrays.hashCode(valid);
    for (int i = 0; i < values.length; i++) {
      if (valid[i]) {
        result = 31 * result + Double.hashCode(values[i]);
      }
    }
    return result;
  }

  @Override
  public String toString() {
    return "BeamGrid[" + pings + "x" + beams + ", valid=" + validCount() + "]";
  }

  /** Mutable builder; cells start invalid until {@link #set(int, int, double)} is called. */
  public static final class Builder {
    private final int pings;
    private final int beams;
    private final double[] values;
    private final boolean[] valid;

    public Builder(int pings, int beams) {
      this.pings = pings;
      this.beams = beams;
      this.values = new double[pings * beams];
      this.valid = new boolean[pings * beams];
      Arrays.fill(values, Double.NaN);
    }

    public Builder set(int ping, int beam, double value) {
      int i = ping * beams + beam;
      values[i] = value;
      valid[i] = true;
      return this;
    }

    public BeamGrid build() {
      return new BeamGrid(pings, beams, values.clone(), valid.clone());
    }
  }
}
