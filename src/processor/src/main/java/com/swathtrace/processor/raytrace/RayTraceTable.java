package com.swathtrace.processor.raytrace;

/**
 * Cumulative depth, horizontal distance and one-way travel time at every layer boundary of a cast,
 * for each launch angle.
 *
 * <p>Entry {@code k} describes the ray at the top of layer {@code k}; entry 0 is the transducer.
 * Once a ray is refracted to horizontal it cannot reach deeper boundaries and the remaining
 * entries are positive infinity.
 */
public final class RayTraceTable {
  private final double[] cumulativeDepth;
  private final double[][] cumulativeDistance;
  private final double[][] cumulativeTime;
  private final double[][] sinAngle;
  private final int clippedUpdates;

  RayTraceTable(
      double[] cumulativeDepth,
      double[][] cumulativeDistance,
      double[][] cumulativeTime,
      double[][] sinAngle,
      int clippedUpdates) {
    this.cumulativeDepth = cumulativeDepth;
    this.cumulativeDistance = cumulativeDistance;
    this.cumulativeTime = cumulativeTime;
    this.sinAngle = sinAngle;
    this.clippedUpdates = clippedUpdates;
  }

  public int beamCount() {
    return cumulativeTime.length;
  }

  public int boundaryCount() {
    return cumulativeDepth.length;
  }

  public double cumulativeDepth(int boundary) {
    return cumulativeDepth[boundary];
  }

  public double cumulativeDistance(int beam, int boundary) {
    return cumulativeDistance[beam][boundary];
  }

  public double cumulativeTime(int beam, int boundary) {
    return cumulativeTime[beam][boundary];
  }

  /** Sine of the ray angle from vertical inside layer {@code layer} (between boundary layer and layer + 1). */
  public double sinAngle(int beam, int layer) {
    return sinAngle[beam][layer];
  }

  /** Travel time to the bottom of the cast for one beam. */
  public double maxTime(int beam) {
    return cumulativeTime[beam][cumulativeDepth.length - 1];
  }

  /** Snell updates whose sine left [-1, 1] and had to be clipped. */
  public int clippedUpdates() {
    return clippedUpdates;
  }

  double[] timesFor(int beam) {
    return cumulativeTime[beam];
  }

  double[] distancesFor(int beam) {
    return cumulativeDistance[beam];
  }

  double[] depths() {
    return cumulativeDepth;
  }
}
