package com.swathtrace.processor.raytrace;

/**
 * Per-beam horizontal distance and depth from the transducer, plus how each lookup went.
 * Values for beams not flagged {@link BeamFlag#RESOLVED} are NaN.
 */
public final class RayTraceResult {
  private final double[] horizontalDistance;
  private final double[] depth;
  private final BeamFlag[] flags;

  RayTraceResult(double[] horizontalDistance, double[] depth, BeamFlag[] flags) {
    this.horizontalDistance = horizontalDistance;
    this.depth = depth;
    this.flags = flags;
  }

  public int size() {
    return flags.length;
  }

  public double horizontalDistance(int beam) {
    return horizontalDistance[beam];
  }

  public double depth(int beam) {
    return depth[beam];
  }

  public BeamFlag flag(int beam) {
    return flags[beam];
  }

  public boolean isResolved(int beam) {
    return flags[beam] == BeamFlag.RESOLVED;
  }

  public int count(BeamFlag flag) {
    int count = 0;
    for (BeamFlag f : flags) {
      if (f == flag) {
        count++;
      }
    }
    return count;
  }
}
