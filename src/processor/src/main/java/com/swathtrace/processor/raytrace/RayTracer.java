package com.swathtrace.processor.raytrace;

import com.swathtrace.processor.cast.NormalizedCast;
import com.swathtrace.processor.config.ProcessorProperties;
import java.util.Arrays;

/**
 * Snell's-law ray tracing through a layered cast.
 *
 * <p>Within a layer the sound speed is constant, so the ray is straight and the travel time grows
 * linearly with both depth and horizontal distance. Crossing into the next layer the ray bends by
 * {@code sin θ' = (c' / c) · sin θ}.
 */
public class RayTracer {
  private final ProcessorProperties.RayTrace settings;
  private final double roundingScale;

  public RayTracer(ProcessorProperties.RayTrace settings) {
    this.settings = settings;
    this.roundingScale = Math.pow(10, settings.roundingDecimals());
  }

  /**
   * Builds the cumulative tables for every launch angle.
   *
   * @param cast normalized cast; layer 0 starts at the transducer
   * @param beamAngles launch angles from vertical in radians, port negative
   */
  public RayTraceTable buildTable(NormalizedCast cast, double[] beamAngles) {
    int boundaries = cast.layerCount();
    double[] depths = cast.depths();
    double[] speeds = cast.soundSpeeds();
    double[][] distance = new double[beamAngles.length][boundaries];
    double[][] time = new double[beamAngles.length][boundaries];
    double[][] sinAngle = new double[beamAngles.length][boundaries - 1];
    int clipped = 0;

    for (int beam = 0; beam < beamAngles.length; beam++) {
      double sin = Math.sin(beamAngles[beam]);
      boolean blocked = false;
      for (int layer = 0; layer < boundaries - 1; layer++) {
        if (layer > 0 && !blocked) {
          double refracted = (speeds[layer] / speeds[layer - 1]) * sin;
          if (refracted > 1.0 || refracted < -1.0) {
            clipped++;
            refracted = Math.max(-1.0, Math.min(1.0, refracted));
          }
          sin = refracted;
        }
        sinAngle[beam][layer] = sin;

        double cos = Math.sqrt(Math.max(0.0, 1.0 - sin * sin));
        if (blocked || cos == 0.0) {
          blocked = true;
          distance[beam][layer + 1] = Double.POSITIVE_INFINITY;
          time[beam][layer + 1] = Double.POSITIVE_INFINITY;
          continue;
        }
        double thickness = depths[layer + 1] - depths[layer];
        double across = thickness * sin / cos;
        double path = Math.hypot(thickness, across);
        distance[beam][layer + 1] = distance[beam][layer] + across;
        time[beam][layer + 1] = time[beam][layer] + path / speeds[layer];
      }
    }
    return new RayTraceTable(depths, distance, time, sinAngle, clipped);
  }

  /**
   * Looks up horizontal distance and depth at the given one-way travel times, one per beam of the
   * table.
   *
   * @param oneWayTimes half the two-way travel time, seconds
   */
  public RayTraceResult interpolate(RayTraceTable table, double[] oneWayTimes) {
    if (oneWayTimes.length != table.beamCount()) {
      throw new IllegalArgumentException(
          "table has " + table.beamCount() + " beams, got " + oneWayTimes.length + " travel times");
    }
    int n = oneWayTimes.length;
    double[] horizontal = new double[n];
    double[] depth = new double[n];
    BeamFlag[] flags = new BeamFlag[n];
    double[] depths = table.depths();

    for (int beam = 0; beam < n; beam++) {
      double target = oneWayTimes[beam];
      double[] times = table.timesFor(beam);
      if (!(target > times[0])) {
        flags[beam] = BeamFlag.ABOVE_TRANSDUCER;
        horizontal[beam] = Double.NaN;
        depth[beam] = Double.NaN;
        continue;
      }
      int k = firstAtOrAbove(times, target);
      if (k < 0 || Double.isInfinite(times[k])) {
        flags[beam] = BeamFlag.BEYOND_CAST;
        horizontal[beam] = Double.NaN;
        depth[beam] = Double.NaN;
        continue;
      }
      double[] distances = table.distancesFor(beam);
      double fraction = (target - times[k - 1]) / (times[k] - times[k - 1]);
      horizontal[beam] = distances[k - 1] + fraction * (distances[k] - distances[k - 1]);
      depth[beam] = depths[k - 1] + fraction * (depths[k] - depths[k - 1]);
      flags[beam] = BeamFlag.RESOLVED;
    }
    return new RayTraceResult(horizontal, depth, flags);
  }

  /** Rounds an output offset to the configured number of decimals, half to even. */
  public double round(double value) {
    return Math.rint(value * roundingScale) / roundingScale;
  }

  public int roundingDecimals() {
    return settings.roundingDecimals();
  }

  private static int firstAtOrAbove(double[] times, double target) {
    int index = Arrays.binarySearch(times, target);
    if (index >= 0) {
      while (index > 0 && times[index - 1] == target) {
        index--;
      }
      return index;
    }
    int insertion = -index - 1;
    return insertion < times.length ? insertion : -1;
  }
}
