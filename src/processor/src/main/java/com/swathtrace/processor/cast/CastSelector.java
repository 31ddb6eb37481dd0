package com.swathtrace.processor.cast;

import java.util.List;

/** Picks the cast that applies to a block of pings. */
public final class CastSelector {
  private CastSelector() {}

  /**
   * Cast whose time is closest to {@code time}; ties go to the cast listed first.
   *
   * @throws IllegalArgumentException when no casts are given
   */
  public static SoundVelocityCast nearestInTime(List<SoundVelocityCast> casts, double time) {
    if (casts.isEmpty()) {
      throw new IllegalArgumentException("no casts to select from");
    }
    SoundVelocityCast best = casts.get(0);
    double bestDistance = Math.abs(best.time() - time);
    for (int i = 1; i < casts.size(); i++) {
      double distance = Math.abs(casts.get(i).time() - time);
      if (distance < bestDistance) {
        best = casts.get(i);
        bestDistance = distance;
      }
    }
    return best;
  }

  /** Mean of the ping times, the reference time for a chunk. */
  public static double meanTime(double[] pingTimes) {
    if (pingTimes.length == 0) {
      throw new IllegalArgumentException("no ping times");
    }
    double sum = 0.0;
    for (double t : pingTimes) {
      sum += t;
    }
    return sum / pingTimes.length;
  }
}
