package com.swathtrace.processor.rotation;

import com.swathtrace.processor.grid.DimensionMismatchException;
import java.util.List;

/**
 * Attitude samples stored as parallel arrays, already interpolated by the caller onto the times
 * of interest (ping times, receive times).
 */
public final class AttitudeSeries {
  private final double[] times;
  private final double[] roll;
  private final double[] pitch;
  private final double[] heading;
  private final double[] heave;

  public AttitudeSeries(double[] times, double[] roll, double[] pitch, double[] heading, double[] heave) {
    int n = times.length;
    if (roll.length != n || pitch.length != n || heading.length != n || heave.length != n) {
      throw new DimensionMismatchException(
          "attitude arrays differ in length: time=" + n + " roll=" + roll.length
              + " pitch=" + pitch.length + " heading=" + heading.length + " heave=" + heave.length);
    }
    this.times = times.clone();
    this.roll = roll.clone();
    this.pitch = pitch.clone();
    this.heading = heading.clone();
    this.heave = heave.clone();
  }

  /** Builds a series from individual samples, in the given order. */
  public static AttitudeSeries of(List<AttitudeSample> samples) {
    int n = samples.size();
    double[] times = new double[n];
    double[] roll = new double[n];
    double[] pitch = new double[n];
    double[] heading = new double[n];
    double[] heave = new double[n];
    for (int i = 0; i < n; i++) {
      AttitudeSample s = samples.get(i);
      times[i] = s.time();
      roll[i] = s.roll();
      pitch[i] = s.pitch();
      heading[i] = s.heading();
      heave[i] = s.heave();
    }
    return new AttitudeSeries(times, roll, pitch, heading, heave);
  }

  public int size() {
    return times.length;
  }

  public double[] times() {
    return times.clone();
  }

  public double[] roll() {
    return roll.clone();
  }

  public double[] pitch() {
    return pitch.clone();
  }

  public double[] heading() {
    return heading.clone();
  }

  public double[] heave() {
    return heave.clone();
  }

  /**
   * Returns the samples at the given indices, in index order. Indices may repeat, which is how
   * per-beam receive times that share an attitude sample are expanded.
   */
  public AttitudeSeries select(int[] index) {
    int n = index.length;
    double[] t = new double[n];
    double[] r = new double[n];
    double[] p = new double[n];
    double[] h = new double[n];
    double[] hv = new double[n];
    for (int i = 0; i < n; i++) {
      int k = index[i];
      if (k < 0 || k >= times.length) {
        throw new IndexOutOfBoundsException("attitude index " + k + " outside 0.." + times.length);
      }
      t[i] = times[k];
      r[i] = roll[k];
      p[i] = pitch[k];
      h[i] = heading[k];
      hv[i] = heave[k];
    }
    return new AttitudeSeries(t, r, p, h, hv);
  }

  @Override
  public String toString() {
    return "AttitudeSeries[size=" + times.length + "]";
  }
}
