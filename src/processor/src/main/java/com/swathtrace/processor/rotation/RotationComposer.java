package com.swathtrace.processor.rotation;

import com.swathtrace.processor.grid.DimensionMismatchException;

/**
 * Builds and composes rotation matrices from attitude and mounting angles.
 *
 * <p>Rotations are intrinsic: each rotation is performed in the frame left by the previous one,
 * so roll-pitch-yaw composes as {@code R = Rz(yaw)·Ry(pitch)·Rx(roll)}.
 */
public final class RotationComposer {

  private RotationComposer() {}

  /**
   * Builds one rotation matrix per sample.
   *
   * @param times time coordinate of each sample
   * @param roll roll series
   * @param pitch pitch series
   * @param heading heading (yaw) series
   * @param order rotation order
   * @param degrees {@code true} when the angles are in degrees
   * @return rotation series with the given time coordinates
   */
  public static RotationMatrix buildRotationMatrix(
      double[] times, double[] roll, double[] pitch, double[] heading, RotationOrder order, boolean degrees) {
    int n = times.length;
    if (roll.length != n || pitch.length != n || heading.length != n) {
      throw new DimensionMismatchException(
          "rotation inputs differ in length: time=" + n + " roll=" + roll.length
              + " pitch=" + pitch.length + " heading=" + heading.length);
    }

    double[] first = order == RotationOrder.YPR ? heading : roll;
    double[] third = order == RotationOrder.YPR ? roll : heading;

    double[] elements = new double[n * 9];
    for (int i = 0; i < n; i++) {
      double r = degrees ? Math.toRadians(first[i]) : first[i];
      double p = degrees ? Math.toRadians(pitch[i]) : pitch[i];
      double y = degrees ? Math.toRadians(third[i]) : third[i];

      double rcos = Math.cos(r);
      double pcos = Math.cos(p);
      double ycos = Math.cos(y);
      double rsin = Math.sin(r);
      double psin = Math.sin(p);
      double ysin = Math.sin(y);

      int o = i * 9;
      elements[o] = ycos * pcos;
      elements[o + 1] = ycos * psin * rsin - ysin * rcos;
      elements[o + 2] = ycos * psin * rcos + ysin * rsin;
      elements[o + 3] = ysin * pcos;
      elements[o + 4] = ysin * psin * rsin + ycos * rcos;
      elements[o + 5] = ysin * psin * rcos - ycos * rsin;
      elements[o + 6] = -psin;
      elements[o + 7] = pcos * rsin;
      elements[o + 8] = pcos * rcos;
    }
    return new RotationMatrix(times.clone(), elements);
  }

  /**
   * Builds the single-sample rotation for a surveyed mounting angle (roll-pitch-yaw, degrees).
   *
   * @param mountingAngle mounting angle with its effective timestamp
   * @return rotation with one sample at the effective time
   */
  public static RotationMatrix buildMountingAngleMatrix(MountingAngle mountingAngle) {
    return buildRotationMatrix(
        new double[] {mountingAngle.effectiveTime()},
        new double[] {mountingAngle.roll()},
        new double[] {mountingAngle.pitch()},
        new double[] {mountingAngle.yaw()},
        RotationOrder.RPY,
        true);
  }

  /**
   * Composes two rotation series: {@code first} is applied, then {@code second}, giving
   * {@code second·first} at every sample. At least one operand must have a single sample; it is
   * broadcast across the other's samples, whose time coordinates the result keeps.
   *
   * @param first rotation applied first (typically the mounting rotation)
   * @param second rotation applied second (typically the attitude rotation)
   * @return composed series
   */
  public static RotationMatrix combine(RotationMatrix first, RotationMatrix second) {
    boolean firstSingle = first.size() == 1;
    boolean secondSingle = second.size() == 1;
    if (!firstSingle && !secondSingle) {
      throw new InvalidCompositionException(
          "one rotation must have a single sample, got " + first.size() + " and " + second.size());
    }

    RotationMatrix series = firstSingle ? second : first;
    int n = series.size();
    double[] a = first.elements();
    double[] b = second.elements();
    double[] out = new double[n * 9];
    for (int s = 0; s < n; s++) {
      int ao = firstSingle ? 0 : s * 9;
      int bo = secondSingle ? 0 : s * 9;
      int o = s * 9;
      for (int r = 0; r < 3; r++) {
        for (int c = 0; c < 3; c++) {
          out[o + r * 3 + c] =
              b[bo + r * 3] * a[ao + c]
                  + b[bo + r * 3 + 1] * a[ao + 3 + c]
                  + b[bo + r * 3 + 2] * a[ao + 6 + c];
        }
      }
    }
    return new RotationMatrix(series.times(), out);
  }

  /**
   * Builds attitude rotations (roll-pitch-yaw, degrees) at selected samples of an attitude
   * series. Transmit and receive attitude differ by the travel time, so callers select the
   * samples for each with separate index arrays.
   *
   * @param attitude attitude already interpolated to the times of interest
   * @param timeIndex optional sample indices to select; {@code null} uses every sample
   * @return rotation per selected sample
   */
  public static RotationMatrix attitudeRotationAt(AttitudeSeries attitude, int[] timeIndex) {
    AttitudeSeries selected = timeIndex == null ? attitude : attitude.select(timeIndex);
    return buildRotationMatrix(
        selected.times(), selected.roll(), selected.pitch(), selected.heading(), RotationOrder.RPY, true);
  }
}
