package com.swathtrace.processor.beam;

import com.swathtrace.processor.grid.BeamGrid;
import com.swathtrace.processor.grid.DimensionMismatchException;

/**
 * Turns raw steering angles into a corrected beam angle and a heading-relative azimuth.
 *
 * <p>The beam vector is the intersection of the transmit fan and the receive cone, expressed
 * first in the co-located array frame and then rotated into the vessel frame using the
 * transmitter/receiver orientation vectors. Transmitter and receiver are treated as co-located.
 */
public final class BeamVectorBuilder {
  private static final double HALF_PI = Math.PI / 2.0;

  private BeamVectorBuilder() {}

  /**
   * Builds azimuth and corrected angle for every valid beam.
   *
   * @param heading vessel heading in degrees at transmit time, one per ping
   * @param beamPointingAngle receiver steering angle in degrees
   * @param tiltAngle transmitter tilt angle in degrees
   * @param orientation transmitter/receiver vectors at transmit/receive time
   * @param txReversed transmitter installed 180° in yaw
   * @param rxReversed receiver installed 180° in yaw
   * @return azimuth and corrected angle, sharing the input validity mask
   */
  public static BeamVectors build(
      double[] heading,
      BeamGrid beamPointingAngle,
      BeamGrid tiltAngle,
      OrientationVectors orientation,
      boolean txReversed,
      boolean rxReversed) {
    if (heading.length != beamPointingAngle.pings()) {
      throw new DimensionMismatchException(
          "heading has " + heading.length + " pings, beam angles have " + beamPointingAngle.pings());
    }
    if (!beamPointingAngle.hasSameMask(tiltAngle)) {
      throw new DimensionMismatchException("tilt angle and beam pointing angle disagree in valid beams");
    }
    if (!beamPointingAngle.hasSameMask(orientation.mask())) {
      throw new DimensionMismatchException("orientation vectors and beam pointing angle disagree in valid beams");
    }

    int pings = beamPointingAngle.pings();
    int beams = beamPointingAngle.beams();
    BeamGrid.Builder azimuth = new BeamGrid.Builder(pings, beams);
    BeamGrid.Builder angle = new BeamGrid.Builder(pings, beams);
    for (int p = 0; p < pings; p++) {
      for (int b = 0; b < beams; b++) {
        if (!beamPointingAngle.isValid(p, b)) {
          continue;
        }
        double rxAngle = Math.toRadians(beamPointingAngle.get(p, b));
        double txAngle = Math.toRadians(tiltAngle.get(p, b));
        if (txReversed) {
          txAngle = -txAngle;
        }
        if (rxReversed) {
          rxAngle = -rxAngle;
        }
        double[] tx = orientation.txVector(p, b);
        double[] rx = orientation.rxVector(p, b);
        double[] geo = geographicBeamVector(tx, rx, arrayRelativeBeamVector(tx, rx, txAngle, rxAngle));

        azimuth.set(p, b, relativeAzimuth(geo, heading[p]));
        angle.set(p, b, pointingAngle(geo, rxAngle));
      }
    }
    return new BeamVectors(azimuth.build(), angle.build());
  }

  /**
   * Beam vector in the co-located array frame (x forward, y starboard, z down), corrected for
   * the misalignment between the transmit and receive arrays.
   */
  static double[] arrayRelativeBeamVector(double[] tx, double[] rx, double txAngle, double rxAngle) {
    double delta = Math.acos(clampUnit(dot(tx, rx))) - HALF_PI;
    double ysub1 = -Math.sin(rxAngle) / Math.cos(delta);
    double ysub2 = Math.sin(txAngle) * Math.tan(delta);
    double x = Math.sin(txAngle);
    double y = ysub1 + ysub2;
    double radialSquared = x * x + y * y;
    double z = Math.sqrt(Math.max(0.0, 1.0 - radialSquared));
    return new double[] {x, y, z};
  }

  /** Rotates an array-relative beam vector into the vessel frame spanned by tx and rx. */
  static double[] geographicBeamVector(double[] tx, double[] rx, double[] beamVector) {
    double[] zPrime = cross(tx, rx);
    double[] yPrime = cross(zPrime, tx);
    double[] out = new double[3];
    for (int k = 0; k < 3; k++) {
      out[k] = beamVector[0] * tx[k] + beamVector[1] * yPrime[k] + beamVector[2] * zPrime[k];
    }
    return out;
  }

  static double relativeAzimuth(double[] geo, double headingDegrees) {
    double azimuthDegrees = Math.toDegrees(Math.atan2(geo[1], geo[0]));
    double relative = (azimuthDegrees - headingDegrees + 360.0) % 360.0;
    if (relative < 0) {
      relative += 360.0;
    }
    return Math.toRadians(relative);
  }

  static double pointingAngle(double[] geo, double rxAngle) {
    double horizontal = Math.hypot(geo[0], geo[1]);
    double angle = HALF_PI - Math.atan(geo[2] / horizontal);
    return rxAngle < 0 ? -angle : angle;
  }

  private static double dot(double[] a, double[] b) {
    return a[0] * b[0] + a[1] * b[1] + a[2] * b[2];
  }

  private static double[] cross(double[] a, double[] b) {
    return new double[] {
      a[1] * b[2] - a[2] * b[1],
      a[2] * b[0] - a[0] * b[2],
      a[0] * b[1] - a[1] * b[0]
    };
  }

  private static double clampUnit(double v) {
    return Math.max(-1.0, Math.min(1.0, v));
  }
}
