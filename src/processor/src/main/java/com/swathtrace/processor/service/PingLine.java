package com.swathtrace.processor.service;

import com.swathtrace.processor.grid.BeamGrid;
import com.swathtrace.processor.grid.DimensionMismatchException;
import java.util.Arrays;

/**
 * Sound-velocity correction inputs for a run of consecutive pings.
 *
 * <p>Grids are (ping, beam) with a shared validity mask. Angles are radians: {@code beamAngle} is
 * the corrected beam angle from vertical (port negative), {@code beamAzimuth} is relative to the
 * vessel heading. Offsets are lever-arm corrections in meters added to the traced sounding.
 *
 * @param pingTimes UTC seconds, one per ping
 * @param surfaceSoundSpeed sound speed at the transducer, m/s, one per ping
 * @param zWaterlineOffset transducer to waterline, meters, positive down
 */
public record PingLine(
    double[] pingTimes,
    double[] surfaceSoundSpeed,
    BeamGrid beamAngle,
    BeamGrid beamAzimuth,
    BeamGrid twoWayTravelTime,
    double zWaterlineOffset,
    BeamGrid alongOffset,
    BeamGrid acrossOffset,
    BeamGrid downOffset) {

  public PingLine {
    pingTimes = pingTimes.clone();
    surfaceSoundSpeed = surfaceSoundSpeed.clone();
  }

  /** Line whose lever-arm offsets are the same for every beam. */
  public static PingLine withUniformOffsets(
      double[] pingTimes,
      double[] surfaceSoundSpeed,
      BeamGrid beamAngle,
      BeamGrid beamAzimuth,
      BeamGrid twoWayTravelTime,
      double zWaterlineOffset,
      double along,
      double across,
      double down) {
    return new PingLine(
        pingTimes,
        surfaceSoundSpeed,
        beamAngle,
        beamAzimuth,
        twoWayTravelTime,
        zWaterlineOffset,
        BeamGrid.filledLike(beamAngle, along),
        BeamGrid.filledLike(beamAngle, across),
        BeamGrid.filledLike(beamAngle, down));
  }

  @Override
  public double[] pingTimes() {
    return pingTimes.clone();
  }

  @Override
  public double[] surfaceSoundSpeed() {
    return surfaceSoundSpeed.clone();
  }

  public int pings() {
    return pingTimes.length;
  }

  /** Pings {@code [from, to)} as a new line. */
  public PingLine slice(int from, int to) {
    return new PingLine(
        Arrays.copyOfRange(pingTimes, from, to),
        Arrays.copyOfRange(surfaceSoundSpeed, from, to),
        beamAngle.slicePings(from, to),
        beamAzimuth.slicePings(from, to),
        twoWayTravelTime.slicePings(from, to),
        zWaterlineOffset,
        alongOffset.slicePings(from, to),
        acrossOffset.slicePings(from, to),
        downOffset.slicePings(from, to));
  }

  /**
   * Checks that every per-ping array and grid agrees with the beam angles, and that every valid
   * beam has a finite travel time.
   *
   * @throws DimensionMismatchException on the first disagreement
   * @throws IllegalArgumentException when a valid beam's travel time is NaN or infinite
   */
  public void checkShapes() {
    int pings = beamAngle.pings();
    if (pingTimes.length != pings || surfaceSoundSpeed.length != pings) {
      throw new DimensionMismatchException(
          "beam angles have " + pings + " pings, ping times " + pingTimes.length
              + ", surface sound speed " + surfaceSoundSpeed.length);
    }
    requireSameMask("beam azimuth", beamAzimuth);
    requireSameMask("two way travel time", twoWayTravelTime);
    requireFinite("two way travel time", twoWayTravelTime);
    requireCovers("alongtrack offset", alongOffset);
    requireCovers("acrosstrack offset", acrossOffset);
    requireCovers("down offset", downOffset);
  }

  private void requireSameMask(String name, BeamGrid grid) {
    if (!beamAngle.hasSameMask(grid)) {
      throw new DimensionMismatchException(name + " " + grid + " does not match beam angle " + beamAngle);
    }
  }

  private void requireFinite(String name, BeamGrid grid) {
    for (int p = 0; p < grid.pings(); p++) {
      for (int b = 0; b < grid.beams(); b++) {
        if (grid.isValid(p, b) && !Double.isFinite(grid.get(p, b))) {
          throw new IllegalArgumentException(name + " is not finite for ping " + p + " beam " + b);
        }
      }
    }
  }

  private void requireCovers(String name, BeamGrid grid) {
    if (!beamAngle.hasSameShape(grid)) {
      throw new DimensionMismatchException(name + " " + grid + " does not match beam angle " + beamAngle);
    }
    for (int p = 0; p < grid.pings(); p++) {
      for (int b = 0; b < grid.beams(); b++) {
        if (beamAngle.isValid(p, b) && !grid.isValid(p, b)) {
          throw new DimensionMismatchException(name + " missing for ping " + p + " beam " + b);
        }
      }
    }
  }
}
