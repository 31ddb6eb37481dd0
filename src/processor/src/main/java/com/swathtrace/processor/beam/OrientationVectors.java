package com.swathtrace.processor.beam;

import com.swathtrace.processor.grid.BeamGrid;
import com.swathtrace.processor.grid.DimensionMismatchException;

/**
 * Transmitter and receiver unit vectors in the vessel frame, per (ping, beam).
 *
 * <p>The transmitter vector is evaluated at transmit time and the receiver vector at receive
 * time, which differ by the two-way travel time. Components are x forward, y starboard, z down.
 */
public final class OrientationVectors {
  private final BeamGrid[] tx;
  private final BeamGrid[] rx;

  public OrientationVectors(BeamGrid txX, BeamGrid txY, BeamGrid txZ, BeamGrid rxX, BeamGrid rxY, BeamGrid rxZ) {
    BeamGrid[] all = {txX, txY, txZ, rxX, rxY, rxZ};
    for (BeamGrid g : all) {
      if (!g.hasSameMask(txX)) {
        throw new DimensionMismatchException("orientation vector components disagree in shape or valid beams");
      }
    }
    this.tx = new BeamGrid[] {txX, txY, txZ};
    this.rx = new BeamGrid[] {rxX, rxY, rxZ};
  }

  public int pings() {
    return tx[0].pings();
  }

  public int beams() {
    return tx[0].beams();
  }

  /** Grid whose validity mask marks the beams that have orientation vectors. */
  public BeamGrid mask() {
    return tx[0];
  }

  public boolean isValid(int ping, int beam) {
    return tx[0].isValid(ping, beam);
  }

  public double[] txVector(int ping, int beam) {
    return new double[] {tx[0].get(ping, beam), tx[1].get(ping, beam), tx[2].get(ping, beam)};
  }

  public double[] rxVector(int ping, int beam) {
    return new double[] {rx[0].get(ping, beam), rx[1].get(ping, beam), rx[2].get(ping, beam)};
  }
}
