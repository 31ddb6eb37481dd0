package com.swathtrace.processor.beam;

import com.swathtrace.processor.grid.CompactBeams;
import com.swathtrace.processor.grid.DimensionMismatchException;
import com.swathtrace.processor.rotation.AttitudeSeries;
import com.swathtrace.processor.rotation.MountingAngle;
import com.swathtrace.processor.rotation.MountingAngleHistory;
import com.swathtrace.processor.rotation.RotationComposer;
import com.swathtrace.processor.rotation.RotationMatrix;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Rotates the ideal transmitter/receiver orientation vectors by mounting and attitude rotations.
 *
 * <p>The transmitter is evaluated at transmit time and the receiver at receive time. Receiver
 * orientation changes measurably while the echo returns, so each beam gets its own receiver
 * vector.
 */
public final class OrientationBuilder {
  private static final Logger log = LoggerFactory.getLogger(OrientationBuilder.class);

  private OrientationBuilder() {}

  /**
   * Same as {@link #build(ReceiveTimes, AttitudeSeries, ReceiveTimes, AttitudeSeries, double[],
   * MountingAngle, double[], MountingAngle)}, taking the mounting angles in effect at the first
   * transmit time.
   */
  public static OrientationVectors build(
      ReceiveTimes transmit,
      AttitudeSeries transmitAttitude,
      ReceiveTimes receive,
      AttitudeSeries receiveAttitude,
      double[] idealTx,
      MountingAngleHistory txMounts,
      double[] idealRx,
      MountingAngleHistory rxMounts) {
    double[] transmitTimes = transmit.uniqueTimes();
    double reference = transmitTimes.length == 0 ? Double.NEGATIVE_INFINITY : transmitTimes[0];
    return build(
        transmit,
        transmitAttitude,
        receive,
        receiveAttitude,
        idealTx,
        txMounts.applicableAt(reference),
        idealRx,
        rxMounts.applicableAt(reference));
  }

  /**
   * Builds orientation vectors for every valid beam.
   *
   * @param transmit transmit times (ping time plus sector delay)
   * @param transmitAttitude attitude at {@code transmit.uniqueTimes()}
   * @param receive receive times (ping time plus delay plus two-way travel time)
   * @param receiveAttitude attitude at {@code receive.uniqueTimes()}
   * @param idealTx transmitter unit vector in the array frame
   * @param txMount transmitter mounting angle
   * @param idealRx receiver unit vector in the array frame
   * @param rxMount receiver mounting angle
   * @return vessel-frame vectors per (ping, beam)
   */
  public static OrientationVectors build(
      ReceiveTimes transmit,
      AttitudeSeries transmitAttitude,
      ReceiveTimes receive,
      AttitudeSeries receiveAttitude,
      double[] idealTx,
      MountingAngle txMount,
      double[] idealRx,
      MountingAngle rxMount) {
    if (transmitAttitude.size() != transmit.uniqueTimes().length) {
      throw new DimensionMismatchException(
          "transmit attitude has " + transmitAttitude.size() + " samples for "
              + transmit.uniqueTimes().length + " unique transmit times");
    }
    if (receiveAttitude.size() != receive.uniqueTimes().length) {
      throw new DimensionMismatchException(
          "receive attitude has " + receiveAttitude.size() + " samples for "
              + receive.uniqueTimes().length + " unique receive times");
    }
    if (!transmit.beams().hasSamePositions(receive.beams())) {
      throw new DimensionMismatchException("transmit and receive times cover different beams");
    }
    if (idealTx.length != 3 || idealRx.length != 3) {
      throw new IllegalArgumentException("ideal orientation vectors must have 3 components");
    }

    RotationMatrix txRotation = RotationComposer.combine(
        RotationComposer.buildMountingAngleMatrix(txMount),
        RotationComposer.attitudeRotationAt(transmitAttitude, transmit.inverseIndex()));
    RotationMatrix rxRotation = RotationComposer.combine(
        RotationComposer.buildMountingAngleMatrix(rxMount),
        RotationComposer.attitudeRotationAt(receiveAttitude, receive.inverseIndex()));

    CompactBeams beams = transmit.beams();
    int n = beams.size();
    double[][] tx = new double[3][n];
    double[][] rx = new double[3][n];
    for (int i = 0; i < n; i++) {
      double[] t = txRotation.apply(i, idealTx);
      double[] r = rxRotation.apply(i, idealRx);
      for (int k = 0; k < 3; k++) {
        tx[k][i] = t[k];
        rx[k][i] = r[k];
      }
    }
    log.debug(
        "Built orientation vectors for {} beams ({} transmit / {} receive attitude samples)",
        n,
        transmitAttitude.size(),
        receiveAttitude.size());

    return new OrientationVectors(
        beams.withValues(tx[0]).reform(),
        beams.withValues(tx[1]).reform(),
        beams.withValues(tx[2]).reform(),
        beams.withValues(rx[0]).reform(),
        beams.withValues(rx[1]).reform(),
        beams.withValues(rx[2]).reform());
  }
}
