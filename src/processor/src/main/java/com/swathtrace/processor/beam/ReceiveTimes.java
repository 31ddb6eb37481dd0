package com.swathtrace.processor.beam;

import com.swathtrace.processor.grid.BeamGrid;
import com.swathtrace.processor.grid.CompactBeams;
import com.swathtrace.processor.grid.DimensionMismatchException;
import java.util.Arrays;

/**
 * Per-beam event times (ping time plus a beam-wise delay) reduced to their unique values.
 *
 * <p>Adding travel time to ping time produces many repeated times across beams. Attitude is
 * interpolated once per unique time by the caller, and {@link #inverseIndex()} expands it back
 * to one sample per valid beam, in {@link BeamGrid#compact()} order.
 */
public final class ReceiveTimes {
  private final CompactBeams beams;
  private final double[] uniqueTimes;
  private final int[] inverseIndex;

  private ReceiveTimes(CompactBeams beams, double[] uniqueTimes, int[] inverseIndex) {
    this.beams = beams;
    this.uniqueTimes = uniqueTimes;
    this.inverseIndex = inverseIndex;
  }

  /**
   * Computes {@code pingTime + latency + additional} for every valid beam.
   *
   * @param pingTimes ping times in UTC seconds, one per grid row
   * @param additional beam-wise seconds to add (sector delay for transmit, delay plus two-way
   *     travel time for receive)
   * @param latencySeconds motion latency added to every ping time
   * @return unique sorted times with the inverse index
   */
  public static ReceiveTimes of(double[] pingTimes, BeamGrid additional, double latencySeconds) {
    if (pingTimes.length != additional.pings()) {
      throw new DimensionMismatchException(
          "ping times (" + pingTimes.length + ") do not match beam rows (" + additional.pings() + ")");
    }
    CompactBeams compact = additional.compact();
    int n = compact.size();
    double[] times = new double[n];
    for (int i = 0; i < n; i++) {
      times[i] = pingTimes[compact.pingIndex(i)] + latencySeconds + compact.value(i);
    }

    double[] sorted = times.clone();
    Arrays.sort(sorted);
    int unique = 0;
    for (int i = 0; i < n; i++) {
      if (unique == 0 || Double.compare(sorted[i], sorted[unique - 1]) != 0) {
        sorted[unique++] = sorted[i];
      }
    }
    double[] uniqueTimes = Arrays.copyOf(sorted, unique);

    int[] inverse = new int[n];
    for (int i = 0; i < n; i++) {
      inverse[i] = Arrays.binarySearch(uniqueTimes, times[i]);
    }
    return new ReceiveTimes(compact.withValues(times), uniqueTimes, inverse);
  }

  /** Unique times, ascending; attitude must be supplied at exactly these times. */
  public double[] uniqueTimes() {
    return uniqueTimes.clone();
  }

  /** For each valid beam, the index of its time in {@link #uniqueTimes()}. */
  public int[] inverseIndex() {
    return inverseIndex.clone();
  }

  /** Beam positions with the computed time of each beam. */
  public CompactBeams beams() {
    return beams;
  }
}
