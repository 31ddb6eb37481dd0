package com.swathtrace.processor.cast;

import java.time.DateTimeException;
import java.time.LocalDate;
import java.time.ZoneOffset;

/** Julian (year, day-of-year) dates as used in cast headers. */
public final class JulianTime {
  private JulianTime() {}

  /**
   * Converts a julian date and time of day to UTC epoch seconds.
   *
   * @param year e.g. 2021
   * @param dayOfYear 1-based day of year
   * @param seconds seconds of the minute, may carry a fraction
   * @throws DateTimeException when the day or time is out of range
   */
  public static double toEpochSeconds(int year, int dayOfYear, int hour, int minute, double seconds) {
    if (seconds < 0 || seconds >= 60) {
      throw new DateTimeException("seconds out of range: " + seconds);
    }
    long whole = LocalDate.ofYearDay(year, dayOfYear)
        .atTime(hour, minute)
        .toEpochSecond(ZoneOffset.UTC);
    return whole + seconds;
  }
}
