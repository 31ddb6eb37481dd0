package com.swathtrace.processor.rotation;

/**
 * Static sensor mounting offset for one installation period.
 *
 * @param roll roll mounting angle in degrees
 * @param pitch pitch mounting angle in degrees
 * @param yaw yaw mounting angle in degrees
 * @param effectiveTimestamp UTC seconds, as recorded in the installation parameters, from which
 *     the angles apply
 */
public record MountingAngle(double roll, double pitch, double yaw, String effectiveTimestamp) {
  public MountingAngle {
    if (effectiveTimestamp == null || effectiveTimestamp.isBlank()) {
      throw new IllegalArgumentException("mounting angle requires an effective timestamp");
    }
    effectiveTimestamp = effectiveTimestamp.trim();
  }

  /** Effective timestamp as UTC seconds. */
  public double effectiveTime() {
    try {
      return Double.parseDouble(effectiveTimestamp);
    } catch (NumberFormatException ex) {
      throw new IllegalArgumentException(
          "mounting angle timestamp is not numeric: " + effectiveTimestamp, ex);
    }
  }
}
