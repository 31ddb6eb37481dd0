package com.swathtrace.processor.service;

/**
 * Beam counts from one or more ray traces.
 *
 * @param resolved beams with valid offsets
 * @param aboveTransducer beams with a non-positive travel time
 * @param beyondCast beams whose travel time ran past the bottom of the cast
 * @param clippedAngles Snell updates clipped back into [-1, 1]
 */
public record RayTraceDiagnostics(long resolved, long aboveTransducer, long beyondCast, long clippedAngles) {
  public static final RayTraceDiagnostics EMPTY = new RayTraceDiagnostics(0, 0, 0, 0);

  public RayTraceDiagnostics plus(RayTraceDiagnostics other) {
    return new RayTraceDiagnostics(
        resolved + other.resolved,
        aboveTransducer + other.aboveTransducer,
        beyondCast + other.beyondCast,
        clippedAngles + other.clippedAngles);
  }

  public long outOfRange() {
    return aboveTransducer + beyondCast;
  }
}
