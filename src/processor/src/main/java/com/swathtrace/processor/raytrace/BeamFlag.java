package com.swathtrace.processor.raytrace;

/** Outcome of looking up one beam's travel time in its ray-trace table. */
public enum BeamFlag {
  /** Travel time falls inside the cast; offsets are valid. */
  RESOLVED,
  /** Travel time is zero or negative, the return would sit at or above the transducer. */
  ABOVE_TRANSDUCER,
  /** Travel time runs past the bottom of the cast. */
  BEYOND_CAST
}
