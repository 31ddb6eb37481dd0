package com.swathtrace.processor.grid;

/**
 * Raised when arrays that must describe the same pings and beams disagree in shape or in which
 * beams are present.
 *
 * <p>Aborts the enclosing chunk; data is never truncated to make the shapes agree.
 */
public class DimensionMismatchException extends RuntimeException {
  /**
   * Creates a dimension mismatch with a description of the conflicting inputs.
   *
   * @param message which arrays disagree and how
   */
  public DimensionMismatchException(String message) {
    super(message);
  }
}
