package com.swathtrace.processor.cast;

/**
 * Thrown when a cast cannot be traced after normalization: fewer than two layers remain or the
 * depths are not strictly increasing.
 */
public class CastDegenerateException extends RuntimeException {
  public CastDegenerateException(String message) {
    super(message);
  }
}
