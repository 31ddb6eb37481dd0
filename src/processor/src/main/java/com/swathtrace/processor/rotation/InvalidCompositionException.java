package com.swathtrace.processor.rotation;

/** Raised when two rotation series cannot be composed because neither has a single sample. */
public class InvalidCompositionException extends RuntimeException {
  public InvalidCompositionException(String message) {
    super(message);
  }
}
