package com.swathtrace.processor.cast;

/** A cast file or inline profile could not be parsed; nothing from the input is kept. */
public class CastFormatException extends RuntimeException {
  public CastFormatException(String message) {
    super(message);
  }

  public CastFormatException(String message, Throwable cause) {
    super(message, cause);
  }
}
