package com.swathtrace.processor.service;

/** How far a sounding has been carried through the processing chain; codes are persisted. */
public enum ProcessingStatus {
  CONVERTED(0),
  ORIENTATION(1),
  BEAM_VECTOR(2),
  SOUND_VELOCITY(3),
  GEOREFERENCE(4),
  TPU(5);

  private final int code;

  ProcessingStatus(int code) {
    this.code = code;
  }

  public int code() {
    return code;
  }

  public static ProcessingStatus fromCode(int code) {
    for (ProcessingStatus status : values()) {
      if (status.code == code) {
        return status;
      }
    }
    throw new IllegalArgumentException("Unknown processing status code: " + code);
  }
}
