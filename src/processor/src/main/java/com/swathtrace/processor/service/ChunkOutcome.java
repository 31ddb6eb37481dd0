package com.swathtrace.processor.service;

/** Result of one dispatched chunk; exactly one of {@code result} and {@code error} is set. */
public record ChunkOutcome(int chunkIndex, ChunkResult result, Throwable error) {

  public static ChunkOutcome succeeded(ChunkResult result) {
    return new ChunkOutcome(result.chunkIndex(), result, null);
  }

  public static ChunkOutcome failed(int chunkIndex, Throwable error) {
    return new ChunkOutcome(chunkIndex, null, error);
  }

  public boolean isSuccess() {
    return error == null;
  }
}
