package com.swathtrace.processor.service;

import com.swathtrace.processor.cast.CastSelector;
import com.swathtrace.processor.cast.SoundVelocityCast;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/** Splits a survey line into chunks and assigns each the cast nearest in time. */
public final class PingChunker {
  private PingChunker() {}

  /**
   * @param pingsPerChunk maximum pings per chunk; the last chunk holds the remainder
   * @param casts candidate casts, at least one
   * @return chunks in ping order, indexed from 0
   */
  public static List<PingChunk> split(PingLine line, List<SoundVelocityCast> casts, int pingsPerChunk) {
    if (pingsPerChunk <= 0) {
      throw new IllegalArgumentException("pingsPerChunk must be > 0");
    }
    if (casts.isEmpty()) {
      throw new IllegalArgumentException("at least one cast is needed to correct a line");
    }
    List<PingChunk> chunks = new ArrayList<>();
    double[] times = line.pingTimes();
    for (int from = 0; from < line.pings(); from += pingsPerChunk) {
      int to = Math.min(from + pingsPerChunk, line.pings());
      double[] chunkTimes = Arrays.copyOfRange(times, from, to);
      SoundVelocityCast cast = CastSelector.nearestInTime(casts, CastSelector.meanTime(chunkTimes));
      chunks.add(new PingChunk(chunks.size(), from, line.slice(from, to), cast));
    }
    return chunks;
  }
}
