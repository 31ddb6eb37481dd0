package com.swathtrace.processor.service;

import com.swathtrace.processor.grid.BeamGrid;
import java.util.List;

/**
 * Sounding offsets for a whole survey line, reassembled from its chunks.
 *
 * <p>Pings of a failed chunk keep their input status and have no offsets; the failure is in
 * {@link #outcomes()}.
 */
public record LineResult(
    BeamGrid alongTrack,
    BeamGrid acrossTrack,
    BeamGrid depth,
    StatusGrid status,
    List<ChunkOutcome> outcomes,
    RayTraceDiagnostics diagnostics) {

  public LineResult {
    outcomes = List.copyOf(outcomes);
  }

  public List<ChunkOutcome> failedChunks() {
    return outcomes.stream().filter(o -> !o.isSuccess()).toList();
  }
}
