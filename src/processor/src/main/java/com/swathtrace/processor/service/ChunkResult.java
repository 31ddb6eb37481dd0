package com.swathtrace.processor.service;

import com.swathtrace.processor.grid.BeamGrid;

/**
 * Sounding offsets from the transducer for one chunk, in the chunk's (ping, beam) layout.
 * Beams that could not be traced are invalid in all three grids.
 */
public record ChunkResult(
    int chunkIndex,
    int firstPing,
    String castName,
    BeamGrid alongTrack,
    BeamGrid acrossTrack,
    BeamGrid depth,
    StatusGrid status,
    RayTraceDiagnostics diagnostics) {}
