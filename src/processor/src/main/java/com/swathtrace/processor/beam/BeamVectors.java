package com.swathtrace.processor.beam;

import com.swathtrace.processor.grid.BeamGrid;

/**
 * Attitude and mounting corrected beam geometry.
 *
 * @param beamAzimuth azimuth of the beam footprint relative to vessel heading, radians in
 *     {@code [0, 2π)}
 * @param correctedBeamAngle angle from nadir in radians, negative to port
 */
public record BeamVectors(BeamGrid beamAzimuth, BeamGrid correctedBeamAngle) {}
