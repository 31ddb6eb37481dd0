package com.swathtrace.processor.cast;

import java.util.List;

/**
 * Contents of one cast file.
 *
 * @param version format marker from the first line, e.g. {@code [SVP_VERSION_2]}
 * @param name display name from the second line, file name component only
 * @param casts one cast per section, in file order
 */
public record CastFile(String version, String name, List<SoundVelocityCast> casts) {
  public CastFile {
    casts = List.copyOf(casts);
  }
}
