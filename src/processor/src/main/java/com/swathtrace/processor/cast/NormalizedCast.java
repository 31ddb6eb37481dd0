package com.swathtrace.processor.cast;

/**
 * Cast ready for ray tracing: referenced to the transducer, first layer at depth 0 holding the
 * surface sound speed and clamped below the maximum allowable speed. No interior layer repeats
 * the speed above it; the terminal layer may, so the cast keeps its full depth.
 *
 * <p>Layer {@code i} covers depths {@code [depth(i), depth(i + 1))} at {@code soundSpeed(i)}.
 */
public final class NormalizedCast {
  private final String name;
  private final double surfaceSoundSpeed;
  private final double[] depths;
  private final double[] soundSpeeds;

  NormalizedCast(String name, double surfaceSoundSpeed, double[] depths, double[] soundSpeeds) {
    this.name = name;
    this.surfaceSoundSpeed = surfaceSoundSpeed;
    this.depths = depths;
    this.soundSpeeds = soundSpeeds;
  }

  public String name() {
    return name;
  }

  /** Surface sound speed this cast was normalized for. */
  public double surfaceSoundSpeed() {
    return surfaceSoundSpeed;
  }

  public int layerCount() {
    return depths.length;
  }

  public double depth(int layer) {
    return depths[layer];
  }

  public double soundSpeed(int layer) {
    return soundSpeeds[layer];
  }

  public double[] depths() {
    return depths.clone();
  }

  public double[] soundSpeeds() {
    return soundSpeeds.clone();
  }

  /** Depth of the terminal layer, the deepest point a beam can be traced to. */
  public double maxDepth() {
    return depths[depths.length - 1];
  }

  @Override
  public String toString() {
    return "NormalizedCast[name=" + name + ", ssv=" + surfaceSoundSpeed + ", layers=" + depths.length + "]";
  }
}
