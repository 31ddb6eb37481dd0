package com.swathtrace.processor.cast;

import java.util.Arrays;
import java.util.Objects;

/**
 * One sound-velocity profile: ordered (depth, sound speed) layers plus the metadata needed to pick
 * it for a survey line.
 *
 * <p>Instances are immutable; {@link #withLayers(double[], double[])} and friends return copies.
 * Depths are in meters positive down, sound speeds in m/s, time in UTC seconds.
 */
public final class SoundVelocityCast {
  private final String name;
  private final double time;
  private final Double latitude;
  private final Double longitude;
  private final String source;
  private final double[] depths;
  private final double[] soundSpeeds;

  public SoundVelocityCast(
      String name,
      double time,
      Double latitude,
      Double longitude,
      String source,
      double[] depths,
      double[] soundSpeeds) {
    Objects.requireNonNull(depths, "depths");
    Objects.requireNonNull(soundSpeeds, "soundSpeeds");
    if (depths.length != soundSpeeds.length) {
      throw new IllegalArgumentException(
          "cast has " + depths.length + " depths but " + soundSpeeds.length + " sound speeds");
    }
    if ((latitude == null) != (longitude == null)) {
      throw new IllegalArgumentException("cast location needs both latitude and longitude");
    }
    this.name = name;
    this.time = time;
    this.latitude = latitude;
    this.longitude = longitude;
    this.source = source;
    this.depths = depths.clone();
    this.soundSpeeds = soundSpeeds.clone();
  }

  /** Cast without location or source file, as decoded from an inline profile. */
  public static SoundVelocityCast of(String name, double time, double[] depths, double[] soundSpeeds) {
    return new SoundVelocityCast(name, time, null, null, null, depths, soundSpeeds);
  }

  public String name() {
    return name;
  }

  public double time() {
    return time;
  }

  public boolean hasLocation() {
    return latitude != null;
  }

  /** Latitude in decimal degrees, or null when the cast was logged without a position. */
  public Double latitude() {
    return latitude;
  }

  public Double longitude() {
    return longitude;
  }

  /** File the cast was read from, or null for inline casts. */
  public String source() {
    return source;
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

  /** Same metadata, new layers. */
  public SoundVelocityCast withLayers(double[] newDepths, double[] newSoundSpeeds) {
    return new SoundVelocityCast(name, time, latitude, longitude, source, newDepths, newSoundSpeeds);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof SoundVelocityCast other)) {
      return false;
    }
    return Double.compare(time, other.time) == 0
        && Objects.equals(name, other.name)
        && Objects.equals(latitude, other.latitude)
        && Objects.equals(longitude, other.longitude)
        && Objects.equals(source, other.source)
        && Arrays.equals(depths, other.depths)
        && Arrays.equals(soundSpeeds, other.soundSpeeds);
  }

  @Override
  public int hashCode() {
    int result = Objects.hash(name, time, latitude, longitude, source);
    result = 31 * result + Arrays.hashCode(depths);
    return 31 * result + Arrays.hashCode(soundSpeeds);
  }

  @Override
  public String toString() {
    return "SoundVelocityCast[name=" + name + ", time=" + time + ", layers=" + depths.length + "]";
  }
}
