package com.swathtrace.processor.cast;

import com.swathtrace.processor.config.ProcessorProperties;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Prepares a raw cast for ray tracing against one surface sound speed.
 *
 * <p>Steps, in order: transducer referencing ({@link #toTransducerReference}), then
 * {@link #normalize}: surface layer, gradient clamp, optional deep extension, repeated-speed
 * collapse, validation. Every step returns new arrays; the input cast is never touched.
 */
public class CastProcessor {
  private static final Logger log = LoggerFactory.getLogger(CastProcessor.class);

  private final ProcessorProperties.Cast settings;

  public CastProcessor(ProcessorProperties.Cast settings) {
    this.settings = settings;
  }

  /**
   * Shifts the cast from waterline to transducer reference.
   *
   * @param cast cast with depths relative to the waterline
   * @param zWaterlineOffset offset from transducer to waterline, positive down
   * @return cast with {@code depth + zWaterlineOffset}; layers ending up above the transducer are
   *     dropped
   */
  public SoundVelocityCast toTransducerReference(SoundVelocityCast cast, double zWaterlineOffset) {
    List<double[]> kept = new ArrayList<>();
    for (int i = 0; i < cast.layerCount(); i++) {
      double depth = cast.depth(i) + zWaterlineOffset;
      if (depth >= 0) {
        kept.add(new double[] {depth, cast.soundSpeed(i)});
      }
    }
    double[] depths = new double[kept.size()];
    double[] speeds = new double[kept.size()];
    for (int i = 0; i < kept.size(); i++) {
      depths[i] = kept.get(i)[0];
      speeds[i] = kept.get(i)[1];
    }
    return cast.withLayers(depths, speeds);
  }

  /**
   * Largest sound speed a layer may have before some beam of the partition would be refracted past
   * horizontal: {@code 1 / max(|sin θ| / ssv)}.
   *
   * @param beamAngles launch angles in radians
   * @param surfaceSoundSpeed surface sound speed in m/s
   * @return the limit, or positive infinity when every beam points at nadir
   */
  public double maxAllowableSoundSpeed(double[] beamAngles, double surfaceSoundSpeed) {
    double maxRayParameter = 0.0;
    for (double angle : beamAngles) {
      maxRayParameter = Math.max(maxRayParameter, Math.abs(Math.sin(angle)) / surfaceSoundSpeed);
    }
    return maxRayParameter == 0.0 ? Double.POSITIVE_INFINITY : 1.0 / maxRayParameter;
  }

  /**
   * Builds the traceable cast for one surface sound speed.
   *
   * @param cast transducer-referenced cast
   * @param surfaceSoundSpeed sound speed measured at the transducer
   * @param maxAllowableSoundSpeed limit from {@link #maxAllowableSoundSpeed}
   * @throws CastDegenerateException when fewer than two layers remain or depths do not increase
   */
  public NormalizedCast normalize(SoundVelocityCast cast, double surfaceSoundSpeed, double maxAllowableSoundSpeed) {
    List<double[]> layers = new ArrayList<>(cast.layerCount() + 2);
    for (int i = 0; i < cast.layerCount(); i++) {
      layers.add(new double[] {cast.depth(i), cast.soundSpeed(i)});
    }

    if (!layers.isEmpty() && layers.get(0)[0] == 0.0) {
      layers.get(0)[1] = surfaceSoundSpeed;
    } else {
      layers.add(0, new double[] {0.0, surfaceSoundSpeed});
    }

    boolean clamped = clamp(layers, maxAllowableSoundSpeed);
    if (clamped) {
      log.debug("Cast {} clamped at {} m for max allowable sound speed {}",
          cast.name(), layers.get(layers.size() - 1)[0], maxAllowableSoundSpeed);
    } else if (settings.extensionEnabled()) {
      double[] last = layers.get(layers.size() - 1);
      if (last[0] < settings.extendToDepth()) {
        layers.add(new double[] {settings.extendToDepth(), last[1]});
      }
    }

    collapseRepeatedSpeeds(layers);
    validate(cast.name(), layers);

    double[] depths = new double[layers.size()];
    double[] speeds = new double[layers.size()];
    for (int i = 0; i < layers.size(); i++) {
      depths[i] = layers.get(i)[0];
      speeds[i] = layers.get(i)[1];
    }
    return new NormalizedCast(cast.name(), surfaceSoundSpeed, depths, speeds);
  }

  /**
   * Cuts the cast at the first layer below the surface reaching the limit; that layer becomes the
   * terminal one, at the depth where the speed crosses the limit.
   */
  private static boolean clamp(List<double[]> layers, double maxAllowable) {
    for (int i = 1; i < layers.size(); i++) {
      double[] layer = layers.get(i);
      if (layer[1] < maxAllowable) {
        continue;
      }
      double[] previous = layers.get(i - 1);
      double depth = layer[0];
      if (layer[1] != previous[1]) {
        double fraction = (maxAllowable - previous[1]) / (layer[1] - previous[1]);
        fraction = Math.max(0.0, Math.min(1.0, fraction));
        depth = previous[0] + fraction * (layer[0] - previous[0]);
      }
      layers.subList(i + 1, layers.size()).clear();
      layers.set(i, new double[] {depth, maxAllowable});
      return true;
    }
    return false;
  }

  // A layer repeating the speed above it adds nothing to the trace; the terminal layer stays as
  // the bottom of the cast.
  private static void collapseRepeatedSpeeds(List<double[]> layers) {
    int i = 1;
    while (i < layers.size() - 1) {
      if (layers.get(i)[1] == layers.get(i - 1)[1]) {
        layers.remove(i);
      } else {
        i++;
      }
    }
  }

  private static void validate(String name, List<double[]> layers) {
    if (layers.size() < 2) {
      throw new CastDegenerateException(
          "cast " + name + " has " + layers.size() + " layer(s) below the transducer, at least 2 needed");
    }
    for (int i = 1; i < layers.size(); i++) {
      if (!(layers.get(i)[0] > layers.get(i - 1)[0])) {
        throw new CastDegenerateException(
            "cast " + name + " depths not strictly increasing at layer " + i + " ("
                + layers.get(i - 1)[0] + " -> " + layers.get(i)[0] + ")");
      }
    }
  }
}
