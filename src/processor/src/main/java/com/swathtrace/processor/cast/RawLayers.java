package com.swathtrace.processor.cast;

import java.util.Map;
import java.util.TreeMap;

/**
 * Collects (depth, sound speed) rows as logged by a profiler.
 *
 * <p>Rows come out sorted by depth, a repeated depth keeps the last row added, and the surface is
 * covered by a depth-0 row holding the first sound speed seen unless the input has its own.
 */
final class RawLayers {
  private final TreeMap<Double, Double> layers = new TreeMap<>();

  void add(double depth, double soundSpeed) {
    if (layers.isEmpty()) {
      layers.put(0.0, soundSpeed);
    }
    layers.put(depth == 0.0 ? 0.0 : depth, soundSpeed);
  }

  boolean isEmpty() {
    return layers.isEmpty();
  }

  double[] depths() {
    double[] out = new double[layers.size()];
    int n = 0;
    for (Double depth : layers.keySet()) {
      out[n++] = depth;
    }
    return out;
  }

  double[] soundSpeeds() {
    double[] out = new double[layers.size()];
    int n = 0;
    for (Map.Entry<Double, Double> entry : layers.entrySet()) {
      out[n++] = entry.getValue();
    }
    return out;
  }
}
