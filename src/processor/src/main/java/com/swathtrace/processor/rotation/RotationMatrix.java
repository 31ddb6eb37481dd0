package com.swathtrace.processor.rotation;

import java.util.Arrays;

/**
 * Series of 3×3 rotation matrices, one per time sample.
 *
 * <p>Mounting rotations hold a single sample; attitude rotations hold one per attitude time.
 * Elements are stored row-major, nine per sample.
 */
public final class RotationMatrix {
  private final double[] times;
  private final double[] elements;

  RotationMatrix(double[] times, double[] elements) {
    if (elements.length != times.length * 9) {
      throw new IllegalArgumentException(
          "expected " + times.length * 9 + " elements for " + times.length + " samples");
    }
    this.times = times;
    this.elements = elements;
  }

  public int size() {
    return times.length;
  }

  public double time(int sample) {
    return times[sample];
  }

  public double[] times() {
    return times.clone();
  }

  public double get(int sample, int row, int col) {
    return elements[sample * 9 + row * 3 + col];
  }

  /** Returns the 3×3 matrix of one sample as rows. */
  public double[][] matrix(int sample) {
    double[][] m = new double[3][3];
    for (int r = 0; r < 3; r++) {
      System.arraycopy(elements, sample * 9 + r * 3, m[r], 0, 3);
    }
    return m;
  }

  /** Applies the rotation of one sample to a vector: {@code R·v}. */
  public double[] apply(int sample, double[] v) {
    int o = sample * 9;
    return new double[] {
      elements[o] * v[0] + elements[o + 1] * v[1] + elements[o + 2] * v[2],
      elements[o + 3] * v[0] + elements[o + 4] * v[1] + elements[o + 5] * v[2],
      elements[o + 6] * v[0] + elements[o + 7] * v[1] + elements[o + 8] * v[2]
    };
  }

  public double determinant(int sample) {
    int o = sample * 9;
    double a = elements[o];
    double b = elements[o + 1];
    double c = elements[o + 2];
    double d = elements[o + 3];
    double e = elements[o + 4];
    double f = elements[o + 5];
    double g = elements[o + 6];
    double h = elements[o + 7];
    double i = elements[o + 8];
    return a * (e * i - f * h) - b * (d * i - f * g) + c * (d * h - e * g);
  }

  /** True when {@code R·Rᵗ} is the identity within {@code tolerance} for the sample. */
  public boolean isOrthonormal(int sample, double tolerance) {
    for (int r = 0; r < 3; r++) {
      for (int c = 0; c < 3; c++) {
        double dot = 0.0;
        for (int k = 0; k < 3; k++) {
          dot += get(sample, r, k) * get(sample, c, k);
        }
        double expected = r == c ? 1.0 : 0.0;
        if (Math.abs(dot - expected) > tolerance) {
          return false;
        }
      }
    }
    return true;
  }

  double[] elements() {
    return elements;
  }

  @Override
  public String toString() {
    return "RotationMatrix[samples=" + times.length
        + (times.length == 1 ? ", " + Arrays.toString(elements) : "") + "]";
  }
}
