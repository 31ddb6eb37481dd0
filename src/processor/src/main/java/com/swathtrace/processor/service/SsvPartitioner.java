package com.swathtrace.processor.service;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/** Groups pings by exact surface sound speed; each group gets its own cast and ray-trace table. */
public final class SsvPartitioner {
  private SsvPartitioner() {}

  /**
   * Pings sharing one surface sound speed.
   *
   * @param surfaceSoundSpeed the shared value, m/s
   * @param pings indices into the chunk, ascending
   */
  public record Partition(double surfaceSoundSpeed, int[] pings) {
    public Partition {
      pings = pings.clone();
    }

    @Override
    public int[] pings() {
      return pings.clone();
    }
  }

  /**
   * @return partitions in ascending sound speed order; every ping appears in exactly one
   * @throws IllegalArgumentException for a non-finite or non-positive sound speed
   */
  public static List<Partition> partition(double[] surfaceSoundSpeed) {
    Map<Double, List<Integer>> groups = new TreeMap<>();
    for (int p = 0; p < surfaceSoundSpeed.length; p++) {
      double ssv = surfaceSoundSpeed[p];
      if (!Double.isFinite(ssv) || ssv <= 0) {
        throw new IllegalArgumentException("surface sound speed at ping " + p + " must be finite and > 0, got " + ssv);
      }
      groups.computeIfAbsent(ssv, k -> new ArrayList<>()).add(p);
    }
    List<Partition> partitions = new ArrayList<>(groups.size());
    for (Map.Entry<Double, List<Integer>> group : groups.entrySet()) {
      int[] pings = group.getValue().stream().mapToInt(Integer::intValue).toArray();
      partitions.add(new Partition(group.getKey(), pings));
    }
    return partitions;
  }
}
