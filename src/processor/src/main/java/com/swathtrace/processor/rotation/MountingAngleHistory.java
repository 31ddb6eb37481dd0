package com.swathtrace.processor.rotation;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Mounting angles of one sensor across installation periods.
 *
 * <p>Entries are ordered by effective time. A lookup returns the most recent entry that took
 * effect at or before the requested time; times before the first entry fall back to the first
 * entry, the same way installation records are applied to data logged before the first record.
 */
public final class MountingAngleHistory {
  private final List<MountingAngle> entries;

  public MountingAngleHistory(List<MountingAngle> entries) {
    if (entries == null || entries.isEmpty()) {
      throw new IllegalArgumentException("mounting angle history needs at least one entry");
    }
    List<MountingAngle> sorted = new ArrayList<>(entries);
    sorted.sort(Comparator.comparingDouble(MountingAngle::effectiveTime));
    this.entries = List.copyOf(sorted);
  }

  public List<MountingAngle> entries() {
    return entries;
  }

  /**
   * Returns the mounting angle that applies at {@code time}.
   *
   * @param time UTC seconds
   * @return applicable entry
   */
  public MountingAngle applicableAt(double time) {
    MountingAngle applicable = entries.get(0);
    for (MountingAngle entry : entries) {
      if (entry.effectiveTime() <= time) {
        applicable = entry;
      } else {
        break;
      }
    }
    return applicable;
  }
}
