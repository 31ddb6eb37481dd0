package com.swathtrace.processor.service;

import com.swathtrace.processor.grid.BeamGrid;
import java.util.Arrays;

/**
 * Processing status per (ping, beam). Absent beams have no status and report null.
 */
public final class StatusGrid {
  private final int pings;
  private final int beams;
  private final ProcessingStatus[] cells;

  private StatusGrid(int pings, int beams, ProcessingStatus[] cells) {
    this.pings = pings;
    this.beams = beams;
    this.cells = cells;
  }

  /** Every valid beam of {@code template} starts at {@code status}. */
  public static StatusGrid filledLike(BeamGrid template, ProcessingStatus status) {
    return new Builder(template, status).build();
  }

  public int pings() {
    return pings;
  }

  public int beams() {
    return beams;
  }

  public ProcessingStatus get(int ping, int beam) {
    return cells[ping * beams + beam];
  }

  /** Number of beams currently at {@code status}. */
  public int count(ProcessingStatus status) {
    int count = 0;
    for (ProcessingStatus cell : cells) {
      if (cell == status) {
        count++;
      }
    }
    return count;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof StatusGrid other)) {
      return false;
    }
    return pings == other.pings && beams == other.beams && Arrays.equals(cells, other.cells);
  }

  @Override
  public int hashCode() {
    return 31 * (31 * pings + beams) + Arrays.hashCode(cells);
  }

  @Override
  public String toString() {
    return "StatusGrid[" + pings + "x" + beams + "]";
  }

  static final class Builder {
    private final int pings;
    private final int beams;
    private final ProcessingStatus[] cells;

    Builder(BeamGrid template, ProcessingStatus initial) {
      this.pings = template.pings();
      this.beams = template.beams();
      this.cells = new ProcessingStatus[pings * beams];
      for (int p = 0; p < pings; p++) {
        for (int b = 0; b < beams; b++) {
          if (template.isValid(p, b)) {
            cells[p * beams + b] = initial;
          }
        }
      }
    }

    Builder set(int ping, int beam, ProcessingStatus status) {
      cells[ping * beams + beam] = status;
      return this;
    }

    StatusGrid build() {
      return new StatusGrid(pings, beams, cells.clone());
    }
  }
}
