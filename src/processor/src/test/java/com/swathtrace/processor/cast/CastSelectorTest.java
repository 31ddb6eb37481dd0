package com.swathtrace.processor.cast;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.List;
import org.junit.jupiter.api.Test;

class CastSelectorTest {
  private static SoundVelocityCast castAt(double time) {
    return SoundVelocityCast.of("profile_" + (long) time, time, new double[] {0.0, 10.0}, new double[] {1500.0, 1510.0});
  }

  @Test
  void picksCastClosestInTime() {
    List<SoundVelocityCast> casts = List.of(castAt(1000), castAt(2000), castAt(5000));

    assertThat(CastSelector.nearestInTime(casts, 1400).time()).isEqualTo(1000);
    assertThat(CastSelector.nearestInTime(casts, 3600).time()).isEqualTo(5000);
    assertThat(CastSelector.nearestInTime(casts, 0).time()).isEqualTo(1000);
  }

  @Test
  void tieGoesToFirstListed() {
    List<SoundVelocityCast> casts = List.of(castAt(2000), castAt(1000));

    assertThat(CastSelector.nearestInTime(casts, 1500).time()).isEqualTo(2000);
  }

  @Test
  void meanTimeAveragesPings() {
    assertThat(CastSelector.meanTime(new double[] {10.0, 20.0, 60.0})).isEqualTo(30.0);
  }

  @Test
  void rejectsEmptyInput() {
    assertThatThrownBy(() -> CastSelector.nearestInTime(List.of(), 10.0))
        .isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> CastSelector.meanTime(new double[0]))
        .isInstanceOf(IllegalArgumentException.class);
  }
}
