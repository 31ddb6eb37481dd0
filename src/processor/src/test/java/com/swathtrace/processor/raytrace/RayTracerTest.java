package com.swathtrace.processor.raytrace;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

import com.swathtrace.processor.cast.CastProcessor;
import com.swathtrace.processor.cast.NormalizedCast;
import com.swathtrace.processor.cast.SoundVelocityCast;
import com.swathtrace.processor.config.ProcessorProperties;
import java.util.Arrays;
import org.junit.jupiter.api.Test;

class RayTracerTest {
  private static final double TEN_DEGREES = Math.toRadians(10.0);

  private final RayTracer rayTracer = new RayTracer(new ProcessorProperties.RayTrace(3));

  private static NormalizedCast normalized(double extendToDepth, double ssv, double[] depths, double[] speeds) {
    CastProcessor processor = new CastProcessor(new ProcessorProperties.Cast(extendToDepth));
    return processor.normalize(SoundVelocityCast.of("test", 0.0, depths, speeds), ssv, Double.POSITIVE_INFINITY);
  }

  private static NormalizedCast threeLayerCast(double extendToDepth) {
    return normalized(extendToDepth, 1500.0,
        new double[] {0.0, 10.0, 50.0}, new double[] {1500.0, 1520.0, 1480.0});
  }

  @Test
  void singleLayerMatchesClosedForm() {
    NormalizedCast cast = normalized(0.0, 1500.0, new double[] {0.0, 100.0}, new double[] {1500.0, 1500.0});
    double angle = Math.toRadians(30.0);

    RayTraceResult result = rayTracer.interpolate(
        rayTracer.buildTable(cast, new double[] {angle}), new double[] {0.02});

    assertThat(result.flag(0)).isEqualTo(BeamFlag.RESOLVED);
    assertThat(result.horizontalDistance(0)).isCloseTo(1500.0 * 0.02 * Math.sin(angle), within(1e-3));
    assertThat(result.depth(0)).isCloseTo(1500.0 * 0.02 * Math.cos(angle), within(1e-3));
    assertThat(rayTracer.round(result.horizontalDistance(0))).isEqualTo(15.0);
    assertThat(rayTracer.round(result.depth(0))).isEqualTo(25.981);
  }

  @Test
  void cumulativeTablesFollowEachLayer() {
    RayTraceTable table = rayTracer.buildTable(threeLayerCast(0.0), new double[] {TEN_DEGREES});

    assertThat(table.boundaryCount()).isEqualTo(3);
    assertThat(table.cumulativeDepth(2)).isEqualTo(50.0);
    assertThat(table.cumulativeTime(0, 0)).isZero();
    assertThat(table.cumulativeTime(0, 1)).isCloseTo(0.0067695107459, within(1e-12));
    assertThat(table.cumulativeTime(0, 2)).isCloseTo(0.0335024220118, within(1e-12));
    assertThat(table.maxTime(0)).isEqualTo(table.cumulativeTime(0, 2));
    assertThat(table.clippedUpdates()).isZero();
  }

  @Test
  void travelTimePastTheCastIsFlaggedNotZeroed() {
    RayTraceResult result = rayTracer.interpolate(
        rayTracer.buildTable(threeLayerCast(0.0), new double[] {TEN_DEGREES}), new double[] {0.04});

    assertThat(result.flag(0)).isEqualTo(BeamFlag.BEYOND_CAST);
    assertThat(result.horizontalDistance(0)).isNaN();
    assertThat(result.depth(0)).isNaN();
    assertThat(result.count(BeamFlag.BEYOND_CAST)).isEqualTo(1);
  }

  @Test
  void extendedCastResolvesTheReferenceBeam() {
    RayTraceResult result = rayTracer.interpolate(
        rayTracer.buildTable(threeLayerCast(100.0), new double[] {TEN_DEGREES}), new double[] {0.04});

    assertThat(result.flag(0)).isEqualTo(BeamFlag.RESOLVED);
    assertThat(result.horizontalDistance(0)).isCloseTo(10.560982586982115, within(1e-9));
    assertThat(result.depth(0)).isCloseTo(59.474219404530224, within(1e-9));
    assertThat(rayTracer.round(result.horizontalDistance(0))).isEqualTo(10.561);
    assertThat(rayTracer.round(result.depth(0))).isEqualTo(59.474);
  }

  @Test
  void nonPositiveTravelTimeIsAboveTransducer() {
    RayTraceTable table = rayTracer.buildTable(threeLayerCast(0.0), new double[] {TEN_DEGREES, TEN_DEGREES});

    RayTraceResult result = rayTracer.interpolate(table, new double[] {0.0, -0.001});

    assertThat(result.flag(0)).isEqualTo(BeamFlag.ABOVE_TRANSDUCER);
    assertThat(result.flag(1)).isEqualTo(BeamFlag.ABOVE_TRANSDUCER);
    assertThat(result.count(BeamFlag.RESOLVED)).isZero();
  }

  @Test
  void boundaryTravelTimeLandsOnTheBoundary() {
    RayTraceTable table = rayTracer.buildTable(threeLayerCast(0.0), new double[] {TEN_DEGREES});

    RayTraceResult result = rayTracer.interpolate(table, new double[] {table.cumulativeTime(0, 1)});

    assertThat(result.depth(0)).isCloseTo(10.0, within(1e-9));
    assertThat(result.horizontalDistance(0)).isCloseTo(table.cumulativeDistance(0, 1), within(1e-9));
  }

  @Test
  void offsetsGrowWithTravelTime() {
    NormalizedCast cast = threeLayerCast(0.0);
    double[] times = {0.001, 0.005, 0.0068, 0.012, 0.02, 0.03, 0.0335};
    double[] angles = new double[times.length];
    Arrays.fill(angles, Math.toRadians(-35.0));

    RayTraceResult result = rayTracer.interpolate(rayTracer.buildTable(cast, angles), times);

    for (int i = 1; i < times.length; i++) {
      assertThat(result.depth(i)).isGreaterThan(result.depth(i - 1));
      assertThat(Math.abs(result.horizontalDistance(i))).isGreaterThan(Math.abs(result.horizontalDistance(i - 1)));
      assertThat(result.horizontalDistance(i)).isNegative();
    }
  }

  @Test
  void rayParameterIsConservedAcrossLayers() {
    NormalizedCast cast = normalized(0.0, 1500.0,
        new double[] {0.0, 5.0, 20.0, 60.0, 120.0}, new double[] {1500.0, 1495.0, 1510.0, 1488.0, 1492.0});
    double[] angles = {Math.toRadians(-60.0), Math.toRadians(15.0), Math.toRadians(45.0)};

    RayTraceTable table = rayTracer.buildTable(cast, angles);

    assertThat(table.clippedUpdates()).isZero();
    for (int beam = 0; beam < angles.length; beam++) {
      double rayParameter = Math.sin(angles[beam]) / cast.soundSpeed(0);
      for (int layer = 0; layer < cast.layerCount() - 1; layer++) {
        assertThat(table.sinAngle(beam, layer) / cast.soundSpeed(layer)).isCloseTo(rayParameter, within(1e-12));
      }
    }
  }

  @Test
  void refractionPastHorizontalIsClippedAndBlocksDeeperLayers() {
    NormalizedCast cast = normalized(0.0, 1500.0,
        new double[] {0.0, 10.0, 30.0}, new double[] {1500.0, 3100.0, 3200.0});
    double angle = Math.toRadians(40.0);

    RayTraceTable table = rayTracer.buildTable(cast, new double[] {angle, angle});
    RayTraceResult result = rayTracer.interpolate(table, new double[] {0.005, 0.05});

    assertThat(table.clippedUpdates()).isEqualTo(2);
    assertThat(table.sinAngle(0, 1)).isEqualTo(1.0);
    assertThat(table.cumulativeTime(0, 2)).isInfinite();
    assertThat(result.flag(0)).isEqualTo(BeamFlag.RESOLVED);
    assertThat(result.flag(1)).isEqualTo(BeamFlag.BEYOND_CAST);
  }

  @Test
  void rejectsTravelTimesForOtherBeams() {
    RayTraceTable table = rayTracer.buildTable(threeLayerCast(0.0), new double[] {TEN_DEGREES});

    assertThatThrownBy(() -> rayTracer.interpolate(table, new double[] {0.01, 0.02}))
        .isInstanceOf(IllegalArgumentException.class);
  }
}
