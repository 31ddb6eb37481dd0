package com.swathtrace.processor.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyDouble;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.spy;
import static org.mockito.Mockito.when;

import com.swathtrace.processor.cast.CastDegenerateException;
import com.swathtrace.processor.cast.CastProcessor;
import com.swathtrace.processor.cast.SoundVelocityCast;
import com.swathtrace.processor.config.ProcessorProperties;
import com.swathtrace.processor.grid.BeamGrid;
import com.swathtrace.processor.grid.DimensionMismatchException;
import com.swathtrace.processor.raytrace.RayTracer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeoutException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

class SoundVelocityCorrectorTest {
  private static final SoundVelocityCast REFERENCE_CAST = SoundVelocityCast.of(
      "profile_1000", 1000.0, new double[] {0.0, 10.0, 50.0}, new double[] {1500.0, 1520.0, 1480.0});
  private static final SoundVelocityCast ISOVELOCITY_CAST = SoundVelocityCast.of(
      "profile_2000", 2000.0, new double[] {0.0, 100.0}, new double[] {1500.0, 1500.0});

  private final SimpleMeterRegistry meterRegistry = new SimpleMeterRegistry();
  private final CastLibrary castLibrary = mock(CastLibrary.class);
  private final List<SoundVelocityCorrector> correctors = new ArrayList<>();

  @AfterEach
  void stopWorkers() {
    correctors.forEach(SoundVelocityCorrector::stop);
  }

  @Test
  void referenceBeamPastTheCastIsFlaggedInvalid() {
    SoundVelocityCorrector corrector = corrector(0.0, 1000);

    ChunkResult result = corrector.correctChunk(new PingChunk(0, 0, referenceLine(), REFERENCE_CAST));

    assertThat(result.depth().isValid(0, 0)).isFalse();
    assertThat(result.alongTrack().isValid(0, 0)).isFalse();
    assertThat(result.acrossTrack().isValid(0, 0)).isFalse();
    assertThat(result.status().get(0, 0)).isEqualTo(ProcessingStatus.BEAM_VECTOR);
    assertThat(result.diagnostics().beyondCast()).isEqualTo(1);
    assertThat(meterRegistry.counter("processor.svcorrect.beams", "outcome", "beyond_cast").count()).isEqualTo(1.0);
  }

  @Test
  void referenceBeamResolvesWhenCastIsExtended() {
    SoundVelocityCorrector corrector = corrector(100.0, 1000);

    ChunkResult result = corrector.correctChunk(new PingChunk(0, 0, referenceLine(), REFERENCE_CAST));

    assertThat(result.acrossTrack().get(0, 0)).isEqualTo(10.561);
    assertThat(result.alongTrack().get(0, 0)).isEqualTo(0.0);
    assertThat(result.depth().get(0, 0)).isEqualTo(59.474);
    assertThat(result.status().get(0, 0)).isEqualTo(ProcessingStatus.SOUND_VELOCITY);
    assertThat(result.castName()).isEqualTo("profile_1000");
  }

  @Test
  void oppositeAzimuthsMirrorAlongTrack() {
    SoundVelocityCorrector corrector = corrector(0.0, 1000);
    PingLine line = PingLine.withUniformOffsets(
        new double[] {1000.0},
        new double[] {1500.0},
        BeamGrid.fromRows(new double[][] {{Math.toRadians(30.0), Math.toRadians(30.0)}}),
        BeamGrid.fromRows(new double[][] {{0.0, Math.PI}}),
        BeamGrid.fromRows(new double[][] {{0.04, 0.04}}),
        0.0, 0.0, 0.0, 0.0);

    ChunkResult result = corrector.correctChunk(new PingChunk(0, 0, line, ISOVELOCITY_CAST));

    assertThat(result.alongTrack().get(0, 0)).isEqualTo(15.0);
    assertThat(result.alongTrack().get(0, 1)).isEqualTo(-15.0);
    assertThat(result.acrossTrack().get(0, 0)).isEqualTo(0.0);
    assertThat(Math.abs(result.acrossTrack().get(0, 1))).isEqualTo(0.0);
    assertThat(result.depth().get(0, 0)).isEqualTo(result.depth().get(0, 1));
  }

  @Test
  void leverArmOffsetsAreAdded() {
    SoundVelocityCorrector corrector = corrector(0.0, 1000);
    PingLine line = PingLine.withUniformOffsets(
        new double[] {1000.0},
        new double[] {1500.0},
        BeamGrid.fromRows(new double[][] {{Math.toRadians(30.0)}}),
        BeamGrid.fromRows(new double[][] {{Math.PI / 2}}),
        BeamGrid.fromRows(new double[][] {{0.04}}),
        0.0, 1.0, 2.0, 3.0);

    ChunkResult result = corrector.correctChunk(new PingChunk(0, 0, line, ISOVELOCITY_CAST));

    assertThat(result.acrossTrack().get(0, 0)).isEqualTo(17.0);
    assertThat(result.alongTrack().get(0, 0)).isEqualTo(1.0);
    assertThat(result.depth().get(0, 0)).isEqualTo(28.981);
  }

  @Test
  void eachSurfaceSoundSpeedGetsItsOwnCast() {
    SoundVelocityCorrector corrector = corrector(0.0, 1000);
    PingLine line = PingLine.withUniformOffsets(
        new double[] {1000.0, 1001.0, 1002.0},
        new double[] {1520.0, 1500.0, 1520.0},
        BeamGrid.filled(3, 1, Math.toRadians(30.0)),
        BeamGrid.filled(3, 1, Math.PI / 2),
        BeamGrid.filled(3, 1, 0.08),
        0.0, 0.0, 0.0, 0.0);

    ChunkResult result = corrector.correctChunk(new PingChunk(0, 0, line, ISOVELOCITY_CAST));

    assertThat(result.depth().get(1, 0)).isEqualTo(51.962);
    assertThat(result.depth().get(0, 0)).isEqualTo(52.654);
    assertThat(result.depth().get(2, 0)).isEqualTo(52.654);
    assertThat(ISOVELOCITY_CAST.soundSpeeds()).containsExactly(1500.0, 1500.0);
  }

  @Test
  void waterlineOffsetMovesTheCastToTheTransducer() {
    SoundVelocityCorrector corrector = corrector(0.0, 1000);
    PingLine line = PingLine.withUniformOffsets(
        new double[] {1000.0},
        new double[] {1500.0},
        BeamGrid.fromRows(new double[][] {{0.0}}),
        BeamGrid.fromRows(new double[][] {{0.0}}),
        BeamGrid.fromRows(new double[][] {{0.04}}),
        -60.0, 0.0, 0.0, 0.0);

    ChunkResult result = corrector.correctChunk(new PingChunk(0, 0, line, ISOVELOCITY_CAST));

    assertThat(result.depth().get(0, 0)).isEqualTo(30.0);
    assertThat(result.diagnostics().beyondCast()).isZero();
  }

  @Test
  void absentBeamsStayAbsent() {
    SoundVelocityCorrector corrector = corrector(0.0, 1000);
    PingLine line = PingLine.withUniformOffsets(
        new double[] {1000.0, 1001.0},
        new double[] {1500.0, 1500.0},
        BeamGrid.fromRows(new double[][] {{0.1, 0.2}, {0.3}}),
        BeamGrid.fromRows(new double[][] {{0.0, 0.0}, {0.0}}),
        BeamGrid.fromRows(new double[][] {{0.02, 0.0}, {0.02}}),
        0.0, 0.0, 0.0, 0.0);

    ChunkResult result = corrector.correctChunk(new PingChunk(0, 0, line, ISOVELOCITY_CAST));

    assertThat(result.depth().isValid(1, 1)).isFalse();
    assertThat(result.status().get(1, 1)).isNull();
    assertThat(result.status().get(0, 1)).isEqualTo(ProcessingStatus.BEAM_VECTOR);
    assertThat(result.status().count(ProcessingStatus.SOUND_VELOCITY)).isEqualTo(2);
    assertThat(result.diagnostics().aboveTransducer()).isEqualTo(1);
  }

  @Test
  void mismatchedGridsAreRejected() {
    SoundVelocityCorrector corrector = corrector(0.0, 1000);
    PingLine line = new PingLine(
        new double[] {1000.0},
        new double[] {1500.0},
        BeamGrid.fromRows(new double[][] {{0.1, 0.2}}),
        BeamGrid.fromRows(new double[][] {{0.0}}),
        BeamGrid.fromRows(new double[][] {{0.02, 0.02}}),
        0.0,
        BeamGrid.filled(1, 2, 0.0),
        BeamGrid.filled(1, 2, 0.0),
        BeamGrid.filled(1, 2, 0.0));

    assertThatThrownBy(() -> corrector.correctChunk(new PingChunk(0, 0, line, ISOVELOCITY_CAST)))
        .isInstanceOf(DimensionMismatchException.class);
  }

  @Test
  void failingChunkDoesNotAffectOthers() {
    SoundVelocityCorrector corrector = corrector(0.0, 1000);
    SoundVelocityCast tooShallow = SoundVelocityCast.of(
        "profile_3000", 3000.0, new double[] {0.0, 1.0}, new double[] {1500.0, 1501.0});
    PingLine shallowLine = PingLine.withUniformOffsets(
        new double[] {1000.0},
        new double[] {1500.0},
        BeamGrid.fromRows(new double[][] {{0.0}}),
        BeamGrid.fromRows(new double[][] {{0.0}}),
        BeamGrid.fromRows(new double[][] {{0.01}}),
        -5.0, 0.0, 0.0, 0.0);

    List<ChunkOutcome> outcomes = corrector.correctChunks(List.of(
        new PingChunk(0, 0, referenceLine(), ISOVELOCITY_CAST),
        new PingChunk(1, 1, shallowLine, tooShallow),
        new PingChunk(2, 2, referenceLine(), ISOVELOCITY_CAST)));

    assertThat(outcomes).extracting(ChunkOutcome::chunkIndex).containsExactly(0, 1, 2);
    assertThat(outcomes.get(0).isSuccess()).isTrue();
    assertThat(outcomes.get(1).isSuccess()).isFalse();
    assertThat(outcomes.get(1).error()).isInstanceOf(CastDegenerateException.class);
    assertThat(outcomes.get(2).isSuccess()).isTrue();
    assertThat(meterRegistry.counter("processor.svcorrect.chunks.failed").count()).isEqualTo(1.0);
    assertThat(meterRegistry.counter("processor.svcorrect.chunks.processed").count()).isEqualTo(2.0);
  }

  @Test
  void slowChunkIsCancelledAndReportedAsTimedOut() {
    CastProcessor castProcessor = spy(new CastProcessor(new ProcessorProperties.Cast(0.0)));
    doAnswer(invocation -> {
      Thread.sleep(10_000);
      return invocation.callRealMethod();
    }).when(castProcessor).toTransducerReference(argThat(cast -> cast != null && cast.name().equals("slow")), anyDouble());
    SoundVelocityCorrector corrector = register(new SoundVelocityCorrector(
        castProcessor,
        new RayTracer(new ProcessorProperties.RayTrace(3)),
        castLibrary,
        properties(0.0, 1000, 1),
        meterRegistry));
    SoundVelocityCast slow = SoundVelocityCast.of("slow", 0.0, new double[] {0.0, 100.0}, new double[] {1500.0, 1500.0});

    List<ChunkOutcome> outcomes = corrector.correctChunks(List.of(
        new PingChunk(0, 0, referenceLine(), slow),
        new PingChunk(1, 0, referenceLine(), ISOVELOCITY_CAST)));

    assertThat(outcomes.get(0).isSuccess()).isFalse();
    assertThat(outcomes.get(0).error()).isInstanceOf(TimeoutException.class);
    assertThat(outcomes.get(1).isSuccess()).isTrue();
  }

  @Test
  void cancelledChunkNeverReachesTheCounters() {
    CastProcessor castProcessor = spy(new CastProcessor(new ProcessorProperties.Cast(0.0)));
    doAnswer(invocation -> {
      long end = System.nanoTime() + 2_500_000_000L;
      while (System.nanoTime() < end) {
        Thread.onSpinWait();
      }
      return invocation.callRealMethod();
    }).when(castProcessor).toTransducerReference(argThat(cast -> cast != null && cast.name().equals("busy")), anyDouble());
    SoundVelocityCorrector corrector = register(new SoundVelocityCorrector(
        castProcessor,
        new RayTracer(new ProcessorProperties.RayTrace(3)),
        castLibrary,
        properties(0.0, 1000, 1),
        meterRegistry));
    SoundVelocityCast busy = SoundVelocityCast.of("busy", 0.0, new double[] {0.0, 100.0}, new double[] {1500.0, 1500.0});

    List<ChunkOutcome> outcomes = corrector.correctChunks(List.of(new PingChunk(0, 0, referenceLine(), busy)));
    corrector.stop();

    assertThat(outcomes.get(0).error()).isInstanceOf(TimeoutException.class);
    assertThat(meterRegistry.counter("processor.svcorrect.chunks.failed").count()).isEqualTo(1.0);
    assertThat(meterRegistry.counter("processor.svcorrect.chunks.processed").count()).isZero();
    assertThat(meterRegistry.counter("processor.svcorrect.beams", "outcome", "resolved").count()).isZero();
  }

  @Test
  void nonFiniteTravelTimeIsRejected() {
    SoundVelocityCorrector corrector = corrector(0.0, 1000);
    PingLine line = PingLine.withUniformOffsets(
        new double[] {1000.0},
        new double[] {1500.0},
        BeamGrid.fromRows(new double[][] {{0.1, 0.2}}),
        BeamGrid.fromRows(new double[][] {{0.0, 0.0}}),
        BeamGrid.of(1, 2, new double[] {0.02, Double.NaN}, new boolean[] {true, true}),
        0.0, 0.0, 0.0, 0.0);

    assertThatThrownBy(() -> corrector.correctChunk(new PingChunk(0, 0, line, ISOVELOCITY_CAST)))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("beam 1");
    assertThat(meterRegistry.counter("processor.svcorrect.beams", "outcome", "above_transducer").count()).isZero();
  }

  @Test
  void lineIsChunkedAndReassembledInPingOrder() {
    SoundVelocityCorrector corrector = corrector(0.0, 2);
    SoundVelocityCast early = SoundVelocityCast.of(
        "profile_0", 0.0, new double[] {0.0, 1.0, 200.0}, new double[] {1500.0, 1500.0, 1500.0});
    SoundVelocityCast late = SoundVelocityCast.of(
        "profile_190", 190.0, new double[] {0.0, 1.0, 200.0}, new double[] {1500.0, 1600.0, 1600.0});
    PingLine line = PingLine.withUniformOffsets(
        new double[] {0.0, 1.0, 100.0, 101.0, 200.0},
        new double[] {1500.0, 1500.0, 1500.0, 1500.0, 1500.0},
        BeamGrid.filled(5, 2, 0.0),
        BeamGrid.filled(5, 2, 0.0),
        BeamGrid.filled(5, 2, 0.1),
        0.0, 0.0, 0.0, 0.0);

    LineResult result = corrector.correctLine(line, List.of(early, late));

    assertThat(result.outcomes()).hasSize(3);
    assertThat(result.failedChunks()).isEmpty();
    assertThat(result.outcomes()).extracting(o -> o.result().castName())
        .containsExactly("profile_0", "profile_190", "profile_190");
    assertThat(result.depth().pings()).isEqualTo(5);
    assertThat(result.depth().get(0, 1)).isEqualTo(75.0);
    assertThat(result.depth().get(2, 0)).isEqualTo(79.933);
    assertThat(result.depth().get(4, 1)).isEqualTo(79.933);
    assertThat(result.status().count(ProcessingStatus.SOUND_VELOCITY)).isEqualTo(10);
    assertThat(result.diagnostics().resolved()).isEqualTo(10);
  }

  @Test
  void lineUsesCastLibraryByDefault() {
    SoundVelocityCorrector corrector = corrector(0.0, 1000);
    when(castLibrary.casts()).thenReturn(List.of(ISOVELOCITY_CAST));

    LineResult result = corrector.correctLine(referenceLine());

    assertThat(result.outcomes()).singleElement().extracting(o -> o.result().castName()).isEqualTo("profile_2000");
  }

  @Test
  void lineNeedsAtLeastOneCast() {
    SoundVelocityCorrector corrector = corrector(0.0, 1000);
    when(castLibrary.casts()).thenReturn(List.of());

    assertThatThrownBy(() -> corrector.correctLine(referenceLine()))
        .isInstanceOf(IllegalStateException.class);
  }

  private static PingLine referenceLine() {
    return PingLine.withUniformOffsets(
        new double[] {1000.0},
        new double[] {1500.0},
        BeamGrid.fromRows(new double[][] {{Math.toRadians(10.0)}}),
        BeamGrid.fromRows(new double[][] {{Math.PI / 2}}),
        BeamGrid.fromRows(new double[][] {{0.08}}),
        0.0, 0.0, 0.0, 0.0);
  }

  private static ProcessorProperties properties(double extendToDepth, int pingsPerChunk, long timeoutSeconds) {
    return new ProcessorProperties(
        new ProcessorProperties.Chunking(pingsPerChunk, 2, timeoutSeconds),
        new ProcessorProperties.Cast(extendToDepth),
        new ProcessorProperties.RayTrace(3),
        new ProcessorProperties.Library(null, false));
  }

  private SoundVelocityCorrector corrector(double extendToDepth, int pingsPerChunk) {
    ProcessorProperties properties = properties(extendToDepth, pingsPerChunk, 30);
    return register(new SoundVelocityCorrector(
        new CastProcessor(properties.cast()),
        new RayTracer(properties.rayTrace()),
        castLibrary,
        properties,
        meterRegistry));
  }

  private SoundVelocityCorrector register(SoundVelocityCorrector corrector) {
    correctors.add(corrector);
    return corrector;
  }
}
