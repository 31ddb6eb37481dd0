package com.swathtrace.processor.service;

import com.swathtrace.processor.cast.CastProcessor;
import com.swathtrace.processor.cast.NormalizedCast;
import com.swathtrace.processor.cast.SoundVelocityCast;
import com.swathtrace.processor.config.ProcessorProperties;
import com.swathtrace.processor.grid.BeamGrid;
import com.swathtrace.processor.raytrace.BeamFlag;
import com.swathtrace.processor.raytrace.RayTraceResult;
import com.swathtrace.processor.raytrace.RayTraceTable;
import com.swathtrace.processor.raytrace.RayTracer;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Sound-velocity correction of beam angles and travel times into sounding offsets.
 *
 * <p>This component:
 * <ul>
 *   <li>splits each chunk by surface sound speed and traces every group against its own cast</li>
 *   <li>fans chunks out to a fixed worker pool and collects them back in chunk order</li>
 *   <li>reports beams the cast could not cover as invalid, with counters per outcome</li>
 * </ul>
 */
@Component
public class SoundVelocityCorrector {
  private static final Logger LOGGER = LoggerFactory.getLogger(SoundVelocityCorrector.class);
  private static final long NOT_STARTED = Long.MIN_VALUE;
  private static final long POLL_NANOS = TimeUnit.MILLISECONDS.toNanos(50);

  private final CastProcessor castProcessor;
  private final RayTracer rayTracer;
  private final CastLibrary castLibrary;
  private final ProcessorProperties.Chunking chunking;
  private final ExecutorService executor;
  private final Counter chunksProcessed;
  private final Counter chunksFailed;
  private final Counter beamsResolved;
  private final Counter beamsAboveTransducer;
  private final Counter beamsBeyondCast;
  private final Counter anglesClipped;
  private final Timer chunkTimer;

  public SoundVelocityCorrector(
    CastProcessor castProcessor,
    RayTracer rayTracer,
    CastLibrary castLibrary,
    ProcessorProperties properties,
    MeterRegistry meterRegistry
  ) {
    this.castProcessor = castProcessor;
    this.rayTracer = rayTracer;
    this.castLibrary = castLibrary;
    this.chunking = properties.chunking();
    AtomicInteger threadCount = new AtomicInteger();
    this.executor = Executors.newFixedThreadPool(chunking.workerThreads(), runnable -> {
      Thread thread = new Thread(runnable, "svcorrect-worker-" + threadCount.incrementAndGet());
      thread.setDaemon(true);
      return thread;
    });
    this.chunksProcessed = meterRegistry.counter("processor.svcorrect.chunks.processed");
    this.chunksFailed = meterRegistry.counter("processor.svcorrect.chunks.failed");
    this.beamsResolved = meterRegistry.counter("processor.svcorrect.beams", "outcome", "resolved");
    this.beamsAboveTransducer = meterRegistry.counter("processor.svcorrect.beams", "outcome", "above_transducer");
    this.beamsBeyondCast = meterRegistry.counter("processor.svcorrect.beams", "outcome", "beyond_cast");
    this.anglesClipped = meterRegistry.counter("processor.svcorrect.angles.clipped");
    this.chunkTimer = meterRegistry.timer("processor.svcorrect.chunk.duration");
  }

  /** Stops the worker pool; running chunks are interrupted. */
  @jakarta.annotation.PreDestroy
  public void stop() {
    executor.shutdownNow();
    try {
      executor.awaitTermination(5, TimeUnit.SECONDS);
    } catch (InterruptedException ignored) {
      Thread.currentThread().interrupt();
    }
  }

  /**
   * Corrects one chunk on the calling thread.
   *
   * @throws com.swathtrace.processor.grid.DimensionMismatchException when the chunk's arrays disagree
   * @throws com.swathtrace.processor.cast.CastDegenerateException when a partition's cast cannot be traced
   */
  public ChunkResult correctChunk(PingChunk chunk) {
    ChunkResult result = trace(chunk);
    publish(result);
    return result;
  }

  // Publishes nothing; a cancelled chunk must never reach the counters.
  private ChunkResult trace(PingChunk chunk) {
    PingLine pings = chunk.pings();
    pings.checkShapes();
    SoundVelocityCast cast = castProcessor.toTransducerReference(chunk.cast(), pings.zWaterlineOffset());

    BeamGrid angles = pings.beamAngle();
    int beams = angles.beams();
    BeamGrid.Builder along = new BeamGrid.Builder(angles.pings(), beams);
    BeamGrid.Builder across = new BeamGrid.Builder(angles.pings(), beams);
    BeamGrid.Builder depth = new BeamGrid.Builder(angles.pings(), beams);
    StatusGrid.Builder status = new StatusGrid.Builder(angles, ProcessingStatus.BEAM_VECTOR);
    RayTraceDiagnostics diagnostics = RayTraceDiagnostics.EMPTY;

    for (SsvPartitioner.Partition partition : SsvPartitioner.partition(pings.surfaceSoundSpeed())) {
      if (Thread.currentThread().isInterrupted()) {
        throw new CancellationException("chunk " + chunk.chunkIndex() + " cancelled");
      }
      BeamSelection selection = BeamSelection.of(pings, partition.pings());
      if (selection.size() == 0) {
        continue;
      }
      double ssv = partition.surfaceSoundSpeed();
      double maxAllowable = castProcessor.maxAllowableSoundSpeed(selection.angles, ssv);
      NormalizedCast normalized = castProcessor.normalize(cast, ssv, maxAllowable);
      RayTraceTable table = rayTracer.buildTable(normalized, selection.angles);
      RayTraceResult result = rayTracer.interpolate(table, selection.oneWayTimes);

      for (int i = 0; i < selection.size(); i++) {
        if (!result.isResolved(i)) {
          continue;
        }
        int p = selection.pings[i];
        int b = selection.beams[i];
        double horizontal = Math.abs(result.horizontalDistance(i));
        double azimuth = pings.beamAzimuth().get(p, b);
        across.set(p, b, rayTracer.round(horizontal * Math.sin(azimuth) + pings.acrossOffset().get(p, b)));
        along.set(p, b, rayTracer.round(horizontal * Math.cos(azimuth) + pings.alongOffset().get(p, b)));
        depth.set(p, b, rayTracer.round(result.depth(i) + pings.downOffset().get(p, b)));
        status.set(p, b, ProcessingStatus.SOUND_VELOCITY);
      }
      diagnostics = diagnostics.plus(new RayTraceDiagnostics(
          result.count(BeamFlag.RESOLVED),
          result.count(BeamFlag.ABOVE_TRANSDUCER),
          result.count(BeamFlag.BEYOND_CAST),
          table.clippedUpdates()));
    }

    return new ChunkResult(
        chunk.chunkIndex(),
        chunk.firstPing(),
        chunk.cast().name(),
        along.build(),
        across.build(),
        depth.build(),
        status.build(),
        diagnostics);
  }

  /**
   * Corrects chunks in parallel on the worker pool.
   *
   * @return one outcome per chunk, in the order given; a failed or timed-out chunk does not affect
   *     the others and is not retried
   */
  public List<ChunkOutcome> correctChunks(List<PingChunk> chunks) {
    List<ChunkTask> tasks = new ArrayList<>(chunks.size());
    for (PingChunk chunk : chunks) {
      ChunkTask task = new ChunkTask(chunk);
      task.future = executor.submit(task);
      tasks.add(task);
    }
    List<ChunkOutcome> outcomes = new ArrayList<>(tasks.size());
    for (ChunkTask task : tasks) {
      ChunkOutcome outcome = await(task);
      if (outcome.isSuccess()) {
        publish(outcome.result());
      } else {
        chunksFailed.increment();
        LOGGER.warn("Sound velocity correction failed for chunk {}", outcome.chunkIndex(), outcome.error());
      }
      outcomes.add(outcome);
    }
    return outcomes;
  }

  /** Corrects a full line against the casts in the {@link CastLibrary}. */
  public LineResult correctLine(PingLine line) {
    List<SoundVelocityCast> casts = castLibrary.casts();
    if (casts.isEmpty()) {
      throw new IllegalStateException("Cast library is empty, no cast to correct the line with");
    }
    return correctLine(line, casts);
  }

  /**
   * Splits a line into chunks, gives each the cast nearest its mean ping time and puts the results
   * back together in line order.
   */
  public LineResult correctLine(PingLine line, List<SoundVelocityCast> casts) {
    line.checkShapes();
    List<PingChunk> chunks = PingChunker.split(line, casts, chunking.pingsPerChunk());
    LOGGER.info("Correcting {} pings in {} chunk(s)", line.pings(), chunks.size());
    List<ChunkOutcome> outcomes = correctChunks(chunks);

    BeamGrid angles = line.beamAngle();
    BeamGrid.Builder along = new BeamGrid.Builder(angles.pings(), angles.beams());
    BeamGrid.Builder across = new BeamGrid.Builder(angles.pings(), angles.beams());
    BeamGrid.Builder depth = new BeamGrid.Builder(angles.pings(), angles.beams());
    StatusGrid.Builder status = new StatusGrid.Builder(angles, ProcessingStatus.BEAM_VECTOR);
    RayTraceDiagnostics diagnostics = RayTraceDiagnostics.EMPTY;
    for (ChunkOutcome outcome : outcomes) {
      if (!outcome.isSuccess()) {
        continue;
      }
      ChunkResult result = outcome.result();
      diagnostics = diagnostics.plus(result.diagnostics());
      for (int p = 0; p < result.depth().pings(); p++) {
        int linePing = result.firstPing() + p;
        for (int b = 0; b < result.depth().beams(); b++) {
          if (result.depth().isValid(p, b)) {
            along.set(linePing, b, result.alongTrack().get(p, b));
            across.set(linePing, b, result.acrossTrack().get(p, b));
            depth.set(linePing, b, result.depth().get(p, b));
          }
          ProcessingStatus s = result.status().get(p, b);
          if (s != null) {
            status.set(linePing, b, s);
          }
        }
      }
    }
    return new LineResult(along.build(), across.build(), depth.build(), status.build(), outcomes, diagnostics);
  }

  private ChunkOutcome await(ChunkTask task) {
    long timeoutNanos = TimeUnit.SECONDS.toNanos(chunking.chunkTimeoutSeconds());
    int chunkIndex = task.chunk.chunkIndex();
    while (true) {
      long started = task.startedNanos;
      long waitNanos = POLL_NANOS;
      if (started != NOT_STARTED) {
        waitNanos = timeoutNanos - (System.nanoTime() - started);
        if (waitNanos <= 0 && !task.future.isDone()) {
          task.future.cancel(true);
          return ChunkOutcome.failed(chunkIndex, new TimeoutException(
              "chunk " + chunkIndex + " exceeded " + chunking.chunkTimeoutSeconds() + "s"));
        }
      }
      try {
        return ChunkOutcome.succeeded(task.future.get(Math.max(waitNanos, 0), TimeUnit.NANOSECONDS));
      } catch (TimeoutException ex) {
        LOGGER.trace("Chunk {} still queued or running", chunkIndex);
      } catch (ExecutionException ex) {
        return ChunkOutcome.failed(chunkIndex, ex.getCause());
      } catch (CancellationException ex) {
        return ChunkOutcome.failed(chunkIndex, ex);
      } catch (InterruptedException ex) {
        task.future.cancel(true);
        Thread.currentThread().interrupt();
        return ChunkOutcome.failed(chunkIndex, ex);
      }
    }
  }

  private void publish(ChunkResult result) {
    RayTraceDiagnostics diagnostics = result.diagnostics();
    beamsResolved.increment(diagnostics.resolved());
    beamsAboveTransducer.increment(diagnostics.aboveTransducer());
    beamsBeyondCast.increment(diagnostics.beyondCast());
    anglesClipped.increment(diagnostics.clippedAngles());
    chunksProcessed.increment();
    if (diagnostics.outOfRange() > 0) {
      LOGGER.warn("Chunk {} cast {}: {} beam(s) above the transducer, {} beyond the cast",
          result.chunkIndex(), result.castName(), diagnostics.aboveTransducer(), diagnostics.beyondCast());
    }
    if (diagnostics.clippedAngles() > 0) {
      LOGGER.warn("Chunk {} cast {}: {} refracted angle(s) clipped to horizontal",
          result.chunkIndex(), result.castName(), diagnostics.clippedAngles());
    }
    LOGGER.debug("Chunk {} resolved {} beam(s)", result.chunkIndex(), diagnostics.resolved());
  }

  private final class ChunkTask implements Callable<ChunkResult> {
    private final PingChunk chunk;
    private volatile long startedNanos = NOT_STARTED;
    private Future<ChunkResult> future;

    private ChunkTask(PingChunk chunk) {
      this.chunk = chunk;
    }

    @Override
    public ChunkResult call() {
      startedNanos = System.nanoTime();
      Supplier<ChunkResult> work = () -> trace(chunk);
      return chunkTimer.record(work);
    }
  }

  /** Valid beams of a partition's pings, flattened for the ray tracer. */
  private static final class BeamSelection {
    private final int[] pings;
    private final int[] beams;
    private final double[] angles;
    private final double[] oneWayTimes;

    private BeamSelection(int[] pings, int[] beams, double[] angles, double[] oneWayTimes) {
      this.pings = pings;
      this.beams = beams;
      this.angles = angles;
      this.oneWayTimes = oneWayTimes;
    }

    static BeamSelection of(PingLine line, int[] pingIndices) {
      BeamGrid angle = line.beamAngle();
      BeamGrid twtt = line.twoWayTravelTime();
      int count = 0;
      for (int p : pingIndices) {
        for (int b = 0; b < angle.beams(); b++) {
          if (angle.isValid(p, b)) {
            count++;
          }
        }
      }
      int[] pings = new int[count];
      int[] beams = new int[count];
      double[] angles = new double[count];
      double[] oneWay = new double[count];
      int n = 0;
      for (int p : pingIndices) {
        for (int b = 0; b < angle.beams(); b++) {
          if (angle.isValid(p, b)) {
            pings[n] = p;
            beams[n] = b;
            angles[n] = angle.get(p, b);
            oneWay[n] = twtt.get(p, b) / 2.0;
            n++;
          }
        }
      }
      return new BeamSelection(pings, beams, angles, oneWay);
    }

    int size() {
      return angles.length;
    }
  }
}
