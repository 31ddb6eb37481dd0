package com.swathtrace.processor.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Typed configuration for the sound-velocity correction processor.
 *
 * <p>Values are bound from {@code application.yml} and environment variables under the
 * {@code processor.*} prefix. Sections left out of the configuration fall back to
 * {@link #defaults()}.
 */
@ConfigurationProperties(prefix = "processor")
public record ProcessorProperties(Chunking chunking, Cast cast, RayTrace rayTrace, Library library) {

  public ProcessorProperties {
    chunking = chunking == null ? new Chunking(1000, 4, 600) : chunking;
    cast = cast == null ? new Cast(0.0) : cast;
    rayTrace = rayTrace == null ? new RayTrace(3) : rayTrace;
    library = library == null ? new Library(null, true) : library;
  }

  public static ProcessorProperties defaults() {
    return new ProcessorProperties(null, null, null, null);
  }

  /**
   * How survey lines are split and dispatched.
   *
   * @param pingsPerChunk pings per chunk handed to one worker
   * @param workerThreads size of the worker pool
   * @param chunkTimeoutSeconds time a chunk may run before it is cancelled
   */
  public record Chunking(int pingsPerChunk, int workerThreads, long chunkTimeoutSeconds) {
    public Chunking {
      if (pingsPerChunk <= 0) {
        throw new IllegalArgumentException("processor.chunking.pings-per-chunk must be > 0");
      }
      if (workerThreads <= 0) {
        throw new IllegalArgumentException("processor.chunking.worker-threads must be > 0");
      }
      if (chunkTimeoutSeconds <= 0) {
        throw new IllegalArgumentException("processor.chunking.chunk-timeout-seconds must be > 0");
      }
    }
  }

  /**
   * Cast normalization.
   *
   * @param extendToDepth depth in meters the last layer's sound speed is extended to; 0 disables
   */
  public record Cast(double extendToDepth) {
    public Cast {
      if (extendToDepth < 0) {
        throw new IllegalArgumentException("processor.cast.extend-to-depth must be >= 0");
      }
    }

    public boolean extensionEnabled() {
      return extendToDepth > 0;
    }
  }

  /** @param roundingDecimals decimals kept on output offsets (3 is millimetres) */
  public record RayTrace(int roundingDecimals) {
    public RayTrace {
      if (roundingDecimals < 0) {
        throw new IllegalArgumentException("processor.ray-trace.rounding-decimals must be >= 0");
      }
    }
  }

  /**
   * Cast files loaded at startup.
   *
   * @param directory folder holding {@code .svp} files; blank disables the library
   * @param searchSubdirectories also scan nested folders
   */
  public record Library(String directory, boolean searchSubdirectories) {
    public boolean enabled() {
      return directory != null && !directory.isBlank();
    }
  }
}
