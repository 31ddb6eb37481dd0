package com.swathtrace.processor.service;

import com.swathtrace.processor.cast.CastFile;
import com.swathtrace.processor.cast.CastFormatException;
import com.swathtrace.processor.cast.CastSelector;
import com.swathtrace.processor.cast.InlineCastCodec;
import com.swathtrace.processor.cast.SoundVelocityCast;
import com.swathtrace.processor.cast.SvpCastReader;
import com.swathtrace.processor.config.ProcessorProperties;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Casts available to the processor, kept in time order.
 *
 * <p>When {@code processor.library.directory} is set, every {@code .svp} file below it is read at
 * startup. A malformed file is skipped and counted; the others still load. Casts stored inline
 * as {@code profile_<time>} JSON can be added with {@link #addInline}.
 */
@Component
public class CastLibrary {
  private static final Logger LOGGER = LoggerFactory.getLogger(CastLibrary.class);

  private final ProcessorProperties.Library settings;
  private final SvpCastReader reader;
  private final InlineCastCodec codec;
  private final CopyOnWriteArrayList<SoundVelocityCast> casts = new CopyOnWriteArrayList<>();
  private final Counter filesLoaded;
  private final Counter filesRejected;

  public CastLibrary(
    ProcessorProperties properties,
    SvpCastReader reader,
    InlineCastCodec codec,
    MeterRegistry meterRegistry
  ) {
    this.settings = properties.library();
    this.reader = reader;
    this.codec = codec;
    this.filesLoaded = meterRegistry.counter("processor.cast_library.files.loaded");
    this.filesRejected = meterRegistry.counter("processor.cast_library.files.rejected");
    meterRegistry.gauge("processor.cast_library.casts", casts, List::size);
  }

  /** Loads the configured folder, if any. */
  @jakarta.annotation.PostConstruct
  public void loadConfiguredDirectory() {
    if (!settings.enabled()) {
      LOGGER.info("Cast library directory not configured, starting with no casts");
      return;
    }
    Path directory = Path.of(settings.directory());
    if (!Files.isDirectory(directory)) {
      LOGGER.warn("Cast library directory {} does not exist", directory);
      return;
    }
    int loaded = loadDirectory(directory, settings.searchSubdirectories());
    LOGGER.info("Cast library loaded {} cast(s) from {}", loaded, directory);
  }

  /**
   * Reads every cast file in a folder.
   *
   * @return number of casts added
   */
  public int loadDirectory(Path directory, boolean searchSubdirectories) {
    List<Path> files;
    try {
      files = reader.findCastFiles(directory, searchSubdirectories);
    } catch (IOException ex) {
      LOGGER.warn("Unable to list cast files in {}", directory, ex);
      return 0;
    }
    int added = 0;
    for (Path file : files) {
      try {
        added += add(reader.read(file));
        filesLoaded.increment();
      } catch (CastFormatException ex) {
        filesRejected.increment();
        LOGGER.warn("Skipping cast file {}: {}", file, ex.getMessage());
      }
    }
    return added;
  }

  /**
   * Adds the casts of a file, skipping casts already present with the same name.
   *
   * @return number of casts added
   */
  public synchronized int add(CastFile file) {
    int added = 0;
    for (SoundVelocityCast cast : file.casts()) {
      if (addIfAbsent(cast)) {
        added++;
      } else {
        LOGGER.debug("Cast {} from {} already loaded", cast.name(), file.name());
      }
    }
    return added;
  }

  /**
   * Decodes and adds a cast stored inline.
   *
   * @param key {@code profile_<time>}
   * @param profileJson list of depth/sound-speed pairs
   * @param attributesJson location and source, or null
   * @return true when added, false when a cast with that name was already present
   * @throws CastFormatException when the key or either document is malformed
   */
  public synchronized boolean addInline(String key, String profileJson, String attributesJson) {
    SoundVelocityCast cast = codec.decode(key, profileJson, attributesJson);
    boolean added = addIfAbsent(cast);
    if (!added) {
      LOGGER.debug("Inline cast {} already loaded", key);
    }
    return added;
  }

  private boolean addIfAbsent(SoundVelocityCast cast) {
    if (casts.stream().anyMatch(c -> c.name().equals(cast.name()))) {
      return false;
    }
    casts.add(cast);
    casts.sort(Comparator.comparingDouble(SoundVelocityCast::time));
    return true;
  }

  /** Casts in time order. */
  public List<SoundVelocityCast> casts() {
    return List.copyOf(casts);
  }

  public int size() {
    return casts.size();
  }

  public Optional<SoundVelocityCast> nearestInTime(double time) {
    List<SoundVelocityCast> snapshot = casts();
    if (snapshot.isEmpty()) {
      return Optional.empty();
    }
    return Optional.of(CastSelector.nearestInTime(snapshot, time));
  }
}
