package com.swathtrace.processor.cast;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.DateTimeException;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reads {@code .svp} cast files.
 *
 * <pre>
 * [SVP_VERSION_2]
 * 2016_288_021224.svp
 * Section 2016-288 02:12 37:35:23 -076:06:35
 * 0.0 1500.1
 * 2.5 1501.3
 * Section 2016-288 05:40:10 37:36:01 -076:05:58
 * ...
 * </pre>
 *
 * <p>Each section becomes one cast named {@code profile_<epoch seconds>}. Rows are sorted by depth,
 * a repeated depth keeps the row read last, and a depth-0 layer with the first row's sound speed
 * is added when the section does not start at the surface. A malformed header or row rejects the
 * whole file.
 */
public class SvpCastReader {
  private static final Logger log = LoggerFactory.getLogger(SvpCastReader.class);

  public static final String EXTENSION = ".svp";
  private static final String SECTION_PREFIX = "Section ";

  /**
   * Parses every section of the file.
   *
   * @throws CastFormatException when the file cannot be read or any part of it is malformed
   */
  public CastFile read(Path file) {
    String fileName = String.valueOf(file.getFileName());
    if (!fileName.endsWith(EXTENSION)) {
      throw new CastFormatException("Not a valid svp file: " + file);
    }
    List<String> lines;
    try {
      lines = Files.readAllLines(file, StandardCharsets.UTF_8);
    } catch (IOException ex) {
      throw new CastFormatException("Unable to read " + file, ex);
    }
    return parse(file.toString(), lines);
  }

  CastFile parse(String source, List<String> lines) {
    if (lines.size() < 3) {
      throw new CastFormatException("Error reading " + source + ": expected version, name and at least one section");
    }
    String version = lines.get(0).strip();
    String name = baseName(lines.get(1).strip());

    List<List<String>> sections = new ArrayList<>();
    List<String> current = new ArrayList<>();
    for (int i = 2; i < lines.size(); i++) {
      String line = lines.get(i);
      if (current.isEmpty() && line.isBlank()) {
        continue;
      }
      if (line.stripLeading().startsWith(SECTION_PREFIX) && !current.isEmpty()) {
        sections.add(current);
        current = new ArrayList<>();
      }
      current.add(line);
    }
    if (!current.isEmpty()) {
      sections.add(current);
    }
    if (sections.isEmpty()) {
      throw new CastFormatException("Error reading " + source + ": no cast sections found");
    }

    List<SoundVelocityCast> casts = new ArrayList<>(sections.size());
    for (List<String> section : sections) {
      casts.add(parseSection(source, name, section));
    }
    log.debug("Read {} cast(s) from {}", casts.size(), source);
    return new CastFile(version, name, casts);
  }

  /**
   * Lists the cast files under a folder.
   *
   * @param searchSubdirectories false to look at the folder itself only
   * @return sorted paths of regular files with the {@code .svp} extension
   */
  public List<Path> findCastFiles(Path directory, boolean searchSubdirectories) throws IOException {
    int depth = searchSubdirectories ? Integer.MAX_VALUE : 1;
    try (Stream<Path> paths = Files.walk(directory, depth)) {
      return paths
          .filter(Files::isRegularFile)
          .filter(p -> String.valueOf(p.getFileName()).endsWith(EXTENSION))
          .sorted()
          .collect(Collectors.toList());
    }
  }

  private SoundVelocityCast parseSection(String source, String displayName, List<String> section) {
    String header = section.get(0);
    String[] tokens = header.strip().split("\\s+");
    if (!header.stripLeading().startsWith(SECTION_PREFIX) || tokens.length < 5) {
      throw new CastFormatException(
          "Error reading " + source + ": please verify that the svp file has the correct header, got '" + header + "'");
    }

    double time;
    double latitude;
    double longitude;
    try {
      time = parseHeaderTime(tokens[1], tokens[2]);
      latitude = DmsParser.parse(tokens[3]);
      longitude = DmsParser.parse(tokens[4]);
    } catch (IllegalArgumentException | DateTimeException ex) {
      throw new CastFormatException("Error reading " + source + ": bad section header '" + header + "'", ex);
    }

    RawLayers layers = new RawLayers();
    for (int i = 1; i < section.size(); i++) {
      String row = section.get(i).strip();
      if (row.isEmpty()) {
        continue;
      }
      String[] values = row.split("\\s+");
      if (values.length != 2) {
        throw new CastFormatException(
            "Error reading " + source + ": unable to parse sound velocity profile row '" + row + "'");
      }
      double depth;
      double soundSpeed;
      try {
        depth = Double.parseDouble(values[0]);
        soundSpeed = Double.parseDouble(values[1]);
      } catch (NumberFormatException ex) {
        throw new CastFormatException(
            "Error reading " + source + ": unable to parse sound velocity profile row '" + row + "'", ex);
      }
      layers.add(depth, soundSpeed);
    }
    if (layers.isEmpty()) {
      throw new CastFormatException("Error reading " + source + ": section '" + header.strip() + "' has no data rows");
    }

    return new SoundVelocityCast(
        InlineCastCodec.PROFILE_PREFIX + (long) time, time, latitude, longitude, displayName,
        layers.depths(), layers.soundSpeeds());
  }

  static double parseHeaderTime(String julianDate, String timeOfDay) {
    String[] date = julianDate.split("-");
    String[] clock = timeOfDay.split(":");
    if (date.length != 2) {
      throw new IllegalArgumentException("Unrecognized julian date: " + julianDate);
    }
    if (clock.length != 2 && clock.length != 3) {
      throw new IllegalArgumentException("Unrecognized timestamp: " + timeOfDay);
    }
    double seconds = clock.length == 3 ? Double.parseDouble(clock[2]) : 0.0;
    return JulianTime.toEpochSeconds(
        Integer.parseInt(date[0]),
        Integer.parseInt(date[1]),
        Integer.parseInt(clock[0]),
        Integer.parseInt(clock[1]),
        seconds);
  }

  private static String baseName(String path) {
    int cut = Math.max(path.lastIndexOf('/'), path.lastIndexOf('\\'));
    return cut < 0 ? path : path.substring(cut + 1);
  }
}
