package com.swathtrace.processor.cast;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Parses degree-minute-second strings into decimal degrees.
 *
 * <p>Accepted forms: {@code "80:38:06.57 W"}, {@code "80:38:06.57W"}, {@code "-80:38:06.57"},
 * {@code "-80:38:06"}. Any run of characters other than letters, digits and {@code -} separates
 * the parts. A leading minus wins over a hemisphere letter.
 */
public final class DmsParser {
  private static final Pattern SEPARATOR = Pattern.compile("[^\\w-]+");
  private static final Map<Character, Integer> HEMISPHERES = Map.of('N', 1, 'E', 1, 'S', -1, 'W', -1);

  private DmsParser() {}

  /**
   * @param dms degree-minute-second text
   * @return decimal degrees, negative for south and west
   * @throws IllegalArgumentException when the text has no degree, minute and second parts
   */
  public static double parse(String dms) {
    if (dms == null || dms.isBlank()) {
      throw new IllegalArgumentException("empty DMS value");
    }
    List<String> parts = new ArrayList<>(Arrays.asList(SEPARATOR.split(dms.strip())));
    parts.removeIf(String::isEmpty);
    if (parts.isEmpty()) {
      throw new IllegalArgumentException("unrecognized DMS value: " + dms);
    }

    int hemisphere = 1;
    String last = parts.get(parts.size() - 1);
    if (last.length() == 1 && HEMISPHERES.containsKey(last.charAt(0))) {
      hemisphere = HEMISPHERES.get(last.charAt(0));
      parts.remove(parts.size() - 1);
    } else if (HEMISPHERES.containsKey(last.charAt(last.length() - 1))) {
      hemisphere = HEMISPHERES.get(last.charAt(last.length() - 1));
      parts.set(parts.size() - 1, last.substring(0, last.length() - 1));
    }

    double seconds;
    if (parts.size() == 4) {
      String fraction = parts.get(3);
      seconds = parseInt(parts.get(2), dms) + parseInt(fraction, dms) / Math.pow(10, fraction.length());
    } else if (parts.size() == 3) {
      seconds = parseInt(parts.get(2), dms);
    } else {
      throw new IllegalArgumentException("unrecognized DMS value: " + dms);
    }

    String degreeText = parts.get(0);
    boolean negative = degreeText.startsWith("-");
    double degrees = Math.abs(parseInt(degreeText, dms));
    double minutes = parseInt(parts.get(1), dms);
    double decimal = degrees + minutes / 60.0 + seconds / 3600.0;
    if (negative) {
      return -decimal;
    }
    return hemisphere * decimal;
  }

  private static int parseInt(String part, String dms) {
    try {
      return Integer.parseInt(part);
    } catch (NumberFormatException ex) {
      throw new IllegalArgumentException("unrecognized DMS value: " + dms, ex);
    }
  }
}
