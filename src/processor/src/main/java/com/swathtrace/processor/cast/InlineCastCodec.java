package com.swathtrace.processor.cast;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * JSON form of a cast stored alongside converted sonar data.
 *
 * <p>The profile is kept under {@code profile_<epoch seconds>} as a list of {@code [depth, sound
 * speed]} pairs; location and source file go under {@code attributes_<epoch seconds>} as
 * {@code {"location": [lat, lon], "source": "..."}}. Pair values may be numbers or numeric strings.
 */
public class InlineCastCodec {
  public static final String PROFILE_PREFIX = "profile_";
  public static final String ATTRIBUTES_PREFIX = "attributes_";

  private final ObjectMapper objectMapper;

  public InlineCastCodec(ObjectMapper objectMapper) {
    this.objectMapper = objectMapper;
  }

  public String profileKey(SoundVelocityCast cast) {
    return PROFILE_PREFIX + (long) cast.time();
  }

  public String attributesKey(SoundVelocityCast cast) {
    return ATTRIBUTES_PREFIX + (long) cast.time();
  }

  public String encodeProfile(SoundVelocityCast cast) {
    ArrayNode pairs = objectMapper.createArrayNode();
    for (int i = 0; i < cast.layerCount(); i++) {
      pairs.addArray().add(cast.depth(i)).add(cast.soundSpeed(i));
    }
    return write(pairs);
  }

  public String encodeAttributes(SoundVelocityCast cast) {
    ObjectNode attributes = objectMapper.createObjectNode();
    if (cast.hasLocation()) {
      attributes.putArray("location").add(cast.latitude()).add(cast.longitude());
    } else {
      attributes.putNull("location");
    }
    attributes.put("source", cast.source());
    return write(attributes);
  }

  public SoundVelocityCast decode(String key, String profileJson) {
    return decode(key, profileJson, null);
  }

  /**
   * Rebuilds a cast from its stored form.
   *
   * @param key {@code profile_<epoch seconds>}
   * @param profileJson list of depth/sound-speed pairs
   * @param attributesJson location and source, or null when none were stored
   * @throws CastFormatException when the key or either document is malformed
   */
  public SoundVelocityCast decode(String key, String profileJson, String attributesJson) {
    double time = timeFromKey(key);
    RawLayers layers = new RawLayers();
    JsonNode root = read(key, profileJson);
    if (!root.isArray() || root.isEmpty()) {
      throw new CastFormatException("Profile " + key + " must be a non-empty list of [depth, soundspeed] pairs");
    }
    for (JsonNode pair : root) {
      if (!pair.isArray() || pair.size() != 2) {
        throw new CastFormatException("Profile " + key + " has a malformed layer: " + pair);
      }
      layers.add(number(key, pair.get(0)), number(key, pair.get(1)));
    }

    Double latitude = null;
    Double longitude = null;
    String source = null;
    if (attributesJson != null) {
      JsonNode attributes = read(key, attributesJson);
      JsonNode location = attributes.path("location");
      if (location.isArray() && location.size() == 2) {
        latitude = number(key, location.get(0));
        longitude = number(key, location.get(1));
      }
      JsonNode sourceNode = attributes.path("source");
      source = sourceNode.isTextual() ? sourceNode.asText() : null;
    }
    return new SoundVelocityCast(key, time, latitude, longitude, source, layers.depths(), layers.soundSpeeds());
  }

  private static double timeFromKey(String key) {
    if (key == null || !key.startsWith(PROFILE_PREFIX)) {
      throw new CastFormatException("Inline cast key must look like profile_<time>, got " + key);
    }
    try {
      return Double.parseDouble(key.substring(PROFILE_PREFIX.length()));
    } catch (NumberFormatException ex) {
      throw new CastFormatException("Inline cast key must look like profile_<time>, got " + key, ex);
    }
  }

  private static double number(String key, JsonNode node) {
    if (node.isNumber()) {
      return node.doubleValue();
    }
    if (node.isTextual()) {
      try {
        return Double.parseDouble(node.asText().strip());
      } catch (NumberFormatException ex) {
        throw new CastFormatException("Profile " + key + " has a non-numeric value: " + node, ex);
      }
    }
    throw new CastFormatException("Profile " + key + " has a non-numeric value: " + node);
  }

  private JsonNode read(String key, String json) {
    try {
      return objectMapper.readTree(json);
    } catch (JsonProcessingException ex) {
      throw new CastFormatException("Profile " + key + " is not valid JSON", ex);
    }
  }

  private String write(JsonNode node) {
    try {
      return objectMapper.writeValueAsString(node);
    } catch (JsonProcessingException ex) {
      throw new IllegalStateException("Unable to serialize cast", ex);
    }
  }
}
