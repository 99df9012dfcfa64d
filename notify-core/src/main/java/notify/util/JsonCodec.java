package notify.util;

import java.util.Map;

/**
 * Codec for flat {@code Map<String, String>} documents, used for notification metadata
 * columns and stored preference blobs.
 *
 * <p>{@link DefaultJsonCodec} handles flat string-to-string objects without any
 * dependency. Applications that already ship Jackson or Gson can implement this
 * interface and hand it to the stores instead.
 *
 * @see #getDefault()
 */
public interface JsonCodec {

  /**
   * Returns the shared default implementation.
   *
   * @return the default {@link JsonCodec}
   */
  static JsonCodec getDefault() {
    return DefaultJsonCodec.INSTANCE;
  }

  /**
   * Encodes a string map as a JSON object. Returns {@code null} for a null or empty map.
   *
   * @param values the values to encode
   * @return JSON string, or {@code null}
   */
  String toJson(Map<String, String> values);

  /**
   * Parses a JSON object into a string map. Returns an empty map for {@code null},
   * blank or {@code "null"} input. Members whose value is JSON {@code null} are skipped.
   *
   * @param json the JSON string to parse
   * @return parsed map, never {@code null}
   * @throws IllegalArgumentException if the input is not a flat JSON object of strings
   */
  Map<String, String> parseObject(String json);
}
