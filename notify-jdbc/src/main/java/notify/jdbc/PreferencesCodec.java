package notify.jdbc;

import notify.delivery.DeliveryChannel;
import notify.delivery.NotificationPreferences;
import notify.delivery.QuietHours;
import notify.util.JsonCodec;

import java.time.DateTimeException;
import java.time.LocalTime;
import java.time.ZoneId;
import java.time.format.DateTimeParseException;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.logging.Logger;

/**
 * Converts {@link NotificationPreferences} to and from the flat JSON document stored in
 * the settings column.
 *
 * <p>Keys: {@code channels} and {@code muted} (comma separated), {@code quietHours.enabled},
 * {@code quietHours.start}, {@code quietHours.end} ({@code HH:mm}) and {@code zone}. Missing
 * keys decode to the default value; unknown channel names and unparseable values are
 * skipped with a warning.
 */
public final class PreferencesCodec {
  private static final Logger logger = Logger.getLogger(PreferencesCodec.class.getName());

  static final String CHANNELS = "channels";
  static final String MUTED = "muted";
  static final String QUIET_ENABLED = "quietHours.enabled";
  static final String QUIET_START = "quietHours.start";
  static final String QUIET_END = "quietHours.end";
  static final String ZONE = "zone";

  private final JsonCodec jsonCodec;

  public PreferencesCodec(JsonCodec jsonCodec) {
    this.jsonCodec = Objects.requireNonNull(jsonCodec, "jsonCodec");
  }

  public String encode(NotificationPreferences preferences) {
    Objects.requireNonNull(preferences, "preferences");
    Map<String, String> values = new LinkedHashMap<>();
    values.put(CHANNELS, join(preferences.channelsEnabled().stream().map(Enum::name).toList()));
    values.put(MUTED, join(preferences.mutedCategories()));
    QuietHours quietHours = preferences.quietHours();
    values.put(QUIET_ENABLED, Boolean.toString(quietHours.enabled()));
    values.put(QUIET_START, quietHours.start().toString());
    values.put(QUIET_END, quietHours.end().toString());
    if (preferences.zone() != null) {
      values.put(ZONE, preferences.zone().getId());
    }
    return jsonCodec.toJson(values);
  }

  /**
   * @param json the stored document
   * @return the decoded preferences, or {@code null} for a null or empty document
   * @throws IllegalArgumentException if the document is not valid JSON
   */
  public NotificationPreferences decode(String json) {
    Map<String, String> values = jsonCodec.parseObject(json);
    if (values.isEmpty()) {
      return null;
    }
    NotificationPreferences defaults = NotificationPreferences.defaults();
    Set<DeliveryChannel> channels = values.containsKey(CHANNELS)
        ? parseChannels(values.get(CHANNELS))
        : defaults.channelsEnabled();
    Set<String> muted = values.containsKey(MUTED) ? split(values.get(MUTED)) : Set.of();
    return new NotificationPreferences(channels, muted, parseQuietHours(values), parseZone(values.get(ZONE)));
  }

  private static Set<DeliveryChannel> parseChannels(String value) {
    Set<DeliveryChannel> channels = EnumSet.noneOf(DeliveryChannel.class);
    for (String name : split(value)) {
      try {
        channels.add(DeliveryChannel.valueOf(name.toUpperCase(Locale.ROOT)));
      } catch (IllegalArgumentException e) {
        logger.warning("Ignoring unknown delivery channel '" + name + "'");
      }
    }
    return channels;
  }

  private static QuietHours parseQuietHours(Map<String, String> values) {
    QuietHours fallback = QuietHours.DISABLED;
    try {
      LocalTime start = values.containsKey(QUIET_START) ? LocalTime.parse(values.get(QUIET_START)) : fallback.start();
      LocalTime end = values.containsKey(QUIET_END) ? LocalTime.parse(values.get(QUIET_END)) : fallback.end();
      return new QuietHours(Boolean.parseBoolean(values.get(QUIET_ENABLED)), start, end);
    } catch (DateTimeParseException e) {
      logger.warning("Ignoring unparseable quiet hours: " + e.getParsedString());
      return fallback;
    }
  }

  private static ZoneId parseZone(String value) {
    if (value == null || value.isBlank()) {
      return null;
    }
    try {
      return ZoneId.of(value);
    } catch (DateTimeException e) {
      logger.warning("Ignoring unknown time zone '" + value + "'");
      return null;
    }
  }

  private static String join(Iterable<String> values) {
    return String.join(",", values);
  }

  private static Set<String> split(String value) {
    Set<String> parts = new LinkedHashSet<>();
    if (value == null) {
      return parts;
    }
    for (String part : value.split(",")) {
      String trimmed = part.trim();
      if (!trimmed.isEmpty()) {
        parts.add(trimmed);
      }
    }
    return parts;
  }
}
