package notify;

import java.util.Locale;

/**
 * Urgency of a notification.
 *
 * <p>{@link #HIGH} bypasses batching and quiet hours and keeps its popup open until the
 * user interacts with it. {@link #LOW} is never accompanied by a sound.
 */
public enum Priority {
  LOW,
  NORMAL,
  HIGH;

  /**
   * Parses a stored priority value case-insensitively. {@code null}, blank and unknown
   * values map to {@link #NORMAL}.
   *
   * @param value the stored value, e.g. {@code "high"}
   * @return the matching priority
   */
  public static Priority parse(String value) {
    if (value == null || value.isBlank()) {
      return NORMAL;
    }
    switch (value.trim().toLowerCase(Locale.ROOT)) {
      case "low":
        return LOW;
      case "high":
      case "urgent":
        return HIGH;
      default:
        return NORMAL;
    }
  }

  /**
   * Returns the lower-case wire value, e.g. {@code "normal"}.
   *
   * @return the wire value
   */
  public String wireValue() {
    return name().toLowerCase(Locale.ROOT);
  }

  /**
   * Returns the more urgent of two priorities.
   *
   * @param a first priority
   * @param b second priority
   * @return {@code a} or {@code b}, whichever ranks higher
   */
  public static Priority max(Priority a, Priority b) {
    return a.compareTo(b) >= 0 ? a : b;
  }
}
