package notify.delivery;

import java.time.LocalTime;
import java.time.temporal.ChronoUnit;
import java.util.Objects;

/**
 * A daily time-of-day window during which only high-priority notifications produce a
 * popup or sound.
 *
 * <p>Evaluated at minute precision with both ends included. When {@code start} is after
 * {@code end} the window wraps midnight: 22:00-08:00 covers 23:00 and 07:30 but not 12:00.
 *
 * @param enabled whether the window applies at all
 * @param start   first minute of the window
 * @param end     last minute of the window
 */
public record QuietHours(boolean enabled, LocalTime start, LocalTime end) {

  /** Disabled window with the default bounds 22:00-08:00. */
  public static final QuietHours DISABLED =
      new QuietHours(false, LocalTime.of(22, 0), LocalTime.of(8, 0));

  public QuietHours {
    Objects.requireNonNull(start, "start");
    Objects.requireNonNull(end, "end");
    start = start.truncatedTo(ChronoUnit.MINUTES);
    end = end.truncatedTo(ChronoUnit.MINUTES);
  }

  /**
   * Creates an enabled window from {@code HH:mm} strings.
   *
   * @param start e.g. {@code "22:00"}
   * @param end   e.g. {@code "08:00"}
   * @return the window
   * @throws java.time.format.DateTimeParseException if either value is malformed
   */
  public static QuietHours of(String start, String end) {
    return new QuietHours(true, LocalTime.parse(start), LocalTime.parse(end));
  }

  /**
   * Returns {@code true} if the window is enabled and {@code time} falls inside it.
   *
   * @param time the local time of day to test
   * @return whether quiet hours are in effect
   */
  public boolean contains(LocalTime time) {
    if (!enabled) {
      return false;
    }
    int now = minuteOfDay(time);
    int from = minuteOfDay(start);
    int to = minuteOfDay(end);
    if (from <= to) {
      return now >= from && now <= to;
    }
    return now >= from || now <= to;
  }

  public QuietHours withEnabled(boolean enabled) {
    return new QuietHours(enabled, start, end);
  }

  private static int minuteOfDay(LocalTime time) {
    return time.getHour() * 60 + time.getMinute();
  }
}
