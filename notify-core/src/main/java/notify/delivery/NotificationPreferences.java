package notify.delivery;

import java.time.ZoneId;
import java.util.Collections;
import java.util.EnumSet;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;

/**
 * A user's delivery preferences.
 *
 * @param channelsEnabled channels the user wants; a disabled {@link DeliveryChannel#SYSTEM}
 *                        means no popups and a disabled {@link DeliveryChannel#SOUND} means
 *                        no sounds
 * @param mutedCategories categories that never produce a popup or sound
 * @param quietHours      the quiet-hours window
 * @param zone            zone the quiet-hours window is expressed in, or {@code null} for
 *                        the dispatcher's clock zone
 */
public record NotificationPreferences(
    Set<DeliveryChannel> channelsEnabled,
    Set<String> mutedCategories,
    QuietHours quietHours,
    ZoneId zone
) {

  private static final NotificationPreferences DEFAULTS = new NotificationPreferences(
      EnumSet.allOf(DeliveryChannel.class), Set.of(), QuietHours.DISABLED, null);

  public NotificationPreferences {
    channelsEnabled = channelsEnabled == null || channelsEnabled.isEmpty()
        ? Collections.unmodifiableSet(EnumSet.noneOf(DeliveryChannel.class))
        : Collections.unmodifiableSet(EnumSet.copyOf(channelsEnabled));
    mutedCategories = mutedCategories == null
        ? Set.of()
        : Collections.unmodifiableSet(new LinkedHashSet<>(mutedCategories));
    quietHours = Objects.requireNonNullElse(quietHours, QuietHours.DISABLED);
  }

  /**
   * Preferences used for users without stored preferences and whenever the preference
   * store is unavailable: every channel on, nothing muted, quiet hours off.
   *
   * @return the defaults
   */
  public static NotificationPreferences defaults() {
    return DEFAULTS;
  }

  public boolean isEnabled(DeliveryChannel channel) {
    return channelsEnabled.contains(channel);
  }

  public boolean isMuted(String category) {
    return mutedCategories.contains(category);
  }

  /**
   * Returns a copy with the non-null fields of {@code update} applied.
   *
   * @param update the partial update
   * @return the updated preferences
   */
  public NotificationPreferences apply(PreferencesUpdate update) {
    Objects.requireNonNull(update, "update");
    return new NotificationPreferences(
        update.channelsEnabled() != null ? update.channelsEnabled() : channelsEnabled,
        update.mutedCategories() != null ? update.mutedCategories() : mutedCategories,
        update.quietHours() != null ? update.quietHours() : quietHours,
        update.zone() != null ? update.zone() : zone);
  }
}
