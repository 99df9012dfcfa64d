package notify.spi;

import notify.delivery.NotificationPreferences;
import notify.delivery.PreferencesUpdate;

/**
 * Per-user storage for delivery preferences.
 *
 * <p>Implementations may block on I/O; the dispatcher only calls them from its worker
 * threads.
 */
public interface PreferencesStore {

  /**
   * Loads stored preferences.
   *
   * @param userId the user
   * @return stored preferences, or {@code null} if the user has none
   */
  NotificationPreferences get(String userId);

  /**
   * Applies a partial update on top of the stored preferences (or the defaults when
   * none are stored) and persists the result.
   *
   * @param userId the user
   * @param update the fields to change
   * @return the preferences now stored
   */
  NotificationPreferences update(String userId, PreferencesUpdate update);
}
