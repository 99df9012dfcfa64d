package notify.delivery;

import notify.NotifyException;

/**
 * The preference store failed for a user. Logged by the dispatcher, which then delivers
 * with {@link NotificationPreferences#defaults()}.
 */
public class PreferencesUnavailableException extends NotifyException {

  public PreferencesUnavailableException(String userId, Throwable cause) {
    super("Preferences unavailable for user " + userId + "; using defaults", cause);
  }
}
