/**
 * Preference-aware delivery of popups, sounds and in-app events.
 *
 * <p>The {@link notify.delivery.DeliveryPolicyDispatcher} evaluates, in order, the mute
 * list, quiet hours (overridden by high priority) and the enabled channels of the
 * recipient's {@link notify.delivery.NotificationPreferences}.
 */
package notify.delivery;
