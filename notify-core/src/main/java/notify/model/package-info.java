/**
 * Stored notification rows and the input type used to create them.
 *
 * @see notify.model.NotificationRecord
 * @see notify.model.NewNotification
 */
package notify.model;
