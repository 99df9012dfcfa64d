package notify.spi;

import notify.model.NewNotification;
import notify.model.NotificationRecord;

import java.time.Instant;
import java.util.List;

/**
 * Persistence for notification rows.
 *
 * <p>Rows inserted here are what the change stream later pushes back to subscribed
 * sessions.
 */
public interface NotificationStore {

  /**
   * Inserts one notification.
   *
   * @param notification the notification to insert
   * @return the stored row
   */
  NotificationRecord create(NewNotification notification);

  /**
   * Inserts several notifications in one transaction.
   *
   * @param notifications the notifications to insert
   * @return the stored rows, in input order
   */
  List<NotificationRecord> createAll(List<NewNotification> notifications);

  /**
   * @param id the notification id
   * @return the row, or {@code null} if it does not exist
   */
  NotificationRecord findById(String id);

  /**
   * Lists a user's unread notifications, newest first.
   *
   * @param userId the user
   * @param limit  maximum rows to return
   * @return unread rows
   */
  List<NotificationRecord> findUnread(String userId, int limit);

  /**
   * Marks the given notifications read.
   *
   * @param ids    notification ids
   * @param readAt the read timestamp to record
   * @return number of rows that changed
   */
  int markRead(List<String> ids, Instant readAt);

  /**
   * Marks every unread notification of a user read.
   *
   * @param userId the user
   * @param readAt the read timestamp to record
   * @return number of rows that changed
   */
  int markAllRead(String userId, Instant readAt);

  /**
   * @param userId the user
   * @return number of unread notifications
   */
  int countUnread(String userId);

  /**
   * Deletes a user's notifications whose expiry is before {@code now}.
   *
   * @param userId the user
   * @param now    the reference time
   * @return number of rows deleted
   */
  int purgeExpired(String userId, Instant now);
}
