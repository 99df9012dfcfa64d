package notify.spi;

import notify.connection.ChangeEvent;

/**
 * Callbacks a {@link ChangeStreamTransport} uses to report on one channel.
 */
public interface TransportCallbacks {

  /**
   * Reports a subscription status change.
   *
   * @param status the new status
   */
  void onStatus(TransportStatus status);

  /**
   * Reports a status change caused by a failure, keeping the cause for diagnostics.
   *
   * @param status the new status, usually {@link TransportStatus#CHANNEL_ERROR}
   * @param cause  the underlying failure
   */
  default void onStatus(TransportStatus status, Throwable cause) {
    onStatus(status);
  }

  /**
   * Delivers one row change.
   *
   * @param event the change
   */
  void onEvent(ChangeEvent event);
}
