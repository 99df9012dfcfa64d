package notify.spi;

/**
 * Per-channel status reported by a {@link ChangeStreamTransport}.
 */
public enum TransportStatus {
  /** The server acknowledged the subscription. */
  SUBSCRIBED,
  /** The channel failed. */
  CHANNEL_ERROR,
  /** The subscription was not acknowledged in time. */
  TIMED_OUT,
  /** The server or network closed the channel. */
  CLOSED
}
