package notify;

/**
 * Mutable tuning knobs for a {@link NotificationSession}.
 *
 * <p>Defaults: five reconnect attempts starting at one second and doubling up to thirty
 * seconds, stale detection off, a one second batch window and popups that close after
 * five seconds.
 */
public final class NotifyConfig {
  private long reconnectBaseDelayMs = 1000L;
  private long reconnectMaxDelayMs = 30_000L;
  private int maxReconnectAttempts = 5;
  private long staleTimeoutMs = 0L;

  private long batchDelayMs = 1000L;
  private boolean flushOnClose = false;

  private int deliveryWorkers = 2;
  private long popupAutoCloseMs = 5000L;

  public long getReconnectBaseDelayMs() {
    return reconnectBaseDelayMs;
  }

  public NotifyConfig setReconnectBaseDelayMs(long reconnectBaseDelayMs) {
    this.reconnectBaseDelayMs = reconnectBaseDelayMs;
    return this;
  }

  public long getReconnectMaxDelayMs() {
    return reconnectMaxDelayMs;
  }

  public NotifyConfig setReconnectMaxDelayMs(long reconnectMaxDelayMs) {
    this.reconnectMaxDelayMs = reconnectMaxDelayMs;
    return this;
  }

  public int getMaxReconnectAttempts() {
    return maxReconnectAttempts;
  }

  public NotifyConfig setMaxReconnectAttempts(int maxReconnectAttempts) {
    this.maxReconnectAttempts = maxReconnectAttempts;
    return this;
  }

  public long getStaleTimeoutMs() {
    return staleTimeoutMs;
  }

  /**
   * Sets how long a subscribed connection may stay silent before it is treated as dropped.
   * {@code 0} disables stale detection.
   */
  public NotifyConfig setStaleTimeoutMs(long staleTimeoutMs) {
    this.staleTimeoutMs = staleTimeoutMs;
    return this;
  }

  public long getBatchDelayMs() {
    return batchDelayMs;
  }

  public NotifyConfig setBatchDelayMs(long batchDelayMs) {
    this.batchDelayMs = batchDelayMs;
    return this;
  }

  public boolean isFlushOnClose() {
    return flushOnClose;
  }

  public NotifyConfig setFlushOnClose(boolean flushOnClose) {
    this.flushOnClose = flushOnClose;
    return this;
  }

  public int getDeliveryWorkers() {
    return deliveryWorkers;
  }

  public NotifyConfig setDeliveryWorkers(int deliveryWorkers) {
    this.deliveryWorkers = deliveryWorkers;
    return this;
  }

  public long getPopupAutoCloseMs() {
    return popupAutoCloseMs;
  }

  public NotifyConfig setPopupAutoCloseMs(long popupAutoCloseMs) {
    this.popupAutoCloseMs = popupAutoCloseMs;
    return this;
  }
}
