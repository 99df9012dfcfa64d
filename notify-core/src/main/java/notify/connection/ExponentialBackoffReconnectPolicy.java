package notify.connection;

/**
 * Deterministic exponential backoff: {@code min(baseDelay * 2^attempt, maxDelay)}.
 *
 * <p>With the defaults (1s base, 30s cap) the first five attempts wait 1, 2, 4, 8 and
 * 16 seconds. No jitter is applied, so the delays never decrease.
 */
public final class ExponentialBackoffReconnectPolicy implements ReconnectPolicy {
  private final long baseDelayMs;
  private final long maxDelayMs;

  /**
   * @param baseDelayMs delay before the first reconnect (milliseconds)
   * @param maxDelayMs  upper bound for any delay (milliseconds)
   */
  public ExponentialBackoffReconnectPolicy(long baseDelayMs, long maxDelayMs) {
    if (baseDelayMs <= 0) {
      throw new IllegalArgumentException("baseDelayMs must be > 0, got: " + baseDelayMs);
    }
    if (maxDelayMs < baseDelayMs) {
      throw new IllegalArgumentException("maxDelayMs must be >= baseDelayMs, got: " + maxDelayMs);
    }
    this.baseDelayMs = baseDelayMs;
    this.maxDelayMs = maxDelayMs;
  }

  @Override
  public long computeDelayMs(int attempt) {
    if (attempt < 0) {
      throw new IllegalArgumentException("attempt must be >= 0, got: " + attempt);
    }
    if (attempt >= 62) {
      return maxDelayMs;
    }
    long factor = 1L << attempt;
    // base * factor would overflow or exceed the cap
    if (factor > maxDelayMs / baseDelayMs) {
      return maxDelayMs;
    }
    return Math.min(maxDelayMs, baseDelayMs * factor);
  }

  public long baseDelayMs() {
    return baseDelayMs;
  }

  public long maxDelayMs() {
    return maxDelayMs;
  }
}
