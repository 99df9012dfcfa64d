package notify.connection;

/**
 * Observer of {@link ConnectionManager} lifecycle changes.
 *
 * <p>Callbacks run on the manager's scheduler thread, never while the manager's lock is
 * held, so implementations may call back into the manager.
 */
public interface ConnectionListener {

  /**
   * Called after every state transition.
   *
   * @param previous the state before the transition
   * @param current  the new state
   */
  default void onStateChange(ConnectionState previous, ConnectionState current) {
  }

  /**
   * Called once when the reconnect budget is exhausted and the manager stops retrying.
   *
   * @param error the terminal error, also available from {@link ConnectionManager#connectionError()}
   */
  default void onConnectionLost(MaxReconnectAttemptsExceededException error) {
  }
}
