/**
 * Named change-stream channels with automatic reconnection.
 *
 * @see notify.connection.ConnectionManager
 * @see notify.connection.ExponentialBackoffReconnectPolicy
 */
package notify.connection;
