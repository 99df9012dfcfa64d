/**
 * JDBC implementations of the notification and preference stores.
 *
 * <p>{@link notify.jdbc.JdbcNotificationStore} and {@link notify.jdbc.JdbcPreferencesStore}
 * obtain connections from a {@link notify.jdbc.ConnectionProvider}, usually one built with
 * {@link notify.jdbc.ConnectionProvider#of(javax.sql.DataSource)}. SQL errors surface as
 * {@link notify.jdbc.NotifyStoreException}. A reference schema ships as the classpath
 * resource {@code notify/jdbc/schema.sql}.
 */
package notify.jdbc;
