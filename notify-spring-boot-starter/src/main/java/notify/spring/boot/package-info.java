/**
 * Spring Boot auto-configuration for realtime notifications.
 *
 * <p>{@link notify.spring.boot.NotifyAutoConfiguration} exposes a
 * {@link notify.spring.boot.NotificationSessionFactory} once the application provides a
 * change-stream transport and a notification sink. JDBC stores are registered when a
 * {@link javax.sql.DataSource} is present.
 *
 * @see notify.spring.boot.NotifyProperties
 * @see notify.spring.boot.NotifyMicrometerAutoConfiguration
 */
package notify.spring.boot;
