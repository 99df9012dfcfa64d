/**
 * Service Provider Interfaces for plugging the notification runtime into its environment.
 *
 * <p>Integrators implement these to supply the realtime transport, notification and
 * preference persistence, the delivery surfaces and metrics.
 *
 * @see notify.spi.ChangeStreamTransport
 * @see notify.spi.NotificationStore
 * @see notify.spi.PreferencesStore
 * @see notify.spi.NotificationSink
 * @see notify.spi.MetricsExporter
 */
package notify.spi;
