/**
 * Root API of the realtime notification runtime.
 *
 * <h2>Core Design</h2>
 * <p>A {@link notify.NotificationSession} keeps the signed-in user's change-stream
 * channels subscribed through a {@linkplain notify.connection.ConnectionManager connection
 * manager} that reconnects with exponential backoff and re-subscribes every channel.
 * Inserted notification rows become {@link notify.RawEvent}s and are coalesced per
 * recipient and category by the {@linkplain notify.batch.BatchQueue batch queue}; urgent
 * events skip the batch window. The resulting {@link notify.Deliverable}s pass through the
 * {@linkplain notify.delivery.DeliveryPolicyDispatcher dispatcher}, which applies mute
 * lists, quiet hours and channel switches before showing a popup, playing a sound and
 * publishing the in-app event.
 *
 * <h2>Module Layout</h2>
 * <ul>
 *   <li><b>notify-core</b> - runtime and SPIs</li>
 *   <li><b>notify-jdbc</b> - JDBC notification and preference stores</li>
 *   <li><b>notify-micrometer</b> - Micrometer metrics exporter</li>
 *   <li><b>notify-spring-boot-starter</b> - Spring Boot auto-configuration</li>
 * </ul>
 *
 * <h2>Quick Start</h2>
 * <pre>{@code
 * var dataSource = ...;
 * var connections = ConnectionProvider.of(dataSource);
 *
 * try (NotificationSession session = NotificationSession.builder()
 *     .transport(transport)
 *     .notificationStore(new JdbcNotificationStore(connections))
 *     .preferencesStore(new JdbcPreferencesStore(connections))
 *     .sink(sink)
 *     .build()) {
 *
 *   session.subscribeToNotifications(userId);
 *   session.send(NewNotification.builder()
 *       .userId(userId)
 *       .category("message")
 *       .title("New message")
 *       .content("Dana replied to your listing")
 *       .build());
 * }
 * }</pre>
 *
 * @see notify.NotificationSession
 * @see notify.RawEvent
 * @see notify.Deliverable
 */
package notify;
