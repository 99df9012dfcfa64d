package notify.spring.boot;

import notify.NotificationSession;
import notify.batch.BatchFormatter;
import notify.delivery.SoundCatalog;
import notify.jdbc.ConnectionProvider;
import notify.jdbc.JdbcNotificationStore;
import notify.jdbc.JdbcPreferencesStore;
import notify.jdbc.TableNames;
import notify.spi.ChangeStreamTransport;
import notify.spi.MetricsExporter;
import notify.spi.NotificationSink;
import notify.spi.NotificationStore;
import notify.spi.PreferencesStore;
import notify.util.JsonCodec;

import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.autoconfigure.jdbc.DataSourceAutoConfiguration;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import javax.sql.DataSource;
import java.time.Clock;

/**
 * Auto-configuration for realtime notification sessions.
 *
 * <p>With a {@link DataSource} present, JDBC-backed {@link NotificationStore} and
 * {@link PreferencesStore} beans are created unless {@code notify.jdbc.enabled=false}.
 * Once the application supplies a {@link ChangeStreamTransport} and a
 * {@link NotificationSink}, a {@link NotificationSessionFactory} opens sessions wired to
 * all of them.
 *
 * @see NotifyProperties
 * @see NotifyMicrometerAutoConfiguration
 */
@AutoConfiguration(after = DataSourceAutoConfiguration.class)
@ConditionalOnClass(NotificationSession.class)
@EnableConfigurationProperties(NotifyProperties.class)
public class NotifyAutoConfiguration {

  @Bean
  @ConditionalOnMissingBean
  public SoundCatalog soundCatalog(NotifyProperties props) {
    NotifyProperties.Delivery delivery = props.getDelivery();
    if (delivery.getSounds().isEmpty()
        && SoundCatalog.DEFAULT_SOUND.equals(delivery.getFallbackSound())) {
      return SoundCatalog.defaults();
    }
    SoundCatalog.Builder builder = SoundCatalog.builder().fallback(delivery.getFallbackSound());
    delivery.getSounds().forEach(builder::sound);
    return builder.build();
  }

  @Bean
  @ConditionalOnMissingBean
  public BatchFormatter batchFormatter(NotifyProperties props) {
    return new BatchFormatter(props.getDelivery().getCategoryLabels());
  }

  @Bean(destroyMethod = "close")
  @ConditionalOnMissingBean
  @ConditionalOnBean({ChangeStreamTransport.class, NotificationSink.class})
  public NotificationSessionFactory notificationSessionFactory(NotifyProperties props,
      ChangeStreamTransport transport,
      NotificationSink sink,
      ObjectProvider<PreferencesStore> preferencesStoreProvider,
      ObjectProvider<NotificationStore> notificationStoreProvider,
      ObjectProvider<MetricsExporter> metricsProvider,
      SoundCatalog soundCatalog,
      BatchFormatter batchFormatter) {
    return new NotificationSessionFactory(transport, sink,
        preferencesStoreProvider.getIfAvailable(),
        notificationStoreProvider.getIfAvailable(),
        metricsProvider.getIfAvailable(),
        soundCatalog, batchFormatter, props);
  }

  @Configuration(proxyBeanMethods = false)
  @ConditionalOnBean(DataSource.class)
  @ConditionalOnProperty(prefix = "notify.jdbc", name = "enabled", matchIfMissing = true)
  static class JdbcStoreConfiguration {

    @Bean
    @ConditionalOnMissingBean(ConnectionProvider.class)
    public ConnectionProvider notifyConnectionProvider(DataSource dataSource) {
      return ConnectionProvider.of(dataSource);
    }

    @Bean
    @ConditionalOnMissingBean
    public TableNames notifyTableNames(NotifyProperties props) {
      return new TableNames(props.getJdbc().getNotificationsTable(),
          props.getJdbc().getSettingsTable());
    }

    @Bean
    @ConditionalOnMissingBean(NotificationStore.class)
    public JdbcNotificationStore notificationStore(ConnectionProvider connectionProvider,
        TableNames tableNames) {
      return new JdbcNotificationStore(connectionProvider,
          tableNames.notifications(), JsonCodec.getDefault());
    }

    @Bean
    @ConditionalOnMissingBean(PreferencesStore.class)
    public JdbcPreferencesStore preferencesStore(ConnectionProvider connectionProvider,
        TableNames tableNames) {
      return new JdbcPreferencesStore(connectionProvider,
          tableNames.settings(), JsonCodec.getDefault(), Clock.systemUTC());
    }
  }
}
