package notify.spring.boot;

import io.micrometer.core.instrument.MeterRegistry;
import notify.micrometer.MicrometerMetricsExporter;
import notify.spi.MetricsExporter;

import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

/**
 * Auto-configuration for Micrometer metrics integration.
 *
 * <p>Creates a {@link MicrometerMetricsExporter} when Micrometer is on the classpath
 * and {@code notify.metrics.enabled} is true (default).
 *
 * <p>Runs before {@link NotifyAutoConfiguration} so the {@link MetricsExporter}
 * bean is shared by every session the {@link NotificationSessionFactory} opens.
 */
@AutoConfiguration(before = NotifyAutoConfiguration.class)
@ConditionalOnClass({MicrometerMetricsExporter.class, MeterRegistry.class})
@ConditionalOnProperty(prefix = "notify.metrics", name = "enabled", matchIfMissing = true)
@EnableConfigurationProperties(NotifyProperties.class)
public class NotifyMicrometerAutoConfiguration {

  @Bean(destroyMethod = "close")
  @ConditionalOnMissingBean(MetricsExporter.class)
  public MicrometerMetricsExporter micrometerMetricsExporter(
      MeterRegistry meterRegistry, NotifyProperties props) {
    return new MicrometerMetricsExporter(meterRegistry, props.getMetrics().getNamePrefix());
  }
}
