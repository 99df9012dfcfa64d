/**
 * Micrometer bridge for exporting notification metrics to Prometheus, Grafana, and other
 * backends.
 *
 * <p>{@link notify.micrometer.MicrometerMetricsExporter} implements the
 * {@link notify.spi.MetricsExporter} SPI using Micrometer counters and gauges.
 *
 * @see notify.micrometer.MicrometerMetricsExporter
 */
package notify.micrometer;
