/**
 * Micrometer bridge for exporting bus metrics to Prometheus, Grafana, and other backends.
 *
 * <p>{@link enginebus.micrometer.MicrometerMetricsExporter} implements the
 * {@link enginebus.spi.MetricsExporter} SPI using Micrometer counters, gauges and timers.
 *
 * @see enginebus.micrometer.MicrometerMetricsExporter
 */
package enginebus.micrometer;
