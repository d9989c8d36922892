/**
 * Micrometer bridge for exporting revision metrics to Prometheus, Grafana, and other backends.
 *
 * <p>{@link revision.micrometer.MicrometerRevisionMetrics} implements the
 * {@link revision.spi.RevisionMetrics} SPI using Micrometer counters and a distribution summary.
 *
 * @see revision.micrometer.MicrometerRevisionMetrics
 */
package revision.micrometer;
