/**
 * Extension points of the bus. {@link enginebus.spi.MetricsExporter} is the only one;
 * {@code enginebus-micrometer} ships an implementation.
 */
package enginebus.spi;
