/**
 * Micrometer bridge for {@link io.txevents.spi.MetricsExporter}.
 */
package io.txevents.micrometer;
