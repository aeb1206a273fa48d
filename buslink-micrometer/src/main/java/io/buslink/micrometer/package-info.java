/**
 * Micrometer bridge for bus client metrics.
 *
 * @see io.buslink.micrometer.MicrometerMetricsExporter
 */
package io.buslink.micrometer;
