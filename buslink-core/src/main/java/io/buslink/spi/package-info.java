/**
 * Service provider interfaces that integrations implement, currently the
 * {@link io.buslink.spi.MetricsExporter}.
 */
package io.buslink.spi;
