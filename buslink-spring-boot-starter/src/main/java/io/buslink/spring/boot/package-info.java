/**
 * Spring Boot auto-configuration for the bus client.
 *
 * <p>Provide an {@link io.buslink.transport.EventTransport} bean and one
 * {@link io.buslink.api.Api} bean per locally served API; a
 * {@link io.buslink.BusClient} is created, opened and closed with the context, and
 * {@link io.buslink.spring.boot.BusListener @BusListener} beans start listening once
 * all singletons exist.
 */
package io.buslink.spring.boot;
