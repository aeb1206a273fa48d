/**
 * Root API of buslink: the {@link io.buslink.BusClient} composite, its
 * {@link io.buslink.BusConfig} and the {@link io.buslink.BusException} hierarchy.
 *
 * <p>Application code fires and listens for events through the client. Every operation
 * that touches a transport travels as a {@link io.buslink.command.Command} over an
 * internal queue, so application threads never block on transport I/O longer than it
 * takes to enqueue and (optionally) await completion.
 *
 * @see io.buslink.BusClient
 * @see io.buslink.client.EventClient
 * @see io.buslink.transport
 */
package io.buslink;
