/**
 * Capability contracts that wire transports implement: {@link io.buslink.transport.RpcTransport},
 * {@link io.buslink.transport.ResultTransport}, {@link io.buslink.transport.EventTransport}
 * and {@link io.buslink.transport.SchemaTransport}.
 *
 * <p>A backend implements whichever roles it supports. Operations without a natural
 * implementation fail with {@link io.buslink.UnsupportedTransportOperationException}.
 * {@link io.buslink.transport.EventTransportHandler} executes outbound event commands
 * against an event transport.
 */
package io.buslink.transport;
