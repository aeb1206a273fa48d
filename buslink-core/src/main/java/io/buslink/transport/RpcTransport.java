package io.buslink.transport;

import io.buslink.UnsupportedTransportOperationException;
import io.buslink.api.Api;
import io.buslink.message.RpcMessage;

import java.util.List;
import java.util.Map;

/**
 * Publishes remote procedure calls and receives pending calls for local APIs.
 */
public interface RpcTransport extends Transport {

    /**
     * Publishes a call to a remote procedure.
     *
     * @param message the call
     * @param options transport-specific options
     * @throws Exception if publishing fails
     */
    default void callRpc(RpcMessage message, Map<String, Object> options) throws Exception {
        throw UnsupportedTransportOperationException.of(this, "calling RPCs");
    }

    /**
     * Receives pending calls for the given APIs, blocking until at least one is available.
     *
     * @param apis the APIs this process serves
     * @return the received calls
     * @throws Exception if consumption fails
     */
    default List<RpcMessage> consumeRpcs(List<Api> apis) throws Exception {
        throw UnsupportedTransportOperationException.of(this, "consuming RPCs");
    }
}
