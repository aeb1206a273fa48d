package io.buslink.transport;

import io.buslink.UnsupportedTransportOperationException;
import io.buslink.message.ResultMessage;
import io.buslink.message.RpcMessage;

import java.util.Map;

/**
 * Delivers RPC results back to the caller.
 */
public interface ResultTransport extends Transport {

    /**
     * Computes where the result of the given call should be delivered.
     *
     * @param message the outgoing call
     * @return an opaque return path understood by this transport
     */
    default String getReturnPath(RpcMessage message) {
        throw UnsupportedTransportOperationException.of(this, "return paths");
    }

    /**
     * Sends a result back to the caller.
     *
     * @param message    the call that was executed
     * @param result     the result to deliver
     * @param returnPath the path produced by {@link #getReturnPath}
     * @throws Exception if delivery fails
     */
    default void sendResult(RpcMessage message, ResultMessage result, String returnPath) throws Exception {
        throw UnsupportedTransportOperationException.of(this, "sending results");
    }

    /**
     * Waits for and returns the result of the given call.
     *
     * @param message    the call that was made
     * @param returnPath the path produced by {@link #getReturnPath}
     * @param options    transport-specific options, such as a timeout
     * @return the result
     * @throws Exception if the result cannot be received
     */
    default ResultMessage receiveResult(RpcMessage message, String returnPath,
                                        Map<String, Object> options) throws Exception {
        throw UnsupportedTransportOperationException.of(this, "receiving results");
    }
}
