package io.buslink.message;

import java.util.Objects;

/**
 * The outcome of a remote procedure call, as carried by an
 * {@link io.buslink.transport.ResultTransport}.
 *
 * @param rpcMessageId the id of the {@link RpcMessage} this result answers
 * @param result       the returned value, or {@code null} on error
 * @param error        {@code true} if the procedure failed
 * @param trace        failure description when {@code error} is set
 */
public record ResultMessage(String rpcMessageId, Object result, boolean error, String trace) {

    public ResultMessage {
        Objects.requireNonNull(rpcMessageId, "rpcMessageId");
    }

    public static ResultMessage success(RpcMessage request, Object result) {
        return new ResultMessage(request.id(), result, false, null);
    }

    public static ResultMessage failure(RpcMessage request, String trace) {
        return new ResultMessage(request.id(), null, true, trace);
    }
}
