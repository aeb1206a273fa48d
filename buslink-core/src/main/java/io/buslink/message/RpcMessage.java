package io.buslink.message;

import com.github.f4b6a3.ulid.UlidCreator;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * A request to execute a remote procedure, as carried by an
 * {@link io.buslink.transport.RpcTransport}.
 *
 * @param id            unique request identifier
 * @param apiName       the API that owns the procedure
 * @param procedureName the procedure to call
 * @param kwargs        keyword arguments for the call
 * @param returnPath    where the result should be delivered, or {@code null} before one is assigned
 */
public record RpcMessage(String id, String apiName, String procedureName,
                         Map<String, Object> kwargs, String returnPath) {

    public RpcMessage {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(apiName, "apiName");
        Objects.requireNonNull(procedureName, "procedureName");
        kwargs = kwargs == null
                ? Collections.emptyMap()
                : Collections.unmodifiableMap(new LinkedHashMap<>(kwargs));
    }

    public static RpcMessage of(String apiName, String procedureName, Map<String, ?> kwargs) {
        return new RpcMessage(UlidCreator.getMonotonicUlid().toString(), apiName, procedureName,
                kwargs == null ? null : new LinkedHashMap<>(kwargs), null);
    }

    public RpcMessage withReturnPath(String returnPath) {
        return new RpcMessage(id, apiName, procedureName, kwargs, returnPath);
    }

    public String canonicalName() {
        return apiName + "." + procedureName;
    }
}
