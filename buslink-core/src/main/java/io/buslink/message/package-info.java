/**
 * Transport-independent message model: {@link io.buslink.message.EventMessage},
 * {@link io.buslink.message.RpcMessage} and {@link io.buslink.message.ResultMessage}.
 */
package io.buslink.message;
