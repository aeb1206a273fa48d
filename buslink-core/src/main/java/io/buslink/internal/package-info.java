/**
 * The internal command channel: a {@link io.buslink.internal.CommandProducer} that
 * enqueues commands and monitors queue depth, a {@link io.buslink.internal.CommandConsumer}
 * that runs their handlers concurrently, and the {@link io.buslink.internal.ErrorChannel}
 * where background failures end up.
 */
package io.buslink.internal;
