/**
 * The closed set of {@link io.buslink.command.Command} variants exchanged between the
 * client API and the transport layer, and the {@link io.buslink.command.CommandRouter}
 * that maps a variant to its handler.
 */
package io.buslink.command;
