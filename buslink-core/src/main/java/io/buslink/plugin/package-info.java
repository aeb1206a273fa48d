/**
 * Per-client plugins invoked at the {@link io.buslink.plugin.HookPoint hook points} of the
 * event flows.
 */
package io.buslink.plugin;
