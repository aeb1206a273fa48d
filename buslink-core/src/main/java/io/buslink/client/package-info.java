/**
 * The event client: firing events for local APIs and running named listeners.
 *
 * @see io.buslink.client.EventClient
 */
package io.buslink.client;
