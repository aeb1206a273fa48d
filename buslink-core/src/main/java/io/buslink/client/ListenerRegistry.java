package io.buslink.client;

import java.util.List;
import java.util.Optional;

/**
 * Registry for looking up listener registrations by listener name.
 *
 * <p>The event client uses it to route received events to the right intake queue.
 *
 * @see DefaultListenerRegistry
 */
public interface ListenerRegistry {

  /**
   * Returns the registration with the given name.
   *
   * @param listenerName the unique listener name
   * @return the registration, or empty if no listener has that name
   */
  Optional<ListenerRegistration> get(String listenerName);

  List<ListenerRegistration> all();
}
