package io.buslink.client;

import io.buslink.DuplicateListenerException;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Thread-safe registry of listener registrations, keyed by unique listener name.
 */
public final class DefaultListenerRegistry implements ListenerRegistry {
  private final ConcurrentMap<String, ListenerRegistration> registrations = new ConcurrentHashMap<>();

  /**
   * Adds a registration.
   *
   * @param registration the registration
   * @return this registry for chaining
   * @throws DuplicateListenerException if a listener with the same name exists
   */
  public DefaultListenerRegistry register(ListenerRegistration registration) {
    Objects.requireNonNull(registration, "registration");
    if (registrations.putIfAbsent(registration.name(), registration) != null) {
      throw DuplicateListenerException.named(registration.name());
    }
    return this;
  }

  /**
   * Removes a registration so its name can be used again.
   *
   * @param listenerName the listener name
   * @return the removed registration, if there was one
   */
  public Optional<ListenerRegistration> unregister(String listenerName) {
    return Optional.ofNullable(registrations.remove(listenerName));
  }

  public boolean contains(String listenerName) {
    return registrations.containsKey(listenerName);
  }

  @Override
  public Optional<ListenerRegistration> get(String listenerName) {
    return Optional.ofNullable(registrations.get(listenerName));
  }

  @Override
  public List<ListenerRegistration> all() {
    return new ArrayList<>(registrations.values());
  }
}
