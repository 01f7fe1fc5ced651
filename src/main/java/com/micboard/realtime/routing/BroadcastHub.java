package com.micboard.realtime.routing;

import com.micboard.realtime.mappers.ThrowingConsumer;
import java.text.MessageFormat;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.logging.Level;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.extern.java.Log;

/**
 * In-memory publish and subscribe registry keyed by topic name.
 *
 * <p>Registrations are held per topic in copy-on-write lists. Publishing iterates the list as
 * it was when the publish began, so subscribers that join during a publish do not receive that
 * message, and no lock is held while a subscriber runs.
 *
 * @param <T> The message type
 */
@Log
public class BroadcastHub<T> {

  private final Map<String, CopyOnWriteArrayList<Registration<T>>> registry =
      new ConcurrentHashMap<>();

  private final AtomicInteger maxSubscriptionId = new AtomicInteger(0);

  /**
   * Register a subscriber on a topic. Each call creates a new registration.
   *
   * @param topic The topic name
   * @param subscriber Receives every message published to the topic
   * @return The handle used to unsubscribe
   */
  public TopicSubscription subscribe(
      String topic, ThrowingConsumer<? super T, ? extends Exception> subscriber) {
    TopicSubscription handle = new TopicSubscription(maxSubscriptionId.incrementAndGet(), topic);
    Registration<T> registration = new Registration<>(handle, subscriber);
    registry.compute(topic, (key, registrations) -> {
      CopyOnWriteArrayList<Registration<T>> updated =
          registrations == null ? new CopyOnWriteArrayList<>() : registrations;
      updated.add(registration);
      return updated;
    });
    log.log(Level.FINE, MessageFormat.format(
        "{0} subscribing to topic {1}", handle.getId(), topic));
    return handle;
  }

  /**
   * Deliver a message to every subscriber currently registered on a topic. A subscriber that
   * throws is unregistered and the remaining subscribers still receive the message.
   *
   * @param topic The topic name
   * @param message The message
   * @return The number of subscribers that accepted the message
   */
  public int publish(String topic, T message) {
    List<Registration<T>> registrations = registry.get(topic);
    if (registrations == null) {
      return 0;
    }

    int delivered = 0;
    for (Registration<T> registration : registrations) {
      if (!registration.isActive()) {
        continue;
      }
      try {
        registration.getSubscriber().accept(message);
        delivered++;
      } catch (Exception ex) {
        log.log(Level.WARNING, MessageFormat.format(
            "Dropping subscriber {0} on topic {1} after failed delivery",
            registration.getHandle().getId(), topic), ex);
        unsubscribe(registration.getHandle());
      }
    }
    return delivered;
  }

  /**
   * Remove a registration. Removing one that is already gone has no effect.
   *
   * @param handle The handle returned by {@link #subscribe}
   * @return true if the registration was removed by this call
   */
  public boolean unsubscribe(TopicSubscription handle) {
    AtomicBoolean removed = new AtomicBoolean(false);
    registry.computeIfPresent(handle.getTopic(), (key, registrations) -> {
      for (Registration<T> registration : registrations) {
        if (registration.getHandle().equals(handle) && registrations.remove(registration)) {
          registration.deactivate();
          removed.set(true);
        }
      }
      return registrations.isEmpty() ? null : registrations;
    });
    if (removed.get()) {
      log.log(Level.FINE, MessageFormat.format(
          "{0} unsubscribing from topic {1}", handle.getId(), handle.getTopic()));
    }
    return removed.get();
  }

  public int getSubscriberCount(String topic) {
    List<Registration<T>> registrations = registry.get(topic);
    return registrations == null ? 0 : registrations.size();
  }

  public Set<String> getTopics() {
    return Collections.unmodifiableSet(new TreeSet<>(registry.keySet()));
  }

  @RequiredArgsConstructor
  private static class Registration<T> {
    @Getter private final TopicSubscription handle;
    @Getter private final ThrowingConsumer<? super T, ? extends Exception> subscriber;
    @Getter private volatile boolean active = true;

    void deactivate() {
      active = false;
    }
  }
}
