package com.micboard.realtime.streams;

import com.micboard.realtime.exceptions.NoSupportingDelegateException;
import com.micboard.realtime.model.DeviceEndpoint;
import java.util.Comparator;
import java.util.Optional;
import java.util.PriorityQueue;
import java.util.function.Predicate;
import lombok.Value;
import reactor.core.publisher.Mono;

/** Delegates each connect to the first client whose condition accepts the endpoint. */
public class ConditionalDeviceStreamClient<T> implements DeviceStreamClient<T> {
  private static final int INITIAL_CAPACITY = 4;

  private final Comparator<DelegateWithPriority<T>> priorityOrder =
      Comparator.comparingInt(DelegateWithPriority::getPriority);

  private final PriorityQueue<DelegateWithPriority<T>> delegates =
      new PriorityQueue<>(INITIAL_CAPACITY, priorityOrder);

  /**
   * Add a client to delegate to, after every client already added.
   *
   * @param client The client to delegate to.
   * @param predicate The condition to satisfy to use this delegate
   */
  public synchronized void addClient(
      DeviceStreamClient<T> client, Predicate<DeviceEndpoint> predicate) {
    Optional<Integer> lowestPriority =
        delegates.stream().map(DelegateWithPriority::getPriority).reduce(Math::max);
    addClient(client, predicate, lowestPriority.orElse(0) + 1);
  }

  public synchronized void addClient(
      DeviceStreamClient<T> client, Predicate<DeviceEndpoint> predicate, int priority) {
    removeClient(client);
    delegates.add(new DelegateWithPriority<>(client, predicate, priority));
  }

  public synchronized boolean removeClient(DeviceStreamClient<T> client) {
    return delegates.removeIf(delegate -> delegate.getClient().equals(client));
  }

  @Override
  public Mono<DeviceStream<T>> connect(DeviceEndpoint endpoint) {
    return findClient(endpoint)
        .map(client -> client.connect(endpoint))
        .orElseGet(() -> Mono.error(new NoSupportingDelegateException(
            "No stream client supports " + endpoint.getConnectionType()
                + " endpoint " + endpoint.getUri())));
  }

  private synchronized Optional<DeviceStreamClient<T>> findClient(DeviceEndpoint endpoint) {
    return delegates.stream()
        .sorted(priorityOrder)
        .filter(delegate -> delegate.getPredicate().test(endpoint))
        .findFirst()
        .map(DelegateWithPriority::getClient);
  }

  @Value
  private static class DelegateWithPriority<T> {
    protected final DeviceStreamClient<T> client;

    protected final Predicate<DeviceEndpoint> predicate;

    protected final int priority;
  }
}
