package com.micboard.realtime.routing;

import static org.assertj.core.api.Assertions.assertThat;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

public class BroadcastHubTest {

  private static final String TOPIC = "device:rx-1";

  private BroadcastHub<String> hub;

  /** Setup the tests. */
  @BeforeEach
  public void init() {
    hub = new BroadcastHub<>();
  }

  @Test
  public void testPublishWithoutSubscribers() {
    assertThat(hub.publish(TOPIC, "a")).isZero();
    assertThat(hub.getTopics()).isEmpty();
  }

  @Test
  public void testFailingSubscriberIsDroppedOthersStillReceive() {
    List<String> first = new ArrayList<>();
    List<String> third = new ArrayList<>();
    hub.subscribe(TOPIC, first::add);
    hub.subscribe(TOPIC, message -> {
      throw new IOException("Broken pipe");
    });
    hub.subscribe(TOPIC, third::add);

    assertThat(hub.publish(TOPIC, "a")).isEqualTo(2);
    assertThat(hub.getSubscriberCount(TOPIC)).isEqualTo(2);
    assertThat(hub.publish(TOPIC, "b")).isEqualTo(2);

    assertThat(first).containsExactly("a", "b");
    assertThat(third).containsExactly("a", "b");
  }

  @Test
  public void testEachRegistrationReceivesItsOwnCopy() {
    List<String> received = new ArrayList<>();
    TopicSubscription firstHandle = hub.subscribe(TOPIC, received::add);
    TopicSubscription secondHandle = hub.subscribe(TOPIC, received::add);
    assertThat(firstHandle).isNotEqualTo(secondHandle);

    hub.publish(TOPIC, "a");
    assertThat(received).containsExactly("a", "a");

    assertThat(hub.unsubscribe(firstHandle)).isTrue();
    hub.publish(TOPIC, "b");
    assertThat(received).containsExactly("a", "a", "b");
  }

  @Test
  public void testUnsubscribeTwiceIsHarmless() {
    TopicSubscription handle = hub.subscribe(TOPIC, message -> { });

    assertThat(hub.unsubscribe(handle)).isTrue();
    assertThat(hub.unsubscribe(handle)).isFalse();
    assertThat(hub.getSubscriberCount(TOPIC)).isZero();
    assertThat(hub.getTopics()).doesNotContain(TOPIC);
  }

  @Test
  public void testTopicsAreIsolated() {
    List<String> deviceMessages = new ArrayList<>();
    List<String> allMessages = new ArrayList<>();
    hub.subscribe(TOPIC, deviceMessages::add);
    hub.subscribe(Topics.ALL_DEVICES, allMessages::add);

    hub.publish(Topics.ALL_DEVICES, "everyone");

    assertThat(deviceMessages).isEmpty();
    assertThat(allMessages).containsExactly("everyone");
    assertThat(hub.getTopics()).containsExactly(TOPIC, Topics.ALL_DEVICES);
  }

  @Test
  public void testSubscriberJoiningDuringPublishMissesThatMessage() {
    List<String> late = new ArrayList<>();
    hub.subscribe(TOPIC, message -> hub.subscribe(TOPIC, late::add));

    hub.publish(TOPIC, "a");
    assertThat(late).isEmpty();
  }

  @Test
  public void testSubscriberMayUnsubscribeItselfDuringPublish() {
    List<String> received = new ArrayList<>();
    List<TopicSubscription> self = new ArrayList<>();
    self.add(hub.subscribe(TOPIC, message -> {
      received.add(message);
      hub.unsubscribe(self.get(0));
    }));

    hub.publish(TOPIC, "a");
    hub.publish(TOPIC, "b");

    assertThat(received).containsExactly("a");
  }

  @Test
  public void testConcurrentSubscribePublishUnsubscribe() throws Exception {
    int threads = 8;
    int rounds = 300;
    List<String> stable = new CopyOnWriteArrayList<>();
    hub.subscribe(TOPIC, stable::add);
    AtomicInteger published = new AtomicInteger();

    ExecutorService executor = Executors.newFixedThreadPool(threads);
    CountDownLatch start = new CountDownLatch(1);
    List<Future<?>> futures = new ArrayList<>();
    for (int i = 0; i < threads; i++) {
      boolean publisher = i % 2 == 0;
      futures.add(executor.submit(() -> {
        start.await();
        for (int j = 0; j < rounds; j++) {
          if (publisher) {
            hub.publish(TOPIC, "m");
            published.incrementAndGet();
          } else {
            TopicSubscription handle = hub.subscribe(TOPIC, message -> { });
            hub.unsubscribe(handle);
          }
        }
        return null;
      }));
    }
    start.countDown();
    for (Future<?> future : futures) {
      future.get(20, TimeUnit.SECONDS);
    }
    executor.shutdown();

    assertThat(stable).hasSize(published.get());
    assertThat(hub.getSubscriberCount(TOPIC)).isEqualTo(1);
    assertThat(Collections.frequency(stable, "m")).isEqualTo(threads / 2 * rounds);
  }
}
