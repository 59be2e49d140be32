package com.streamfirst.lazymint.adapters;

import com.streamfirst.lazymint.ports.EventPort;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Consumer;
import lombok.extern.slf4j.Slf4j;

/**
 * In-memory implementation of EventPort for testing and development. Events are delivered
 * synchronously within the same JVM and every published event is kept in a journal so tests can
 * inspect what an operation emitted.
 */
@Slf4j
public class InMemoryEventAdapter implements EventPort {

  private final Map<String, List<Subscription>> subscriptionsByTopic = new ConcurrentHashMap<>();
  private final Map<String, String> subscriptionToTopic = new ConcurrentHashMap<>();
  private final List<Object> journal = new CopyOnWriteArrayList<>();
  private final AtomicLong subscriptionCounter = new AtomicLong(1);

  private record Subscription(String id, Class<?> eventType, Consumer<Object> handler) {}

  @Override
  public void publish(String topic, Object event) {
    log.debug("Publishing event to topic '{}': {}", topic, event);
    journal.add(event);

    int delivered = 0;
    for (Subscription subscription : subscriptionsByTopic.getOrDefault(topic, List.of())) {
      if (!subscription.eventType().isInstance(event)) {
        continue;
      }
      try {
        subscription.handler().accept(event);
        delivered++;
      } catch (RuntimeException e) {
        // a failing observer must not fail the operation that emitted the event
        log.error("Error delivering event to subscriber {} for topic '{}'", subscription.id(), topic, e);
      }
    }
    log.trace("Delivered event on topic '{}' to {} subscribers", topic, delivered);
  }

  @Override
  public String subscribe(String topic, Consumer<Object> handler) {
    return subscribe(topic, Object.class, handler);
  }

  @Override
  public <T> String subscribe(String topic, Class<T> eventType, Consumer<? super T> handler) {
    String subscriptionId = "sub-" + subscriptionCounter.getAndIncrement();
    Consumer<Object> typed = event -> handler.accept(eventType.cast(event));

    subscriptionsByTopic
        .computeIfAbsent(topic, k -> new CopyOnWriteArrayList<>())
        .add(new Subscription(subscriptionId, eventType, typed));
    subscriptionToTopic.put(subscriptionId, topic);

    log.info(
        "Subscribed to topic '{}' for type '{}' with ID {}",
        topic,
        eventType.getSimpleName(),
        subscriptionId);
    return subscriptionId;
  }

  @Override
  public boolean unsubscribe(String subscriptionId) {
    String topic = subscriptionToTopic.remove(subscriptionId);
    if (topic == null) {
      log.debug("Subscription '{}' not found", subscriptionId);
      return false;
    }
    subscriptionsByTopic
        .getOrDefault(topic, List.of())
        .removeIf(subscription -> subscription.id().equals(subscriptionId));
    log.info("Unsubscribed subscription '{}' from topic '{}'", subscriptionId, topic);
    return true;
  }

  /** Gets every event published so far, in publication order. */
  public List<Object> getPublishedEvents() {
    return new ArrayList<>(journal);
  }

  /** Gets the published events of one type, in publication order. */
  public <T> List<T> getPublishedEvents(Class<T> eventType) {
    return journal.stream().filter(eventType::isInstance).map(eventType::cast).toList();
  }

  /** Clears the journal and all subscriptions. Useful for testing. */
  public void clear() {
    log.info("Clearing all subscriptions and published events");
    subscriptionsByTopic.clear();
    subscriptionToTopic.clear();
    journal.clear();
  }
}
