package com.healthauth.core.event;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * Dispatches ledger events to subscribers on the emitting thread.
 * Handler failures are logged and never reach the emitter.
 */
public class LedgerEventBus {

    private static final Logger log = LoggerFactory.getLogger(LedgerEventBus.class);

    private final Map<LedgerEventType, CopyOnWriteArrayList<Subscription>> subscriptions;
    private final Map<String, Subscription> subscriptionById;

    public LedgerEventBus() {
        this.subscriptions = new ConcurrentHashMap<>();
        this.subscriptionById = new ConcurrentHashMap<>();
    }

    /**
     * Emits an event to subscribers of its type, then to wildcard subscribers.
     */
    public void emit(LedgerEvent event) {
        if (event == null) {
            return;
        }
        deliver(subscriptions.get(event.eventType()), event);
        deliver(subscriptions.get(LedgerEventType.ALL), event);
    }

    /**
     * Subscribes to events of a specific type.
     *
     * @param eventType type of events to receive, or {@link LedgerEventType#ALL}
     * @param handler   handler to invoke
     * @return subscription ID
     */
    public String subscribe(LedgerEventType eventType, Consumer<LedgerEvent> handler) {
        if (eventType == null) {
            throw new IllegalArgumentException("Event type cannot be null");
        }
        if (handler == null) {
            throw new IllegalArgumentException("Handler cannot be null");
        }
        String subscriptionId = UUID.randomUUID().toString();
        Subscription subscription = new Subscription(subscriptionId, eventType, handler);

        subscriptions.computeIfAbsent(eventType, k -> new CopyOnWriteArrayList<>()).add(subscription);
        subscriptionById.put(subscriptionId, subscription);

        return subscriptionId;
    }

    public void unsubscribe(String subscriptionId) {
        Subscription subscription = subscriptionById.remove(subscriptionId);
        if (subscription != null) {
            CopyOnWriteArrayList<Subscription> subs = subscriptions.get(subscription.eventType());
            if (subs != null) {
                subs.remove(subscription);
            }
        }
    }

    public int getSubscriberCount(LedgerEventType eventType) {
        CopyOnWriteArrayList<Subscription> subs = subscriptions.get(eventType);
        return subs != null ? subs.size() : 0;
    }

    private void deliver(CopyOnWriteArrayList<Subscription> subs, LedgerEvent event) {
        if (subs == null) {
            return;
        }
        for (Subscription sub : subs) {
            try {
                sub.handler().accept(event);
            } catch (RuntimeException e) {
                log.warn("Ledger event handler {} failed on {}", sub.id(), event.eventType(), e);
            }
        }
    }

    private record Subscription(
            String id,
            LedgerEventType eventType,
            Consumer<LedgerEvent> handler
    ) {}
}
