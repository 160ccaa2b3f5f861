package com.panelbridge.dispatch;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

/**
 * Fans out entity state changes to listeners registered for that entity's key.
 *
 * <p>Thread safety: ConcurrentHashMap of CopyOnWriteArrayList, as subscriptions change rarely
 * compared to publications. {@link #publish} snapshots the subscriber list at publication time,
 * so a listener added later only sees later changes and a concurrent subscribe/unsubscribe never
 * blocks or breaks an in-flight delivery.
 *
 * <p>Delivery runs on the dispatch executor (a single thread in production) so listeners see a
 * key's changes in publication order and never run on the store's writer thread. A throwing
 * listener is logged and does not affect the others.
 */
@Component
public class StateChangeDispatcher {

    private static final Logger log = LoggerFactory.getLogger(StateChangeDispatcher.class);

    private final Map<EntityKey, CopyOnWriteArrayList<Subscription>> subscriptions = new ConcurrentHashMap<>();
    private final Executor dispatchExecutor;

    public StateChangeDispatcher(@Qualifier("dispatchExecutor") Executor dispatchExecutor) {
        this.dispatchExecutor = dispatchExecutor;
    }

    public Subscription subscribe(EntityKey key, StateChangeListener listener) {
        Subscription subscription = new Subscription(key, listener, this);
        subscriptions.compute(key, (k, list) -> {
            CopyOnWriteArrayList<Subscription> target = list != null ? list : new CopyOnWriteArrayList<>();
            target.add(subscription);
            return target;
        });
        log.debug("Listener subscribed to {}", key);
        return subscription;
    }

    /** Queues delivery of {@code state} to the current subscribers of {@code key}. */
    public void publish(EntityKey key, Object state) {
        CopyOnWriteArrayList<Subscription> current = subscriptions.get(key);
        if (current == null || current.isEmpty()) {
            return;
        }
        List<Subscription> targets = List.copyOf(current);
        StateChange change = new StateChange(key, state, Instant.now());
        try {
            dispatchExecutor.execute(() -> deliver(change, targets));
        } catch (RejectedExecutionException e) {
            log.warn("Dispatch executor rejected notification for {} (shutting down?)", key);
        }
    }

    public int getSubscriberCount(EntityKey key) {
        List<Subscription> current = subscriptions.get(key);
        return current != null ? current.size() : 0;
    }

    void remove(Subscription subscription) {
        subscriptions.computeIfPresent(subscription.getKey(), (key, list) -> {
            list.remove(subscription);
            return list.isEmpty() ? null : list;
        });
        log.debug("Listener unsubscribed from {}", subscription.getKey());
    }

    private void deliver(StateChange change, List<Subscription> targets) {
        for (Subscription subscription : targets) {
            try {
                subscription.deliver(change);
            } catch (RuntimeException e) {
                log.error("Listener for {} failed: {}", change.getKey(), e.getMessage(), e);
            }
        }
    }
}
