package com.panelbridge.dispatch;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Handle returned by {@link StateChangeDispatcher#subscribe}. After {@link #unsubscribe()} the
 * listener receives nothing, including notifications already queued for it.
 */
public class Subscription {

    private final EntityKey key;
    private final StateChangeListener listener;
    private final StateChangeDispatcher dispatcher;
    private final AtomicBoolean active = new AtomicBoolean(true);

    Subscription(EntityKey key, StateChangeListener listener, StateChangeDispatcher dispatcher) {
        this.key = key;
        this.listener = listener;
        this.dispatcher = dispatcher;
    }

    public EntityKey getKey() {
        return key;
    }

    public boolean isActive() {
        return active.get();
    }

    public void unsubscribe() {
        if (active.compareAndSet(true, false)) {
            dispatcher.remove(this);
        }
    }

    void deliver(StateChange change) {
        if (active.get()) {
            listener.onStateChange(change);
        }
    }
}
