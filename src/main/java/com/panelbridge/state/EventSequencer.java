package com.panelbridge.state;

import java.util.concurrent.atomic.AtomicLong;
import org.springframework.stereotype.Component;

/** Monotonic arrival counter shared by every producer of door events. */
@Component
public class EventSequencer {

    private final AtomicLong sequence = new AtomicLong();

    public long next() {
        return sequence.incrementAndGet();
    }
}
