package com.panelbridge.stream;

import java.io.IOException;

/** An open push channel. Sends may come from the receive loop thread only. */
public interface StreamChannel {

    void send(String text) throws IOException;

    boolean isOpen();

    /** Closes the channel; safe to call more than once. */
    void close();
}
