package com.panelbridge.stream;

/**
 * Callbacks from the transport's own threads. Implementations only hand the data over to the
 * receive loop; they never process it in place.
 */
public interface StreamChannelListener {

    void onText(String text);

    void onClosed(String reason);

    void onError(Throwable error);
}
