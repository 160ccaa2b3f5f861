package com.panelbridge.stream;

import com.panelbridge.exception.TransportException;
import java.net.URI;
import java.util.Map;

/** Opens WebSocket channels to the panel's notification hub. */
public interface StreamTransport {

    /**
     * Opens a channel and blocks until the upgrade completed.
     *
     * @throws TransportException when the connection or upgrade fails
     */
    StreamChannel open(URI uri, Map<String, String> headers, StreamChannelListener listener);
}
