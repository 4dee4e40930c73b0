package com.vtrader.realtime;

import java.io.IOException;

/**
 * One open push stream to a browser session. Identity-based: two connections are
 * equal only if they are the same object.
 */
public interface PushConnection {

    /** Short id for logs. */
    String getId();

    /**
     * Writes one complete frame. Any exception means the connection is dead; it is
     * never retried.
     */
    void send(String frame) throws IOException;

    /** Ends the stream from the server side. Safe to call on a dead connection. */
    void close();
}
