package com.vtrader.realtime;

/** Text framing of the one-way server-push protocol. */
public final class SseFrames {

    /** Comment frame; browsers ignore it, proxies see traffic. */
    public static final String HEARTBEAT = ": heartbeat\n\n";

    private SseFrames() {}

    public static String data(String json) {
        return "data: " + json + "\n\n";
    }
}
