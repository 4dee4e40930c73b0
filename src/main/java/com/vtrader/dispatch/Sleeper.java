package com.vtrader.dispatch;

import java.time.Duration;

/** Blocking pause used by the drain loop while it waits for rate budget. */
@FunctionalInterface
public interface Sleeper {

    void sleep(Duration duration) throws InterruptedException;

    static Sleeper threadSleep() {
        return duration -> Thread.sleep(duration.toMillis());
    }
}
